package com.platform.eslsync.model;

/**
 * Minimal projection of a store taking part in verification.
 */
public record Store(
    String id,
    String code,
    String name,
    String companyId,
    boolean syncEnabled
) {

    /**
     * Name for logs and results, falling back to the store code.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : code;
    }
}
