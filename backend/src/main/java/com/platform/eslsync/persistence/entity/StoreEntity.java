package com.platform.eslsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for stores. Read-only from the verifier's point of view.
 */
@Entity
@Table(name = "stores", indexes = {
    @Index(name = "idx_stores_sync_enabled", columnList = "sync_enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(length = 50, nullable = false)
    private String code;
    
    @Column(length = 255)
    private String name;
    
    @Column(name = "company_id", length = 36, nullable = false)
    private String companyId;
    
    @Column(name = "sync_enabled", nullable = false)
    @Builder.Default
    private boolean syncEnabled = true;
}
