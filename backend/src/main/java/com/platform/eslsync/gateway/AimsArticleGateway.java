package com.platform.eslsync.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.eslsync.config.AimsProperties;
import com.platform.eslsync.error.RemoteGatewayException;
import com.platform.eslsync.model.RemoteRecord;
import com.platform.eslsync.persistence.entity.StoreEntity;
import com.platform.eslsync.persistence.repository.StoreJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for the AIMS article listing API.
 * Pages through a store's articles until an empty or short page.
 */
@Slf4j
@Component
public class AimsArticleGateway implements RemoteRecordGateway {
    
    private static final String ARTICLES_PATH = "/common/api/v2/common/config/article/info";
    private static final List<String> LIST_WRAPPERS = List.of("articleList", "content", "data");
    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {};
    
    private final AimsProperties properties;
    private final StoreJpaRepository storeRepository;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    
    public AimsArticleGateway(
            AimsProperties properties,
            StoreJpaRepository storeRepository,
            ObjectMapper objectMapper,
            HttpClient aimsHttpClient) {
        this.properties = properties;
        this.storeRepository = storeRepository;
        this.objectMapper = objectMapper;
        this.httpClient = aimsHttpClient;
    }
    
    @Override
    public List<RemoteRecord> fetchRemoteRecords(String storeId) {
        StoreEntity store = storeRepository.findById(storeId)
            .orElseThrow(() -> RemoteGatewayException.notConfigured(storeId));
        
        int pageSize = properties.getPageSize();
        List<RemoteRecord> articles = new ArrayList<>();
        
        for (int page = 0; page < properties.getMaxPages(); page++) {
            ArticlePage batch = fetchPage(store.getCode(), page, pageSize);
            articles.addAll(batch.articles());
            // end of data is judged on entries returned, not on entries kept
            if (batch.entries() < pageSize) {
                break;
            }
            if (page == properties.getMaxPages() - 1) {
                log.warn("Stopped paging AIMS articles for store {} after {} pages", store.getCode(), page + 1);
            }
        }
        
        log.debug("Fetched {} AIMS articles for store {}", articles.size(), store.getCode());
        return articles;
    }
    
    private ArticlePage fetchPage(String storeCode, int page, int size) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(articlesUri(storeCode, page, size))
            .header("Accept", "application/json")
            .header("Authorization", "Bearer " + properties.getApiToken())
            .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .GET()
            .build();
        
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw RemoteGatewayException.unreachable(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RemoteGatewayException.unreachable("interrupted", e);
        }
        
        int status = response.statusCode();
        if (status == 204) {
            return ArticlePage.EMPTY;
        }
        if (status < 200 || status >= 300) {
            throw RemoteGatewayException.httpStatus(status, response.body());
        }
        
        String body = response.body();
        if (body == null || body.isBlank()) {
            return ArticlePage.EMPTY;
        }
        return parseArticles(body);
    }
    
    private ArticlePage parseArticles(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw RemoteGatewayException.malformed(e.getMessage(), e);
        }
        
        JsonNode list = unwrap(root);
        List<RemoteRecord> records = new ArrayList<>(list.size());
        for (JsonNode node : list) {
            if (node.isObject()) {
                records.add(RemoteRecord.of(objectMapper.convertValue(node, FIELD_MAP)));
            }
        }
        return new ArticlePage(records, list.size());
    }
    
    /**
     * AIMS returns either a bare array or an object wrapping it.
     */
    private JsonNode unwrap(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        for (String wrapper : LIST_WRAPPERS) {
            JsonNode candidate = root.path(wrapper);
            if (candidate.isArray()) {
                return candidate;
            }
        }
        return objectMapper.createArrayNode();
    }
    
    private URI articlesUri(String storeCode, int page, int size) {
        return URI.create(properties.getBaseUrl() + ARTICLES_PATH
            + "?company=" + encode(properties.getCompany())
            + "&store=" + encode(storeCode)
            + "&page=" + page
            + "&size=" + size);
    }
    
    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
    
    /**
     * One page of articles. entries counts every element AIMS returned, including
     * non-object ones that were not kept.
     */
    private record ArticlePage(List<RemoteRecord> articles, int entries) {
        static final ArticlePage EMPTY = new ArticlePage(List.of(), 0);
    }
}
