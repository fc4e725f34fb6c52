package com.deepansh.feed.hydration;

import com.deepansh.feed.model.ContentMetadata;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the content catalog: POST /v1/content/batch {"ids": [...]}.
 *
 * Circuit breaker config (application.yml, instance "metadataBackend"):
 * - Opens after 50% failures over the last 20 calls
 * - Half-open after 10s
 * - Calls slower than 250ms count as failures
 *
 * Both a failed call and an open circuit yield an empty result, which the
 * Hydrator reports as partial hydration.
 */
@Component
@Slf4j
public class CatalogMetadataClient implements MetadataBackend {

    private static final String BATCH_PATH = "/v1/content/batch";

    private final RestClient restClient;

    public CatalogMetadataClient(@Qualifier("catalogRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    @CircuitBreaker(name = "metadataBackend", fallbackMethod = "lookupFallback")
    public Map<String, ContentMetadata> batchLookup(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }

        ContentMetadata[] body = restClient.post()
                .uri(BATCH_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("ids", List.copyOf(ids)))
                .retrieve()
                .body(ContentMetadata[].class);

        Map<String, ContentMetadata> result = new LinkedHashMap<>();
        if (body != null) {
            for (ContentMetadata metadata : body) {
                if (metadata != null && metadata.getId() != null) {
                    result.put(metadata.getId(), metadata);
                }
            }
        }
        log.debug("Catalog batch lookup [requested={}, resolved={}]", ids.size(), result.size());
        return result;
    }

    public Map<String, ContentMetadata> lookupFallback(Collection<String> ids, Exception ex) {
        log.error("Catalog lookup failed for {} ids, returning none: {}", ids.size(), ex.getMessage());
        return Map.of();
    }
}
