package com.deepansh.feed.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled HttpClient for the metadata catalog.
 *
 * Hydration sits on the request path, so connect and read timeouts are kept
 * well inside the feed latency budget. A slow catalog surfaces as a
 * RestClientException and is absorbed by the metadataBackend circuit breaker.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("catalogRestClient")
    public RestClient catalogRestClient(FeedProperties properties) {
        FeedProperties.Catalog catalog = properties.getCatalog();

        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(catalog.getMaxConnections())
                        .setMaxConnPerRoute(catalog.getMaxConnections())
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(catalog.getConnectTimeoutMs()))
                                .setSocketTimeout(Timeout.ofMilliseconds(catalog.getReadTimeoutMs()))
                                .build())
                        .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(catalog.getReadTimeoutMs()))
                        .build())
                .build();

        log.info("Catalog client configured [baseUrl={}, connectTimeout={}ms, readTimeout={}ms]",
                catalog.getBaseUrl(), catalog.getConnectTimeoutMs(), catalog.getReadTimeoutMs());

        return RestClient.builder()
                .baseUrl(catalog.getBaseUrl())
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient))
                .build();
    }
}
