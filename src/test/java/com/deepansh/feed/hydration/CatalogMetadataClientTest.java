package com.deepansh.feed.hydration;

import com.deepansh.feed.model.ContentMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CatalogMetadataClientTest {

    private MockRestServiceServer server;
    private CatalogMetadataClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://catalog.test");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new CatalogMetadataClient(builder.build());
    }

    @Test
    void batchLookup_postsIdsAndKeysResultById() {
        server.expect(requestTo("http://catalog.test/v1/content/batch"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"ids\":[\"m1\",\"m2\"]}"))
                .andRespond(withSuccess("""
                        [{"id":"m1","title":"Heat","mediaType":"movie","unknownField":1},
                         {"id":"m2","title":"Ronin"}]
                        """, MediaType.APPLICATION_JSON));

        Map<String, ContentMetadata> result = client.batchLookup(List.of("m1", "m2"));

        assertThat(result).containsOnlyKeys("m1", "m2");
        assertThat(result.get("m1").getTitle()).isEqualTo("Heat");
        server.verify();
    }

    @Test
    void batchLookup_emptyIds_makesNoCall() {
        assertThat(client.batchLookup(List.of())).isEmpty();
        server.verify();
    }

    @Test
    void batchLookup_serverError_propagatesToCircuitBreaker() {
        server.expect(requestTo("http://catalog.test/v1/content/batch"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.batchLookup(List.of("m1")))
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void lookupFallback_returnsEmptyMap() {
        assertThat(client.lookupFallback(List.of("m1"), new IllegalStateException("open"))).isEmpty();
    }
}
