package com.deepansh.feed.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed configuration for the feed engine.
 * Bound from application.yml under the "feed" prefix.
 */
@Component
@ConfigurationProperties(prefix = "feed")
@Data
public class FeedProperties {

    private Mix mix = new Mix();
    private Plan plan = new Plan();
    private ColdStart coldStart = new ColdStart();
    private Images images = new Images();
    private Index index = new Index();
    private Dedup dedup = new Dedup();
    private Context context = new Context();
    private Request request = new Request();
    private Hydration hydration = new Hydration();
    private Cursor cursor = new Cursor();
    private Catalog catalog = new Catalog();

    @PostConstruct
    public void validate() {
        mix.validate();
        plan.validate();
        images.validate();
    }

    @Data
    public static class Mix {
        private double trendingShare = 0.5;
        private double personalizedShare = 0.3;
        private double friendsShare = 0.2;

        void validate() {
            double sum = trendingShare + personalizedShare + friendsShare;
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalStateException("feed.mix shares must sum to 1.0 but sum to " + sum);
            }
            if (trendingShare < 0 || personalizedShare < 0 || friendsShare < 0) {
                throw new IllegalStateException("feed.mix shares must not be negative");
            }
        }
    }

    @Data
    public static class Plan {
        /** Plan length is max(pageSize * pagesPerPlan, minSize) */
        private int pagesPerPlan = 5;
        private int minSize = 50;
        private int oversample = 3;
        private Duration ttl = Duration.ofMinutes(10);
        /** Positions [0, fixedHead) stay in score order */
        private int fixedHead = 3;
        /** Positions [fixedHead, middleBandEnd) are permuted within middleWindow */
        private int middleBandEnd = 7;
        private int middleWindow = 2;
        /** How long the per-session epoch counter outlives its plan */
        private Duration epochTtl = Duration.ofHours(24);

        void validate() {
            if (fixedHead < 0 || middleBandEnd < fixedHead) {
                throw new IllegalStateException("feed.plan shuffle tiers are inconsistent: fixedHead="
                        + fixedHead + ", middleBandEnd=" + middleBandEnd);
            }
            if (oversample < 1 || middleWindow < 1) {
                throw new IllegalStateException("feed.plan oversample and middleWindow must be >= 1");
            }
        }
    }

    @Data
    public static class ColdStart {
        private String defaultGenres = "action,comedy,drama";
        private String communityBucket = "community";

        public List<String> getDefaultGenreList() {
            if (defaultGenres == null || defaultGenres.isBlank()) return List.of();
            return Arrays.stream(defaultGenres.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class Images {
        /** Interleave image posts into planned feeds */
        private boolean enabled = true;
        private String bucket = "images";
        /** One image after every `interval` planned items */
        private int interval = 3;
        /** Minimum image candidates read, before oversampling */
        private int minRead = 10;

        void validate() {
            if (enabled && interval < 1) {
                throw new IllegalStateException("feed.images.interval must be >= 1");
            }
        }
    }

    @Data
    public static class Index {
        private long refreshIntervalMs = 30_000;
        /** Bucket family (name before ':') to fallback bucket */
        private Map<String, String> fallbacks = new LinkedHashMap<>(Map.of(
                "genre", "trending",
                "friends", "community"));
    }

    @Data
    public static class Dedup {
        private Duration sessionTtl = Duration.ofMinutes(10);
        private int bloomCapacity = 10_000;
        private double bloomFalsePositiveRate = 0.01;
        private Duration bloomTtl = Duration.ofDays(30);
    }

    @Data
    public static class Context {
        private long sourceTimeoutMs = 80;
        private Duration cacheTtl = Duration.ofSeconds(60);
        private int seenHistoryLimit = 500;
        private int savedItemsLimit = 200;
    }

    @Data
    public static class Request {
        /** Soft latency target; exceeding it is logged */
        private long budgetMs = 150;
        /** Hard deadline for the whole pipeline */
        private long deadlineMs = 1000;
        private int defaultLimit = 10;
        private int maxLimit = 100;
    }

    @Data
    public static class Hydration {
        private Duration cacheTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class Cursor {
        private String secret = "local-dev-cursor-secret";
    }

    @Data
    public static class Catalog {
        private String baseUrl = "http://localhost:8090";
        private int connectTimeoutMs = 200;
        private int readTimeoutMs = 300;
        private int maxConnections = 50;
    }
}
