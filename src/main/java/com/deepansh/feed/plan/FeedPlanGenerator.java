package com.deepansh.feed.plan;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.dedup.DedupStore;
import com.deepansh.feed.exception.BucketUnavailableException;
import com.deepansh.feed.exception.CandidatesUnavailableException;
import com.deepansh.feed.index.CandidateIndexPool;
import com.deepansh.feed.index.FriendActivityIndex;
import com.deepansh.feed.model.CandidateBucket;
import com.deepansh.feed.model.FeedPlan;
import com.deepansh.feed.model.FeedType;
import com.deepansh.feed.model.IndexEntry;
import com.deepansh.feed.model.MixSummary;
import com.deepansh.feed.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Builds the ordered, write-once item list for a feed session.
 *
 * Flow per new plan:
 * 1. Compute per-bucket quotas from the mix shares and the plan target size
 * 2. Read every bucket concurrently (oversampled), applying cold-start substitution
 * 3. Drop ids already emitted in the session; push account-seen ids behind fresh ones
 * 4. Concatenate buckets, lift the top-ranked trending/personalized items to the head,
 *    tiered shuffle
 * 5. Top up from trending when the plan is too short to fill two pages
 * 6. Interleave image posts, one after every feed.images.interval items
 * 7. SET NX the plan; the loser of a race reads the winner's plan back
 *
 * A TRENDING feed runs the same flow with the whole target assigned to the
 * trending bucket.
 */
@Service
@Slf4j
public class FeedPlanGenerator {

    static final String TRENDING_BUCKET = "trending";
    static final String GENRE_PREFIX = "genre:";
    static final String IMAGES_KEY = "images";

    private static final double QUOTA_EPSILON = 1e-9;
    private static final int CREATE_ATTEMPTS = 2;

    private final CandidateIndexPool indexPool;
    private final FriendActivityIndex friendActivityIndex;
    private final DedupStore dedupStore;
    private final FeedPlanStore planStore;
    private final Executor executor;
    private final FeedProperties properties;
    private final TieredShuffle shuffle;

    public FeedPlanGenerator(CandidateIndexPool indexPool,
                             FriendActivityIndex friendActivityIndex,
                             DedupStore dedupStore,
                             FeedPlanStore planStore,
                             @Qualifier("contextTaskExecutor") Executor executor,
                             FeedProperties properties) {
        this.indexPool = indexPool;
        this.friendActivityIndex = friendActivityIndex;
        this.dedupStore = dedupStore;
        this.planStore = planStore;
        this.executor = executor;
        this.properties = properties;
        FeedProperties.Plan plan = properties.getPlan();
        this.shuffle = new TieredShuffle(plan.getFixedHead(), plan.getMiddleBandEnd(), plan.getMiddleWindow());
    }

    public FeedPlan getOrCreatePlan(String sessionId, UserContext context, int pageSize, FeedType feedType) {
        Optional<FeedPlan> existing = findLive(sessionId);
        if (existing.isPresent()) {
            log.debug("Reusing plan [sessionId={}, size={}]", sessionId, existing.get().size());
            return existing.get();
        }

        long epoch = planStore.lastEpoch(sessionId) + 1;
        FeedPlan candidate = generate(sessionId, context, pageSize, feedType, epoch);

        for (int attempt = 1; attempt <= CREATE_ATTEMPTS; attempt++) {
            if (planStore.createIfAbsent(candidate)) {
                planStore.recordEpoch(sessionId, epoch);
                dedupStore.sessionMark(sessionId, candidate.itemIds());
                log.info("Plan created [sessionId={}, userId={}, feedType={}, epoch={}, size={}, mix={}, "
                                + "substitutions={}]",
                        sessionId, context.userId(), feedType.value(), epoch, candidate.size(),
                        candidate.mixSummary().counts(), candidate.mixSummary().substitutions());
                return candidate;
            }

            // Another worker created the plan between our find and our SET NX
            Optional<FeedPlan> winner = findLive(sessionId);
            if (winner.isPresent()) {
                log.debug("Lost plan creation race, using stored plan [sessionId={}]", sessionId);
                return winner.get();
            }
            log.debug("Stored plan expired during creation [sessionId={}, attempt={}]", sessionId, attempt);
        }
        throw new IllegalStateException("Plan for session " + sessionId + " was neither created nor readable");
    }

    private Optional<FeedPlan> findLive(String sessionId) {
        Instant now = Instant.now();
        return planStore.find(sessionId).filter(plan -> !plan.isExpired(now));
    }

    private FeedPlan generate(String sessionId, UserContext context, int pageSize, FeedType feedType, long epoch) {
        FeedProperties.Plan planProps = properties.getPlan();
        int target = Math.max(pageSize * planProps.getPagesPerPlan(), planProps.getMinSize());

        Map<CandidateBucket, Integer> quotas = new EnumMap<>(CandidateBucket.class);
        if (feedType == FeedType.TRENDING) {
            quotas.put(CandidateBucket.TRENDING, target);
        } else {
            for (CandidateBucket bucket : CandidateBucket.values()) {
                quotas.put(bucket, quota(bucket.share(properties.getMix()), target));
            }
        }

        List<String> substitutions = new ArrayList<>();
        List<String> readFallbacks = Collections.synchronizedList(new ArrayList<>());
        Map<CandidateBucket, CompletableFuture<Optional<List<IndexEntry>>>> reads =
                new EnumMap<>(CandidateBucket.class);
        quotas.forEach((bucket, quota) -> {
            int fetch = quota * planProps.getOversample();
            reads.put(bucket, readAsync(bucket, bucketReader(bucket, context, fetch, substitutions, readFallbacks)));
        });
        CompletableFuture.allOf(reads.values().toArray(new CompletableFuture[0])).join();
        substitutions.addAll(readFallbacks);

        Map<CandidateBucket, List<IndexEntry>> candidates = new EnumMap<>(CandidateBucket.class);
        reads.forEach((bucket, read) -> read.join().ifPresent(entries -> candidates.put(bucket, entries)));
        if (candidates.isEmpty()) {
            throw new CandidatesUnavailableException(sessionId);
        }

        Set<String> sessionSeen = dedupStore.sessionSeen(sessionId);
        Set<String> softSeen = softSeen(context, candidates.values());

        Assembly assembly = assemble(candidates, quotas, sessionSeen, softSeen, planProps.getFixedHead());
        List<String> ordered = shuffle.apply(assembly.itemIds(), TieredShuffle.seed(sessionId, epoch));

        int toppedUp = 0;
        if (ordered.size() < pageSize * 2) {
            List<String> extra = topUp(ordered, target, sessionSeen, softSeen);
            toppedUp = extra.size();
            ordered = new ArrayList<>(ordered);
            ordered.addAll(extra);
            log.info("Plan topped up from trending [sessionId={}, added={}, size={}]",
                    sessionId, toppedUp, ordered.size());
        }

        Map<String, Integer> counts = new LinkedHashMap<>(assembly.counts());
        if (properties.getImages().isEnabled()) {
            Set<String> demote = new HashSet<>(softSeen);
            demote.addAll(context.seenIds());
            List<String> mixed = interleaveImages(ordered, sessionSeen, demote);
            if (mixed.size() > ordered.size()) {
                counts.put(IMAGES_KEY, mixed.size() - ordered.size());
                ordered = mixed;
            }
        }

        return new FeedPlan(
                sessionId,
                context.userId(),
                ordered,
                Instant.now(),
                planProps.getTtl().toSeconds(),
                epoch,
                feedType,
                new MixSummary(counts, substitutions, toppedUp));
    }

    /**
     * Returns the supplier that reads one bucket, recording any cold-start or
     * fallback substitution. Substitutions are decided on the calling thread so
     * their order is stable.
     */
    private Supplier<List<IndexEntry>> bucketReader(CandidateBucket bucket, UserContext context, int fetch,
                                                    List<String> substitutions, List<String> readFallbacks) {
        switch (bucket) {
            case TRENDING:
                return () -> indexPool.rangeTop(TRENDING_BUCKET, fetch);

            case PERSONALIZED: {
                List<String> genres = context.genres().stream().sorted().toList();
                if (context.isColdStartGenres()) {
                    genres = properties.getColdStart().getDefaultGenreList();
                    substitutions.add("personalized->default-genres");
                }
                for (String genre : genres) {
                    String genreBucket = GENRE_PREFIX + genre;
                    if (!indexPool.exists(genreBucket)) {
                        indexPool.fallbackFor(genreBucket)
                                .ifPresent(fallback -> substitutions.add(genreBucket + "->" + fallback));
                    }
                }
                List<String> genreList = genres;
                return () -> readGenres(genreList, fetch);
            }

            case FRIENDS:
            default: {
                if (context.isColdStartFriends()) {
                    String community = properties.getColdStart().getCommunityBucket();
                    substitutions.add("friends->" + community);
                    return () -> indexPool.rangeTop(community, fetch);
                }
                String userId = context.userId();
                return () -> readFriends(userId, fetch, readFallbacks);
            }
        }
    }

    private CompletableFuture<Optional<List<IndexEntry>>> readAsync(CandidateBucket bucket,
                                                                   Supplier<List<IndexEntry>> reader) {
        long timeoutMs = properties.getContext().getSourceTimeoutMs();
        return CompletableFuture.supplyAsync(() -> Optional.of(reader.get()), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof BucketUnavailableException || cause instanceof TimeoutException) {
                        log.warn("Bucket {} contributes no candidates: {}", bucket.key(), cause.toString());
                        return Optional.empty();
                    }
                    throw new CompletionException(cause);
                });
    }

    /**
     * Union of the genre buckets, best score per id. Unavailable genres are
     * skipped; the read fails only when none of them could be read.
     */
    private List<IndexEntry> readGenres(List<String> genres, int fetch) {
        Map<String, IndexEntry> best = new LinkedHashMap<>();
        int available = 0;
        for (String genre : genres) {
            try {
                for (IndexEntry entry : indexPool.rangeTop(GENRE_PREFIX + genre, fetch)) {
                    best.merge(entry.id(), entry,
                            (a, b) -> IndexEntry.RANKING.compare(a, b) <= 0 ? a : b);
                }
                available++;
            } catch (BucketUnavailableException e) {
                log.debug("Genre bucket skipped: {}", e.getBucket());
            }
        }
        if (available == 0) {
            throw new BucketUnavailableException(CandidateBucket.PERSONALIZED.key());
        }
        return best.values().stream()
                .sorted(IndexEntry.RANKING)
                .limit(fetch)
                .toList();
    }

    private List<IndexEntry> readFriends(String userId, int fetch, List<String> readFallbacks) {
        try {
            return friendActivityIndex.rangeTop(userId, fetch);
        } catch (BucketUnavailableException e) {
            Optional<String> fallback = indexPool.fallbackFor(e.getBucket());
            if (fallback.isEmpty()) {
                throw e;
            }
            log.info("Friend activity unavailable for user={}, reading {}", userId, fallback.get());
            List<IndexEntry> entries = indexPool.rangeTop(fallback.get(), fetch);
            readFallbacks.add(CandidateBucket.FRIENDS.key() + "->" + fallback.get());
            return entries;
        }
    }

    private Set<String> softSeen(UserContext context, Collection<List<IndexEntry>> candidates) {
        Set<String> ids = new LinkedHashSet<>();
        candidates.forEach(entries -> entries.forEach(entry -> ids.add(entry.id())));

        Set<String> soft = new HashSet<>(dedupStore.accountProbablySeen(context.userId(), ids));
        for (String id : ids) {
            if (context.seenIds().contains(id)) {
                soft.add(id);
            }
        }
        return soft;
    }

    private List<String> topUp(List<String> planned, int target, Set<String> sessionSeen, Set<String> softSeen) {
        int deep = target * properties.getPlan().getOversample();
        List<IndexEntry> trending;
        try {
            trending = indexPool.rangeTop(TRENDING_BUCKET, deep);
        } catch (BucketUnavailableException e) {
            log.warn("Top-up skipped, trending unavailable");
            return List.of();
        }

        List<String> fresh = unplannedFreshFirst(trending, planned, sessionSeen, softSeen);
        int room = Math.max(0, target - planned.size());
        return fresh.subList(0, Math.min(room, fresh.size()));
    }

    private List<String> interleaveImages(List<String> planned, Set<String> sessionSeen, Set<String> softSeen) {
        FeedProperties.Images config = properties.getImages();
        int slots = planned.size() / config.getInterval();
        if (slots == 0) {
            return planned;
        }

        List<IndexEntry> images;
        try {
            int depth = Math.max(slots, config.getMinRead()) * properties.getPlan().getOversample();
            images = indexPool.rangeTop(config.getBucket(), depth);
        } catch (BucketUnavailableException e) {
            log.debug("Image bucket {} unavailable, plan has no images", config.getBucket());
            return planned;
        }

        List<String> picks = unplannedFreshFirst(images, planned, sessionSeen, softSeen);
        return interleave(planned, picks.subList(0, Math.min(slots, picks.size())), config.getInterval());
    }

    /**
     * Ids of entries not yet planned nor emitted in the session, in ranking
     * order with soft-seen ids moved behind the fresh ones.
     */
    private static List<String> unplannedFreshFirst(List<IndexEntry> entries, Collection<String> planned,
                                                    Set<String> sessionSeen, Set<String> softSeen) {
        Set<String> taken = new HashSet<>(planned);
        List<String> fresh = new ArrayList<>();
        List<String> demoted = new ArrayList<>();
        for (IndexEntry entry : entries) {
            String id = entry.id();
            if (sessionSeen.contains(id) || !taken.add(id)) {
                continue;
            }
            (softSeen.contains(id) ? demoted : fresh).add(id);
        }
        fresh.addAll(demoted);
        return fresh;
    }

    /** Inserts the next insert after every interval items; leftovers are dropped. */
    static List<String> interleave(List<String> items, List<String> inserts, int interval) {
        List<String> result = new ArrayList<>(items.size() + inserts.size());
        int next = 0;
        for (int i = 0; i < items.size(); i++) {
            result.add(items.get(i));
            if ((i + 1) % interval == 0 && next < inserts.size()) {
                result.add(inserts.get(next++));
            }
        }
        return result;
    }

    /**
     * Pure selection step: quota per bucket in fixed bucket order, then the
     * fixedHead best-ranked trending/personalized picks moved to the front in
     * ranking order. Friends picks and soft-seen picks only reach the head when
     * there are too few of the others. The rest keep their concatenation order.
     */
    static Assembly assemble(Map<CandidateBucket, List<IndexEntry>> candidates,
                             Map<CandidateBucket, Integer> quotas,
                             Set<String> sessionSeen,
                             Set<String> softSeen,
                             int fixedHead) {
        Set<String> chosenIds = new HashSet<>();
        Set<String> friendPicks = new HashSet<>();
        List<IndexEntry> chosen = new ArrayList<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (CandidateBucket bucket : CandidateBucket.values()) {
            List<IndexEntry> entries = candidates.getOrDefault(bucket, List.of());
            List<IndexEntry> fresh = new ArrayList<>();
            List<IndexEntry> demoted = new ArrayList<>();
            for (IndexEntry entry : entries) {
                if (sessionSeen.contains(entry.id()) || chosenIds.contains(entry.id())) {
                    continue;
                }
                (softSeen.contains(entry.id()) ? demoted : fresh).add(entry);
            }
            fresh.addAll(demoted);

            int quota = quotas.getOrDefault(bucket, 0);
            int taken = 0;
            for (IndexEntry entry : fresh) {
                if (taken == quota) {
                    break;
                }
                if (chosenIds.add(entry.id())) {
                    chosen.add(entry);
                    if (bucket == CandidateBucket.FRIENDS) {
                        friendPicks.add(entry.id());
                    }
                    taken++;
                }
            }
            counts.put(bucket.key(), taken);
        }

        Comparator<IndexEntry> headOrder = Comparator
                .comparing((IndexEntry entry) -> friendPicks.contains(entry.id()))
                .thenComparing(entry -> softSeen.contains(entry.id()))
                .thenComparing(IndexEntry.RANKING);
        List<IndexEntry> head = chosen.stream()
                .sorted(headOrder)
                .limit(fixedHead)
                .toList();
        Set<String> headIds = new HashSet<>();
        head.forEach(entry -> headIds.add(entry.id()));

        List<String> itemIds = new ArrayList<>(chosen.size());
        head.forEach(entry -> itemIds.add(entry.id()));
        for (IndexEntry entry : chosen) {
            if (!headIds.contains(entry.id())) {
                itemIds.add(entry.id());
            }
        }
        return new Assembly(itemIds, counts);
    }

    static int quota(double share, int target) {
        return (int) Math.ceil(share * target - QUOTA_EPSILON);
    }

    record Assembly(List<String> itemIds, Map<String, Integer> counts) {
    }
}
