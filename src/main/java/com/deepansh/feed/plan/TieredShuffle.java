package com.deepansh.feed.plan;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Positional shuffle that keeps the top of the feed stable and varies the rest.
 *
 * - [0, fixedHead)             untouched
 * - [fixedHead, middleBandEnd) each item swaps with one at most window-1 places later
 * - [middleBandEnd, end)       full Fisher-Yates permutation
 *
 * The generator is java.util.Random, whose sequence is fixed by the JDK for a
 * given seed, so any worker reproduces the same order.
 */
public final class TieredShuffle {

    private final int fixedHead;
    private final int middleBandEnd;
    private final int middleWindow;

    public TieredShuffle(int fixedHead, int middleBandEnd, int middleWindow) {
        if (fixedHead < 0 || middleBandEnd < fixedHead || middleWindow < 1) {
            throw new IllegalArgumentException("Invalid shuffle tiers: fixedHead=" + fixedHead
                    + ", middleBandEnd=" + middleBandEnd + ", middleWindow=" + middleWindow);
        }
        this.fixedHead = fixedHead;
        this.middleBandEnd = middleBandEnd;
        this.middleWindow = middleWindow;
    }

    public static long seed(String sessionId, long epoch) {
        return Hashing.murmur3_128().newHasher()
                .putString(sessionId, StandardCharsets.UTF_8)
                .putLong(epoch)
                .hash()
                .asLong();
    }

    public <T> List<T> apply(List<T> items, long seed) {
        List<T> result = new ArrayList<>(items);
        Random random = new Random(seed);

        int bandEnd = Math.min(middleBandEnd, result.size());
        for (int i = fixedHead; i < bandEnd; i++) {
            int reach = Math.min(middleWindow, bandEnd - i);
            int j = i + random.nextInt(reach);
            Collections.swap(result, i, j);
        }

        for (int i = result.size() - 1; i > middleBandEnd; i--) {
            int j = middleBandEnd + random.nextInt(i - middleBandEnd + 1);
            Collections.swap(result, i, j);
        }
        return result;
    }
}
