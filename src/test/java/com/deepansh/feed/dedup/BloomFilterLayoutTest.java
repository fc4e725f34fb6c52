package com.deepansh.feed.dedup;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.BitSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BloomFilterLayoutTest {

    @Test
    void forCapacity_tenThousandAtOnePercent_matchesStandardSizing() {
        BloomFilterLayout layout = BloomFilterLayout.forCapacity(10_000, 0.01);

        assertThat(layout.bitCount()).isEqualTo(95_851L);
        assertThat(layout.hashCount()).isEqualTo(7);
    }

    @Test
    void offsets_areStableAndInRange() {
        BloomFilterLayout layout = BloomFilterLayout.forCapacity(10_000, 0.01);

        long[] first = layout.offsets("movie:42");
        long[] second = layout.offsets("movie:42");

        assertThat(first).containsExactly(second);
        assertThat(Arrays.stream(first).boxed().toList())
                .hasSize(7)
                .allMatch(o -> o >= 0 && o < layout.bitCount());
    }

    @Test
    void falsePositiveRate_staysNearTargetAtCapacity() {
        BloomFilterLayout layout = BloomFilterLayout.forCapacity(10_000, 0.01);
        BitSet bits = new BitSet((int) layout.bitCount());
        for (int i = 0; i < 10_000; i++) {
            for (long offset : layout.offsets("seen-" + i)) {
                bits.set((int) offset);
            }
        }

        int falsePositives = 0;
        int probes = 20_000;
        for (int i = 0; i < probes; i++) {
            boolean all = true;
            for (long offset : layout.offsets("unseen-" + i)) {
                if (!bits.get((int) offset)) {
                    all = false;
                    break;
                }
            }
            if (all) falsePositives++;
        }

        assertThat((double) falsePositives / probes).isLessThan(0.02);
    }

    @Test
    void forCapacity_invalidArguments_throw() {
        assertThatThrownBy(() -> BloomFilterLayout.forCapacity(0, 0.01)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BloomFilterLayout.forCapacity(100, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
