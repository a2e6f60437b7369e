package com.phillippitts.voicecapture.service.audio.capture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleAccumulatorTest {

    @Test
    void appendsInOrderAndGrows() {
        SampleAccumulator acc = new SampleAccumulator(100_000);
        short[] chunk = new short[10_000];
        for (int i = 0; i < chunk.length; i++) {
            chunk[i] = (short) i;
        }

        acc.append(chunk, chunk.length);
        acc.append(chunk, chunk.length);

        short[] all = acc.toArray();
        assertThat(all).hasSize(20_000);
        assertThat(all[9_999]).isEqualTo((short) 9_999);
        assertThat(all[10_000]).isEqualTo((short) 0);
    }

    @Test
    void refusesSamplesBeyondCapacity() {
        SampleAccumulator acc = new SampleAccumulator(5);

        assertThat(acc.append(new short[]{1, 2, 3}, 3)).isEqualTo(3);
        assertThat(acc.append(new short[]{4, 5, 6}, 3)).isEqualTo(2);
        assertThat(acc.append(new short[]{7}, 1)).isZero();
        assertThat(acc.toArray()).containsExactly((short) 1, (short) 2, (short) 3, (short) 4, (short) 5);
    }

    @Test
    void honoursLengthArgument() {
        SampleAccumulator acc = new SampleAccumulator(10);

        acc.append(new short[]{1, 2, 3, 4}, 2);

        assertThat(acc.size()).isEqualTo(2);
    }

    @Test
    void clearResetsState() {
        SampleAccumulator acc = new SampleAccumulator(10);
        acc.append(new short[]{1, 2}, 2);

        acc.clear();

        assertThat(acc.toArray()).isEmpty();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new SampleAccumulator(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
