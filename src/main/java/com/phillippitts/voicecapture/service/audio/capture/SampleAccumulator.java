package com.phillippitts.voicecapture.service.audio.capture;

import java.util.Arrays;

/**
 * Growable buffer of PCM16 samples with a hard capacity. Thread-safe for one producer
 * (capture thread) and one consumer (finalization after the loop exits).
 *
 * <p>Unlike a ring buffer it never drops old audio: samples beyond the capacity are refused,
 * and the capture loop stops well before that point.
 */
final class SampleAccumulator {

    private static final int INITIAL_CAPACITY = 16_000;

    private final int maxSamples;
    private short[] buffer;
    private int size;

    SampleAccumulator(int maxSamples) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0, got: " + maxSamples);
        }
        this.maxSamples = maxSamples;
        this.buffer = new short[Math.min(INITIAL_CAPACITY, maxSamples)];
    }

    /**
     * Appends samples up to the capacity.
     *
     * @return number of samples actually appended
     */
    synchronized int append(short[] src, int len) {
        int accepted = Math.min(Math.max(0, len), maxSamples - size);
        if (accepted <= 0) {
            return 0;
        }
        ensureCapacity(size + accepted);
        System.arraycopy(src, 0, buffer, size, accepted);
        size += accepted;
        return accepted;
    }

    synchronized int size() {
        return size;
    }

    int maxSamples() {
        return maxSamples;
    }

    synchronized short[] toArray() {
        return Arrays.copyOf(buffer, size);
    }

    synchronized void clear() {
        buffer = new short[Math.min(INITIAL_CAPACITY, maxSamples)];
        size = 0;
    }

    private void ensureCapacity(int required) {
        if (required <= buffer.length) {
            return;
        }
        int grown = (int) Math.min((long) maxSamples, Math.max((long) required, buffer.length * 2L));
        buffer = Arrays.copyOf(buffer, grown);
    }
}
