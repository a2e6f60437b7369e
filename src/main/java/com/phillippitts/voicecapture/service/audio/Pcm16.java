package com.phillippitts.voicecapture.service.audio;

import java.util.Objects;

/**
 * Conversions between little-endian PCM16 byte streams and sample arrays.
 */
public final class Pcm16 {

    private Pcm16() {}

    /**
     * Decodes little-endian 16-bit samples.
     *
     * @param bytes  source buffer
     * @param length number of valid bytes; a trailing odd byte is ignored
     * @return decoded samples
     */
    public static short[] toSamples(byte[] bytes, int length) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        int count = Math.min(length, bytes.length) / 2;
        short[] samples = new short[count];
        for (int i = 0; i < count; i++) {
            samples[i] = (short) ((bytes[2 * i] & 0xFF) | (bytes[2 * i + 1] << 8));
        }
        return samples;
    }

    /** Encodes samples as little-endian 16-bit bytes. */
    public static byte[] toBytes(short[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >>> 8) & 0xFF);
        }
        return out;
    }
}
