package com.phillippitts.voicecapture.service.audio;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Writes minimal PCM WAV files using the project-required audio format.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian.
 * This utility only supports this fixed format to avoid bugs and ambiguity.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given samples.
     *
     * @param samples 16-bit mono samples at 16 kHz
     * @param wavPath output file path (will be created or overwritten)
     * @return number of bytes written, header included
     * @throws IllegalStateException if the file cannot be written
     */
    public static long writeMono16kHz(short[] samples, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        int dataSize = samples.length * REQUIRED_BLOCK_ALIGN;
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(wavPath))) {
            writeHeader(os, dataSize);
            for (short s : samples) {
                writeLEShort(os, s);
            }
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
        return (long) WAV_HEADER_SIZE + dataSize;
    }

    /**
     * Returns the size a WAV file holding {@code sampleCount} samples would have.
     */
    public static long fileSizeFor(long sampleCount) {
        return WAV_HEADER_SIZE + sampleCount * REQUIRED_BLOCK_ALIGN;
    }

    private static void writeHeader(OutputStream os, int dataSize) throws IOException {
        // RIFF chunk: size covers everything after the first 8 bytes
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        // fmt chunk, 16 bytes for PCM
        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        writeLEShort(os, (short) 1);
        writeLEShort(os, (short) REQUIRED_CHANNELS);
        writeLEInt(os, REQUIRED_SAMPLE_RATE);
        writeLEInt(os, REQUIRED_BYTE_RATE);
        writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
        writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
