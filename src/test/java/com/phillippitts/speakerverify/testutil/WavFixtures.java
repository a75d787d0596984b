package com.phillippitts.speakerverify.testutil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Builds small 16 kHz mono PCM16 WAV files for tests.
 */
public final class WavFixtures {

    public static final int SAMPLE_RATE = 16_000;
    public static final int BYTE_RATE = SAMPLE_RATE * 2;

    private WavFixtures() {}

    /**
     * WAV bytes with a silent payload of the given duration.
     */
    public static byte[] pcm16Mono(long durationMs) {
        int dataSize = (int) (BYTE_RATE * durationMs / 1000);
        return wav(1, 1, SAMPLE_RATE, BYTE_RATE, 2, new byte[dataSize]);
    }

    /**
     * WAV bytes with the given payload, so two files of equal duration can still differ in content.
     */
    public static byte[] pcm16Mono(long durationMs, byte fill) {
        int dataSize = (int) (BYTE_RATE * durationMs / 1000);
        byte[] data = new byte[dataSize];
        Arrays.fill(data, fill);
        return wav(1, 1, SAMPLE_RATE, BYTE_RATE, 2, data);
    }

    /**
     * Raw WAV assembly with arbitrary header fields, for malformed-header tests.
     */
    public static byte[] wav(int audioFormat, int channels, int sampleRate, int byteRate, int blockAlign, byte[] data) {
        ByteBuffer buf = ByteBuffer.allocate(44 + data.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(36 + data.length);
        buf.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        buf.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(16);
        buf.putShort((short) audioFormat);
        buf.putShort((short) channels);
        buf.putInt(sampleRate);
        buf.putInt(byteRate);
        buf.putShort((short) blockAlign);
        buf.putShort((short) 16);
        buf.put("data".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(data.length);
        buf.put(data);
        return buf.array();
    }

    public static Path write(Path dir, String name, byte[] bytes) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, bytes);
        return file;
    }
}
