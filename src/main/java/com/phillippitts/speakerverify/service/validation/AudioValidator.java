package com.phillippitts.speakerverify.service.validation;

import com.phillippitts.speakerverify.config.properties.AudioValidationProperties;
import com.phillippitts.speakerverify.exception.ValidationFailedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Checks a resolved audio file before it is sent to the extractor.
 *
 * <p>All files: must exist, be non-empty and not exceed {@code audio.validation.max-file-size-bytes}.
 *
 * <p>WAV (RIFF/WAVE): the chunk structure is walked to find {@code fmt } and {@code data}; the
 * format fields must be sane and the duration derived from the data size and byte rate must lie
 * within {@code [min-duration-ms, max-duration-ms]}. Only chunk headers are read, never the samples.
 *
 * <p>Other containers (mp3, flac, ...) are passed through; the extractor decodes them.
 */
@Component
public class AudioValidator {

    private static final Logger LOG = LogManager.getLogger(AudioValidator.class);

    static final int RIFF_HEADER_SIZE = 12;
    static final int CHUNK_HEADER_SIZE = 8;
    static final int FMT_CHUNK_MIN_SIZE = 16;
    static final int FORMAT_PCM = 1;
    static final int FORMAT_IEEE_FLOAT = 3;
    static final int FORMAT_EXTENSIBLE = 0xFFFE;

    private final AudioValidationProperties props;

    public AudioValidator(AudioValidationProperties props) {
        this.props = props;
    }

    /**
     * @param file resolved local audio file
     * @return duration in milliseconds for WAV input, or -1 when the container was not inspected
     * @throws ValidationFailedException when size, format or duration constraints are violated
     */
    public long validate(Path file) {
        long size;
        try {
            if (!Files.isRegularFile(file)) {
                throw new ValidationFailedException("Audio file does not exist");
            }
            size = Files.size(file);
        } catch (IOException e) {
            throw new ValidationFailedException("Audio file is not readable: " + e.getMessage());
        }
        if (size == 0) {
            throw new ValidationFailedException(0, "Audio file is empty");
        }
        if (size > props.getMaxFileSizeBytes()) {
            throw new ValidationFailedException(size, "Audio file too large. Max: "
                    + props.getMaxFileSizeBytes() + " bytes (" + (props.getMaxFileSizeBytes() / (1024 * 1024)) + " MB)");
        }

        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            if (!isWav(ch)) {
                LOG.debug("{} is not RIFF/WAVE; leaving format checks to the extractor", file.getFileName());
                return -1;
            }
            long durationMs = validateWav(ch, size);
            LOG.debug("{} validated: {} bytes, {} ms", file.getFileName(), size, durationMs);
            return durationMs;
        } catch (IOException e) {
            throw new ValidationFailedException(size, "Audio file could not be read: " + e.getMessage());
        }
    }

    private static boolean isWav(FileChannel ch) throws IOException {
        ByteBuffer header = read(ch, 0, RIFF_HEADER_SIZE);
        if (header.remaining() < RIFF_HEADER_SIZE) {
            return false;
        }
        return "RIFF".equals(fourCc(header, 0)) && "WAVE".equals(fourCc(header, 8));
    }

    /**
     * Walks the chunk list: {@code id(4) + size(4 LE) + payload}, payloads padded to even length.
     */
    private long validateWav(FileChannel ch, long fileSize) throws IOException {
        long offset = RIFF_HEADER_SIZE;
        ByteBuffer fmt = null;
        long dataSize = -1;

        while (offset + CHUNK_HEADER_SIZE <= fileSize) {
            ByteBuffer hdr = read(ch, offset, CHUNK_HEADER_SIZE);
            String chunkId = fourCc(hdr, 0);
            long chunkSize = Integer.toUnsignedLong(hdr.getInt(4));
            long payload = offset + CHUNK_HEADER_SIZE;

            if ("fmt ".equals(chunkId)) {
                if (chunkSize < FMT_CHUNK_MIN_SIZE) {
                    throw new ValidationFailedException(fileSize, "fmt chunk too small: " + chunkSize + " bytes");
                }
                fmt = read(ch, payload, FMT_CHUNK_MIN_SIZE);
                if (fmt.remaining() < FMT_CHUNK_MIN_SIZE) {
                    throw new ValidationFailedException(fileSize, "Truncated fmt chunk");
                }
            } else if ("data".equals(chunkId)) {
                // streamed WAVs may declare a size larger than the file; count what is there
                dataSize = Math.min(chunkSize, fileSize - payload);
                break;
            }
            if (payload + chunkSize > fileSize) {
                throw new ValidationFailedException(fileSize, "Invalid chunk size: " + chunkSize + " at offset " + offset);
            }
            offset = payload + chunkSize + (chunkSize % 2);
        }

        if (fmt == null) {
            throw new ValidationFailedException(fileSize, "Missing fmt chunk in WAV file");
        }
        if (dataSize < 0) {
            throw new ValidationFailedException(fileSize, "Missing data chunk in WAV file");
        }

        int audioFormat = Short.toUnsignedInt(fmt.getShort(0));
        int channels = Short.toUnsignedInt(fmt.getShort(2));
        long sampleRate = Integer.toUnsignedLong(fmt.getInt(4));
        long byteRate = Integer.toUnsignedLong(fmt.getInt(8));
        int blockAlign = Short.toUnsignedInt(fmt.getShort(12));

        if (audioFormat != FORMAT_PCM && audioFormat != FORMAT_IEEE_FLOAT && audioFormat != FORMAT_EXTENSIBLE) {
            throw new ValidationFailedException(fileSize, "Unsupported WAV encoding: " + audioFormat);
        }
        if (channels == 0 || sampleRate == 0 || byteRate == 0 || blockAlign == 0) {
            throw new ValidationFailedException(fileSize, "Corrupt WAV header (channels=" + channels
                    + ", sampleRate=" + sampleRate + ", byteRate=" + byteRate + ", blockAlign=" + blockAlign + ")");
        }

        long durationMs = dataSize * 1000L / byteRate;
        if (durationMs < props.getMinDurationMs()) {
            throw new ValidationFailedException(fileSize, "Audio too short: " + durationMs + " ms (min "
                    + props.getMinDurationMs() + " ms)");
        }
        if (durationMs > props.getMaxDurationMs()) {
            throw new ValidationFailedException(fileSize, "Audio too long: " + durationMs + " ms (max "
                    + props.getMaxDurationMs() + " ms)");
        }
        return durationMs;
    }

    private static ByteBuffer read(FileChannel ch, long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        while (buf.hasRemaining()) {
            int n = ch.read(buf, position + buf.position());
            if (n < 0) {
                break;
            }
        }
        buf.flip();
        return buf;
    }

    private static String fourCc(ByteBuffer buf, int index) {
        byte[] id = new byte[4];
        for (int i = 0; i < 4; i++) {
            id[i] = buf.get(index + i);
        }
        return new String(id, StandardCharsets.US_ASCII);
    }
}
