package com.phillippitts.speakerverify.domain;

import org.springframework.core.io.InputStreamSource;

import java.util.Objects;

/**
 * Where a request's audio comes from. Exactly one of three variants:
 * <ul>
 *   <li>{@link Upload} - bytes posted by the client with their original filename</li>
 *   <li>{@link RemoteUrl} - an http/https URL fetched through the content cache</li>
 *   <li>{@link LocalPath} - a file already present on the server; never deleted by the service</li>
 * </ul>
 *
 * <p>Shape checks (non-null, non-blank) happen here. Semantic checks (extension allow-list,
 * scheme, existence) belong to {@link com.phillippitts.speakerverify.service.audio.AudioSourceResolver}.
 */
public interface AudioSource {

    /**
     * Short human-readable description used in batch results and log lines.
     *
     * @return description of this source
     */
    String describe();

    /**
     * Creates a source from a string the way batch candidates are interpreted:
     * anything carrying a URI scheme is a URL, everything else is a local path.
     *
     * @param value URL or path string
     * @return remote or local source
     */
    static AudioSource fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("audio source must not be blank");
        }
        String trimmed = value.trim();
        return trimmed.contains("://") ? new RemoteUrl(trimmed) : new LocalPath(trimmed);
    }

    /**
     * Uploaded bytes.
     *
     * @param filename client-supplied filename (untrusted, sanitized before use)
     * @param content  stream source for the uploaded bytes
     */
    record Upload(String filename, InputStreamSource content) implements AudioSource {
        public Upload {
            Objects.requireNonNull(content, "content must not be null");
            filename = filename == null ? "" : filename;
        }

        @Override
        public String describe() {
            return filename;
        }
    }

    /**
     * Remote audio addressed by URL.
     *
     * @param url absolute URL string
     */
    record RemoteUrl(String url) implements AudioSource {
        public RemoteUrl {
            Objects.requireNonNull(url, "url must not be null");
        }

        @Override
        public String describe() {
            return url;
        }
    }

    /**
     * Audio already on the server's filesystem.
     *
     * @param path filesystem path string
     */
    record LocalPath(String path) implements AudioSource {
        public LocalPath {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String describe() {
            return path;
        }
    }
}
