package com.phillippitts.speakerverify.service.audio;

import com.phillippitts.speakerverify.config.properties.AudioSourceProperties;
import com.phillippitts.speakerverify.domain.AudioSource;
import com.phillippitts.speakerverify.domain.ResolvedAudio;
import com.phillippitts.speakerverify.exception.InvalidSourceException;
import com.phillippitts.speakerverify.service.cache.ContentCache;
import com.phillippitts.speakerverify.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Turns an {@link AudioSource} into a local file the extractor can read.
 *
 * <ul>
 *   <li>Upload: extension must be allow-listed; bytes are written under the scratch directory with a
 *       collision-free name and the result is owned (deleted on close).</li>
 *   <li>RemoteUrl: http/https only; served through the {@link ContentCache}. The result is borrowed
 *       and holds a cache lease until closed.</li>
 *   <li>LocalPath: must be an existing readable regular file; borrowed, never deleted.</li>
 * </ul>
 */
@Component
public class AudioSourceResolver {

    private static final Logger LOG = LogManager.getLogger(AudioSourceResolver.class);
    private static final int MAX_FILENAME_CHARS = 100;

    private final Path scratchDir;
    private final Set<String> allowedExtensions;
    private final ContentCache cache;

    public AudioSourceResolver(AudioSourceProperties props, ContentCache cache) {
        this.scratchDir = Paths.get(props.getScratchDir()).toAbsolutePath().normalize();
        this.allowedExtensions = Set.copyOf(props.getAllowedExtensions());
        this.cache = cache;
        try {
            Files.createDirectories(scratchDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create scratch directory " + scratchDir, e);
        }
    }

    /**
     * @param source audio source from the request
     * @return resolved local file; the caller must close it
     * @throws InvalidSourceException on a disallowed extension, unsupported scheme or missing file
     * @throws com.phillippitts.speakerverify.exception.DownloadFailedException if a remote fetch fails
     */
    public ResolvedAudio resolve(AudioSource source) {
        if (source instanceof AudioSource.Upload upload) {
            return resolveUpload(upload);
        }
        if (source instanceof AudioSource.RemoteUrl remote) {
            return resolveRemote(remote);
        }
        if (source instanceof AudioSource.LocalPath local) {
            return resolveLocal(local);
        }
        throw new InvalidSourceException(String.valueOf(source), "unsupported audio source type");
    }

    private ResolvedAudio resolveUpload(AudioSource.Upload upload) {
        String extension = extensionOf(upload.filename());
        if (extension == null || !allowedExtensions.contains(extension)) {
            throw new InvalidSourceException(upload.filename(),
                    "file type not allowed: " + LogSanitizer.truncate(upload.filename(), MAX_FILENAME_CHARS));
        }
        String safeName = sanitizeFilename(upload.filename());
        if (!safeName.toLowerCase(Locale.ROOT).endsWith("." + extension) || safeName.length() == extension.length() + 1) {
            safeName = "upload." + extension;
        }
        Path target = scratchDir.resolve(UUID.randomUUID() + "_" + safeName);
        try (InputStream in = upload.content().getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(target);
            throw new UncheckedIOException("Failed to store uploaded audio", e);
        }
        LOG.debug("Stored upload {} as {}", LogSanitizer.truncate(upload.filename(), MAX_FILENAME_CHARS), target.getFileName());
        return ResolvedAudio.owned(target);
    }

    private ResolvedAudio resolveRemote(AudioSource.RemoteUrl remote) {
        String url = remote.url();
        String scheme;
        try {
            URI uri = new URI(url);
            scheme = uri.getScheme();
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new InvalidSourceException(LogSanitizer.redactUrl(url), "URL has no host");
            }
        } catch (URISyntaxException e) {
            throw new InvalidSourceException(LogSanitizer.redactUrl(url), "malformed URL");
        }
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new InvalidSourceException(LogSanitizer.redactUrl(url), "unsupported URL scheme: " + scheme);
        }
        ContentCache.CacheLease lease = cache.getOrFetch(url);
        return ResolvedAudio.borrowed(lease.path(), lease.onRelease());
    }

    private ResolvedAudio resolveLocal(AudioSource.LocalPath local) {
        Path path;
        try {
            path = Paths.get(local.path());
        } catch (InvalidPathException e) {
            throw new InvalidSourceException(local.path(), "invalid path: " + local.path());
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new InvalidSourceException(local.path(), "file not found: " + local.path());
        }
        return ResolvedAudio.borrowed(path);
    }

    /**
     * Lowercase extension without the dot, or {@code null} when the name has none.
     */
    static String extensionOf(String filename) {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return null;
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Reduces a client filename to a safe basename: directory parts dropped, whitespace turned into
     * underscores, anything outside {@code [A-Za-z0-9._-]} removed, leading dots and underscores stripped, long names cut from the front.
     */
    static String sanitizeFilename(String filename) {
        if (filename == null) {
            return "";
        }
        String base = filename.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        String cleaned = base.trim()
                .replaceAll("\\s+", "_")
                .replaceAll("[^A-Za-z0-9._-]", "")
                .replaceFirst("^[._]+", "");
        // keep the tail so the extension survives
        return cleaned.length() <= MAX_FILENAME_CHARS ? cleaned : cleaned.substring(cleaned.length() - MAX_FILENAME_CHARS);
    }

    Path scratchDir() {
        return scratchDir;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete partial upload {}: {}", path, e.toString());
        }
    }
}
