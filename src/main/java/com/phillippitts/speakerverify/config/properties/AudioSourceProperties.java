package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Where uploads are staged and which upload extensions are accepted.
 */
@ConfigurationProperties(prefix = "audio.source")
@Validated
public class AudioSourceProperties {

    /** Scratch directory for uploaded audio; files here are deleted at the end of each request. */
    @NotBlank(message = "Scratch directory must not be blank")
    private String scratchDir = Path.of(System.getProperty("java.io.tmpdir"), "speaker_verification", "scratch")
            .toString();

    /** Allowed upload extensions, lowercase, without the dot. */
    @NotEmpty(message = "Allowed extensions must not be empty")
    private Set<String> allowedExtensions = new LinkedHashSet<>(
            List.of("wav", "mp3", "flac", "m4a", "ogg", "wma", "aac"));

    public String getScratchDir() {
        return scratchDir;
    }

    public void setScratchDir(String scratchDir) {
        this.scratchDir = scratchDir;
    }

    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(Set<String> allowedExtensions) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String ext : allowedExtensions) {
            normalized.add(ext.trim().toLowerCase(Locale.ROOT));
        }
        this.allowedExtensions = normalized;
    }
}
