package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request statistics settings.
 */
@ConfigurationProperties(prefix = "stats")
@Validated
public class StatsProperties {

    /** Number of recent request records kept in memory. */
    @Positive(message = "History size must be positive")
    private int historySize = 200;

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}
