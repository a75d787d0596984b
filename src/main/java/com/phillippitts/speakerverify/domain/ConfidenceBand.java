package com.phillippitts.speakerverify.domain;

import java.util.Locale;

/**
 * Coarse confidence label derived from the distance between score and threshold.
 * A fixed heuristic, not a statistical guarantee.
 */
public enum ConfidenceBand {
    HIGH,
    MEDIUM;

    /** Lowercase wire name ("high" / "medium"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
