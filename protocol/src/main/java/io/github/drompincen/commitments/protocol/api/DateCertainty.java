package io.github.drompincen.commitments.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * How precisely a commitment's date is known, from least to most precise.
 * Declaration order is the lattice order: {@code unknown < month < week < day < exact < time_confirmed}.
 */
public enum DateCertainty {
    UNKNOWN("unknown"),
    MONTH("month"),
    WEEK("week"),
    DAY("day"),
    EXACT("exact"),
    TIME_CONFIRMED("time_confirmed");

    private final String label;

    DateCertainty(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Looks up a level by its wire label (case-insensitive); empty for anything outside the lattice. */
    public static Optional<DateCertainty> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim();
        for (DateCertainty c : values()) {
            if (c.label.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static DateCertainty fromJson(String label) {
        return fromLabel(label).orElseThrow(() ->
                new IllegalArgumentException("Unknown date certainty: " + label));
    }
}
