package io.github.drompincen.commitments.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CommitmentStatus {
    ACTIVE, COMPLETED, CANCELLED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Completed and cancelled commitments are never reopened. */
    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonCreator
    public static CommitmentStatus fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
