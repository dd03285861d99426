package io.github.drompincen.commitments.runtime.commitment;

import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/** Field-level checks shared by creation, refinement and linking. Limits mirror the store's column sizes. */
public final class CommitmentRules {

    public static final int MAX_TYPE_LENGTH = 100;
    public static final int MAX_ORGANIZER_LENGTH = 500;
    public static final int MAX_SOURCE_ID_LENGTH = 255;

    private CommitmentRules() {}

    public static String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new CommitmentValidationException(field + " is required");
        }
        return checkLength(value, field, maxLength);
    }

    public static String checkLength(String value, String field, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new CommitmentValidationException(field + " exceeds " + maxLength + " characters");
        }
        return value;
    }

    public static Double checkConfidence(Double score) {
        if (score != null && (score.isNaN() || score < 0.0 || score > 1.0)) {
            throw new CommitmentValidationException("confidence_score must be within [0.0, 1.0], got " + score);
        }
        return score;
    }

    public static void checkDateOrder(Instant start, Instant end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new CommitmentValidationException("end_date " + end + " precedes start_date " + start);
        }
    }

    public static String checkTimezone(String timezone) {
        if (timezone == null) return null;
        try {
            return ZoneId.of(timezone).getId();
        } catch (DateTimeException e) {
            throw new CommitmentValidationException("Unknown timezone: " + timezone);
        }
    }
}
