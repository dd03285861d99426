package io.github.drompincen.commitments.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * A provenance link between a commitment and one source artifact.
 * {@code sourceId} is the email message id or the calendar event id depending on {@code sourceType};
 * {@code eventData} is only populated for calendar events.
 */
public record CommitmentLinkDto(
        String linkId,
        String commitmentId,
        SourceType sourceType,
        String sourceId,
        Map<String, Object> eventData,
        Instant linkedAt,
        LinkedBy linkedBy,
        Double confidenceScore,
        String linkReason
) {
    public enum SourceType {
        EMAIL, CALENDAR_EVENT
    }

    public enum LinkedBy {
        AI, MANUAL;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static LinkedBy fromLabel(String label) {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        }
    }
}
