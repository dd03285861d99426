package io.github.drompincen.commitments.runtime.commitment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.protocol.api.DateHistoryEntry;
import io.github.drompincen.commitments.protocol.api.Participant;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a commitment as a flat, JSON-compatible map with snake_case keys.
 * Start and end dates are rendered in the commitment's timezone, every other timestamp in UTC;
 * absent values render as null.
 */
@Component
public class CommitmentSerializer {

    private static final TypeReference<List<Map<String, Object>>> PARTICIPANT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CommitmentSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toMap(CommitmentDocument c, long emailCount, long calendarEventCount) {
        ZoneId zone = c.getTimezone() != null ? ZoneId.of(c.getTimezone()) : ZoneOffset.UTC;

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", c.getId());
        map.put("title", c.getTitle());
        map.put("description", c.getDescription());
        map.put("commitment_type", c.getCommitmentType());
        map.put("status", c.getStatus() != null ? c.getStatus().label() : null);
        map.put("start_date", format(c.getStartDate(), zone));
        map.put("end_date", format(c.getEndDate(), zone));
        map.put("timezone", c.getTimezone());
        map.put("date_certainty", c.getDateCertainty() != null ? c.getDateCertainty().label() : null);
        map.put("participants", participants(c.getParticipants()));
        map.put("organizer", c.getOrganizer());
        map.put("location", c.getLocation());
        map.put("meeting_links", c.getMeetingLinks() != null ? new ArrayList<>(c.getMeetingLinks()) : List.of());
        map.put("auto_linked", c.isAutoLinked());
        map.put("confidence_score", c.getConfidenceScore());
        map.put("metadata", metadata(c));
        map.put("created_at", format(c.getCreatedAt(), ZoneOffset.UTC));
        map.put("updated_at", format(c.getUpdatedAt(), ZoneOffset.UTC));
        map.put("email_count", emailCount);
        map.put("calendar_event_count", calendarEventCount);
        return map;
    }

    private List<Map<String, Object>> participants(List<Participant> participants) {
        if (participants == null) return List.of();
        return objectMapper.convertValue(participants, PARTICIPANT_LIST);
    }

    private Map<String, Object> metadata(CommitmentDocument c) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (c.getAttributes() != null) {
            metadata.putAll(c.getAttributes());
        }
        List<Map<String, Object>> history = new ArrayList<>();
        if (c.getDateHistory() != null) {
            for (DateHistoryEntry entry : c.getDateHistory()) {
                Map<String, Object> e = new LinkedHashMap<>();
                e.put("date", entry.date());
                e.put("source", entry.source());
                e.put("updated_at", format(entry.updatedAt(), ZoneOffset.UTC));
                history.add(e);
            }
        }
        metadata.put(CommitmentService.DATE_HISTORY_KEY, history);
        return metadata;
    }

    static String format(Instant instant, ZoneId zone) {
        return instant == null ? null : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(zone));
    }
}
