package io.github.drompincen.commitments.runtime.commitment;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.protocol.api.CommitmentStatus;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.protocol.api.DateHistoryEntry;
import io.github.drompincen.commitments.protocol.api.Participant;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommitmentSerializerTest {

    private final CommitmentSerializer serializer = new CommitmentSerializer(new ObjectMapper());

    @Test
    void rendersAllFieldsWithSnakeCaseKeys() {
        Map<String, Object> map = serializer.toMap(makeCommitment(), 3, 1);

        assertThat(map).containsKeys("id", "title", "description", "commitment_type", "status",
                "start_date", "end_date", "timezone", "date_certainty", "participants", "organizer",
                "location", "meeting_links", "auto_linked", "confidence_score", "metadata",
                "created_at", "updated_at", "email_count", "calendar_event_count");
        assertThat(map.get("status")).isEqualTo("active");
        assertThat(map.get("date_certainty")).isEqualTo("time_confirmed");
        assertThat(map.get("email_count")).isEqualTo(3L);
        assertThat(map.get("calendar_event_count")).isEqualTo(1L);
    }

    @Test
    void startAndEndUseCommitmentTimezone() {
        Map<String, Object> map = serializer.toMap(makeCommitment(), 0, 0);

        assertThat(map.get("start_date")).isEqualTo("2025-12-15T14:00:00+01:00");
        assertThat(map.get("end_date")).isEqualTo("2025-12-17T18:00:00+01:00");
        assertThat(map.get("created_at")).isEqualTo("2025-11-01T09:00:00Z");
    }

    @Test
    void absentTimestampsRenderAsNull() {
        CommitmentDocument doc = makeCommitment();
        doc.setTimezone(null);
        doc.setStartDate(null);
        doc.setEndDate(null);

        Map<String, Object> map = serializer.toMap(doc, 0, 0);

        assertThat(map.get("start_date")).isNull();
        assertThat(map.get("end_date")).isNull();
        assertThat(map).containsEntry("timezone", null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void metadataMergesAttributesWithDateHistory() {
        Map<String, Object> map = serializer.toMap(makeCommitment(), 0, 0);

        Map<String, Object> metadata = (Map<String, Object>) map.get("metadata");
        assertThat(metadata).containsEntry("project", "Q4");
        List<Map<String, Object>> history = (List<Map<String, Object>>) metadata.get("date_history");
        assertThat(history).hasSize(1);
        assertThat(history.get(0))
                .containsEntry("date", "2025-12-15T13:00:00Z")
                .containsEntry("source", "email-2")
                .containsEntry("updated_at", "2025-11-02T10:30:00Z");
    }

    @Test
    @SuppressWarnings("unchecked")
    void participantsBecomePlainMaps() {
        Map<String, Object> map = serializer.toMap(makeCommitment(), 0, 0);

        List<Map<String, Object>> participants = (List<Map<String, Object>>) map.get("participants");
        assertThat(participants).hasSize(1);
        assertThat(participants.get(0))
                .containsEntry("email", "ana@example.com")
                .containsEntry("name", "Ana")
                .containsEntry("role", "organizer");
    }

    private CommitmentDocument makeCommitment() {
        CommitmentDocument doc = new CommitmentDocument();
        doc.setId("c1");
        doc.setTitle("Team Offsite");
        doc.setCommitmentType("trip");
        doc.setStatus(CommitmentStatus.ACTIVE);
        doc.setTimezone("Europe/Berlin");
        doc.setStartDate(Instant.parse("2025-12-15T13:00:00Z"));
        doc.setEndDate(Instant.parse("2025-12-17T17:00:00Z"));
        doc.setDateCertainty(DateCertainty.TIME_CONFIRMED);
        doc.setParticipants(List.of(new Participant("ana@example.com", "Ana", "organizer")));
        doc.setMeetingLinks(List.of("https://meet.example.com/offsite"));
        doc.setConfidenceScore(0.8);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("project", "Q4");
        doc.setAttributes(attributes);
        doc.setDateHistory(List.of(new DateHistoryEntry("2025-12-15T13:00:00Z", "email-2",
                Instant.parse("2025-11-02T10:30:00Z"))));
        doc.setCreatedAt(Instant.parse("2025-11-01T09:00:00Z"));
        doc.setUpdatedAt(Instant.parse("2025-11-02T10:30:00Z"));
        return doc;
    }
}
