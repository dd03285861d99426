package io.github.drompincen.commitments.persistence.document;

import io.github.drompincen.commitments.protocol.api.CommitmentLinkDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "commitment_calendar_events")
@CompoundIndex(name = "uq_commitment_calendar_event", def = "{'commitmentId': 1, 'eventId': 1}", unique = true)
public class CommitmentCalendarEventDocument {

    @Id
    private String linkId;
    @Indexed(name = "idx_commitment_calendar_commitment")
    private String commitmentId;
    @Indexed(name = "idx_commitment_calendar_event")
    private String eventId;
    // snapshot of the calendar event as it looked when linked
    private Map<String, Object> eventData;
    @Indexed(name = "idx_commitment_calendar_linked_at")
    private Instant linkedAt;
    private CommitmentLinkDto.LinkedBy linkedBy = CommitmentLinkDto.LinkedBy.AI;
    private Double confidenceScore;
    private String linkReason;

    public CommitmentCalendarEventDocument() {}

    public String getLinkId() { return linkId; }
    public void setLinkId(String linkId) { this.linkId = linkId; }

    public String getCommitmentId() { return commitmentId; }
    public void setCommitmentId(String commitmentId) { this.commitmentId = commitmentId; }

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public Map<String, Object> getEventData() { return eventData; }
    public void setEventData(Map<String, Object> eventData) { this.eventData = eventData; }

    public Instant getLinkedAt() { return linkedAt; }
    public void setLinkedAt(Instant linkedAt) { this.linkedAt = linkedAt; }

    public CommitmentLinkDto.LinkedBy getLinkedBy() { return linkedBy; }
    public void setLinkedBy(CommitmentLinkDto.LinkedBy linkedBy) { this.linkedBy = linkedBy; }

    public Double getConfidenceScore() { return confidenceScore; }
    public void setConfidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; }

    public String getLinkReason() { return linkReason; }
    public void setLinkReason(String linkReason) { this.linkReason = linkReason; }
}
