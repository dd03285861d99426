package io.github.drompincen.commitments.persistence.document;

import io.github.drompincen.commitments.protocol.api.CommitmentStatus;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.protocol.api.DateHistoryEntry;
import io.github.drompincen.commitments.protocol.api.Participant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.index.WildcardIndexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical record of one real-world event, meeting, trip, project or deadline.
 * {@code dateHistory} is append-only: it is only ever extended through an atomic {@code $push}.
 */
@Document(collection = "commitments")
@CompoundIndexes({
        @CompoundIndex(name = "idx_commitments_dates", def = "{'startDate': 1, 'endDate': 1}"),
        @CompoundIndex(name = "idx_commitments_participants", def = "{'participants.email': 1}")
})
public class CommitmentDocument {

    @Id
    private String id;
    private String title;
    private String description;
    @Indexed(name = "idx_commitments_type")
    private String commitmentType;
    @Indexed(name = "idx_commitments_status")
    private CommitmentStatus status = CommitmentStatus.ACTIVE;
    private Instant startDate;
    private Instant endDate;
    private String timezone;
    @Indexed(name = "idx_commitments_certainty")
    private DateCertainty dateCertainty = DateCertainty.UNKNOWN;
    private List<Participant> participants = new ArrayList<>();
    private String organizer;
    private String location;
    private List<String> meetingLinks = new ArrayList<>();
    private boolean autoLinked;
    private Double confidenceScore;
    private List<DateHistoryEntry> dateHistory = new ArrayList<>();
    @WildcardIndexed
    private Map<String, Object> attributes = new LinkedHashMap<>();
    @Indexed(name = "idx_commitments_created_at")
    private Instant createdAt;
    private Instant updatedAt;

    public CommitmentDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCommitmentType() { return commitmentType; }
    public void setCommitmentType(String commitmentType) { this.commitmentType = commitmentType; }

    public CommitmentStatus getStatus() { return status; }
    public void setStatus(CommitmentStatus status) { this.status = status; }

    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }

    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public DateCertainty getDateCertainty() { return dateCertainty; }
    public void setDateCertainty(DateCertainty dateCertainty) { this.dateCertainty = dateCertainty; }

    public List<Participant> getParticipants() { return participants; }
    public void setParticipants(List<Participant> participants) { this.participants = participants; }

    public String getOrganizer() { return organizer; }
    public void setOrganizer(String organizer) { this.organizer = organizer; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public List<String> getMeetingLinks() { return meetingLinks; }
    public void setMeetingLinks(List<String> meetingLinks) { this.meetingLinks = meetingLinks; }

    public boolean isAutoLinked() { return autoLinked; }
    public void setAutoLinked(boolean autoLinked) { this.autoLinked = autoLinked; }

    public Double getConfidenceScore() { return confidenceScore; }
    public void setConfidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; }

    public List<DateHistoryEntry> getDateHistory() { return dateHistory; }
    public void setDateHistory(List<DateHistoryEntry> dateHistory) { this.dateHistory = dateHistory; }

    public Map<String, Object> getAttributes() { return attributes; }
    public void setAttributes(Map<String, Object> attributes) { this.attributes = attributes; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Commitment{id=" + id + ", title='" + title + "', type=" + commitmentType + "}";
    }
}
