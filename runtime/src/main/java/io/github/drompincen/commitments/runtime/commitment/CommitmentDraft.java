package io.github.drompincen.commitments.runtime.commitment;

import io.github.drompincen.commitments.protocol.api.CreateCommitmentRequest;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.protocol.api.Participant;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Initial best-guess fields for a new commitment, as supplied by an extraction step.
 * Every supported field has its own setter; free-form extras go into {@link Builder#attribute}.
 */
public final class CommitmentDraft {

    private final String title;
    private final String commitmentType;
    private final Instant startDate;
    private final Instant endDate;
    private final String timezone;
    private final DateCertainty dateCertainty;
    private final String description;
    private final List<Participant> participants;
    private final String organizer;
    private final String location;
    private final List<String> meetingLinks;
    private final boolean autoLinked;
    private final Double confidenceScore;
    private final Map<String, Object> attributes;

    private CommitmentDraft(Builder b) {
        this.title = b.title;
        this.commitmentType = b.commitmentType;
        this.startDate = b.startDate;
        this.endDate = b.endDate;
        this.timezone = b.timezone;
        this.dateCertainty = b.dateCertainty;
        this.description = b.description;
        this.participants = List.copyOf(b.participants);
        this.organizer = b.organizer;
        this.location = b.location;
        this.meetingLinks = List.copyOf(b.meetingLinks);
        this.autoLinked = b.autoLinked;
        this.confidenceScore = b.confidenceScore;
        this.attributes = new LinkedHashMap<>(b.attributes);
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    public static CommitmentDraft from(CreateCommitmentRequest request) {
        Builder b = builder(request.title())
                .commitmentType(request.commitmentType())
                .startDate(request.startDate())
                .endDate(request.endDate())
                .timezone(request.timezone())
                .description(request.description())
                .organizer(request.organizer())
                .location(request.location())
                .confidenceScore(request.confidenceScore());
        if (request.dateCertainty() != null) b.dateCertainty(request.dateCertainty());
        if (request.participants() != null) request.participants().forEach(b::participant);
        if (request.meetingLinks() != null) request.meetingLinks().forEach(b::meetingLink);
        if (request.autoLinked() != null) b.autoLinked(request.autoLinked());
        if (request.metadata() != null) request.metadata().forEach(b::attribute);
        return b.build();
    }

    public String title() { return title; }
    public String commitmentType() { return commitmentType; }
    public Instant startDate() { return startDate; }
    public Instant endDate() { return endDate; }
    public String timezone() { return timezone; }
    public DateCertainty dateCertainty() { return dateCertainty; }
    public String description() { return description; }
    public List<Participant> participants() { return participants; }
    public String organizer() { return organizer; }
    public String location() { return location; }
    public List<String> meetingLinks() { return meetingLinks; }
    public boolean autoLinked() { return autoLinked; }
    public Double confidenceScore() { return confidenceScore; }
    public Map<String, Object> attributes() { return attributes; }

    public static final class Builder {
        private final String title;
        private String commitmentType;
        private Instant startDate;
        private Instant endDate;
        private String timezone;
        private DateCertainty dateCertainty = DateCertainty.UNKNOWN;
        private String description;
        private final List<Participant> participants = new ArrayList<>();
        private String organizer;
        private String location;
        private final List<String> meetingLinks = new ArrayList<>();
        private boolean autoLinked;
        private Double confidenceScore;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String title) {
            this.title = title;
        }

        public Builder commitmentType(String commitmentType) { this.commitmentType = commitmentType; return this; }
        public Builder startDate(Instant startDate) { this.startDate = startDate; return this; }
        public Builder endDate(Instant endDate) { this.endDate = endDate; return this; }
        public Builder timezone(String timezone) { this.timezone = timezone; return this; }
        public Builder dateCertainty(DateCertainty dateCertainty) { this.dateCertainty = dateCertainty; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder participant(Participant participant) { this.participants.add(participant); return this; }
        public Builder organizer(String organizer) { this.organizer = organizer; return this; }
        public Builder location(String location) { this.location = location; return this; }
        public Builder meetingLink(String url) { this.meetingLinks.add(url); return this; }
        public Builder autoLinked(boolean autoLinked) { this.autoLinked = autoLinked; return this; }
        public Builder confidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; return this; }
        public Builder attribute(String key, Object value) { this.attributes.put(key, value); return this; }

        public CommitmentDraft build() {
            return new CommitmentDraft(this);
        }
    }
}
