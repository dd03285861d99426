package io.github.drompincen.commitments.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CreateCommitmentRequest(
        String title,
        String commitmentType,
        Instant startDate,
        Instant endDate,
        String timezone,
        DateCertainty dateCertainty,
        String description,
        List<Participant> participants,
        String organizer,
        String location,
        List<String> meetingLinks,
        Boolean autoLinked,
        Double confidenceScore,
        Map<String, Object> metadata
) {}
