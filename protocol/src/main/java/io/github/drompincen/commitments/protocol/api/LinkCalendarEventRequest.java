package io.github.drompincen.commitments.protocol.api;

import java.util.Map;

public record LinkCalendarEventRequest(
        String eventId,
        Map<String, Object> eventData,
        CommitmentLinkDto.LinkedBy linkedBy,
        Double confidenceScore,
        String linkReason
) {}
