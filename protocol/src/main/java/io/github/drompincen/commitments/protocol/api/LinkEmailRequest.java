package io.github.drompincen.commitments.protocol.api;

public record LinkEmailRequest(
        String messageId,
        CommitmentLinkDto.LinkedBy linkedBy,
        Double confidenceScore,
        String linkReason
) {}
