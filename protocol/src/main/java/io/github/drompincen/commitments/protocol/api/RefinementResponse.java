package io.github.drompincen.commitments.protocol.api;

public record RefinementResponse(
        String commitmentId,
        boolean applied,
        int historySize
) {}
