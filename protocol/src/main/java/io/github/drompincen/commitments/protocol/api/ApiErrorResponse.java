package io.github.drompincen.commitments.protocol.api;

public record ApiErrorResponse(
        int status,
        String error,
        String message
) {}
