package io.github.drompincen.commitments.protocol.api;

public record Participant(
        String email,
        String name,
        String role
) {}
