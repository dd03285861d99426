package io.github.drompincen.commitments.protocol.api;

public record UpdateStatusRequest(CommitmentStatus status) {}
