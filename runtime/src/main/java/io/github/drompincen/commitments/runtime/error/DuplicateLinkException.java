package io.github.drompincen.commitments.runtime.error;

import io.github.drompincen.commitments.protocol.api.CommitmentLinkDto;

import java.util.Locale;

/**
 * The (commitment, source) pair is already linked. Expected under retried deliveries;
 * callers usually treat it as "already linked".
 */
public class DuplicateLinkException extends CommitmentException {

    private final String commitmentId;
    private final CommitmentLinkDto.SourceType sourceType;
    private final String sourceId;

    public DuplicateLinkException(String commitmentId, CommitmentLinkDto.SourceType sourceType,
                                  String sourceId, Throwable cause) {
        super("Commitment " + commitmentId + " is already linked to "
                + sourceType.name().toLowerCase(Locale.ROOT) + " " + sourceId, cause);
        this.commitmentId = commitmentId;
        this.sourceType = sourceType;
        this.sourceId = sourceId;
    }

    public String getCommitmentId() { return commitmentId; }

    public CommitmentLinkDto.SourceType getSourceType() { return sourceType; }

    public String getSourceId() { return sourceId; }
}
