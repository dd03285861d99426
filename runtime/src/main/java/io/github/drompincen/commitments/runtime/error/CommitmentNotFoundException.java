package io.github.drompincen.commitments.runtime.error;

public class CommitmentNotFoundException extends CommitmentException {

    private final String commitmentId;

    public CommitmentNotFoundException(String commitmentId) {
        super("Commitment not found: " + commitmentId);
        this.commitmentId = commitmentId;
    }

    public String getCommitmentId() {
        return commitmentId;
    }
}
