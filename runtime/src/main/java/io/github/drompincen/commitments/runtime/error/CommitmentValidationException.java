package io.github.drompincen.commitments.runtime.error;

public class CommitmentValidationException extends CommitmentException {

    public CommitmentValidationException(String message) {
        super(message);
    }
}
