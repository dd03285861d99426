package io.github.drompincen.commitments.runtime.error;

/** Root of the typed outcomes reported by the commitment core. */
public abstract class CommitmentException extends RuntimeException {

    protected CommitmentException(String message) {
        super(message);
    }

    protected CommitmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
