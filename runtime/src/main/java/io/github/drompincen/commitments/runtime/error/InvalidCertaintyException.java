package io.github.drompincen.commitments.runtime.error;

public class InvalidCertaintyException extends CommitmentValidationException {

    private final String label;

    public InvalidCertaintyException(String label) {
        super("Unknown date certainty: " + label);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
