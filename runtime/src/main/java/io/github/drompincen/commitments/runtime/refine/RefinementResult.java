package io.github.drompincen.commitments.runtime.refine;

import io.github.drompincen.commitments.persistence.document.CommitmentDocument;

public record RefinementResult(
        Outcome outcome,
        CommitmentDocument commitment
) {
    public enum Outcome {
        /** Date fields and certainty were overwritten and the observation logged. */
        APPLIED,
        /** The observation was less certain than what is known; it was only logged. */
        RECORDED_ONLY
    }

    public boolean applied() {
        return outcome == Outcome.APPLIED;
    }
}
