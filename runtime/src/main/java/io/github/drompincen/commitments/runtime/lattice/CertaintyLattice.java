package io.github.drompincen.commitments.runtime.lattice;

import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.runtime.error.InvalidCertaintyException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Total order over date-certainty levels and the accept/reject decision for a new observation.
 * A new observation counts as a refinement when it is at least as precise as the current one,
 * so a same-precision correction still applies.
 */
@Component
public class CertaintyLattice {

    public int rank(DateCertainty level) {
        if (level == null) {
            throw new InvalidCertaintyException(null);
        }
        return level.ordinal();
    }

    public int rank(String label) {
        return rank(parse(label));
    }

    public DateCertainty parse(String label) {
        return DateCertainty.fromLabel(label).orElseThrow(() -> new InvalidCertaintyException(label));
    }

    public boolean isRefinement(DateCertainty current, DateCertainty candidate) {
        return rank(candidate) >= rank(current);
    }

    public boolean isRefinement(String current, String candidate) {
        return isRefinement(parse(current), parse(candidate));
    }

    /** Levels the candidate may overwrite, i.e. every level ranked at or below it. */
    public List<DateCertainty> refinableFrom(DateCertainty candidate) {
        int max = rank(candidate);
        return Arrays.stream(DateCertainty.values())
                .filter(level -> level.ordinal() <= max)
                .toList();
    }
}
