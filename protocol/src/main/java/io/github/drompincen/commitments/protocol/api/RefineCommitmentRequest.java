package io.github.drompincen.commitments.protocol.api;

import java.time.Instant;

/** {@code onlyIfMoreCertain} selects the lattice-gated refinement instead of the plain overwrite. */
public record RefineCommitmentRequest(
        Instant startDate,
        Instant endDate,
        DateCertainty dateCertainty,
        String source,
        boolean onlyIfMoreCertain
) {}
