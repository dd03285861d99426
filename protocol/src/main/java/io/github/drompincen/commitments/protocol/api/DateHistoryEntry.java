package io.github.drompincen.commitments.protocol.api;

import java.time.Instant;

/** One observed date, as received from a source. {@code date} is a display label, never parsed. */
public record DateHistoryEntry(
        String date,
        String source,
        Instant updatedAt
) {}
