package io.github.drompincen.commitments.runtime.refine;

import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.protocol.api.DateHistoryEntry;
import io.github.drompincen.commitments.runtime.AbstractCoreIntegrationTest;
import io.github.drompincen.commitments.runtime.commitment.CommitmentDraft;
import io.github.drompincen.commitments.runtime.error.CommitmentNotFoundException;
import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;
import io.github.drompincen.commitments.runtime.error.InvalidCertaintyException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RefinementServiceIntegrationTest extends AbstractCoreIntegrationTest {

    private static final Instant DEC_1 = Instant.parse("2025-12-01T00:00:00Z");
    private static final Instant DEC_15 = Instant.parse("2025-12-15T00:00:00Z");
    private static final Instant DEC_15_2PM = Instant.parse("2025-12-15T14:00:00Z");
    private static final Instant DEC_17 = Instant.parse("2025-12-17T00:00:00Z");

    @Test
    void teamOffsiteIsRefinedStepByStep() {
        CommitmentDocument offsite = createOffsite();

        CommitmentDocument afterFirst = refinementService.refine(offsite.getId(), DEC_15, DEC_17, DateCertainty.DAY, "email-1");
        assertThat(afterFirst.getDateHistory()).hasSize(1);
        assertThat(afterFirst.getStartDate()).isEqualTo(DEC_15);
        assertThat(afterFirst.getEndDate()).isEqualTo(DEC_17);
        assertThat(afterFirst.getDateCertainty()).isEqualTo(DateCertainty.DAY);

        CommitmentDocument afterSecond = refinementService.refine(offsite.getId(), DEC_15_2PM, null, DateCertainty.EXACT, "email-2");
        assertThat(afterSecond.getDateHistory()).hasSize(2);
        assertThat(afterSecond.getStartDate()).isEqualTo(DEC_15_2PM);
        assertThat(afterSecond.getEndDate()).isEqualTo(DEC_17);
        assertThat(afterSecond.getDateCertainty()).isEqualTo(DateCertainty.EXACT);

        List<DateHistoryEntry> history = commitmentService.get(offsite.getId()).getDateHistory();
        assertThat(history).extracting(DateHistoryEntry::source).containsExactly("email-1", "email-2");
        assertThat(history.get(0).date()).isEqualTo("2025-12-15T00:00:00Z to 2025-12-17T00:00:00Z");
        assertThat(history.get(1).date()).isEqualTo("2025-12-15T14:00:00Z");
    }

    @Test
    void everyObservationIsLoggedEvenWhenNothingChanges() {
        CommitmentDocument offsite = createOffsite();

        for (int i = 0; i < 4; i++) {
            refinementService.refine(offsite.getId(), DEC_1, null, DateCertainty.MONTH, "email-" + i);
        }

        CommitmentDocument reloaded = commitmentService.get(offsite.getId());
        assertThat(reloaded.getDateHistory()).hasSize(4);
        assertThat(reloaded.getStartDate()).isEqualTo(DEC_1);
        assertThat(reloaded.getUpdatedAt()).isAfterOrEqualTo(reloaded.getCreatedAt());
    }

    @Test
    void blindRefineMayLowerCertainty() {
        CommitmentDocument offsite = createOffsite();
        refinementService.refine(offsite.getId(), DEC_15_2PM, null, DateCertainty.EXACT, "email-1");

        CommitmentDocument updated = refinementService.refine(offsite.getId(), DEC_1, null, DateCertainty.MONTH, "email-2");

        assertThat(updated.getDateCertainty()).isEqualTo(DateCertainty.MONTH);
        assertThat(updated.getStartDate()).isEqualTo(DEC_1);
    }

    @Test
    void gatedRefineOnlyRecordsLessCertainObservation() {
        CommitmentDocument offsite = createOffsite();
        refinementService.refine(offsite.getId(), DEC_15_2PM, DEC_17, DateCertainty.EXACT, "email-1");

        RefinementResult result = refinementService.refineIfMoreCertain(
                offsite.getId(), DEC_1, null, DateCertainty.MONTH, "email-2");

        assertThat(result.outcome()).isEqualTo(RefinementResult.Outcome.RECORDED_ONLY);
        assertThat(result.applied()).isFalse();
        CommitmentDocument reloaded = commitmentService.get(offsite.getId());
        assertThat(reloaded.getDateHistory()).hasSize(2);
        assertThat(reloaded.getStartDate()).isEqualTo(DEC_15_2PM);
        assertThat(reloaded.getDateCertainty()).isEqualTo(DateCertainty.EXACT);
    }

    @Test
    void gatedRefineAppliesEqualOrHigherCertainty() {
        CommitmentDocument offsite = createOffsite();

        RefinementResult sameLevel = refinementService.refineIfMoreCertain(
                offsite.getId(), Instant.parse("2025-12-02T00:00:00Z"), null, DateCertainty.MONTH, "email-1");
        RefinementResult higher = refinementService.refineIfMoreCertain(
                offsite.getId(), DEC_15, DEC_17, DateCertainty.DAY, "email-2");

        assertThat(sameLevel.applied()).isTrue();
        assertThat(higher.applied()).isTrue();
        assertThat(higher.commitment().getDateCertainty()).isEqualTo(DateCertainty.DAY);
        assertThat(higher.commitment().getDateHistory()).hasSize(2);
    }

    @Test
    void unknownCommitmentIsNotFound() {
        assertThatThrownBy(() -> refinementService.refine("missing", DEC_15, null, DateCertainty.DAY, "email-1"))
                .isInstanceOf(CommitmentNotFoundException.class);
        assertThatThrownBy(() -> refinementService.refineIfMoreCertain("missing", DEC_15, null, DateCertainty.DAY, "email-1"))
                .isInstanceOf(CommitmentNotFoundException.class);
    }

    @Test
    void invertedRangeIsRejectedWithoutTouchingHistory() {
        CommitmentDocument offsite = createOffsite();

        assertThatThrownBy(() -> refinementService.refine(offsite.getId(), DEC_17, DEC_15, DateCertainty.DAY, "email-1"))
                .isInstanceOf(CommitmentValidationException.class);
        assertThatThrownBy(() -> refinementService.refine(offsite.getId(), DEC_15, null, null, "email-1"))
                .isInstanceOf(InvalidCertaintyException.class);

        assertThat(commitmentService.get(offsite.getId()).getDateHistory()).isEmpty();
    }

    @Test
    void newStartAfterPreservedEndIsRejected() {
        CommitmentDocument offsite = createOffsite();
        refinementService.refine(offsite.getId(), DEC_15, DEC_17, DateCertainty.DAY, "email-1");

        Instant dec20 = Instant.parse("2025-12-20T00:00:00Z");
        assertThatThrownBy(() -> refinementService.refine(offsite.getId(), dec20, null, DateCertainty.DAY, "email-2"))
                .isInstanceOf(CommitmentValidationException.class)
                .hasMessageContaining("precedes");

        CommitmentDocument reloaded = commitmentService.get(offsite.getId());
        assertThat(reloaded.getDateHistory()).hasSize(1);
        assertThat(reloaded.getStartDate()).isEqualTo(DEC_15);
    }

    @Test
    void concurrentRefinementsNeverLoseHistory() throws Exception {
        CommitmentDocument offsite = createOffsite();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<CommitmentDocument>> calls = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String source = "email-" + i;
                calls.add(() -> refinementService.refine(offsite.getId(), DEC_15, DEC_17, DateCertainty.DAY, source));
            }
            for (Future<CommitmentDocument> f : pool.invokeAll(calls)) {
                f.get();
            }
        } finally {
            pool.shutdown();
        }

        assertThat(commitmentService.get(offsite.getId()).getDateHistory()).hasSize(40);
    }

    private CommitmentDocument createOffsite() {
        return commitmentService.create(CommitmentDraft.builder("Team Offsite")
                .commitmentType("trip")
                .dateCertainty(DateCertainty.MONTH)
                .startDate(DEC_1)
                .build());
    }
}
