package io.github.drompincen.commitments.runtime.refine;

import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.runtime.commitment.CommitmentService;
import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;
import io.github.drompincen.commitments.runtime.lattice.CertaintyLattice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RefinementServiceTest {

    private static final Instant DEC_1 = Instant.parse("2025-12-01T00:00:00Z");
    private static final Instant DEC_15 = Instant.parse("2025-12-15T00:00:00Z");

    @Mock private MongoTemplate mongoTemplate;
    @Mock private CommitmentService commitmentService;

    private RefinementService service;

    @BeforeEach
    void setUp() {
        service = new RefinementService(mongoTemplate, commitmentService, new CertaintyLattice());
        when(commitmentService.appendHistory(eq("c1"), anyString(), anyString()))
                .thenAnswer(inv -> commitment(DateCertainty.EXACT, null));
    }

    private static CommitmentDocument commitment(DateCertainty certainty, Instant endDate) {
        CommitmentDocument doc = new CommitmentDocument();
        doc.setId("c1");
        doc.setTitle("Team Offsite");
        doc.setDateCertainty(certainty);
        doc.setEndDate(endDate);
        return doc;
    }

    private void findAndModifyReturns(CommitmentDocument first, CommitmentDocument... rest) {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(CommitmentDocument.class)))
                .thenReturn(first, rest);
    }

    @Test
    void gatedRefineRetriesWhenCertaintyWasLoweredInBetween() {
        CommitmentDocument applied = commitment(DateCertainty.DAY, null);
        findAndModifyReturns(null, applied);
        when(commitmentService.get("c1")).thenReturn(commitment(DateCertainty.MONTH, null));

        RefinementResult result = service.refineIfMoreCertain("c1", DEC_15, null, DateCertainty.DAY, "email-9");

        assertThat(result.outcome()).isEqualTo(RefinementResult.Outcome.APPLIED);
        assertThat(result.commitment()).isSameAs(applied);
        verify(mongoTemplate, times(2)).findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(CommitmentDocument.class));
        verify(commitmentService, never()).appendHistory(any(), any(), any());
    }

    @Test
    void gatedRefineRecordsObservationWhenRetriesRunOut() {
        findAndModifyReturns(null);
        when(commitmentService.get("c1")).thenReturn(commitment(DateCertainty.MONTH, null));

        RefinementResult result = service.refineIfMoreCertain("c1", DEC_15, null, DateCertainty.DAY, "email-9");

        assertThat(result.outcome()).isEqualTo(RefinementResult.Outcome.RECORDED_ONLY);
        verify(mongoTemplate, times(RefinementService.MAX_ATTEMPTS)).findAndModify(any(Query.class),
                any(Update.class), any(FindAndModifyOptions.class), eq(CommitmentDocument.class));
        verify(commitmentService).appendHistory("c1", "2025-12-15T00:00:00Z", "email-9");
    }

    @Test
    void gatedRefineRecordsLessCertainObservation() {
        findAndModifyReturns(null);
        when(commitmentService.get("c1")).thenReturn(commitment(DateCertainty.EXACT, null));

        RefinementResult result = service.refineIfMoreCertain("c1", DEC_15, null, DateCertainty.WEEK, "email-3");

        assertThat(result.applied()).isFalse();
        verify(commitmentService).appendHistory("c1", "2025-12-15T00:00:00Z", "email-3");
    }

    @Test
    void gatedRefineRejectsOnlyAKeptEndBeforeTheNewStart() {
        findAndModifyReturns(null);
        when(commitmentService.get("c1")).thenReturn(commitment(DateCertainty.MONTH, DEC_1));

        assertThatThrownBy(() -> service.refineIfMoreCertain("c1", DEC_15, null, DateCertainty.DAY, "email-9"))
                .isInstanceOf(CommitmentValidationException.class)
                .hasMessageContaining("precedes");
        verify(commitmentService, never()).appendHistory(any(), any(), any());
    }

    @Test
    void blindRefineRetriesWhenEndDateMovedInBetween() {
        CommitmentDocument applied = commitment(DateCertainty.DAY, null);
        findAndModifyReturns(null, applied);
        when(commitmentService.get("c1")).thenReturn(commitment(DateCertainty.MONTH, null));

        CommitmentDocument result = service.refine("c1", DEC_15, null, DateCertainty.DAY, "email-4");

        assertThat(result).isSameAs(applied);
    }

    @Test
    void blindRefineRejectsKeptEndBeforeNewStart() {
        findAndModifyReturns(null);
        when(commitmentService.get("c1")).thenReturn(commitment(DateCertainty.MONTH, DEC_1));

        assertThatThrownBy(() -> service.refine("c1", DEC_15, null, DateCertainty.DAY, "email-4"))
                .isInstanceOf(CommitmentValidationException.class);
        verify(mongoTemplate, times(1)).findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(CommitmentDocument.class));
    }
}
