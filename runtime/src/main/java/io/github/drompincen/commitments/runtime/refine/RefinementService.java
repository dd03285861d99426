package io.github.drompincen.commitments.runtime.refine;

import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.protocol.api.DateHistoryEntry;
import io.github.drompincen.commitments.runtime.commitment.CommitmentRules;
import io.github.drompincen.commitments.runtime.commitment.CommitmentService;
import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;
import io.github.drompincen.commitments.runtime.error.InvalidCertaintyException;
import io.github.drompincen.commitments.runtime.lattice.CertaintyLattice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Applies a new date observation to a commitment.
 *
 * <p>Every observation is appended to the date history, whether or not it changes anything.
 * {@link #refine} is a last-writer-wins overwrite that trusts the caller's certainty;
 * {@link #refineIfMoreCertain} only overwrites when the lattice accepts the new certainty.
 * Each attempt is one atomic document update, so concurrent refinements never lose history entries.
 */
@Service
public class RefinementService {

    private static final Logger log = LoggerFactory.getLogger(RefinementService.class);

    // a miss followed by a re-read that shows no conflict means another writer got in between
    static final int MAX_ATTEMPTS = 3;

    private final MongoTemplate mongoTemplate;
    private final CommitmentService commitmentService;
    private final CertaintyLattice lattice;

    public RefinementService(MongoTemplate mongoTemplate, CommitmentService commitmentService,
                             CertaintyLattice lattice) {
        this.mongoTemplate = mongoTemplate;
        this.commitmentService = commitmentService;
        this.lattice = lattice;
    }

    public CommitmentDocument refine(String commitmentId, Instant newStart, Instant newEnd,
                                     DateCertainty newCertainty, String source) {
        validate(newStart, newEnd, newCertainty, source);
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            CommitmentDocument updated = apply(targetQuery(commitmentId, newStart, newEnd),
                    newStart, newEnd, newCertainty, source);
            if (updated != null) {
                log.info("Refined commitment {} to {} ({}) from {}",
                        commitmentId, describe(newStart, newEnd), newCertainty.label(), source);
                return updated;
            }
            CommitmentDocument existing = commitmentService.get(commitmentId);
            if (keptEndPrecedes(existing, newStart, newEnd)) {
                throw endPrecedesStart(existing, newStart);
            }
            log.debug("Commitment {} changed during refinement (attempt {}), retrying", commitmentId, attempt);
        }
        throw new IllegalStateException("Commitment " + commitmentId + " kept changing during refinement from "
                + source + " after " + MAX_ATTEMPTS + " attempts");
    }

    public RefinementResult refineIfMoreCertain(String commitmentId, Instant newStart, Instant newEnd,
                                                DateCertainty newCertainty, String source) {
        validate(newStart, newEnd, newCertainty, source);
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Query query = targetQuery(commitmentId, newStart, newEnd)
                    .addCriteria(Criteria.where("dateCertainty").in(lattice.refinableFrom(newCertainty)));
            CommitmentDocument updated = apply(query, newStart, newEnd, newCertainty, source);
            if (updated != null) {
                log.info("Refined commitment {} to {} ({}) from {}",
                        commitmentId, describe(newStart, newEnd), newCertainty.label(), source);
                return new RefinementResult(RefinementResult.Outcome.APPLIED, updated);
            }

            CommitmentDocument existing = commitmentService.get(commitmentId);
            if (!lattice.isRefinement(existing.getDateCertainty(), newCertainty)) {
                log.debug("Observation {} from {} is less certain ({}) than commitment {} ({}); recording only",
                        describe(newStart, newEnd), source, newCertainty.label(),
                        commitmentId, existing.getDateCertainty().label());
                return recordOnly(commitmentId, newStart, newEnd, source);
            }
            if (keptEndPrecedes(existing, newStart, newEnd)) {
                throw endPrecedesStart(existing, newStart);
            }
            log.debug("Commitment {} changed during gated refinement (attempt {}), retrying", commitmentId, attempt);
        }
        log.info("Commitment {} kept changing; recording observation from {} without applying it", commitmentId, source);
        return recordOnly(commitmentId, newStart, newEnd, source);
    }

    /** Human-readable label for the history log: the start, or {@code "<start> to <end>"}. */
    public static String describe(Instant start, Instant end) {
        String info = start.toString();
        if (end != null) {
            info += " to " + end;
        }
        return info;
    }

    private CommitmentDocument apply(Query query, Instant newStart, Instant newEnd,
                                     DateCertainty newCertainty, String source) {
        DateHistoryEntry entry = CommitmentService.historyEntry(describe(newStart, newEnd), source);
        Update update = new Update()
                .push("dateHistory", entry)
                .set("startDate", newStart)
                .set("dateCertainty", newCertainty)
                .set("updatedAt", entry.updatedAt());
        if (newEnd != null) {
            update.set("endDate", newEnd);
        }
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), CommitmentDocument.class);
    }

    // Without a new end date the stored one is kept, so it must not fall before the new start.
    private Query targetQuery(String commitmentId, Instant newStart, Instant newEnd) {
        Query query = new Query().addCriteria(Criteria.where("_id").is(commitmentId));
        if (newEnd == null) {
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where("endDate").is(null),
                    Criteria.where("endDate").gte(newStart)));
        }
        return query;
    }

    private void validate(Instant newStart, Instant newEnd, DateCertainty newCertainty, String source) {
        if (newStart == null) {
            throw new CommitmentValidationException("start_date is required for a refinement");
        }
        if (newCertainty == null) {
            throw new InvalidCertaintyException(null);
        }
        CommitmentRules.requireText(source, "source", CommitmentRules.MAX_SOURCE_ID_LENGTH);
        CommitmentRules.checkDateOrder(newStart, newEnd);
    }

    private RefinementResult recordOnly(String commitmentId, Instant newStart, Instant newEnd, String source) {
        CommitmentDocument recorded = commitmentService.appendHistory(commitmentId, describe(newStart, newEnd), source);
        return new RefinementResult(RefinementResult.Outcome.RECORDED_ONLY, recorded);
    }

    private static boolean keptEndPrecedes(CommitmentDocument existing, Instant newStart, Instant newEnd) {
        return newEnd == null && existing.getEndDate() != null && existing.getEndDate().isBefore(newStart);
    }

    private static CommitmentValidationException endPrecedesStart(CommitmentDocument existing, Instant newStart) {
        return new CommitmentValidationException("Commitment " + existing.getId() + " keeps end_date "
                + existing.getEndDate() + ", which precedes the new start_date " + newStart);
    }
}
