package io.github.drompincen.commitments.runtime.commitment;

import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.persistence.repository.CommitmentCalendarEventRepository;
import io.github.drompincen.commitments.persistence.repository.CommitmentEmailRepository;
import io.github.drompincen.commitments.persistence.repository.CommitmentRepository;
import io.github.drompincen.commitments.protocol.api.CommitmentStatus;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import io.github.drompincen.commitments.protocol.api.DateHistoryEntry;
import io.github.drompincen.commitments.runtime.error.CommitmentNotFoundException;
import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class CommitmentService {

    private static final Logger log = LoggerFactory.getLogger(CommitmentService.class);

    public static final String DATE_HISTORY_KEY = "date_history";

    static final int MAX_TRANSITION_ATTEMPTS = 3;

    private final CommitmentRepository commitmentRepository;
    private final CommitmentEmailRepository emailRepository;
    private final CommitmentCalendarEventRepository calendarRepository;
    private final MongoTemplate mongoTemplate;
    private final CommitmentSerializer serializer;
    private final String defaultType;
    private final int titleMaxLength;

    public CommitmentService(CommitmentRepository commitmentRepository,
                             CommitmentEmailRepository emailRepository,
                             CommitmentCalendarEventRepository calendarRepository,
                             MongoTemplate mongoTemplate,
                             CommitmentSerializer serializer,
                             @Value("${commitments.default-type:meeting}") String defaultType,
                             @Value("${commitments.title-max-length:500}") int titleMaxLength) {
        this.commitmentRepository = commitmentRepository;
        this.emailRepository = emailRepository;
        this.calendarRepository = calendarRepository;
        this.mongoTemplate = mongoTemplate;
        this.serializer = serializer;
        this.defaultType = defaultType;
        this.titleMaxLength = titleMaxLength;
    }

    // ---- Lifecycle ----

    public CommitmentDocument create(CommitmentDraft draft) {
        String title = CommitmentRules.requireText(draft.title(), "title", titleMaxLength).trim();
        String type = draft.commitmentType() == null || draft.commitmentType().isBlank()
                ? defaultType
                : CommitmentRules.checkLength(draft.commitmentType().trim(), "commitment_type", CommitmentRules.MAX_TYPE_LENGTH);
        CommitmentRules.checkDateOrder(draft.startDate(), draft.endDate());
        CommitmentRules.checkLength(draft.organizer(), "organizer", CommitmentRules.MAX_ORGANIZER_LENGTH);
        CommitmentRules.checkConfidence(draft.confidenceScore());
        if (draft.attributes().containsKey(DATE_HISTORY_KEY)) {
            throw new CommitmentValidationException("metadata key '" + DATE_HISTORY_KEY + "' is reserved");
        }

        Instant now = now();
        CommitmentDocument doc = new CommitmentDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setTitle(title);
        doc.setDescription(draft.description());
        doc.setCommitmentType(type);
        doc.setStatus(CommitmentStatus.ACTIVE);
        doc.setStartDate(draft.startDate());
        doc.setEndDate(draft.endDate());
        doc.setTimezone(CommitmentRules.checkTimezone(draft.timezone()));
        doc.setDateCertainty(draft.dateCertainty() != null ? draft.dateCertainty() : DateCertainty.UNKNOWN);
        doc.setParticipants(new ArrayList<>(draft.participants()));
        doc.setOrganizer(draft.organizer());
        doc.setLocation(draft.location());
        doc.setMeetingLinks(new ArrayList<>(draft.meetingLinks()));
        doc.setAutoLinked(draft.autoLinked());
        doc.setConfidenceScore(draft.confidenceScore());
        doc.setDateHistory(new ArrayList<>());
        doc.setAttributes(new LinkedHashMap<>(draft.attributes()));
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        CommitmentDocument saved = commitmentRepository.insert(doc);
        log.info("Created commitment {} '{}' ({}, certainty={})",
                saved.getId(), saved.getTitle(), saved.getCommitmentType(), saved.getDateCertainty().label());
        return saved;
    }

    /** Moves an active commitment to a terminal status. Terminal commitments are never reopened. */
    public CommitmentDocument transitionStatus(String id, CommitmentStatus target) {
        if (target == null || !target.isTerminal()) {
            throw new CommitmentValidationException("Only completed or cancelled are valid transitions, got " + target);
        }
        Query query = new Query()
                .addCriteria(Criteria.where("_id").is(id))
                .addCriteria(Criteria.where("status").is(CommitmentStatus.ACTIVE));
        for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
            Update update = new Update()
                    .set("status", target)
                    .set("updatedAt", now());
            CommitmentDocument updated = mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().returnNew(true), CommitmentDocument.class);
            if (updated != null) {
                log.info("Commitment {} is now {}", id, target.label());
                return updated;
            }
            CommitmentDocument existing = get(id);
            if (existing.getStatus() != null && existing.getStatus().isTerminal()) {
                throw new CommitmentValidationException("Commitment " + id + " is already "
                        + existing.getStatus().label());
            }
            log.debug("Commitment {} changed during status transition (attempt {}), retrying", id, attempt);
        }
        throw new IllegalStateException("Commitment " + id + " kept changing during transition to "
                + target.label());
    }

    /** Deletes the commitment together with every email and calendar link it owns. */
    public void delete(String id) {
        if (!commitmentRepository.existsById(id)) {
            throw new CommitmentNotFoundException(id);
        }
        // commitment first: a link inserted after this point fails its own commitment check
        commitmentRepository.deleteById(id);
        long emails = emailRepository.deleteByCommitmentId(id);
        long events = calendarRepository.deleteByCommitmentId(id);
        log.info("Deleted commitment {} with {} email links and {} calendar links", id, emails, events);
    }

    // ---- History ----

    /** Appends one observation to the date history in a single atomic update. */
    public CommitmentDocument appendHistory(String id, String dateInfo, String source) {
        Update update = new Update()
                .push("dateHistory", historyEntry(dateInfo, source))
                .set("updatedAt", now());
        CommitmentDocument updated = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(id)), update,
                FindAndModifyOptions.options().returnNew(true), CommitmentDocument.class);
        if (updated == null) {
            throw new CommitmentNotFoundException(id);
        }
        return updated;
    }

    public static DateHistoryEntry historyEntry(String dateInfo, String source) {
        return new DateHistoryEntry(dateInfo, source, now());
    }

    // ---- Lookup ----

    public Optional<CommitmentDocument> find(String id) {
        return commitmentRepository.findById(id);
    }

    public CommitmentDocument get(String id) {
        return commitmentRepository.findById(id).orElseThrow(() -> new CommitmentNotFoundException(id));
    }

    public boolean exists(String id) {
        return commitmentRepository.existsById(id);
    }

    public List<CommitmentDocument> findByStatus(CommitmentStatus status) {
        return commitmentRepository.findByStatus(status);
    }

    public List<CommitmentDocument> findByType(String commitmentType) {
        return commitmentRepository.findByCommitmentType(commitmentType);
    }

    public List<CommitmentDocument> findByCertainty(DateCertainty certainty) {
        return commitmentRepository.findByDateCertainty(certainty);
    }

    public List<CommitmentDocument> findStartingBetween(Instant from, Instant to) {
        return commitmentRepository.findByStartDateBetweenOrderByStartDateAsc(from, to);
    }

    public List<CommitmentDocument> findByParticipantEmail(String email) {
        return commitmentRepository.findByParticipantsEmail(email);
    }

    // ---- Serialization ----

    public Map<String, Object> serialize(String id) {
        return serialize(get(id));
    }

    public Map<String, Object> serialize(CommitmentDocument commitment) {
        long emailCount = emailRepository.countByCommitmentId(commitment.getId());
        long eventCount = calendarRepository.countByCommitmentId(commitment.getId());
        return serializer.toMap(commitment, emailCount, eventCount);
    }

    public static Instant now() {
        // the store keeps millisecond precision
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
