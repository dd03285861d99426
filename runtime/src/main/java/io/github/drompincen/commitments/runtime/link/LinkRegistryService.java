package io.github.drompincen.commitments.runtime.link;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.commitments.persistence.document.CommitmentCalendarEventDocument;
import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.persistence.document.CommitmentEmailDocument;
import io.github.drompincen.commitments.persistence.repository.CommitmentCalendarEventRepository;
import io.github.drompincen.commitments.persistence.repository.CommitmentEmailRepository;
import io.github.drompincen.commitments.protocol.api.CommitmentLinkDto;
import io.github.drompincen.commitments.runtime.commitment.CommitmentRules;
import io.github.drompincen.commitments.runtime.commitment.CommitmentService;
import io.github.drompincen.commitments.runtime.error.CommitmentNotFoundException;
import io.github.drompincen.commitments.runtime.error.DuplicateLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records which emails and calendar events informed a commitment.
 *
 * <p>At most one link exists per (commitment, source) pair. Uniqueness is enforced by the unique
 * index in the store, never by a check-then-insert, so a concurrent duplicate surfaces as
 * {@link DuplicateLinkException}. Links are immutable; they disappear only with their commitment.
 */
@Service
public class LinkRegistryService {

    private static final Logger log = LoggerFactory.getLogger(LinkRegistryService.class);

    private final CommitmentEmailRepository emailRepository;
    private final CommitmentCalendarEventRepository calendarRepository;
    private final CommitmentService commitmentService;
    private final MongoTemplate mongoTemplate;

    public LinkRegistryService(CommitmentEmailRepository emailRepository,
                               CommitmentCalendarEventRepository calendarRepository,
                               CommitmentService commitmentService,
                               MongoTemplate mongoTemplate) {
        this.emailRepository = emailRepository;
        this.calendarRepository = calendarRepository;
        this.commitmentService = commitmentService;
        this.mongoTemplate = mongoTemplate;
    }

    // ---- Email links ----

    public CommitmentEmailDocument linkEmail(String commitmentId, String messageId,
                                             CommitmentLinkDto.LinkedBy linkedBy,
                                             Double confidenceScore, String linkReason) {
        CommitmentRules.requireText(messageId, "message_id", CommitmentRules.MAX_SOURCE_ID_LENGTH);
        CommitmentRules.checkConfidence(confidenceScore);
        requireCommitment(commitmentId);

        CommitmentEmailDocument link = new CommitmentEmailDocument();
        link.setLinkId(UUID.randomUUID().toString());
        link.setCommitmentId(commitmentId);
        link.setMessageId(messageId);
        link.setLinkedAt(CommitmentService.now());
        link.setLinkedBy(linkedBy != null ? linkedBy : CommitmentLinkDto.LinkedBy.AI);
        link.setConfidenceScore(confidenceScore);
        link.setLinkReason(linkReason);
        CommitmentEmailDocument saved;
        try {
            saved = emailRepository.insert(link);
        } catch (DuplicateKeyException e) {
            throw new DuplicateLinkException(commitmentId, CommitmentLinkDto.SourceType.EMAIL, messageId, e);
        }
        if (!touchCommitment(commitmentId, saved.getLinkedBy())) {
            emailRepository.deleteById(saved.getLinkId());
            throw new CommitmentNotFoundException(commitmentId);
        }
        log.info("Linked email {} to commitment {} (by={}, confidence={})",
                messageId, commitmentId, saved.getLinkedBy().label(), confidenceScore);
        return saved;
    }

    /** Idempotent variant for retried deliveries: an existing link is reported as empty. */
    public Optional<CommitmentEmailDocument> linkEmailIfAbsent(String commitmentId, String messageId,
                                                               CommitmentLinkDto.LinkedBy linkedBy,
                                                               Double confidenceScore, String linkReason) {
        try {
            return Optional.of(linkEmail(commitmentId, messageId, linkedBy, confidenceScore, linkReason));
        } catch (DuplicateLinkException e) {
            log.info("Email {} already linked to commitment {}", messageId, commitmentId);
            return Optional.empty();
        }
    }

    public List<CommitmentEmailDocument> emailLinks(String commitmentId) {
        requireCommitment(commitmentId);
        return emailRepository.findByCommitmentIdOrderByLinkedAtAsc(commitmentId);
    }

    public List<String> commitmentsForMessage(String messageId) {
        return emailRepository.findByMessageId(messageId).stream()
                .map(CommitmentEmailDocument::getCommitmentId)
                .distinct()
                .collect(Collectors.toList());
    }

    public long countEmailLinks(String commitmentId) {
        return emailRepository.countByCommitmentId(commitmentId);
    }

    // ---- Calendar links ----

    public CommitmentCalendarEventDocument linkCalendarEvent(String commitmentId, String eventId,
                                                             Map<String, Object> eventData,
                                                             CommitmentLinkDto.LinkedBy linkedBy,
                                                             Double confidenceScore, String linkReason) {
        CommitmentRules.requireText(eventId, "event_id", CommitmentRules.MAX_SOURCE_ID_LENGTH);
        CommitmentRules.checkConfidence(confidenceScore);
        requireCommitment(commitmentId);

        CommitmentCalendarEventDocument link = new CommitmentCalendarEventDocument();
        link.setLinkId(UUID.randomUUID().toString());
        link.setCommitmentId(commitmentId);
        link.setEventId(eventId);
        link.setEventData(eventData != null ? new LinkedHashMap<>(eventData) : null);
        link.setLinkedAt(CommitmentService.now());
        link.setLinkedBy(linkedBy != null ? linkedBy : CommitmentLinkDto.LinkedBy.AI);
        link.setConfidenceScore(confidenceScore);
        link.setLinkReason(linkReason);
        CommitmentCalendarEventDocument saved;
        try {
            saved = calendarRepository.insert(link);
        } catch (DuplicateKeyException e) {
            throw new DuplicateLinkException(commitmentId, CommitmentLinkDto.SourceType.CALENDAR_EVENT, eventId, e);
        }
        if (!touchCommitment(commitmentId, saved.getLinkedBy())) {
            calendarRepository.deleteById(saved.getLinkId());
            throw new CommitmentNotFoundException(commitmentId);
        }
        log.info("Linked calendar event {} to commitment {} (by={}, confidence={})",
                eventId, commitmentId, saved.getLinkedBy().label(), confidenceScore);
        return saved;
    }

    public Optional<CommitmentCalendarEventDocument> linkCalendarEventIfAbsent(String commitmentId, String eventId,
                                                                               Map<String, Object> eventData,
                                                                               CommitmentLinkDto.LinkedBy linkedBy,
                                                                               Double confidenceScore,
                                                                               String linkReason) {
        try {
            return Optional.of(linkCalendarEvent(commitmentId, eventId, eventData, linkedBy, confidenceScore, linkReason));
        } catch (DuplicateLinkException e) {
            log.info("Calendar event {} already linked to commitment {}", eventId, commitmentId);
            return Optional.empty();
        }
    }

    public List<CommitmentCalendarEventDocument> calendarLinks(String commitmentId) {
        requireCommitment(commitmentId);
        return calendarRepository.findByCommitmentIdOrderByLinkedAtAsc(commitmentId);
    }

    public List<String> commitmentsForEvent(String eventId) {
        return calendarRepository.findByEventId(eventId).stream()
                .map(CommitmentCalendarEventDocument::getCommitmentId)
                .distinct()
                .collect(Collectors.toList());
    }

    public long countCalendarLinks(String commitmentId) {
        return calendarRepository.countByCommitmentId(commitmentId);
    }

    // ---- Internals ----

    private void requireCommitment(String commitmentId) {
        if (commitmentId == null || !commitmentService.exists(commitmentId)) {
            throw new CommitmentNotFoundException(commitmentId);
        }
    }

    /**
     * Refreshes the commitment after a link insert, marking it auto-linked for AI links.
     * Returns false when the commitment was deleted in the meantime; the caller then removes its link.
     */
    private boolean touchCommitment(String commitmentId, CommitmentLinkDto.LinkedBy linkedBy) {
        Update update = new Update().set("updatedAt", CommitmentService.now());
        if (linkedBy == CommitmentLinkDto.LinkedBy.AI) {
            update.set("autoLinked", true);
        }
        UpdateResult result = mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(commitmentId)), update, CommitmentDocument.class);
        return result.getMatchedCount() > 0;
    }
}
