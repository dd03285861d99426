package io.github.drompincen.commitments.persistence.repository;

import io.github.drompincen.commitments.persistence.document.CommitmentCalendarEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface CommitmentCalendarEventRepository extends MongoRepository<CommitmentCalendarEventDocument, String> {
    List<CommitmentCalendarEventDocument> findByCommitmentIdOrderByLinkedAtAsc(String commitmentId);
    List<CommitmentCalendarEventDocument> findByEventId(String eventId);
    Optional<CommitmentCalendarEventDocument> findByCommitmentIdAndEventId(String commitmentId, String eventId);
    long countByCommitmentId(String commitmentId);
    long deleteByCommitmentId(String commitmentId);
}
