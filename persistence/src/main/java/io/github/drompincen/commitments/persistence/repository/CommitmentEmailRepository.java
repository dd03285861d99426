package io.github.drompincen.commitments.persistence.repository;

import io.github.drompincen.commitments.persistence.document.CommitmentEmailDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface CommitmentEmailRepository extends MongoRepository<CommitmentEmailDocument, String> {
    List<CommitmentEmailDocument> findByCommitmentIdOrderByLinkedAtAsc(String commitmentId);
    List<CommitmentEmailDocument> findByMessageId(String messageId);
    Optional<CommitmentEmailDocument> findByCommitmentIdAndMessageId(String commitmentId, String messageId);
    long countByCommitmentId(String commitmentId);
    long deleteByCommitmentId(String commitmentId);
}
