package io.github.drompincen.commitments.persistence.repository;

import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.protocol.api.CommitmentStatus;
import io.github.drompincen.commitments.protocol.api.DateCertainty;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface CommitmentRepository extends MongoRepository<CommitmentDocument, String> {

    List<CommitmentDocument> findByStatus(CommitmentStatus status);

    List<CommitmentDocument> findByCommitmentType(String commitmentType);

    List<CommitmentDocument> findByDateCertainty(DateCertainty dateCertainty);

    List<CommitmentDocument> findByStartDateBetweenOrderByStartDateAsc(Instant from, Instant to);

    List<CommitmentDocument> findByParticipantsEmail(String email);
}
