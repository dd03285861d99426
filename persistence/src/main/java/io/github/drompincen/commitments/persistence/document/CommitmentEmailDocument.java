package io.github.drompincen.commitments.persistence.document;

import io.github.drompincen.commitments.protocol.api.CommitmentLinkDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "commitment_emails")
@CompoundIndex(name = "uq_commitment_email", def = "{'commitmentId': 1, 'messageId': 1}", unique = true)
public class CommitmentEmailDocument {

    @Id
    private String linkId;
    @Indexed(name = "idx_commitment_emails_commitment")
    private String commitmentId;
    @Indexed(name = "idx_commitment_emails_message")
    private String messageId;
    @Indexed(name = "idx_commitment_emails_linked_at")
    private Instant linkedAt;
    @Indexed(name = "idx_commitment_emails_linked_by")
    private CommitmentLinkDto.LinkedBy linkedBy = CommitmentLinkDto.LinkedBy.AI;
    private Double confidenceScore;
    private String linkReason;

    public CommitmentEmailDocument() {}

    public String getLinkId() { return linkId; }
    public void setLinkId(String linkId) { this.linkId = linkId; }

    public String getCommitmentId() { return commitmentId; }
    public void setCommitmentId(String commitmentId) { this.commitmentId = commitmentId; }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public Instant getLinkedAt() { return linkedAt; }
    public void setLinkedAt(Instant linkedAt) { this.linkedAt = linkedAt; }

    public CommitmentLinkDto.LinkedBy getLinkedBy() { return linkedBy; }
    public void setLinkedBy(CommitmentLinkDto.LinkedBy linkedBy) { this.linkedBy = linkedBy; }

    public Double getConfidenceScore() { return confidenceScore; }
    public void setConfidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; }

    public String getLinkReason() { return linkReason; }
    public void setLinkReason(String linkReason) { this.linkReason = linkReason; }
}
