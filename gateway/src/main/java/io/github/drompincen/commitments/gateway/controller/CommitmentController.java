package io.github.drompincen.commitments.gateway.controller;

import io.github.drompincen.commitments.persistence.document.CommitmentCalendarEventDocument;
import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.persistence.document.CommitmentEmailDocument;
import io.github.drompincen.commitments.protocol.api.CommitmentLinkDto;
import io.github.drompincen.commitments.protocol.api.CommitmentStatus;
import io.github.drompincen.commitments.protocol.api.CreateCommitmentRequest;
import io.github.drompincen.commitments.protocol.api.LinkCalendarEventRequest;
import io.github.drompincen.commitments.protocol.api.LinkEmailRequest;
import io.github.drompincen.commitments.protocol.api.RefineCommitmentRequest;
import io.github.drompincen.commitments.protocol.api.RefinementResponse;
import io.github.drompincen.commitments.protocol.api.UpdateStatusRequest;
import io.github.drompincen.commitments.runtime.commitment.CommitmentDraft;
import io.github.drompincen.commitments.runtime.commitment.CommitmentService;
import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;
import io.github.drompincen.commitments.runtime.lattice.CertaintyLattice;
import io.github.drompincen.commitments.runtime.link.LinkRegistryService;
import io.github.drompincen.commitments.runtime.refine.RefinementResult;
import io.github.drompincen.commitments.runtime.refine.RefinementService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/commitments")
public class CommitmentController {

    private final CommitmentService commitmentService;
    private final RefinementService refinementService;
    private final LinkRegistryService linkRegistry;
    private final CertaintyLattice lattice;

    public CommitmentController(CommitmentService commitmentService,
                                RefinementService refinementService,
                                LinkRegistryService linkRegistry,
                                CertaintyLattice lattice) {
        this.commitmentService = commitmentService;
        this.refinementService = refinementService;
        this.linkRegistry = linkRegistry;
        this.lattice = lattice;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateCommitmentRequest request) {
        if (request == null) {
            throw new CommitmentValidationException("request body is required");
        }
        CommitmentDocument created = commitmentService.create(CommitmentDraft.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commitmentService.serialize(created));
    }

    @GetMapping("/{id}")
    public Map<String, Object> get(@PathVariable String id) {
        return commitmentService.serialize(id);
    }

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(required = false) String status,
                                          @RequestParam(required = false) String type,
                                          @RequestParam(required = false) String certainty,
                                          @RequestParam(required = false) String participant,
                                          @RequestParam(required = false) Instant from,
                                          @RequestParam(required = false) Instant to) {
        List<CommitmentDocument> docs;
        if (status != null) {
            docs = commitmentService.findByStatus(parseStatus(status));
        } else if (type != null) {
            docs = commitmentService.findByType(type);
        } else if (certainty != null) {
            docs = commitmentService.findByCertainty(lattice.parse(certainty));
        } else if (participant != null) {
            docs = commitmentService.findByParticipantEmail(participant);
        } else if (from != null && to != null) {
            docs = commitmentService.findStartingBetween(from, to);
        } else {
            throw new CommitmentValidationException(
                    "one of status, type, certainty, participant or from/to is required");
        }
        return docs.stream().map(commitmentService::serialize).collect(Collectors.toList());
    }

    @PostMapping("/{id}/refine")
    public RefinementResponse refine(@PathVariable String id, @RequestBody RefineCommitmentRequest request) {
        if (request.onlyIfMoreCertain()) {
            RefinementResult result = refinementService.refineIfMoreCertain(id, request.startDate(),
                    request.endDate(), request.dateCertainty(), request.source());
            return new RefinementResponse(id, result.applied(), result.commitment().getDateHistory().size());
        }
        CommitmentDocument updated = refinementService.refine(id, request.startDate(), request.endDate(),
                request.dateCertainty(), request.source());
        return new RefinementResponse(id, true, updated.getDateHistory().size());
    }

    @PutMapping("/{id}/status")
    public Map<String, Object> updateStatus(@PathVariable String id, @RequestBody UpdateStatusRequest request) {
        return commitmentService.serialize(commitmentService.transitionStatus(id, request.status()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        commitmentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ---- Links ----

    @PostMapping("/{id}/emails")
    public ResponseEntity<CommitmentLinkDto> linkEmail(@PathVariable String id, @RequestBody LinkEmailRequest request) {
        CommitmentEmailDocument link = linkRegistry.linkEmail(id, request.messageId(), request.linkedBy(),
                request.confidenceScore(), request.linkReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(link));
    }

    @GetMapping("/{id}/emails")
    public List<CommitmentLinkDto> emails(@PathVariable String id) {
        return linkRegistry.emailLinks(id).stream().map(this::toDto).collect(Collectors.toList());
    }

    @PostMapping("/{id}/calendar-events")
    public ResponseEntity<CommitmentLinkDto> linkCalendarEvent(@PathVariable String id,
                                                               @RequestBody LinkCalendarEventRequest request) {
        CommitmentCalendarEventDocument link = linkRegistry.linkCalendarEvent(id, request.eventId(),
                request.eventData(), request.linkedBy(), request.confidenceScore(), request.linkReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(link));
    }

    @GetMapping("/{id}/calendar-events")
    public List<CommitmentLinkDto> calendarEvents(@PathVariable String id) {
        return linkRegistry.calendarLinks(id).stream().map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/by-email/{messageId}")
    public List<String> byEmail(@PathVariable String messageId) {
        return linkRegistry.commitmentsForMessage(messageId);
    }

    @GetMapping("/by-calendar-event/{eventId}")
    public List<String> byCalendarEvent(@PathVariable String eventId) {
        return linkRegistry.commitmentsForEvent(eventId);
    }

    private static CommitmentStatus parseStatus(String status) {
        try {
            return CommitmentStatus.fromLabel(status);
        } catch (IllegalArgumentException e) {
            throw new CommitmentValidationException("Unknown status: " + status);
        }
    }

    private CommitmentLinkDto toDto(CommitmentEmailDocument link) {
        return new CommitmentLinkDto(link.getLinkId(), link.getCommitmentId(),
                CommitmentLinkDto.SourceType.EMAIL, link.getMessageId(), null,
                link.getLinkedAt(), link.getLinkedBy(), link.getConfidenceScore(), link.getLinkReason());
    }

    private CommitmentLinkDto toDto(CommitmentCalendarEventDocument link) {
        return new CommitmentLinkDto(link.getLinkId(), link.getCommitmentId(),
                CommitmentLinkDto.SourceType.CALENDAR_EVENT, link.getEventId(), link.getEventData(),
                link.getLinkedAt(), link.getLinkedBy(), link.getConfidenceScore(), link.getLinkReason());
    }
}
