package com.prizeflow.allocation.controller;

import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.model.ConflictStatus;
import com.prizeflow.allocation.service.AllocationCommitService;
import com.prizeflow.allocation.service.AllocationConflictService;
import com.prizeflow.allocation.service.AllocationPreviewService;
import com.prizeflow.allocation.service.AllocationRcaService;
import com.prizeflow.allocation.service.InstitutionPrizeService;
import com.prizeflow.allocation.web.ActorIdentityInterceptor;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tournaments/{tournamentId}/allocation")
public class AllocationController {

    private final AllocationPreviewService allocationPreviewService;
    private final AllocationCommitService allocationCommitService;
    private final AllocationConflictService allocationConflictService;
    private final AllocationRcaService allocationRcaService;
    private final InstitutionPrizeService institutionPrizeService;

    public AllocationController(
            AllocationPreviewService allocationPreviewService,
            AllocationCommitService allocationCommitService,
            AllocationConflictService allocationConflictService,
            AllocationRcaService allocationRcaService,
            InstitutionPrizeService institutionPrizeService
    ) {
        this.allocationPreviewService = allocationPreviewService;
        this.allocationCommitService = allocationCommitService;
        this.allocationConflictService = allocationConflictService;
        this.allocationRcaService = allocationRcaService;
        this.institutionPrizeService = institutionPrizeService;
    }

    @GetMapping("/preview")
    public ResponseEntity<AllocationResponses.PreviewResponse> preview(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(allocationPreviewService.preview(tournamentId));
    }

    @PostMapping("/preview")
    public ResponseEntity<AllocationResponses.PreviewResponse> whatIfPreview(
            @PathVariable UUID tournamentId,
            @RequestAttribute(ActorIdentityInterceptor.ACTOR_ID_ATTRIBUTE) UUID actorId,
            @Valid @RequestBody(required = false) AllocationRequests.WhatIfPreviewRequest request
    ) {
        AllocationRequests.WhatIfPreviewRequest effective = request != null
                ? request
                : new AllocationRequests.WhatIfPreviewRequest(null, null);
        return ResponseEntity.ok(allocationPreviewService.whatIf(tournamentId, effective, actorId));
    }

    @PostMapping("/review")
    public ResponseEntity<AllocationResponses.ReviewResult> review(
            @PathVariable UUID tournamentId,
            @RequestAttribute(ActorIdentityInterceptor.ACTOR_ID_ATTRIBUTE) UUID actorId,
            @Valid @RequestBody AllocationRequests.DecisionSetRequest request
    ) {
        return ResponseEntity.ok(
                allocationConflictService.reviewManualEdits(tournamentId, request.decisions(), actorId)
        );
    }

    @PostMapping("/finalize")
    public ResponseEntity<AllocationResponses.CommitResult> finalizeAllocation(
            @PathVariable UUID tournamentId,
            @RequestAttribute(ActorIdentityInterceptor.ACTOR_ID_ATTRIBUTE) UUID actorId,
            @Valid @RequestBody AllocationRequests.DecisionSetRequest request
    ) {
        AllocationResponses.CommitResult result =
                allocationCommitService.commit(tournamentId, request.decisions(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/current")
    public ResponseEntity<AllocationResponses.CurrentAllocation> current(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(allocationCommitService.getCurrentAllocation(tournamentId));
    }

    @GetMapping("/versions")
    public ResponseEntity<List<AllocationResponses.VersionSummary>> versions(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(allocationCommitService.listVersions(tournamentId));
    }

    @GetMapping("/rca")
    public ResponseEntity<List<AllocationResponses.RcaEntry>> rca(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(allocationRcaService.buildRca(tournamentId));
    }

    @GetMapping("/institution-prizes")
    public ResponseEntity<AllocationResponses.InstitutionPrizesResponse> institutionPrizes(
            @PathVariable UUID tournamentId
    ) {
        return ResponseEntity.ok(institutionPrizeService.allocate(tournamentId));
    }

    @GetMapping("/conflicts")
    public ResponseEntity<List<AllocationResponses.Conflict>> conflicts(
            @PathVariable UUID tournamentId,
            @RequestParam(required = false) ConflictStatus status
    ) {
        return ResponseEntity.ok(allocationConflictService.listConflicts(tournamentId, status));
    }

    @PostMapping("/conflicts/{conflictId}/resolve")
    public ResponseEntity<AllocationResponses.Conflict> resolveConflict(
            @PathVariable UUID tournamentId,
            @PathVariable UUID conflictId,
            @RequestAttribute(ActorIdentityInterceptor.ACTOR_ID_ATTRIBUTE) UUID actorId,
            @Valid @RequestBody(required = false) AllocationRequests.ResolveConflictRequest request
    ) {
        String note = request != null ? request.note() : null;
        return ResponseEntity.ok(allocationConflictService.resolve(tournamentId, conflictId, actorId, note));
    }
}
