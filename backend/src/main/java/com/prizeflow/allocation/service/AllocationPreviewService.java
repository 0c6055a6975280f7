package com.prizeflow.allocation.service;

import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.AllocationDecision;
import com.prizeflow.allocation.engine.AllocationSnapshot;
import com.prizeflow.allocation.engine.PrizeScheduler;
import com.prizeflow.allocation.engine.ScheduleResult;
import com.prizeflow.allocation.mapper.AllocationResponseMapper;
import com.prizeflow.allocation.mapper.AllocationSnapshotMapper;
import com.prizeflow.allocation.model.RuleConfig;
import com.prizeflow.allocation.model.Tournament;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AllocationPreviewService {

    private static final Logger log = LoggerFactory.getLogger(AllocationPreviewService.class);

    private final TournamentAccessService tournamentAccessService;
    private final AllocationDecisionValidator allocationDecisionValidator;
    private final AllocationSnapshotLoader allocationSnapshotLoader;
    private final AllocationSnapshotMapper allocationSnapshotMapper;
    private final PrizeScheduler prizeScheduler;
    private final AllocationResponseMapper allocationResponseMapper;

    @Transactional(readOnly = true)
    public AllocationResponses.PreviewResponse preview(UUID tournamentId) {
        Tournament tournament = tournamentAccessService.requireTournament(tournamentId);
        AllocationSnapshot snapshot = allocationSnapshotLoader.load(tournament);
        ScheduleResult result = prizeScheduler.schedule(snapshot);
        return allocationResponseMapper.toPreviewResponse(tournamentId, snapshot.competitors().size(), result, false);
    }

    /**
     * Preview with organizer inputs: pinned winners and rule switches that apply to
     * this run only. Always a dry run; nothing is persisted.
     */
    @Transactional(readOnly = true)
    public AllocationResponses.PreviewResponse whatIf(
            UUID tournamentId,
            AllocationRequests.WhatIfPreviewRequest request,
            UUID actorId
    ) {
        List<AllocationDecision> pins = allocationDecisionValidator.validatePins(request.overrides());
        Tournament tournament = tournamentAccessService.requireTournament(tournamentId);
        tournamentAccessService.requireOrganizer(tournament, actorId);
        if (!pins.isEmpty()) {
            allocationDecisionValidator.validateReferences(tournamentId, pins);
        }

        RuleConfig ruleOverride = allocationSnapshotMapper.toRuleOverride(request.rules());
        AllocationSnapshot snapshot = allocationSnapshotLoader.load(tournament, ruleOverride);
        ScheduleResult result = prizeScheduler.schedule(snapshot, pins);

        log.info(
                "[alloc.whatif] tournament={} pins={} ruleOverride={} filled={} unfilled={} actor={}",
                tournamentId,
                pins.size(),
                ruleOverride != null,
                result.filledCount(),
                result.unfilledCount(),
                actorId
        );
        return allocationResponseMapper.toPreviewResponse(tournamentId, snapshot.competitors().size(), result, true);
    }
}
