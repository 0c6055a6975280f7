package com.prizeflow.allocation.service;

import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.AllocationDecision;
import com.prizeflow.allocation.engine.ConflictDraft;
import com.prizeflow.allocation.mapper.AllocationResponseMapper;
import com.prizeflow.allocation.model.Allocation;
import com.prizeflow.allocation.model.AllocationVersion;
import com.prizeflow.allocation.model.Tournament;
import com.prizeflow.allocation.model.TournamentStatus;
import com.prizeflow.allocation.repository.AllocationRepository;
import com.prizeflow.allocation.repository.AllocationVersionRepository;
import com.prizeflow.allocation.repository.TournamentRepository;
import com.prizeflow.allocation.web.AllocationRequestException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persists a (possibly edited) allocation as the next immutable version of a tournament.
 */
@Service
@RequiredArgsConstructor
public class AllocationCommitService {

    private static final Logger log = LoggerFactory.getLogger(AllocationCommitService.class);

    private final TournamentRepository tournamentRepository;
    private final AllocationRepository allocationRepository;
    private final AllocationVersionRepository allocationVersionRepository;
    private final AllocationConflictService allocationConflictService;
    private final TournamentAccessService tournamentAccessService;
    private final AllocationDecisionValidator allocationDecisionValidator;
    private final AllocationResponseMapper allocationResponseMapper;
    private final Clock clock;

    @Transactional
    public AllocationResponses.CommitResult commit(
            UUID tournamentId,
            List<AllocationRequests.DecisionRequest> requestedDecisions,
            UUID actorId
    ) {
        List<AllocationDecision> decisions = allocationDecisionValidator.validateShape(requestedDecisions);
        Tournament tournament = tournamentAccessService.requireTournament(tournamentId);
        tournamentAccessService.requireOrganizer(tournament, actorId);
        allocationDecisionValidator.validateReferences(tournamentId, decisions);

        Tournament locked = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + tournamentId
                ));

        List<ConflictDraft> conflicts = allocationConflictService.detectConflicts(locked, decisions);

        OffsetDateTime now = OffsetDateTime.now(clock);
        int version = allocationVersionRepository.findMaxVersion(tournamentId) + 1;
        List<Allocation> rows = new ArrayList<>();
        for (AllocationDecision decision : decisions) {
            if (!decision.awarded()) {
                continue;
            }
            rows.add(newAllocation(tournamentId, version, decision, actorId, now));
        }

        try {
            allocationVersionRepository.insertVersion(tournamentId, version, actorId, now, rows.size());
        } catch (DataIntegrityViolationException ex) {
            log.warn("[alloc.commit] version {} of tournament {} was claimed concurrently", version, tournamentId);
            throw AllocationRequestException.versionConflict(
                    "Allocation version " + version + " was committed concurrently; reload and retry"
            );
        }
        allocationRepository.saveAll(rows);

        locked.setStatus(TournamentStatus.FINALIZED);
        locked.setUpdatedAt(now);
        tournamentRepository.save(locked);

        int resolvedConflicts = allocationConflictService.acceptAtCommit(tournamentId, conflicts, actorId, now);

        log.info(
                "[alloc.commit] tournament={} version={} allocations={} resolvedConflicts={} actor={}",
                tournamentId,
                version,
                rows.size(),
                resolvedConflicts,
                actorId
        );
        return new AllocationResponses.CommitResult(version, rows.size(), resolvedConflicts, now);
    }

    @Transactional(readOnly = true)
    public AllocationResponses.CurrentAllocation getCurrentAllocation(UUID tournamentId) {
        tournamentAccessService.requireTournament(tournamentId);
        AllocationVersion current = allocationVersionRepository.findFirstByTournamentIdOrderByVersionDesc(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "No committed allocation for tournament: " + tournamentId
                ));
        List<Allocation> allocations = allocationRepository
                .findByTournamentIdAndVersionOrderByDecidedAtAscPrizeIdAsc(tournamentId, current.getVersion());
        return allocationResponseMapper.toCurrentAllocationResponse(current, allocations);
    }

    @Transactional(readOnly = true)
    public List<AllocationResponses.VersionSummary> listVersions(UUID tournamentId) {
        tournamentAccessService.requireTournament(tournamentId);
        return allocationResponseMapper.toVersionSummaryResponses(
                allocationVersionRepository.findByTournamentIdOrderByVersionDesc(tournamentId)
        );
    }

    private static Allocation newAllocation(
            UUID tournamentId,
            int version,
            AllocationDecision decision,
            UUID actorId,
            OffsetDateTime now
    ) {
        Allocation allocation = new Allocation();
        allocation.setAllocationId(UUID.randomUUID());
        allocation.setTournamentId(tournamentId);
        allocation.setVersion(version);
        allocation.setPrizeId(decision.prizeId());
        allocation.setCompetitorId(decision.competitorId());
        allocation.setReasonCodes(new ArrayList<>(decision.reasonCodes()));
        allocation.setManual(decision.manual());
        allocation.setDecidedBy(actorId);
        allocation.setDecidedAt(now);
        return allocation;
    }
}
