package com.prizeflow.allocation.service;

import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.AllocationDecision;
import com.prizeflow.allocation.engine.AllocationSnapshot;
import com.prizeflow.allocation.engine.ConflictDraft;
import com.prizeflow.allocation.engine.ManualEditConflictDetector;
import com.prizeflow.allocation.engine.PrizeScheduler;
import com.prizeflow.allocation.engine.ScheduleResult;
import com.prizeflow.allocation.mapper.AllocationResponseMapper;
import com.prizeflow.allocation.model.AllocationConflict;
import com.prizeflow.allocation.model.ConflictStatus;
import com.prizeflow.allocation.model.Tournament;
import com.prizeflow.allocation.repository.AllocationConflictRepository;
import com.prizeflow.allocation.web.AllocationRequestException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Opens, supersedes and resolves conflicts raised by manual edits of the preview.
 */
@Service
@RequiredArgsConstructor
public class AllocationConflictService {

    private static final Logger log = LoggerFactory.getLogger(AllocationConflictService.class);

    static final String NOTE_SUPERSEDED = "superseded";
    static final String NOTE_RESOLVED_BY_ORGANIZER = "resolved_by_organizer";
    static final String NOTE_ACCEPTED_BY_COMMIT = "accepted_by_commit";

    private final AllocationConflictRepository allocationConflictRepository;
    private final TournamentAccessService tournamentAccessService;
    private final AllocationDecisionValidator allocationDecisionValidator;
    private final AllocationSnapshotLoader allocationSnapshotLoader;
    private final PrizeScheduler prizeScheduler;
    private final ManualEditConflictDetector manualEditConflictDetector;
    private final AllocationResponseMapper allocationResponseMapper;
    private final Clock clock;

    @Transactional
    public AllocationResponses.ReviewResult reviewManualEdits(
            UUID tournamentId,
            List<AllocationRequests.DecisionRequest> requestedDecisions,
            UUID actorId
    ) {
        List<AllocationDecision> decisions = allocationDecisionValidator.validateShape(requestedDecisions);
        Tournament tournament = tournamentAccessService.requireTournament(tournamentId);
        tournamentAccessService.requireOrganizer(tournament, actorId);
        allocationDecisionValidator.validateReferences(tournamentId, decisions);

        List<ConflictDraft> drafts = detectConflicts(tournament, decisions);

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<AllocationConflict> openConflicts = allocationConflictRepository
                .findByTournamentIdAndStatusOrderByCreatedAtAscConflictIdAsc(tournamentId, ConflictStatus.OPEN);
        Map<String, AllocationConflict> openByFingerprint = new LinkedHashMap<>();
        openConflicts.forEach(conflict -> openByFingerprint.putIfAbsent(fingerprint(conflict), conflict));

        Set<String> reproduced = new HashSet<>();
        List<AllocationConflict> opened = new ArrayList<>();
        for (ConflictDraft draft : drafts) {
            String fingerprint = draft.fingerprint();
            if (!reproduced.add(fingerprint) || openByFingerprint.containsKey(fingerprint)) {
                continue;
            }
            opened.add(newConflict(tournamentId, draft, actorId, now));
        }

        List<AllocationConflict> superseded = new ArrayList<>();
        for (AllocationConflict conflict : openConflicts) {
            if (!reproduced.contains(fingerprint(conflict))) {
                conflict.setStatus(ConflictStatus.RESOLVED);
                conflict.setResolutionNote(NOTE_SUPERSEDED);
                conflict.setResolvedBy(actorId);
                conflict.setResolvedAt(now);
                superseded.add(conflict);
            }
        }

        allocationConflictRepository.saveAll(superseded);
        List<AllocationConflict> saved = allocationConflictRepository.saveAll(opened);

        int stillOpen = openConflicts.size() - superseded.size() + saved.size();
        log.info(
                "[alloc.review] tournament={} decisions={} opened={} superseded={} open={}",
                tournamentId,
                decisions.size(),
                saved.size(),
                superseded.size(),
                stillOpen
        );
        return new AllocationResponses.ReviewResult(
                allocationResponseMapper.toConflictResponses(saved),
                stillOpen,
                superseded.size()
        );
    }

    /**
     * Conflicts the given decisions carry against a fresh preview of the tournament.
     */
    @Transactional(readOnly = true)
    public List<ConflictDraft> detectConflicts(Tournament tournament, List<AllocationDecision> decisions) {
        AllocationSnapshot snapshot = allocationSnapshotLoader.load(tournament);
        ScheduleResult preview = prizeScheduler.schedule(snapshot);
        return manualEditConflictDetector.detect(snapshot, preview, decisions);
    }

    /**
     * Resolves every open conflict of the tournament and records the committed
     * decisions' own conflicts as already accepted, so no committed relaxation
     * lacks a conflict row.
     *
     * @return number of conflicts resolved or recorded
     */
    @Transactional
    public int acceptAtCommit(UUID tournamentId, List<ConflictDraft> committedDrafts, UUID actorId, OffsetDateTime now) {
        List<AllocationConflict> openConflicts = allocationConflictRepository
                .findByTournamentIdAndStatusOrderByCreatedAtAscConflictIdAsc(tournamentId, ConflictStatus.OPEN);
        Set<String> known = new HashSet<>();
        openConflicts.forEach(conflict -> known.add(fingerprint(conflict)));

        List<AllocationConflict> accepted = new ArrayList<>(openConflicts);
        int recorded = 0;
        for (ConflictDraft draft : committedDrafts) {
            if (known.add(draft.fingerprint())) {
                accepted.add(newConflict(tournamentId, draft, actorId, now));
                recorded++;
            }
        }
        for (AllocationConflict conflict : accepted) {
            conflict.setStatus(ConflictStatus.RESOLVED);
            conflict.setResolutionNote(NOTE_ACCEPTED_BY_COMMIT);
            conflict.setResolvedBy(actorId);
            conflict.setResolvedAt(now);
        }
        allocationConflictRepository.saveAll(accepted);

        if (recorded > 0) {
            log.warn(
                    "[alloc.commit] tournament={} committed {} conflicting decision(s) without review; recorded as {}",
                    tournamentId,
                    recorded,
                    NOTE_ACCEPTED_BY_COMMIT
            );
        }
        return accepted.size();
    }

    @Transactional(readOnly = true)
    public List<AllocationResponses.Conflict> listConflicts(UUID tournamentId, ConflictStatus status) {
        tournamentAccessService.requireTournament(tournamentId);
        List<AllocationConflict> conflicts = status == null
                ? allocationConflictRepository.findByTournamentIdOrderByCreatedAtAscConflictIdAsc(tournamentId)
                : allocationConflictRepository.findByTournamentIdAndStatusOrderByCreatedAtAscConflictIdAsc(
                        tournamentId,
                        status
                );
        return allocationResponseMapper.toConflictResponses(conflicts);
    }

    @Transactional
    public AllocationResponses.Conflict resolve(UUID tournamentId, UUID conflictId, UUID actorId, String note) {
        Tournament tournament = tournamentAccessService.requireTournament(tournamentId);
        tournamentAccessService.requireOrganizer(tournament, actorId);

        AllocationConflict conflict = allocationConflictRepository.findById(conflictId)
                .filter(found -> tournamentId.equals(found.getTournamentId()))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Conflict not found: " + conflictId
                ));
        if (conflict.getStatus() != ConflictStatus.OPEN) {
            throw AllocationRequestException.conflictAlreadyResolved("Conflict " + conflictId + " is already resolved");
        }

        conflict.setStatus(ConflictStatus.RESOLVED);
        conflict.setResolutionNote(StringUtils.hasText(note) ? note.trim() : NOTE_RESOLVED_BY_ORGANIZER);
        conflict.setResolvedBy(actorId);
        conflict.setResolvedAt(OffsetDateTime.now(clock));
        AllocationConflict saved = allocationConflictRepository.save(conflict);

        log.info("[alloc.conflict] tournament={} conflict={} resolved by {}", tournamentId, conflictId, actorId);
        return allocationResponseMapper.toConflictResponse(saved);
    }

    private static String fingerprint(AllocationConflict conflict) {
        return ConflictDraft.fingerprint(
                conflict.getConflictType(),
                conflict.getImpactedCompetitors(),
                conflict.getImpactedPrizes()
        );
    }

    private static AllocationConflict newConflict(
            UUID tournamentId,
            ConflictDraft draft,
            UUID actorId,
            OffsetDateTime now
    ) {
        AllocationConflict conflict = new AllocationConflict();
        conflict.setConflictId(UUID.randomUUID());
        conflict.setTournamentId(tournamentId);
        conflict.setConflictType(draft.type());
        conflict.setImpactedCompetitors(new ArrayList<>(draft.impactedCompetitors()));
        conflict.setImpactedPrizes(new ArrayList<>(draft.impactedPrizes()));
        conflict.setReasons(new ArrayList<>(draft.reasons()));
        conflict.setSuggestedPrizeId(draft.suggestedPrizeId());
        conflict.setSuggestedCompetitorId(draft.suggestedCompetitorId());
        conflict.setStatus(ConflictStatus.OPEN);
        conflict.setOpenedBy(actorId);
        conflict.setCreatedAt(now);
        return conflict;
    }
}
