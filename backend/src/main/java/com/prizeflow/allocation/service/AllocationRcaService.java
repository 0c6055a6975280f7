package com.prizeflow.allocation.service;

import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.AllocationSnapshot;
import com.prizeflow.allocation.engine.CommittedAward;
import com.prizeflow.allocation.engine.CompetitorProfile;
import com.prizeflow.allocation.engine.PrizeScheduler;
import com.prizeflow.allocation.engine.RcaReconciler;
import com.prizeflow.allocation.engine.RcaRow;
import com.prizeflow.allocation.engine.ScheduleResult;
import com.prizeflow.allocation.mapper.AllocationResponseMapper;
import com.prizeflow.allocation.mapper.AllocationSnapshotMapper;
import com.prizeflow.allocation.model.AllocationVersion;
import com.prizeflow.allocation.model.Tournament;
import com.prizeflow.allocation.repository.AllocationRepository;
import com.prizeflow.allocation.repository.AllocationVersionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AllocationRcaService {

    private final TournamentAccessService tournamentAccessService;
    private final AllocationSnapshotLoader allocationSnapshotLoader;
    private final AllocationVersionRepository allocationVersionRepository;
    private final AllocationRepository allocationRepository;
    private final PrizeScheduler prizeScheduler;
    private final RcaReconciler rcaReconciler;
    private final AllocationSnapshotMapper allocationSnapshotMapper;
    private final AllocationResponseMapper allocationResponseMapper;

    @Transactional(readOnly = true)
    public List<AllocationResponses.RcaEntry> buildRca(UUID tournamentId) {
        Tournament tournament = tournamentAccessService.requireTournament(tournamentId);
        AllocationVersion current = allocationVersionRepository.findFirstByTournamentIdOrderByVersionDesc(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "No committed allocation for tournament: " + tournamentId
                ));

        AllocationSnapshot snapshot = allocationSnapshotLoader.load(tournament);
        ScheduleResult preview = prizeScheduler.schedule(snapshot);
        List<CommittedAward> committed = allocationRepository
                .findByTournamentIdAndVersionOrderByDecidedAtAscPrizeIdAsc(tournamentId, current.getVersion())
                .stream()
                .map(allocationSnapshotMapper::toCommittedAward)
                .toList();
        Map<UUID, CompetitorProfile> competitorsById = snapshot.competitors().stream()
                .collect(Collectors.toMap(CompetitorProfile::competitorId, Function.identity(), (left, right) -> left));

        List<RcaRow> rows = rcaReconciler.reconcile(preview.coverage(), committed, competitorsById);
        return rows.stream().map(allocationResponseMapper::toRcaResponse).toList();
    }
}
