package com.prizeflow.allocation.service;

import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.CompetitorProfile;
import com.prizeflow.allocation.engine.InstitutionAllocation;
import com.prizeflow.allocation.engine.InstitutionGroupSpec;
import com.prizeflow.allocation.engine.InstitutionPrizeAllocator;
import com.prizeflow.allocation.mapper.AllocationResponseMapper;
import com.prizeflow.allocation.mapper.AllocationSnapshotMapper;
import com.prizeflow.allocation.model.InstitutionPrize;
import com.prizeflow.allocation.model.InstitutionPrizeGroup;
import com.prizeflow.allocation.repository.CompetitorRepository;
import com.prizeflow.allocation.repository.InstitutionPrizeGroupRepository;
import com.prizeflow.allocation.repository.InstitutionPrizeRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Computes team prize winners on demand. Results are not stored and do not
 * interact with individual allocation versions.
 */
@Service
@RequiredArgsConstructor
public class InstitutionPrizeService {

    private static final Logger log = LoggerFactory.getLogger(InstitutionPrizeService.class);

    private final TournamentAccessService tournamentAccessService;
    private final CompetitorRepository competitorRepository;
    private final InstitutionPrizeGroupRepository institutionPrizeGroupRepository;
    private final InstitutionPrizeRepository institutionPrizeRepository;
    private final InstitutionPrizeAllocator institutionPrizeAllocator;
    private final AllocationSnapshotMapper allocationSnapshotMapper;
    private final AllocationResponseMapper allocationResponseMapper;

    @Transactional(readOnly = true)
    public AllocationResponses.InstitutionPrizesResponse allocate(UUID tournamentId) {
        tournamentAccessService.requireTournament(tournamentId);

        List<InstitutionPrizeGroup> groups =
                institutionPrizeGroupRepository.findByTournamentIdAndActiveTrueOrderByNameAscGroupIdAsc(tournamentId);
        List<UUID> groupIds = groups.stream().map(InstitutionPrizeGroup::getGroupId).toList();
        Map<UUID, List<InstitutionPrize>> prizesByGroup = groupIds.isEmpty()
                ? Map.of()
                : institutionPrizeRepository.findByGroupIdInAndActiveTrueOrderByPlaceAscPrizeIdAsc(groupIds).stream()
                        .collect(Collectors.groupingBy(InstitutionPrize::getGroupId));
        List<InstitutionGroupSpec> groupSpecs = groups.stream()
                .map(group -> allocationSnapshotMapper.toInstitutionGroupSpec(
                        group,
                        prizesByGroup.getOrDefault(group.getGroupId(), List.of())
                ))
                .toList();

        List<CompetitorProfile> competitors = competitorRepository
                .findByTournamentIdOrderByRankAscCompetitorIdAsc(tournamentId)
                .stream()
                .map(allocationSnapshotMapper::toCompetitorProfile)
                .toList();

        InstitutionAllocation allocation = institutionPrizeAllocator.allocate(competitors, groupSpecs);
        log.info(
                "[alloc.institution] tournament={} groups={} competitors={} maxRank={}",
                tournamentId,
                groupSpecs.size(),
                competitors.size(),
                allocation.maxRank()
        );
        return allocationResponseMapper.toInstitutionPrizesResponse(tournamentId, allocation);
    }
}
