package com.prizeflow.allocation.service;

import com.prizeflow.allocation.config.AllocationProperties;
import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.engine.AllocationDecision;
import com.prizeflow.allocation.engine.PrizeScheduler;
import com.prizeflow.allocation.repository.CompetitorRepository;
import com.prizeflow.allocation.repository.PrizeRepository;
import com.prizeflow.allocation.web.AllocationRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Shape and ownership checks shared by review and finalize. Nothing here writes.
 */
@Component
@RequiredArgsConstructor
public class AllocationDecisionValidator {

    private final PrizeRepository prizeRepository;
    private final CompetitorRepository competitorRepository;
    private final AllocationProperties allocationProperties;

    /**
     * Checks that need no database access: non-empty, at least one award, bounded
     * size, and no prize listed twice.
     */
    public List<AllocationDecision> validateShape(List<AllocationRequests.DecisionRequest> decisions) {
        if (decisions == null || decisions.isEmpty()) {
            throw AllocationRequestException.emptyDecisions("At least one decision is required");
        }
        if (decisions.size() > allocationProperties.getMaxDecisionsPerRequest()) {
            throw AllocationRequestException.tooManyDecisions(
                    "At most " + allocationProperties.getMaxDecisionsPerRequest() + " decisions are accepted per request"
            );
        }
        if (decisions.stream().noneMatch(decision -> decision.competitorId() != null)) {
            throw AllocationRequestException.noAwards("At least one decision must award a competitor");
        }

        Set<UUID> seenPrizes = new HashSet<>();
        for (AllocationRequests.DecisionRequest decision : decisions) {
            if (!seenPrizes.add(decision.prizeId())) {
                throw AllocationRequestException.duplicatePrize("Prize " + decision.prizeId() + " is listed more than once");
            }
        }

        return decisions.stream()
                .map(decision -> new AllocationDecision(
                        decision.prizeId(),
                        decision.competitorId(),
                        decision.reasonCodes(),
                        decision.manual()
                ))
                .toList();
    }

    /**
     * Pins may be empty. When present they are bounded and name each prize once.
     */
    public List<AllocationDecision> validatePins(List<AllocationRequests.PinnedAwardRequest> pins) {
        if (pins == null || pins.isEmpty()) {
            return List.of();
        }
        if (pins.size() > allocationProperties.getMaxDecisionsPerRequest()) {
            throw AllocationRequestException.tooManyDecisions(
                    "At most " + allocationProperties.getMaxDecisionsPerRequest() + " overrides are accepted per request"
            );
        }
        Set<UUID> seenPrizes = new HashSet<>();
        for (AllocationRequests.PinnedAwardRequest pin : pins) {
            if (!seenPrizes.add(pin.prizeId())) {
                throw AllocationRequestException.duplicatePrize("Prize " + pin.prizeId() + " is pinned more than once");
            }
        }
        return pins.stream()
                .map(pin -> new AllocationDecision(
                        pin.prizeId(),
                        pin.competitorId(),
                        List.of(PrizeScheduler.REASON_MANUAL_OVERRIDE),
                        true
                ))
                .toList();
    }

    public void validateReferences(UUID tournamentId, List<AllocationDecision> decisions) {
        Set<UUID> prizeIds = new LinkedHashSet<>();
        Set<UUID> competitorIds = new LinkedHashSet<>();
        decisions.forEach(decision -> {
            prizeIds.add(decision.prizeId());
            if (decision.competitorId() != null) {
                competitorIds.add(decision.competitorId());
            }
        });

        long knownPrizes = prizeRepository.countTournamentPrizes(tournamentId, prizeIds);
        if (knownPrizes != prizeIds.size()) {
            throw AllocationRequestException.unknownReference(
                    "One or more prizes do not belong to tournament " + tournamentId
            );
        }

        if (competitorIds.isEmpty()) {
            return;
        }
        long knownCompetitors = competitorRepository.countByTournamentIdAndCompetitorIdIn(tournamentId, competitorIds);
        if (knownCompetitors != competitorIds.size()) {
            throw AllocationRequestException.unknownReference(
                    "One or more competitors do not belong to tournament " + tournamentId
            );
        }
    }
}
