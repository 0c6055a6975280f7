package com.prizeflow.allocation.service;

import com.prizeflow.allocation.config.AllocationProperties;
import com.prizeflow.allocation.model.Tournament;
import com.prizeflow.allocation.repository.TournamentRepository;
import com.prizeflow.allocation.web.AllocationRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class TournamentAccessService {

    private final TournamentRepository tournamentRepository;
    private final AllocationProperties allocationProperties;

    public Tournament requireTournament(UUID tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + tournamentId
                ));
    }

    /**
     * Only the tournament owner or a configured master actor may change its allocation.
     */
    public void requireOrganizer(Tournament tournament, UUID actorId) {
        if (actorId == null) {
            throw AllocationRequestException.actorRequired("An acting organizer is required");
        }
        if (actorId.equals(tournament.getOwnerId())) {
            return;
        }
        if (allocationProperties.getMasterActorIds() != null
                && allocationProperties.getMasterActorIds().contains(actorId)) {
            return;
        }
        throw AllocationRequestException.actorNotAuthorized(
                "Actor " + actorId + " may not change allocations of tournament " + tournament.getTournamentId()
        );
    }
}
