package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.AllocationConflict;
import com.prizeflow.allocation.model.ConflictStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AllocationConflictRepository extends JpaRepository<AllocationConflict, UUID> {
    List<AllocationConflict> findByTournamentIdOrderByCreatedAtAscConflictIdAsc(UUID tournamentId);

    List<AllocationConflict> findByTournamentIdAndStatusOrderByCreatedAtAscConflictIdAsc(
            UUID tournamentId,
            ConflictStatus status
    );
}
