package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.Allocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AllocationRepository extends JpaRepository<Allocation, UUID> {
    List<Allocation> findByTournamentIdAndVersionOrderByDecidedAtAscPrizeIdAsc(UUID tournamentId, Integer version);
}
