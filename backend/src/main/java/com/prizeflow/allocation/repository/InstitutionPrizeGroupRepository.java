package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.InstitutionPrizeGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InstitutionPrizeGroupRepository extends JpaRepository<InstitutionPrizeGroup, UUID> {
    List<InstitutionPrizeGroup> findByTournamentIdAndActiveTrueOrderByNameAscGroupIdAsc(UUID tournamentId);
}
