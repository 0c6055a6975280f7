package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.Competitor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CompetitorRepository extends JpaRepository<Competitor, UUID> {
    List<Competitor> findByTournamentIdOrderByRankAscCompetitorIdAsc(UUID tournamentId);

    @Query("select count(c) from Competitor c where c.tournamentId = :tournamentId and c.competitorId in :competitorIds")
    long countByTournamentIdAndCompetitorIdIn(
            @Param("tournamentId") UUID tournamentId,
            @Param("competitorIds") Collection<UUID> competitorIds
    );
}
