package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.Prize;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface PrizeRepository extends JpaRepository<Prize, UUID> {
    List<Prize> findByCategoryIdInOrderByPlaceAscPrizeIdAsc(Collection<UUID> categoryIds);

    @Query("""
            select count(p) from Prize p
            where p.prizeId in :prizeIds
              and p.categoryId in (select c.categoryId from Category c where c.tournamentId = :tournamentId)
            """)
    long countTournamentPrizes(
            @Param("tournamentId") UUID tournamentId,
            @Param("prizeIds") Collection<UUID> prizeIds
    );
}
