package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.AllocationVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AllocationVersionRepository extends JpaRepository<AllocationVersion, AllocationVersion.Key> {
    List<AllocationVersion> findByTournamentIdOrderByVersionDesc(UUID tournamentId);

    Optional<AllocationVersion> findFirstByTournamentIdOrderByVersionDesc(UUID tournamentId);

    @Query("select coalesce(max(v.version), 0) from AllocationVersion v where v.tournamentId = :tournamentId")
    int findMaxVersion(@Param("tournamentId") UUID tournamentId);

    /**
     * Plain insert: a second row for the same (tournament, version) fails on the primary key.
     */
    @Modifying
    @Query(value = """
            insert into allocation_versions (tournament_id, version, committed_by, committed_at, allocation_count)
            values (:tournamentId, :version, :committedBy, :committedAt, :allocationCount)
            """, nativeQuery = true)
    int insertVersion(
            @Param("tournamentId") UUID tournamentId,
            @Param("version") int version,
            @Param("committedBy") UUID committedBy,
            @Param("committedAt") OffsetDateTime committedAt,
            @Param("allocationCount") int allocationCount
    );
}
