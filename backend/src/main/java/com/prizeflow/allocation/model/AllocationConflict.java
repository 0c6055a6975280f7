package com.prizeflow.allocation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "allocation_conflicts")
public class AllocationConflict {

    @Id
    @Column(name = "conflict_id", nullable = false, updatable = false)
    private UUID conflictId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_type", nullable = false, updatable = false, length = 32)
    private ConflictType conflictType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "impacted_competitors", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<UUID> impactedCompetitors = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "impacted_prizes", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<UUID> impactedPrizes = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reasons", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<String> reasons = new ArrayList<>();

    @Column(name = "suggested_prize_id", updatable = false)
    private UUID suggestedPrizeId;

    @Column(name = "suggested_competitor_id", updatable = false)
    private UUID suggestedCompetitorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ConflictStatus status = ConflictStatus.OPEN;

    @Column(name = "resolution_note", columnDefinition = "TEXT")
    private String resolutionNote;

    @Column(name = "opened_by", updatable = false)
    private UUID openedBy;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;
}
