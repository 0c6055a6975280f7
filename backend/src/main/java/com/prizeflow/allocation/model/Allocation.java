package com.prizeflow.allocation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One committed (prize, competitor) decision. Rows are append-only: a new commit
 * writes a new version instead of touching existing rows.
 */
@Getter
@Setter
@Entity
@Immutable
@Table(name = "allocations")
public class Allocation {

    @Id
    @Column(name = "allocation_id", nullable = false, updatable = false)
    private UUID allocationId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "version", nullable = false, updatable = false)
    private Integer version;

    @Column(name = "prize_id", nullable = false, updatable = false)
    private UUID prizeId;

    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reason_codes", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<String> reasonCodes = new ArrayList<>();

    @Column(name = "is_manual", nullable = false, updatable = false)
    private boolean manual = false;

    @Column(name = "decided_by", nullable = false, updatable = false)
    private UUID decidedBy;

    @Column(name = "decided_at", nullable = false, updatable = false)
    private OffsetDateTime decidedAt;
}
