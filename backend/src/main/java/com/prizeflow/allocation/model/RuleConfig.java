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

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Tournament-level allocation switches. Null columns fall back to
 * {@code prizeflow.allocation.default-rules.*}.
 */
@Getter
@Setter
@Entity
@Table(name = "rule_config")
public class RuleConfig {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "strict_age")
    private Boolean strictAge;

    @Column(name = "allow_unrated_in_rating")
    private Boolean allowUnratedInRating;

    @Column(name = "allow_missing_dob_for_age")
    private Boolean allowMissingDobForAge;

    @Enumerated(EnumType.STRING)
    @Column(name = "age_cutoff_policy", length = 32)
    private AgeCutoffPolicy ageCutoffPolicy;

    @Column(name = "age_cutoff_date")
    private LocalDate ageCutoffDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "multi_prize_policy", length = 32)
    private MultiPrizePolicy multiPrizePolicy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "category_priority_order", columnDefinition = "jsonb")
    private List<UUID> categoryPriorityOrder;

    @Column(name = "verbose_logs")
    private Boolean verboseLogs;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
