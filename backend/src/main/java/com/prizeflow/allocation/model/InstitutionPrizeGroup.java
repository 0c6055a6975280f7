package com.prizeflow.allocation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Team prize table: competitors are grouped by one profile field and the best
 * {@code teamSize} of each group form its team.
 */
@Getter
@Setter
@Entity
@Table(name = "institution_prize_groups")
public class InstitutionPrizeGroup {

    @Id
    @Column(name = "group_id", nullable = false, updatable = false)
    private UUID groupId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(name = "group_by", nullable = false, length = 32)
    private String groupBy;

    @Column(name = "team_size", nullable = false)
    private Integer teamSize;

    @Column(name = "female_slots", nullable = false)
    private Integer femaleSlots = 0;

    @Column(name = "male_slots", nullable = false)
    private Integer maleSlots = 0;

    @Column(name = "scoring_mode", nullable = false, length = 32)
    private String scoringMode = "by_top_k_score";

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
