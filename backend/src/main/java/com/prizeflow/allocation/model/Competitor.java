package com.prizeflow.allocation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Imported, ranked participant. Rows are written by the import pipeline; the
 * allocation engine only reads them.
 */
@Getter
@Setter
@Entity
@Table(name = "competitors")
public class Competitor {

    @Id
    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "rank", nullable = false)
    private Integer rank;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "dob")
    private LocalDate dob;

    @Column(name = "dob_imputed", nullable = false)
    private boolean dobImputed = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", length = 16)
    private Gender gender;

    @Column(name = "state", length = 128)
    private String state;

    @Column(name = "city", length = 128)
    private String city;

    @Column(name = "club", length = 255)
    private String club;

    @Column(name = "disability", length = 64)
    private String disability;

    @Column(name = "group_label", length = 128)
    private String groupLabel;

    @Column(name = "type_label", length = 128)
    private String typeLabel;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
