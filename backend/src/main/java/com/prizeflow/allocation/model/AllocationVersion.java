package com.prizeflow.allocation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Version log entry for one commit. The composite primary key is what keeps two
 * concurrent commits from claiming the same version.
 */
@Getter
@Setter
@Entity
@Immutable
@IdClass(AllocationVersion.Key.class)
@Table(name = "allocation_versions")
public class AllocationVersion {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Id
    @Column(name = "version", nullable = false, updatable = false)
    private Integer version;

    @Column(name = "committed_by", nullable = false, updatable = false)
    private UUID committedBy;

    @Column(name = "committed_at", nullable = false, updatable = false)
    private OffsetDateTime committedAt;

    @Column(name = "allocation_count", nullable = false, updatable = false)
    private Integer allocationCount;

    public static class Key implements Serializable {
        private UUID tournamentId;
        private Integer version;

        public Key() {
        }

        public Key(UUID tournamentId, Integer version) {
            this.tournamentId = tournamentId;
            this.version = version;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key other)) {
                return false;
            }
            return Objects.equals(tournamentId, other.tournamentId) && Objects.equals(version, other.version);
        }

        @Override
        public int hashCode() {
            return Objects.hash(tournamentId, version);
        }
    }
}
