package com.saltbet.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One real-world bout that users can stake on.
 * The id is the bout token {@code <blueId>-<redId>-<freshness>}.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false, length = 128)
    private String id;

    @Column(name = "external_id")
    private Long externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "winning_side", length = 8)
    private Side winningSide;

    @Column(name = "fighter_blue_id", nullable = false, updatable = false)
    private Long fighterBlueId;

    @Column(name = "fighter_red_id", nullable = false, updatable = false)
    private Long fighterRedId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MatchStatus status = MatchStatus.OPEN;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "settled_at")
    private OffsetDateTime settledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
