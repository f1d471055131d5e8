package com.tony.baseballStats.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "pitcher_stats", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"game_id", "player_id"})
})
@Getter @Setter @NoArgsConstructor
public class PitcherStatLine implements StatLine {
    @Id
    // Séquence (et non IDENTITY) pour que Hibernate regroupe les INSERT en batch JDBC
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "pitcher_stats_seq")
    @SequenceGenerator(name = "pitcher_stats_seq", sequenceName = "pitcher_stats_seq", allocationSize = 50)
    @Column(name = "stat_id")
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", insertable = false, updatable = false)
    private Game game;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "player_id", insertable = false, updatable = false)
    private Player player;

    private double inningsPitched; // 6.2 = 6 manches et 2 retraits
    private int hitsAllowed;
    private int runsAllowed;
    private int earnedRuns;
    private int homeRunsAllowed;
    private int walksAllowed;
    private int strikeouts;

    public PitcherStatLine(Long gameId, Long playerId) {
        this.gameId = gameId;
        this.playerId = playerId;
    }
}
