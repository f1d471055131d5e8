package com.tony.baseballStats.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "batter_stats", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"game_id", "player_id"})
})
@Getter @Setter @NoArgsConstructor
public class BatterStatLine implements StatLine {
    @Id
    // Séquence (et non IDENTITY) pour que Hibernate regroupe les INSERT en batch JDBC
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "batter_stats_seq")
    @SequenceGenerator(name = "batter_stats_seq", sequenceName = "batter_stats_seq", allocationSize = 50)
    @Column(name = "stat_id")
    private Long id;

    // Les FK sont écrites directement, les associations ne servent qu'en lecture
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

    // --- COMPTEURS BRUTS ---
    private int atBats;
    private int runs;
    private int hits;
    private int doubles;
    private int triples;
    private int homeRuns;
    private int rbi;
    private int walks;
    private int hitByPitch;
    private int strikeouts;
    private int stolenBases;
    private int caughtStealing;

    // --- STATS DÉRIVÉES (3 décimales) ---
    private double battingAverage;
    private double onBasePercentage;
    private double sluggingPercentage;
    private double onBasePlusSlugging;

    public BatterStatLine(Long gameId, Long playerId) {
        this.gameId = gameId;
        this.playerId = playerId;
    }
}
