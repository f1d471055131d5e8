package com.tony.baseballStats.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "players")
@Getter @Setter @NoArgsConstructor
public class Player {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "player_id")
    private Long id;

    @Column(nullable = false, unique = true)
    private Long apiPlayerId;

    @Column(nullable = false)
    private String name;

    // Équipe du premier roster où le joueur est apparu (jamais mise à jour)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id")
    private Team team;

    private String position; // C, 1B, SS, P, ...

    public Player(Long apiPlayerId, String name, Team team, String position) {
        this.apiPlayerId = apiPlayerId;
        this.name = name;
        this.team = team;
        this.position = position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        return id != null && id.equals(((Player) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
