package com.tony.baseballStats.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "teams")
@Getter @Setter @NoArgsConstructor
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "team_id")
    private Long id;

    // Identifiant attribué par l'API MLB
    @Column(nullable = false, unique = true)
    private Long apiTeamId;

    @Column(nullable = false)
    private String name;

    private String venue;
    private String city;

    public Team(Long apiTeamId, String name, String venue, String city) {
        this.apiTeamId = apiTeamId;
        this.name = name;
        this.venue = venue;
        this.city = city;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
