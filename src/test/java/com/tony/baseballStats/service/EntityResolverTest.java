package com.tony.baseballStats.service;

import com.tony.baseballStats.model.Player;
import com.tony.baseballStats.repository.GameRepository;
import com.tony.baseballStats.repository.PlayerRepository;
import com.tony.baseballStats.repository.TeamRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(EntityResolver.class)
class EntityResolverTest {

    @Autowired private EntityResolver resolver;
    @Autowired private TeamRepository teamRepository;
    @Autowired private PlayerRepository playerRepository;
    @Autowired private GameRepository gameRepository;

    @Test
    @DisplayName("Une équipe vue deux fois n'est créée qu'une fois et garde le même id")
    void resolveTeamShouldBeIdempotent() {
        Long first = resolver.resolveTeam(147L, "New York Yankees", "Yankee Stadium", "Bronx");
        Long second = resolver.resolveTeam(147L, "New York Yankees", "Yankee Stadium", "Bronx");

        assertThat(second).isEqualTo(first);
        assertThat(teamRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Les données d'une équipe existante ne sont pas écrasées")
    void existingTeamShouldNotBeUpdated() {
        Long id = resolver.resolveTeam(111L, "Boston Red Sox", "Fenway Park", "Boston");
        resolver.resolveTeam(111L, "Red Sox", "Autre stade", "Ailleurs");

        assertThat(teamRepository.findById(id)).get()
                .satisfies(t -> {
                    assertThat(t.getName()).isEqualTo("Boston Red Sox");
                    assertThat(t.getVenue()).isEqualTo("Fenway Park");
                });
    }

    @Test
    @DisplayName("Un joueur reste rattaché à sa première équipe même s'il réapparaît ailleurs")
    void playerTeamAssociationShouldBeSticky() {
        Long yankees = resolver.resolveTeam(147L, "New York Yankees", null, null);
        Long redSox = resolver.resolveTeam(111L, "Boston Red Sox", null, null);

        Long first = resolver.resolvePlayer(592450L, "Aaron Judge", yankees, "RF");
        Long second = resolver.resolvePlayer(592450L, "Aaron Judge", redSox, "RF");

        assertThat(second).isEqualTo(first);
        assertThat(playerRepository.count()).isEqualTo(1);
        Player judge = playerRepository.findById(first).orElseThrow();
        assertThat(judge.getTeam().getId()).isEqualTo(yankees);
    }

    @Test
    @DisplayName("Un match vu deux fois n'est créé qu'une fois")
    void resolveGameShouldBeIdempotent() {
        Long home = resolver.resolveTeam(147L, "New York Yankees", null, null);
        Long away = resolver.resolveTeam(111L, "Boston Red Sox", null, null);
        OffsetDateTime date = OffsetDateTime.parse("2024-04-05T23:05:00Z");

        Long first = resolver.resolveGame(745000L, date, "Yankee Stadium", home, away, null, null);
        Long second = resolver.resolveGame(745000L, date, "Yankee Stadium", home, away, 5, 3);

        assertThat(second).isEqualTo(first);
        assertThat(gameRepository.count()).isEqualTo(1);
        // Pas de mise à jour : le score reste celui de la première résolution
        assertThat(gameRepository.findById(first).orElseThrow().getHomeTeamScore()).isNull();
    }
}
