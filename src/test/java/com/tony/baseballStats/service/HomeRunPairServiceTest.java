package com.tony.baseballStats.service;

import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.Game;
import com.tony.baseballStats.model.Player;
import com.tony.baseballStats.model.Team;
import com.tony.baseballStats.model.dto.HomeRunPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.io.StringWriter;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(HomeRunPairService.class)
class HomeRunPairServiceTest {

    @Autowired private HomeRunPairService service;
    @Autowired private TestEntityManager em;

    private Team home;
    private Team away;
    private long nextGamePk = 1;

    @BeforeEach
    void setUp() {
        home = em.persist(new Team(147L, "New York Yankees", null, null));
        away = em.persist(new Team(111L, "Boston Red Sox", null, null));
    }

    private Long player(long apiId, String name) {
        return em.persist(new Player(apiId, name, home, "RF")).getId();
    }

    private Long game(String date) {
        Game game = new Game();
        game.setApiGameId(nextGamePk++);
        game.setGameDate(OffsetDateTime.parse(date));
        game.setHomeTeam(home);
        game.setAwayTeam(away);
        return em.persist(game).getId();
    }

    private void homeRuns(Long gameId, Long playerId, int count) {
        BatterStatLine line = new BatterStatLine(gameId, playerId);
        line.setHomeRuns(count);
        em.persist(line);
    }

    @Test
    @DisplayName("Les paires sont comptées par jour et triées par fréquence")
    void shouldCountPairsPerDay() {
        Long judge = player(1, "Aaron Judge");
        Long soto = player(2, "Juan Soto");
        Long devers = player(3, "Rafael Devers");

        // Jour 1 : Judge + Soto sur le même match
        Long g1 = game("2024-04-05T17:05:00Z");
        homeRuns(g1, judge, 1);
        homeRuns(g1, soto, 2);
        // Jour 2 : Judge + Soto + Devers sur deux matchs différents
        Long g2 = game("2024-04-06T17:05:00Z");
        Long g3 = game("2024-04-06T19:10:00Z");
        homeRuns(g2, judge, 1);
        homeRuns(g2, soto, 1);
        homeRuns(g3, devers, 1);
        // Ligne sans home run : ignorée
        homeRuns(game("2024-04-07T17:05:00Z"), devers, 0);
        em.flush();

        List<HomeRunPair> pairs = service.topPairs(10, null);

        assertThat(pairs).first().isEqualTo(new HomeRunPair("Aaron Judge", "Juan Soto", 2));
        assertThat(pairs).hasSize(3);
        assertThat(pairs).extracting(HomeRunPair::frequency).containsExactly(2L, 1L, 1L);
    }

    @Test
    @DisplayName("Le joueur exclu n'apparaît dans aucune paire et la limite est respectée")
    void shouldExcludePlayerAndApplyLimit() {
        Long judge = player(1, "Aaron Judge");
        Long soto = player(2, "Juan Soto");
        Long devers = player(3, "Rafael Devers");
        Long g1 = game("2024-04-05T17:05:00Z");
        homeRuns(g1, judge, 1);
        homeRuns(g1, soto, 1);
        homeRuns(g1, devers, 1);
        em.flush();

        assertThat(service.topPairs(10, "Aaron Judge"))
                .containsExactly(new HomeRunPair("Juan Soto", "Rafael Devers", 1));
        assertThat(service.topPairs(1, null)).hasSize(1);
    }

    @Test
    @DisplayName("Une limite inférieure à 1 est refusée")
    void invalidLimitShouldBeRejected() {
        assertThatThrownBy(() -> service.topPairs(-1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Export CSV : en-tête puis une ligne par paire")
    void shouldWriteCsv() throws IOException {
        StringWriter out = new StringWriter();

        service.writeCsv(List.of(new HomeRunPair("Aaron Judge", "Juan Soto", 2)), out);

        assertThat(out.toString().lines()).containsExactly(
                "\"player1\",\"player2\",\"frequency\"",
                "\"Aaron Judge\",\"Juan Soto\",\"2\"");
    }
}
