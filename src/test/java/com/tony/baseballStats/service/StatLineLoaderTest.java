package com.tony.baseballStats.service;

import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.Game;
import com.tony.baseballStats.model.PitcherStatLine;
import com.tony.baseballStats.model.Player;
import com.tony.baseballStats.model.Team;
import com.tony.baseballStats.repository.BatterStatLineRepository;
import com.tony.baseballStats.repository.PitcherStatLineRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@Import(StatLineLoader.class)
class StatLineLoaderTest {

    @Autowired private StatLineLoader loader;
    @Autowired private TestEntityManager em;
    @Autowired private BatterStatLineRepository batterRepository;
    @Autowired private PitcherStatLineRepository pitcherRepository;

    private Long gameId;
    private Long judgeId;
    private Long belloId;

    @BeforeEach
    void setUp() {
        Team yankees = em.persist(new Team(147L, "New York Yankees", "Yankee Stadium", "Bronx"));
        Team redSox = em.persist(new Team(111L, "Boston Red Sox", "Fenway Park", "Boston"));
        judgeId = em.persist(new Player(592450L, "Aaron Judge", yankees, "RF")).getId();
        belloId = em.persist(new Player(678394L, "Brayan Bello", redSox, "P")).getId();

        Game game = new Game();
        game.setApiGameId(745000L);
        game.setGameDate(OffsetDateTime.parse("2024-04-05T23:05:00Z"));
        game.setHomeTeam(yankees);
        game.setAwayTeam(redSox);
        gameId = em.persist(game).getId();
        em.flush();
    }

    private BatterStatLine batter(Long playerId, int hits) {
        BatterStatLine line = new BatterStatLine(gameId, playerId);
        line.setAtBats(4);
        line.setHits(hits);
        return line;
    }

    @Test
    @DisplayName("Les lignes frappeurs sont insérées et comptées")
    void shouldInsertBatterLines() {
        int inserted = loader.loadBatterLines(List.of(batter(judgeId, 2), batter(belloId, 0)));

        assertThat(inserted).isEqualTo(2);
        assertThat(batterRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Rejouer le même lot n'insère rien")
    void replayShouldInsertNothing() {
        loader.loadBatterLines(List.of(batter(judgeId, 2)));

        int inserted = loader.loadBatterLines(List.of(batter(judgeId, 2)));

        assertThat(inserted).isZero();
        assertThat(batterRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Un doublon (match, joueur) dans le même lot n'est inséré qu'une fois")
    void duplicatesWithinBatchShouldBeInsertedOnce() {
        int inserted = loader.loadBatterLines(List.of(batter(judgeId, 2), batter(judgeId, 3)));

        assertThat(inserted).isEqualTo(1);
        assertThat(batterRepository.findAll()).singleElement()
                .extracting(BatterStatLine::getHits).isEqualTo(2);
    }

    @Test
    @DisplayName("Un lot mêlant lignes déjà stockées et nouvelles n'insère que les nouvelles")
    void mixedBatchShouldInsertOnlyNewPairs() {
        loader.loadBatterLines(List.of(batter(judgeId, 2)));

        int inserted = loader.loadBatterLines(List.of(batter(judgeId, 3), batter(belloId, 0)));

        assertThat(inserted).isEqualTo(1);
        assertThat(batterRepository.findAll())
                .extracting(BatterStatLine::getPlayerId, BatterStatLine::getHits)
                .containsExactlyInAnyOrder(tuple(judgeId, 2), tuple(belloId, 0));
    }

    @Test
    @DisplayName("Lignes lanceurs : insertion puis rejeu sans effet")
    void shouldInsertPitcherLinesOnce() {
        PitcherStatLine line = new PitcherStatLine(gameId, belloId);
        line.setInningsPitched(6.2);
        line.setStrikeouts(7);

        assertThat(loader.loadPitcherLines(List.of(line))).isEqualTo(1);
        assertThat(loader.loadPitcherLines(List.of(new PitcherStatLine(gameId, belloId)))).isZero();
        assertThat(pitcherRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Un lot vide ne touche pas la base")
    void emptyBatchShouldInsertNothing() {
        assertThat(loader.loadBatterLines(List.of())).isZero();
        assertThat(loader.loadPitcherLines(List.of())).isZero();
    }
}
