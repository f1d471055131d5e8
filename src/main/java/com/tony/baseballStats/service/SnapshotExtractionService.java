package com.tony.baseballStats.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.baseballStats.config.IngestProperties;
import com.tony.baseballStats.model.SourceToken;
import com.tony.baseballStats.model.dto.BatterRecord;
import com.tony.baseballStats.model.dto.GameRecord;
import com.tony.baseballStats.model.dto.PitcherRecord;
import com.tony.baseballStats.model.dto.RosterEntry;
import com.tony.baseballStats.model.dto.Snapshot;
import com.tony.baseballStats.model.dto.TeamRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Construit un snapshot (équipes, rosters, matchs, box scores) pour une période
 * et le dépose dans le dossier d'entrée.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotExtractionService {

    private static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final MlbStatsClient client;
    private final ObjectMapper objectMapper;
    private final IngestProperties properties;

    public Path extract(LocalDate start, LocalDate end) throws IOException {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Période invalide : " + start + " > " + end);
        }
        Snapshot snapshot = buildSnapshot(start, end);

        String fileName = SourceToken.format(properties.getTokenPrefix(), start, end, LocalDateTime.now().format(SUFFIX_FORMAT));
        Path intake = properties.intakePath();
        Files.createDirectories(intake);
        Path target = intake.resolve(fileName);
        // Écriture dans un .part puis renommage : l'import ne voit jamais un fichier à moitié écrit
        Path partial = intake.resolve(fileName + ".part");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(partial.toFile(), snapshot);
        Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);

        log.info("📝 Snapshot écrit : {} ({} matchs, {} frappeurs, {} lanceurs)", target,
                snapshot.getGames().size(), snapshot.getBatterStats().size(), snapshot.getPitcherStats().size());
        return target;
    }

    Snapshot buildSnapshot(LocalDate start, LocalDate end) {
        Snapshot snapshot = new Snapshot();

        // 1. Équipes + rosters (indexés par nom d'équipe)
        for (JsonNode team : client.fetchTeams()) {
            TeamRecord record = new TeamRecord(
                    team.path("id").isNumber() ? team.path("id").asLong() : null,
                    textOrNull(team, "name"),
                    new TeamRecord.Venue(textOrNull(team.path("venue"), "name")),
                    textOrNull(team, "locationName"));
            snapshot.getTeams().add(record);
            if (record.getId() == null || record.getName() == null) continue;

            List<RosterEntry> roster = new ArrayList<>();
            for (JsonNode entry : client.fetchRoster(record.getId())) {
                JsonNode person = entry.path("person");
                roster.add(new RosterEntry(
                        new RosterEntry.Person(person.path("id").isNumber() ? person.path("id").asLong() : null,
                                textOrNull(person, "fullName")),
                        new RosterEntry.Position(textOrNull(entry.path("position"), "abbreviation"))));
            }
            snapshot.getRosters().put(record.getName(), roster);
        }
        log.info("{} rosters récupérés.", snapshot.getRosters().size());

        // 2. Calendrier -> matchs + box scores
        JsonNode schedule = client.fetchSchedule(start, end);
        for (JsonNode date : schedule.path("dates")) {
            for (JsonNode game : date.path("games")) {
                GameRecord record = toGameRecord(game);
                snapshot.getGames().add(record);
                if (record.getGameId() == null) continue;
                client.fetchBoxscore(record.getGameId())
                        .ifPresent(box -> collectBoxscoreStats(box, record.getGameId(), snapshot));
            }
        }
        return snapshot;
    }

    private GameRecord toGameRecord(JsonNode game) {
        JsonNode home = game.path("teams").path("home");
        JsonNode away = game.path("teams").path("away");
        return new GameRecord(
                game.path("gamePk").isNumber() ? game.path("gamePk").asLong() : null,
                textOrNull(game, "gameDate"),
                game.path("venue").path("name").asText("Unknown"),
                home.path("team").path("id").isNumber() ? home.path("team").path("id").asLong() : null,
                away.path("team").path("id").isNumber() ? away.path("team").path("id").asLong() : null,
                home.path("score").isNumber() ? home.path("score").asInt() : null,
                away.path("score").isNumber() ? away.path("score").asInt() : null);
    }

    void collectBoxscoreStats(JsonNode boxscore, Long gameId, Snapshot snapshot) {
        for (String side : List.of("home", "away")) {
            for (JsonNode player : boxscore.path("teams").path(side).path("players")) {
                JsonNode personId = player.path("person").path("id");
                if (!personId.isNumber()) continue;
                Long playerId = personId.asLong();

                JsonNode batting = player.path("stats").path("batting");
                if (batting.isObject() && batting.size() > 0) {
                    snapshot.getBatterStats().add(toBatterRecord(batting, gameId, playerId));
                }
                JsonNode pitching = player.path("stats").path("pitching");
                if (pitching.isObject() && pitching.size() > 0) {
                    snapshot.getPitcherStats().add(toPitcherRecord(pitching, gameId, playerId));
                }
            }
        }
    }

    private BatterRecord toBatterRecord(JsonNode batting, Long gameId, Long playerId) {
        BatterRecord r = new BatterRecord();
        r.setGameId(gameId);
        r.setPlayerId(playerId);
        r.setAtBats(batting.path("atBats").asInt(0));
        r.setRuns(batting.path("runs").asInt(0));
        r.setHits(batting.path("hits").asInt(0));
        r.setDoubles(batting.path("doubles").asInt(0));
        r.setTriples(batting.path("triples").asInt(0));
        r.setHomeRuns(batting.path("homeRuns").asInt(0));
        r.setRbi(batting.path("rbi").asInt(0));
        r.setWalks(batting.path("baseOnBalls").asInt(0));
        r.setHitByPitch(batting.path("hitByPitch").asInt(0));
        r.setStrikeouts(batting.path("strikeOuts").asInt(0));
        r.setStolenBases(batting.path("stolenBases").asInt(0));
        r.setCaughtStealing(batting.path("caughtStealing").asInt(0));
        r.setTotalBases(batting.path("totalBases").asInt(0));
        r.setSacFlies(batting.path("sacFlies").asInt(0));
        return r;
    }

    private PitcherRecord toPitcherRecord(JsonNode pitching, Long gameId, Long playerId) {
        PitcherRecord r = new PitcherRecord();
        r.setGameId(gameId);
        r.setPlayerId(playerId);
        r.setInningsPitched(parseInnings(pitching.path("inningsPitched").asText("0")));
        r.setHitsAllowed(pitching.path("hits").asInt(0));
        r.setRunsAllowed(pitching.path("runs").asInt(0));
        r.setEarnedRuns(pitching.path("earnedRuns").asInt(0));
        r.setHomeRunsAllowed(pitching.path("homeRuns").asInt(0));
        r.setWalksAllowed(pitching.path("baseOnBalls").asInt(0));
        r.setStrikeouts(pitching.path("strikeOuts").asInt(0));
        return r;
    }

    // L'API renvoie "6.2" (texte) ; valeur illisible -> 0.0
    static double parseInnings(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.warn("Manches lancées illisibles '{}', comptées 0.0", raw);
            return 0.0;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
