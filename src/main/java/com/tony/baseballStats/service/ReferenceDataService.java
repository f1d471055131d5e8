package com.tony.baseballStats.service;

import com.tony.baseballStats.exception.ReferenceMissingException;
import com.tony.baseballStats.model.dto.GameRecord;
import com.tony.baseballStats.model.dto.RosterEntry;
import com.tony.baseballStats.model.dto.Snapshot;
import com.tony.baseballStats.model.dto.TeamRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataService {

    private final EntityResolver entityResolver;

    /**
     * Équipes, rosters puis matchs, dans UNE transaction : soit tout est durable,
     * soit rien (pas de match qui pointe vers une équipe annulée).
     */
    @Transactional
    public ReferenceResolution resolve(Snapshot snapshot) {
        IdMapping mapping = new IdMapping();

        // 1. Équipes
        for (TeamRecord team : snapshot.getTeams()) {
            if (team.getId() == null) {
                log.warn("Équipe sans id ignorée : {}", team.getName());
                continue;
            }
            Long teamId = entityResolver.resolveTeam(team.getId(), team.getName(), team.venueName(), team.getLocationName());
            mapping.registerTeam(team.getId(), team.getName(), teamId);
        }

        // 2. Rosters -> joueurs
        int skippedPlayers = 0;
        for (Map.Entry<String, List<RosterEntry>> roster : snapshot.getRosters().entrySet()) {
            Optional<Long> teamId = mapping.teamForRosterKey(roster.getKey());
            if (teamId.isEmpty()) {
                log.warn("Roster '{}' : équipe absente du mapping, ignoré.", roster.getKey());
                skippedPlayers += roster.getValue() == null ? 0 : roster.getValue().size();
                continue;
            }
            if (roster.getValue() == null) continue;
            for (RosterEntry entry : roster.getValue()) {
                if (entry.getPerson() == null || entry.getPerson().getId() == null) {
                    skippedPlayers++;
                    continue;
                }
                Long playerId = entityResolver.resolvePlayer(entry.getPerson().getId(),
                        entry.getPerson().getFullName(), teamId.get(), entry.positionCode());
                mapping.registerPlayer(entry.getPerson().getId(), playerId);
            }
        }

        // 3. Matchs (les deux équipes doivent être résolues)
        int skippedGames = 0;
        for (GameRecord game : snapshot.getGames()) {
            if (game.getGameId() == null) {
                skippedGames++;
                continue;
            }
            Long homeId;
            Long awayId;
            try {
                homeId = mapping.requireTeam(game.getHomeTeamId());
                awayId = mapping.requireTeam(game.getAwayTeamId());
            } catch (ReferenceMissingException e) {
                log.warn("Match {} ignoré : {}", game.getGameId(), e.getMessage());
                skippedGames++;
                continue;
            }
            Long gameId = entityResolver.resolveGame(game.getGameId(), parseGameDate(game), game.getLocation(),
                    homeId, awayId, game.getHomeTeamScore(), game.getAwayTeamScore());
            mapping.registerGame(game.getGameId(), gameId);
        }

        log.info("🔗 Référentiel résolu : {} équipes, {} joueurs, {} matchs ({} matchs ignorés)",
                mapping.teamCount(), mapping.playerCount(), mapping.gameCount(), skippedGames);
        return new ReferenceResolution(mapping, skippedGames, skippedPlayers);
    }

    // Accepte 2024-04-01T17:05:00Z, 2024-04-01T17:05:00 (lu en UTC) ou 2024-04-01
    static OffsetDateTime parseGameDate(GameRecord game) {
        String raw = game.getGameDate();
        if (raw == null || raw.isBlank()) return null;
        try {
            if (raw.length() == 10) {
                return LocalDate.parse(raw).atStartOfDay().atOffset(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime odt ? odt : ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Match {} : date illisible '{}', enregistrée vide.", game.getGameId(), raw);
            return null;
        }
    }
}
