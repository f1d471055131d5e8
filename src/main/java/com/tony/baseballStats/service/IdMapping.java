package com.tony.baseballStats.service;

import com.tony.baseballStats.exception.ReferenceMissingException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Correspondance id API -> id interne, propre à une unité d'import.
 * Jetée après le traitement du snapshot.
 */
public class IdMapping {

    private final Map<Long, Long> teamsByApiId = new HashMap<>();
    private final Map<String, Long> teamsByName = new HashMap<>();
    private final Map<Long, Long> playersByApiId = new HashMap<>();
    private final Map<Long, Long> gamesByApiId = new HashMap<>();

    public void registerTeam(Long apiTeamId, String name, Long teamId) {
        teamsByApiId.put(apiTeamId, teamId);
        if (name != null) teamsByName.put(name, teamId);
    }

    public void registerPlayer(Long apiPlayerId, Long playerId) {
        playersByApiId.put(apiPlayerId, playerId);
    }

    public void registerGame(Long apiGameId, Long gameId) {
        gamesByApiId.put(apiGameId, gameId);
    }

    /**
     * Les rosters sont indexés soit par id API (numérique), soit par nom d'équipe.
     */
    public Optional<Long> teamForRosterKey(String key) {
        if (key != null && !key.isEmpty() && key.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.ofNullable(teamsByApiId.get(Long.parseLong(key)));
            } catch (NumberFormatException e) {
                // Hors de la plage des long : aucun id API ne peut correspondre
                return Optional.empty();
            }
        }
        return Optional.ofNullable(teamsByName.get(key));
    }

    public Long requireTeam(Long apiTeamId) {
        Long teamId = apiTeamId == null ? null : teamsByApiId.get(apiTeamId);
        if (teamId == null) throw new ReferenceMissingException("Équipe", apiTeamId);
        return teamId;
    }

    public Optional<Long> player(Long apiPlayerId) {
        return Optional.ofNullable(apiPlayerId == null ? null : playersByApiId.get(apiPlayerId));
    }

    public Optional<Long> game(Long apiGameId) {
        return Optional.ofNullable(apiGameId == null ? null : gamesByApiId.get(apiGameId));
    }

    public int teamCount() { return teamsByApiId.size(); }
    public int playerCount() { return playersByApiId.size(); }
    public int gameCount() { return gamesByApiId.size(); }
}
