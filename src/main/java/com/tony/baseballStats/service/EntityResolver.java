package com.tony.baseballStats.service;

import com.tony.baseballStats.exception.IntegrityException;
import com.tony.baseballStats.model.Game;
import com.tony.baseballStats.model.Player;
import com.tony.baseballStats.model.Team;
import com.tony.baseballStats.repository.GameRepository;
import com.tony.baseballStats.repository.PlayerRepository;
import com.tony.baseballStats.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Insert-si-absent puis lookup, par id API.
 * La contrainte UNIQUE sur l'id API garantit qu'une entité n'est jamais créée deux fois.
 * Les lignes existantes ne sont jamais modifiées.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityResolver {

    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final GameRepository gameRepository;

    @Transactional
    public Long resolveTeam(Long apiTeamId, String name, String venue, String city) {
        if (teamRepository.findByApiTeamId(apiTeamId).isEmpty()) {
            teamRepository.saveAndFlush(new Team(apiTeamId, name, venue, city));
            log.debug("Nouvelle équipe {} ({})", name, apiTeamId);
        }
        return teamRepository.findByApiTeamId(apiTeamId)
                .map(Team::getId)
                .orElseThrow(() -> new IntegrityException("teams", apiTeamId));
    }

    @Transactional
    public Long resolvePlayer(Long apiPlayerId, String name, Long teamId, String position) {
        var existing = playerRepository.findByApiPlayerId(apiPlayerId);
        if (existing.isEmpty()) {
            Team team = teamId == null ? null : teamRepository.getReferenceById(teamId);
            playerRepository.saveAndFlush(new Player(apiPlayerId, name, team, position));
        } else {
            // Rattachement figé au premier roster : un transfert n'est pas répercuté
            Team current = existing.get().getTeam();
            Long currentTeamId = current == null ? null : current.getId();
            if (!Objects.equals(currentTeamId, teamId)) {
                log.debug("Joueur {} vu avec l'équipe {} mais rattaché à {} (conservé)", apiPlayerId, teamId, currentTeamId);
            }
        }
        return playerRepository.findByApiPlayerId(apiPlayerId)
                .map(Player::getId)
                .orElseThrow(() -> new IntegrityException("players", apiPlayerId));
    }

    @Transactional
    public Long resolveGame(Long apiGameId, OffsetDateTime gameDate, String venue,
                            Long homeTeamId, Long awayTeamId, Integer homeScore, Integer awayScore) {
        if (gameRepository.findByApiGameId(apiGameId).isEmpty()) {
            Game game = new Game();
            game.setApiGameId(apiGameId);
            game.setGameDate(gameDate);
            game.setVenue(venue);
            game.setHomeTeam(teamRepository.getReferenceById(homeTeamId));
            game.setAwayTeam(teamRepository.getReferenceById(awayTeamId));
            game.setHomeTeamScore(homeScore);
            game.setAwayTeamScore(awayScore);
            gameRepository.saveAndFlush(game);
        }
        return gameRepository.findByApiGameId(apiGameId)
                .map(Game::getId)
                .orElseThrow(() -> new IntegrityException("games", apiGameId));
    }
}
