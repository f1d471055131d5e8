package com.tony.baseballStats.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.tony.baseballStats.config.MlbApiProperties;
import com.tony.baseballStats.exception.SnapshotUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Client minimal de statsapi.mlb.com. Sans état : chaque appel est une requête GET.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MlbStatsClient {

    private final MlbApiProperties properties;
    private final RestTemplate restTemplate = new RestTemplate();

    /**
     * Équipes actives de la saison. Sans elles, pas de snapshot possible.
     */
    public JsonNode fetchTeams() {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl()).path("/teams")
                .queryParam("activeStatus", "Y")
                .queryParam("sportId", properties.getSportId())
                .queryParam("season", properties.getSeason())
                .build().toUri();
        JsonNode teams = getRequired(uri, "équipes").path("teams");
        log.info("{} équipes récupérées depuis l'API.", teams.size());
        return teams;
    }

    /**
     * Roster d'une équipe ; un échec donne un roster vide (non bloquant).
     */
    public JsonNode fetchRoster(long teamId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl()).path("/teams/{teamId}/roster")
                .queryParam("season", properties.getSeason())
                .queryParam("rosterType", properties.getRosterType())
                .buildAndExpand(teamId).toUri();
        return getOptional(uri).map(body -> body.path("roster")).orElseGet(() -> {
            log.warn("Roster indisponible pour l'équipe {}", teamId);
            return MissingNode.getInstance();
        });
    }

    public JsonNode fetchSchedule(LocalDate start, LocalDate end) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl()).path("/schedule")
                .queryParam("sportId", properties.getSportId())
                .queryParam("season", properties.getSeason())
                .queryParam("startDate", start)
                .queryParam("endDate", end)
                .build().toUri();
        return getRequired(uri, "calendrier");
    }

    public Optional<JsonNode> fetchBoxscore(long gamePk) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl()).path("/game/{gamePk}/boxscore")
                .buildAndExpand(gamePk).toUri();
        Optional<JsonNode> boxscore = getOptional(uri);
        if (boxscore.isEmpty()) log.warn("Box score indisponible pour le match {}", gamePk);
        return boxscore;
    }

    private JsonNode getRequired(URI uri, String what) {
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            if (body == null) throw new SnapshotUnavailableException("Réponse vide pour " + what + " (" + uri + ")", null);
            return body;
        } catch (RestClientException e) {
            throw new SnapshotUnavailableException("Impossible de récupérer " + what + " (" + uri + ")", e);
        }
    }

    private Optional<JsonNode> getOptional(URI uri) {
        try {
            return Optional.ofNullable(restTemplate.getForObject(uri, JsonNode.class));
        } catch (RestClientException e) {
            log.debug("GET {} en échec : {}", uri, e.getMessage());
            return Optional.empty();
        }
    }
}
