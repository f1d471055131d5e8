package com.tony.baseballStats.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ligne de box score d'un frappeur. Les compteurs absents valent 0.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatterRecord {
    @JsonProperty("game_id") private Long gameId;
    @JsonProperty("player_id") private Long playerId;
    @JsonProperty("at_bats") private int atBats;
    @JsonProperty("runs") private int runs;
    @JsonProperty("hits") private int hits;
    @JsonProperty("doubles") private int doubles;
    @JsonProperty("triples") private int triples;
    @JsonProperty("home_runs") private int homeRuns;
    @JsonProperty("rbi") private int rbi;
    @JsonProperty("walks") private int walks;
    @JsonProperty("hit_by_pitch") private int hitByPitch;
    @JsonProperty("strikeouts") private int strikeouts;
    @JsonProperty("stolen_bases") private int stolenBases;
    @JsonProperty("caught_stealing") private int caughtStealing;
    @JsonProperty("total_bases") private int totalBases;
    @JsonProperty("sac_flies") private int sacFlies;
}
