package com.tony.baseballStats.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PitcherRecord {
    @JsonProperty("game_id") private Long gameId;
    @JsonProperty("player_id") private Long playerId;
    @JsonProperty("innings_pitched") private double inningsPitched;
    @JsonProperty("hits_allowed") private int hitsAllowed;
    @JsonProperty("runs_allowed") private int runsAllowed;
    @JsonProperty("earned_runs") private int earnedRuns;
    @JsonProperty("home_runs_allowed") private int homeRunsAllowed;
    @JsonProperty("walks_allowed") private int walksAllowed;
    @JsonProperty("strikeouts") private int strikeouts;
}
