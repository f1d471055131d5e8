package com.tony.baseballStats.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GameRecord {
    @JsonProperty("game_id") private Long gameId;
    @JsonProperty("game_date") private String gameDate; // ISO-8601, ex : 2024-04-01T17:05:00Z
    @JsonProperty("location") private String location;
    @JsonProperty("home_team_id") private Long homeTeamId;
    @JsonProperty("away_team_id") private Long awayTeamId;
    @JsonProperty("home_team_score") private Integer homeTeamScore;
    @JsonProperty("away_team_score") private Integer awayTeamScore;
}
