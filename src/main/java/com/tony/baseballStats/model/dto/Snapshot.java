package com.tony.baseballStats.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document JSON d'un snapshot (une unité d'import).
 * Les clés inconnues (ex : "schedule" brut) sont ignorées.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Snapshot {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<TeamRecord> teams = new ArrayList<>();

    // Clé = id API de l'équipe ou son nom
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, List<RosterEntry>> rosters = new LinkedHashMap<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<GameRecord> games = new ArrayList<>();

    @JsonProperty("batter_stats")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<BatterRecord> batterStats = new ArrayList<>();

    @JsonProperty("pitcher_stats")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<PitcherRecord> pitcherStats = new ArrayList<>();
}
