package com.tony.baseballStats.model.dto;

// Clé métier d'une ligne de stats : un joueur sur un match
public record StatLineKey(Long gameId, Long playerId) {
}
