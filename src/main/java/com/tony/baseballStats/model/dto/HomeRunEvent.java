package com.tony.baseballStats.model.dto;

import java.time.OffsetDateTime;

// Projection JPQL : un joueur ayant frappé au moins un home run sur un match
public record HomeRunEvent(Long playerId, String playerName, OffsetDateTime gameDate) {
}
