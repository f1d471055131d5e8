package com.tony.baseballStats.service;

/**
 * Résultat de la résolution des données de référence d'une unité.
 */
public record ReferenceResolution(IdMapping mapping, int skippedGames, int skippedPlayers) {
}
