package com.tony.baseballStats.model;

/**
 * Ligne de stats d'un joueur sur un match, déjà rattachée aux identifiants internes.
 */
public interface StatLine {
    Long getGameId();

    Long getPlayerId();
}
