package com.tony.baseballStats.service;

import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.PitcherStatLine;

import java.util.List;

/**
 * Lignes prêtes à charger + compteurs des lignes écartées.
 */
public record StatLineBatch(List<BatterStatLine> batters, List<PitcherStatLine> pitchers,
                            int unresolved, int invalid) {
}
