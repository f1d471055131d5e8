package com.tony.baseballStats.service;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Calcule AVG / OBP / SLG / OPS à partir des compteurs bruts d'un frappeur.
 * Fonction pure : pas d'accès base, pas d'état.
 */
@Service
public class StatisticDeriver {

    // 3 décimales, arrondi bancaire sur la valeur rationnelle exacte (0.0625 -> 0.062)
    static final int SCALE = 3;
    static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public record RateStats(double average, double onBasePercentage, double slugging, double onBasePlusSlugging) {}

    /**
     * @param atBats     AB
     * @param hits       H
     * @param walks      BB
     * @param hitByPitch HBP
     * @param sacFlies   SF
     * @param totalBases TB
     */
    public RateStats derive(int atBats, int hits, int walks, int hitByPitch, int sacFlies, int totalBases) {
        if (atBats < 0 || hits < 0 || walks < 0 || hitByPitch < 0 || sacFlies < 0 || totalBases < 0) {
            throw new IllegalArgumentException(String.format(
                    "Compteurs négatifs (AB=%d H=%d BB=%d HBP=%d SF=%d TB=%d)",
                    atBats, hits, walks, hitByPitch, sacFlies, totalBases));
        }

        BigDecimal avg = ratio(hits, atBats);
        BigDecimal obp = ratio((long) hits + walks + hitByPitch, (long) atBats + walks + hitByPitch + sacFlies);
        BigDecimal slg = ratio(totalBases, atBats);
        // Somme de deux valeurs à 3 décimales : déjà exacte à 3 décimales
        BigDecimal ops = obp.add(slg).setScale(SCALE, ROUNDING);

        return new RateStats(avg.doubleValue(), obp.doubleValue(), slg.doubleValue(), ops.doubleValue());
    }

    // Dénominateur nul -> 0.0 (un joueur sans présence au bâton a une moyenne définie, nulle)
    private BigDecimal ratio(long numerator, long denominator) {
        if (denominator == 0) return BigDecimal.ZERO.setScale(SCALE);
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), SCALE, ROUNDING);
    }
}
