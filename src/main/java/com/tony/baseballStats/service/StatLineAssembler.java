package com.tony.baseballStats.service;

import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.PitcherStatLine;
import com.tony.baseballStats.model.dto.BatterRecord;
import com.tony.baseballStats.model.dto.PitcherRecord;
import com.tony.baseballStats.model.dto.Snapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transforme les lignes brutes du snapshot en entités rattachées aux ids internes.
 * Les lignes dont le match ou le joueur n'a pas été résolu sont écartées ici,
 * le loader ne revérifie pas les clés étrangères.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatLineAssembler {

    private final StatisticDeriver statisticDeriver;

    public StatLineBatch assemble(Snapshot snapshot, IdMapping mapping) {
        int unresolved = 0;
        int invalid = 0;

        List<BatterStatLine> batters = new ArrayList<>();
        for (BatterRecord raw : snapshot.getBatterStats()) {
            Optional<Long> gameId = mapping.game(raw.getGameId());
            Optional<Long> playerId = mapping.player(raw.getPlayerId());
            if (gameId.isEmpty() || playerId.isEmpty()) {
                unresolved++;
                continue;
            }
            try {
                batters.add(toBatterLine(raw, gameId.get(), playerId.get()));
            } catch (IllegalArgumentException e) {
                invalid++;
                log.warn("Ligne frappeur ignorée (match {}, joueur {}) : {}", raw.getGameId(), raw.getPlayerId(), e.getMessage());
            }
        }

        List<PitcherStatLine> pitchers = new ArrayList<>();
        for (PitcherRecord raw : snapshot.getPitcherStats()) {
            Optional<Long> gameId = mapping.game(raw.getGameId());
            Optional<Long> playerId = mapping.player(raw.getPlayerId());
            if (gameId.isEmpty() || playerId.isEmpty()) {
                unresolved++;
                continue;
            }
            pitchers.add(toPitcherLine(raw, gameId.get(), playerId.get()));
        }

        if (unresolved > 0) {
            log.info("{} lignes de stats sans match/joueur résolu, écartées.", unresolved);
        }
        return new StatLineBatch(batters, pitchers, unresolved, invalid);
    }

    private BatterStatLine toBatterLine(BatterRecord raw, Long gameId, Long playerId) {
        StatisticDeriver.RateStats rates = statisticDeriver.derive(raw.getAtBats(), raw.getHits(), raw.getWalks(),
                raw.getHitByPitch(), raw.getSacFlies(), raw.getTotalBases());

        BatterStatLine line = new BatterStatLine(gameId, playerId);
        line.setAtBats(raw.getAtBats());
        line.setRuns(raw.getRuns());
        line.setHits(raw.getHits());
        line.setDoubles(raw.getDoubles());
        line.setTriples(raw.getTriples());
        line.setHomeRuns(raw.getHomeRuns());
        line.setRbi(raw.getRbi());
        line.setWalks(raw.getWalks());
        line.setHitByPitch(raw.getHitByPitch());
        line.setStrikeouts(raw.getStrikeouts());
        line.setStolenBases(raw.getStolenBases());
        line.setCaughtStealing(raw.getCaughtStealing());

        line.setBattingAverage(rates.average());
        line.setOnBasePercentage(rates.onBasePercentage());
        line.setSluggingPercentage(rates.slugging());
        line.setOnBasePlusSlugging(rates.onBasePlusSlugging());
        return line;
    }

    private PitcherStatLine toPitcherLine(PitcherRecord raw, Long gameId, Long playerId) {
        PitcherStatLine line = new PitcherStatLine(gameId, playerId);
        line.setInningsPitched(raw.getInningsPitched());
        line.setHitsAllowed(raw.getHitsAllowed());
        line.setRunsAllowed(raw.getRunsAllowed());
        line.setEarnedRuns(raw.getEarnedRuns());
        line.setHomeRunsAllowed(raw.getHomeRunsAllowed());
        line.setWalksAllowed(raw.getWalksAllowed());
        line.setStrikeouts(raw.getStrikeouts());
        return line;
    }
}
