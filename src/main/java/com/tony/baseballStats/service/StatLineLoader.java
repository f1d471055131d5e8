package com.tony.baseballStats.service;

import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.PitcherStatLine;
import com.tony.baseballStats.model.StatKind;
import com.tony.baseballStats.model.StatLine;
import com.tony.baseballStats.model.dto.StatLineKey;
import com.tony.baseballStats.repository.BatterStatLineRepository;
import com.tony.baseballStats.repository.PitcherStatLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Insertion en masse des lignes de stats : une transaction par type, tout ou rien,
 * INSERT regroupés en batch JDBC (hibernate.jdbc.batch_size).
 * Un couple (match, joueur) déjà présent en base ou en double dans le lot est sauté,
 * ce qui rend un rejeu après crash sans effet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatLineLoader {

    private final BatterStatLineRepository batterRepository;
    private final PitcherStatLineRepository pitcherRepository;

    @Transactional
    public int loadBatterLines(List<BatterStatLine> rows) {
        return persist(StatKind.BATTER, rows, batterRepository, batterRepository::findKeysByGameIdIn);
    }

    @Transactional
    public int loadPitcherLines(List<PitcherStatLine> rows) {
        return persist(StatKind.PITCHER, rows, pitcherRepository, pitcherRepository::findKeysByGameIdIn);
    }

    private <T extends StatLine> int persist(StatKind kind, List<T> rows, JpaRepository<T, Long> repository,
                                             Function<Collection<Long>, List<StatLineKey>> storedKeys) {
        if (rows.isEmpty()) return 0;

        Set<Long> gameIds = rows.stream().map(StatLine::getGameId).collect(Collectors.toSet());
        // Déjà en base ou déjà vus dans ce lot
        Set<StatLineKey> seen = new HashSet<>(storedKeys.apply(gameIds));
        List<T> fresh = new ArrayList<>();
        for (T row : rows) {
            if (seen.add(new StatLineKey(row.getGameId(), row.getPlayerId()))) {
                fresh.add(row);
            }
        }

        repository.saveAll(fresh);
        repository.flush();

        int skipped = rows.size() - fresh.size();
        if (skipped > 0) {
            log.warn("{} : {} lignes déjà présentes (match, joueur), non réinsérées.", kind.table(), skipped);
        }
        log.info("💾 {} lignes insérées dans {}.", fresh.size(), kind.table());
        return fresh.size();
    }
}
