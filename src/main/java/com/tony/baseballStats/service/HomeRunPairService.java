package com.tony.baseballStats.service;

import com.opencsv.CSVWriter;
import com.tony.baseballStats.model.dto.HomeRunEvent;
import com.tony.baseballStats.model.dto.HomeRunPair;
import com.tony.baseballStats.repository.BatterStatLineRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Paires de joueurs ayant tous deux frappé un home run le même jour.
 * Lecture seule.
 */
@Service
@RequiredArgsConstructor
public class HomeRunPairService {

    private final BatterStatLineRepository batterRepository;

    @Transactional(readOnly = true)
    public List<HomeRunPair> topPairs(int limit, String excludedPlayer) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limite invalide : " + limit);
        }
        Map<Long, String> names = new HashMap<>();
        // jour -> joueurs (triés par id interne, comme p1.id < p2.id)
        Map<LocalDate, TreeSet<Long>> playersByDay = new TreeMap<>();

        for (HomeRunEvent event : batterRepository.findHomeRunEvents()) {
            if (event.gameDate() == null) continue;
            if (excludedPlayer != null && excludedPlayer.equals(event.playerName())) continue;
            names.put(event.playerId(), event.playerName());
            playersByDay.computeIfAbsent(event.gameDate().toLocalDate(), d -> new TreeSet<>()).add(event.playerId());
        }

        Map<List<Long>, Long> frequencies = new HashMap<>();
        for (TreeSet<Long> players : playersByDay.values()) {
            List<Long> ids = List.copyOf(players);
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    frequencies.merge(List.of(ids.get(i), ids.get(j)), 1L, Long::sum);
                }
            }
        }

        return frequencies.entrySet().stream()
                .map(e -> new HomeRunPair(names.get(e.getKey().get(0)), names.get(e.getKey().get(1)), e.getValue()))
                .sorted(Comparator.comparingLong(HomeRunPair::frequency).reversed()
                        .thenComparing(HomeRunPair::player1)
                        .thenComparing(HomeRunPair::player2))
                .limit(limit)
                .toList();
    }

    public void writeCsv(List<HomeRunPair> pairs, Writer out) throws IOException {
        try (CSVWriter csv = new CSVWriter(out)) {
            csv.writeNext(new String[]{"player1", "player2", "frequency"});
            for (HomeRunPair pair : pairs) {
                csv.writeNext(new String[]{pair.player1(), pair.player2(), String.valueOf(pair.frequency())});
            }
        }
    }
}
