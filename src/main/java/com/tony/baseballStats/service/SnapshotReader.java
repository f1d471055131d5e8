package com.tony.baseballStats.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.baseballStats.model.dto.Snapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotReader {

    private final ObjectMapper objectMapper;

    public Snapshot read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Snapshot snapshot = objectMapper.readValue(reader, Snapshot.class);
            log.info("📄 {} lu : {} équipes, {} rosters, {} matchs, {} frappeurs, {} lanceurs",
                    file.getFileName(), snapshot.getTeams().size(), snapshot.getRosters().size(),
                    snapshot.getGames().size(), snapshot.getBatterStats().size(), snapshot.getPitcherStats().size());
            return snapshot;
        }
    }
}
