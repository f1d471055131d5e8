package com.tony.baseballStats.service;

import com.tony.baseballStats.config.IngestProperties;
import com.tony.baseballStats.model.DateRange;
import com.tony.baseballStats.model.SourceToken;
import com.tony.baseballStats.model.dto.Snapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Traite les snapshots du dossier d'entrée, un par un, dans l'ordre des noms.
 * L'échec d'une unité n'arrête jamais le lot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionOrchestrator {

    private final IngestProperties properties;
    private final IngestionLedger ledger;
    private final SnapshotReader snapshotReader;
    private final ReferenceDataService referenceDataService;
    private final StatLineAssembler statLineAssembler;
    private final StatLineLoader statLineLoader;

    public synchronized BatchReport runBatch() {
        List<Path> pending = discover();
        log.info("🚀 Import : {} snapshot(s) en attente dans {}", pending.size(), properties.intakePath());

        List<UnitOutcome> outcomes = new ArrayList<>();
        for (Path file : pending) {
            outcomes.add(processUnit(file));
        }

        BatchReport report = new BatchReport(outcomes);
        log.info("✅ Import terminé : {}", report.summary());
        outcomes.stream()
                .filter(u -> u.state() == UnitState.FAILED)
                .forEach(u -> log.warn("   ❌ {} : {}", u.sourceToken(), u.detail()));
        return report;
    }

    List<Path> discover() {
        Path intake = properties.intakePath();
        if (Files.notExists(intake)) return List.of();
        try (Stream<Path> files = Files.list(intake)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Impossible de lister {}", intake, e);
            return List.of();
        }
    }

    UnitOutcome processUnit(Path file) {
        String fileName = file.getFileName().toString();
        UnitState state = UnitState.DISCOVERED;
        try {
            // Registre d'abord : un fichier déjà chargé mais pas archivé (crash pendant le move)
            if (ledger.isRecorded(fileName)) {
                log.info("⏭️ {} déjà au registre, archivage seulement.", fileName);
                return UnitOutcome.skipped(fileName, "déjà enregistré", archive(file));
            }

            SourceToken token = SourceToken.parse(fileName, properties.getTokenPrefix());
            if (token.hasRange()) {
                if (ledger.overlaps(token.range())) {
                    log.info("⏭️ Période {} déjà couverte, {} ignoré.", token.range(), fileName);
                    return UnitOutcome.skipped(fileName, "chevauche une période déjà chargée", false);
                }
            } else {
                log.warn("⚠️ {} ne suit pas le format {}_<début>_<fin>_<suffixe>.json : pas de contrôle de chevauchement.",
                        fileName, properties.getTokenPrefix());
            }
            state = transition(fileName, state, UnitState.RANGE_CHECKED);

            state = transition(fileName, state, UnitState.LOADING);
            LoadCounts counts = load(file, token.range());
            ledger.record(fileName, token.range());
            state = transition(fileName, state, UnitState.COMMITTED);

            return UnitOutcome.committed(fileName, counts.batters(), counts.pitchers(), archive(file));
        } catch (IOException | RuntimeException e) {
            // Le fichier reste dans le dossier d'entrée pour un prochain essai
            log.error("Échec de {} (état {}) : {}", fileName, state, e.getMessage(), e);
            return UnitOutcome.failed(fileName, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private LoadCounts load(Path file, DateRange range) throws IOException {
        Snapshot snapshot = snapshotReader.read(file);
        ReferenceResolution resolution = referenceDataService.resolve(snapshot);
        StatLineBatch batch = statLineAssembler.assemble(snapshot, resolution.mapping());

        int batters = statLineLoader.loadBatterLines(batch.batters());
        int pitchers = statLineLoader.loadPitcherLines(batch.pitchers());
        log.info("📥 {} ({}) : {} frappeurs, {} lanceurs | ignorés : {} matchs, {} joueurs, {} lignes non résolues, {} lignes invalides",
                file.getFileName(), range == null ? "sans période" : range, batters, pitchers,
                resolution.skippedGames(), resolution.skippedPlayers(), batch.unresolved(), batch.invalid());
        return new LoadCounts(batters, pitchers);
    }

    private boolean archive(Path file) {
        Path target = properties.archivePath().resolve(file.getFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("📦 Archivé : {}", target);
            return true;
        } catch (IOException e) {
            // Le registre est déjà écrit : le prochain passage refera seulement le déplacement
            log.error("Archivage impossible pour {}", file, e);
            return false;
        }
    }

    private record LoadCounts(int batters, int pitchers) {}

    private UnitState transition(String fileName, UnitState from, UnitState to) {
        log.debug("{} : {} -> {}", fileName, from, to);
        return to;
    }
}
