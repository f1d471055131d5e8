package com.tony.baseballStats.controller;

import com.tony.baseballStats.exception.SnapshotUnavailableException;
import com.tony.baseballStats.model.ProcessedRange;
import com.tony.baseballStats.service.BatchReport;
import com.tony.baseballStats.service.IngestionLedger;
import com.tony.baseballStats.service.IngestionOrchestrator;
import com.tony.baseballStats.service.SnapshotExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final IngestionOrchestrator orchestrator;
    private final SnapshotExtractionService extractionService;
    private final IngestionLedger ledger;

    // Lance un import de tous les snapshots en attente
    @PostMapping("/ingest")
    public ResponseEntity<BatchReport> runIngestion() {
        log.info("🚀 Import manuel demandé par l'admin");
        return ResponseEntity.ok(orchestrator.runBatch());
    }

    /**
     * Récupère une période depuis l'API MLB et dépose le snapshot dans le dossier d'entrée.
     * Exemple : POST /api/v1/admin/extract?from=2024-04-01&to=2024-04-07
     */
    @PostMapping("/extract")
    public ResponseEntity<?> extract(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (from.isAfter(to)) {
            return ResponseEntity.badRequest().body(Map.of("error", "from doit précéder to"));
        }
        try {
            Path file = extractionService.extract(from, to);
            return ResponseEntity.ok(Map.of("file", file.toString()));
        } catch (SnapshotUnavailableException e) {
            log.warn("Extraction {} → {} impossible : {}", from, to, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            log.error("❌ Écriture du snapshot impossible", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/ledger")
    public ResponseEntity<List<ProcessedRange>> getLedger() {
        return ResponseEntity.ok(ledger.history());
    }
}
