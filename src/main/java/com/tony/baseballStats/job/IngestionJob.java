package com.tony.baseballStats.job;

import com.tony.baseballStats.service.BatchReport;
import com.tony.baseballStats.service.IngestionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "ingest.schedule", name = "enabled", havingValue = "true")
public class IngestionJob {

    private final IngestionOrchestrator orchestrator;

    /**
     * Import périodique des snapshots déposés dans le dossier d'entrée.
     * Fréquence : ingest.schedule.cron (par défaut tous les jours à 10:00).
     */
    @Scheduled(cron = "${ingest.schedule.cron}")
    public void importPendingSnapshots() {
        log.info("⏰ [CRON] Démarrage automatique : import des snapshots en attente...");
        try {
            BatchReport report = orchestrator.runBatch();
            log.info("✅ [CRON] {}", report.summary());
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de l'import", e);
        }
    }
}
