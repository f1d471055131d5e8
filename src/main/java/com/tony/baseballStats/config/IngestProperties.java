package com.tony.baseballStats.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "ingest")
@Validated
@Data
public class IngestProperties {
    // --- Répertoires ---
    @NotBlank
    private String intakeDir = "raw";        // Snapshots en attente
    @NotBlank
    private String archiveDir = "historical"; // Snapshots déjà chargés

    // Nom attendu : <prefix>_<YYYY-MM-DD>_<YYYY-MM-DD>_<suffixe>.json
    @NotBlank
    private String tokenPrefix = "mlb_raw";

    private Schedule schedule = new Schedule();

    public Path intakePath() {
        return Path.of(intakeDir);
    }

    public Path archivePath() {
        return Path.of(archiveDir);
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 10 * * *";
    }
}
