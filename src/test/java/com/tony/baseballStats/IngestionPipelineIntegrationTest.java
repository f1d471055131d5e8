package com.tony.baseballStats;

import com.tony.baseballStats.config.IngestProperties;
import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.PitcherStatLine;
import com.tony.baseballStats.repository.BatterStatLineRepository;
import com.tony.baseballStats.repository.GameRepository;
import com.tony.baseballStats.repository.PitcherStatLineRepository;
import com.tony.baseballStats.repository.PlayerRepository;
import com.tony.baseballStats.repository.ProcessedRangeRepository;
import com.tony.baseballStats.repository.TeamRepository;
import com.tony.baseballStats.service.BatchReport;
import com.tony.baseballStats.service.IngestionOrchestrator;
import com.tony.baseballStats.service.UnitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Chaîne complète : dossier d'entrée -> base H2 -> registre -> archive.
 */
@SpringBootTest
class IngestionPipelineIntegrationTest {

    private static final String WEEK_ONE = "mlb_raw_2024-04-01_2024-04-07_20240408_120000.json";
    private static final String OVERLAPPING = "mlb_raw_2024-04-05_2024-04-10_20240411_120000.json";

    @Autowired private IngestionOrchestrator orchestrator;
    @Autowired private IngestProperties properties;
    @Autowired private TeamRepository teamRepository;
    @Autowired private PlayerRepository playerRepository;
    @Autowired private GameRepository gameRepository;
    @Autowired private BatterStatLineRepository batterRepository;
    @Autowired private PitcherStatLineRepository pitcherRepository;
    @Autowired private ProcessedRangeRepository rangeRepository;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        properties.setIntakeDir(tempDir.resolve("raw").toString());
        properties.setArchiveDir(tempDir.resolve("historical").toString());
        Files.createDirectories(properties.intakePath());

        batterRepository.deleteAllInBatch();
        pitcherRepository.deleteAllInBatch();
        gameRepository.deleteAllInBatch();
        playerRepository.deleteAllInBatch();
        teamRepository.deleteAllInBatch();
        rangeRepository.deleteAllInBatch();
    }

    private void drop(String fileName) throws IOException {
        try (InputStream in = new ClassPathResource("snapshots/e2e-unit.json").getInputStream()) {
            Files.copy(in, properties.intakePath().resolve(fileName));
        }
    }

    @Test
    @DisplayName("Un snapshot est chargé, enregistré au registre puis archivé")
    void shouldLoadRecordAndArchive() throws IOException {
        drop(WEEK_ONE);

        BatchReport report = orchestrator.runBatch();

        assertThat(report.committed()).isEqualTo(1);
        assertThat(teamRepository.count()).isEqualTo(2);
        assertThat(playerRepository.count()).isEqualTo(2);
        assertThat(gameRepository.count()).isEqualTo(1);
        assertThat(rangeRepository.existsBySourceToken(WEEK_ONE)).isTrue();
        assertThat(properties.intakePath().resolve(WEEK_ONE)).doesNotExist();
        assertThat(properties.archivePath().resolve(WEEK_ONE)).exists();

        assertThat(batterRepository.findAll()).singleElement().satisfies(line -> {
            assertThat(line.getHits()).isEqualTo(2);
            assertThat(line.getBattingAverage()).isEqualTo(0.5);
            assertThat(line.getOnBasePercentage()).isEqualTo(0.6);
            assertThat(line.getSluggingPercentage()).isEqualTo(0.75);
            assertThat(line.getOnBasePlusSlugging()).isEqualTo(1.35);
        });
        assertThat(pitcherRepository.findAll()).singleElement()
                .extracting(PitcherStatLine::getInningsPitched).isEqualTo(6.2);
    }

    @Test
    @DisplayName("Redéposer le même fichier n'ajoute aucune ligne")
    void sameFileTwiceShouldAddNothing() throws IOException {
        drop(WEEK_ONE);
        orchestrator.runBatch();

        drop(WEEK_ONE);
        BatchReport second = orchestrator.runBatch();

        assertThat(second.units()).singleElement()
                .satisfies(u -> assertThat(u.state()).isEqualTo(UnitState.SKIPPED));
        assertThat(batterRepository.count()).isEqualTo(1);
        assertThat(pitcherRepository.count()).isEqualTo(1);
        assertThat(rangeRepository.count()).isEqualTo(1);
        assertThat(properties.intakePath().resolve(WEEK_ONE)).doesNotExist();
    }

    @Test
    @DisplayName("Une période qui chevauche une période chargée est ignorée et reste en entrée")
    void overlappingSnapshotShouldBeSkipped() throws IOException {
        drop(WEEK_ONE);
        orchestrator.runBatch();

        drop(OVERLAPPING);
        BatchReport report = orchestrator.runBatch();

        assertThat(report.skipped()).isEqualTo(1);
        assertThat(batterRepository.count()).isEqualTo(1);
        assertThat(rangeRepository.count()).isEqualTo(1);
        assertThat(properties.intakePath().resolve(OVERLAPPING)).exists();
    }

    @Test
    @DisplayName("Un fichier JSON corrompu échoue seul, le lot continue")
    void corruptFileShouldFailAlone() throws IOException {
        Files.writeString(properties.intakePath().resolve("mlb_raw_2024-03-01_2024-03-07_20240308_120000.json"), "{ pas du json");
        drop(WEEK_ONE);

        BatchReport report = orchestrator.runBatch();

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.committed()).isEqualTo(1);
        assertThat(rangeRepository.count()).isEqualTo(1);
        assertThat(batterRepository.findAll()).extracting(BatterStatLine::getAtBats).containsExactly(4);
    }
}
