package com.tony.baseballStats.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

@Component
@RequiredArgsConstructor
@Slf4j
public class DirectoryInitializer implements CommandLineRunner {
    private final IngestProperties properties;

    @Override
    public void run(String... args) throws Exception {
        // Le pipeline suppose que les deux dossiers existent
        for (Path dir : new Path[]{properties.intakePath(), properties.archivePath()}) {
            if (Files.notExists(dir)) {
                Files.createDirectories(dir);
                log.info("📁 Dossier créé : {}", dir.toAbsolutePath());
            }
        }
    }
}
