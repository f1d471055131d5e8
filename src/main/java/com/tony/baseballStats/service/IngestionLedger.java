package com.tony.baseballStats.service;

import com.tony.baseballStats.model.DateRange;
import com.tony.baseballStats.model.ProcessedRange;
import com.tony.baseballStats.repository.ProcessedRangeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Registre des périodes déjà chargées.
 * Un snapshot dont la période chevauche, même d'un jour, une période enregistrée est rejeté en entier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionLedger {

    private final ProcessedRangeRepository repository;

    @Transactional(readOnly = true)
    public boolean overlaps(DateRange range) {
        return repository.countOverlapping(range.start(), range.end()) > 0;
    }

    @Transactional(readOnly = true)
    public boolean isRecorded(String sourceToken) {
        return repository.existsBySourceToken(sourceToken);
    }

    /**
     * Marqueur de commit : à n'appeler qu'une fois le chargement complètement réussi.
     *
     * @param range null si le nom du fichier ne porte pas de période exploitable
     */
    @Transactional
    public ProcessedRange record(String sourceToken, DateRange range) {
        ProcessedRange entry = new ProcessedRange(sourceToken,
                range == null ? null : range.start(),
                range == null ? null : range.end(),
                OffsetDateTime.now());
        ProcessedRange saved = repository.save(entry);
        log.info("📒 {} enregistré au registre ({}).", sourceToken, range == null ? "sans période" : range);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ProcessedRange> history() {
        return repository.findAllByOrderByStartDateAsc();
    }
}
