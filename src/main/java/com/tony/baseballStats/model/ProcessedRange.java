package com.tony.baseballStats.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Entrée du registre : un snapshot chargé jusqu'au bout.
 * Les dates sont nulles quand le nom de fichier ne suivait pas la convention.
 */
@Entity
@Table(name = "processed_ranges")
@Getter @Setter @NoArgsConstructor
public class ProcessedRange {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String sourceToken;

    private LocalDate startDate;
    private LocalDate endDate;

    @Column(nullable = false)
    private OffsetDateTime processedAt;

    public ProcessedRange(String sourceToken, LocalDate startDate, LocalDate endDate, OffsetDateTime processedAt) {
        this.sourceToken = sourceToken;
        this.startDate = startDate;
        this.endDate = endDate;
        this.processedAt = processedAt;
    }
}
