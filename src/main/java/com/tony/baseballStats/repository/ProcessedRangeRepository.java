package com.tony.baseballStats.repository;

import com.tony.baseballStats.model.ProcessedRange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface ProcessedRangeRepository extends JpaRepository<ProcessedRange, Long> {
    boolean existsBySourceToken(String sourceToken);

    // Chevauchement : start_existant <= :end ET :start <= end_existant.
    // Les entrées sans dates ne matchent jamais (comparaison avec NULL).
    @Query("SELECT COUNT(r) FROM ProcessedRange r WHERE r.startDate <= :end AND r.endDate >= :start")
    long countOverlapping(@Param("start") LocalDate start, @Param("end") LocalDate end);

    List<ProcessedRange> findAllByOrderByStartDateAsc();
}
