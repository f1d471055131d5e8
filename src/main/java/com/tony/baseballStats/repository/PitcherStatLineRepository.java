package com.tony.baseballStats.repository;

import com.tony.baseballStats.model.PitcherStatLine;
import com.tony.baseballStats.model.dto.StatLineKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface PitcherStatLineRepository extends JpaRepository<PitcherStatLine, Long> {
    // Couples (match, joueur) déjà stockés pour les matchs d'un lot, en une requête
    @Query("SELECT new com.tony.baseballStats.model.dto.StatLineKey(p.gameId, p.playerId) " +
            "FROM PitcherStatLine p WHERE p.gameId IN :gameIds")
    List<StatLineKey> findKeysByGameIdIn(@Param("gameIds") Collection<Long> gameIds);
}
