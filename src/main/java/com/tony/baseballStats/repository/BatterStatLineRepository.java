package com.tony.baseballStats.repository;

import com.tony.baseballStats.model.BatterStatLine;
import com.tony.baseballStats.model.dto.HomeRunEvent;
import com.tony.baseballStats.model.dto.StatLineKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface BatterStatLineRepository extends JpaRepository<BatterStatLine, Long> {
    // Couples (match, joueur) déjà stockés pour les matchs d'un lot, en une requête
    @Query("SELECT new com.tony.baseballStats.model.dto.StatLineKey(b.gameId, b.playerId) " +
            "FROM BatterStatLine b WHERE b.gameId IN :gameIds")
    List<StatLineKey> findKeysByGameIdIn(@Param("gameIds") Collection<Long> gameIds);

    // Tous les (joueur, match) avec au moins un home run, pour l'analyse des paires
    @Query("SELECT new com.tony.baseballStats.model.dto.HomeRunEvent(p.id, p.name, g.gameDate) " +
            "FROM BatterStatLine b JOIN b.player p JOIN b.game g " +
            "WHERE b.homeRuns > 0")
    List<HomeRunEvent> findHomeRunEvents();
}
