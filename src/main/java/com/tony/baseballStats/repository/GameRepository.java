package com.tony.baseballStats.repository;

import com.tony.baseballStats.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GameRepository extends JpaRepository<Game, Long> {
    Optional<Game> findByApiGameId(Long apiGameId);
}
