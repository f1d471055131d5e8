package com.tony.baseballStats.repository;

import com.tony.baseballStats.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {
    Optional<Player> findByApiPlayerId(Long apiPlayerId);
}
