package com.tony.baseballStats.repository;

import com.tony.baseballStats.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamRepository extends JpaRepository<Team, Long> {
    Optional<Team> findByApiTeamId(Long apiTeamId);
}
