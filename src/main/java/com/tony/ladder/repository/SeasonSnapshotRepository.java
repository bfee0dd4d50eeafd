package com.tony.ladder.repository;

import com.tony.ladder.model.Player;
import com.tony.ladder.model.Season;
import com.tony.ladder.model.SeasonSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SeasonSnapshotRepository extends JpaRepository<SeasonSnapshot, Long> {

    Optional<SeasonSnapshot> findBySeasonAndPlayer(Season season, Player player);

    List<SeasonSnapshot> findBySeasonIdOrderByRatingDesc(Long seasonId);
}
