package com.tony.ladder.repository;

import com.tony.ladder.model.Match;
import com.tony.ladder.model.Player;
import com.tony.ladder.model.RatingHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RatingHistoryEntryRepository extends JpaRepository<RatingHistoryEntry, Long> {

    Optional<RatingHistoryEntry> findByMatchAndPlayer(Match match, Player player);

    @Query("SELECT h FROM RatingHistoryEntry h WHERE h.player.id = :playerId " +
            "ORDER BY h.match.matchDate ASC, h.match.id ASC")
    List<RatingHistoryEntry> findByPlayerChronologically(@Param("playerId") Long playerId);
}
