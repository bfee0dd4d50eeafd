package com.tony.ladder.repository;

import com.tony.ladder.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Journal des matchs. Toutes les lectures sont triées par (matchDate, id).
 */
public interface MatchRepository extends JpaRepository<Match, Long> {

    List<Match> findAllByOrderByMatchDateAscIdAsc();

    Optional<Match> findTopByOrderByMatchDateDescIdDesc();

    List<Match> findBySeasonIdOrderByMatchDateAscIdAsc(Long seasonId);

    List<Match> findByMatchDateBetweenOrderByMatchDateAscIdAsc(LocalDateTime start, LocalDateTime end);
}
