package com.tony.ladder.repository;

import com.tony.ladder.model.Season;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface SeasonRepository extends JpaRepository<Season, Long> {

    List<Season> findByActiveTrue();

    // Saisons dont la fenêtre contient le jour donné (fin nulle = saison ouverte)
    @Query("SELECT s FROM Season s WHERE s.startDate <= :day " +
            "AND (s.endDate IS NULL OR s.endDate >= :day) ORDER BY s.startDate ASC")
    List<Season> findCovering(@Param("day") LocalDate day);
}
