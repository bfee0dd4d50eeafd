package com.tony.ladder.repository;

import com.tony.ladder.model.Player;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {

    Optional<Player> findByName(String name);

    // Verrou ligne sur les deux joueurs d'un match, toujours dans l'ordre des ids (pas de deadlock)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Player p WHERE p.id IN :ids ORDER BY p.id ASC")
    List<Player> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    // Remise à zéro en masse de tous les compteurs de saison (une seule requête, tout ou rien)
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Player p SET p.rating = :rating, p.winCount = 0, p.lossCount = 0, " +
            "p.bonusGivenCount = 0, p.bonusTakenCount = 0")
    int resetSeasonCounters(@Param("rating") int rating);
}
