package com.tony.ladder.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Joueur du classement. Les compteurs portent sur le cycle de saison en cours
 * et sont remis à zéro à chaque activation d'une nouvelle saison.
 */
@Entity
@Getter @Setter @NoArgsConstructor
public class Player {

    public static final int DEFAULT_RATING = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false, columnDefinition = "integer default 1000")
    private Integer rating = DEFAULT_RATING;

    @Column(nullable = false)
    private Integer winCount = 0;

    @Column(nullable = false)
    private Integer lossCount = 0;

    // Compteurs "bonus" (victoire blanche) : purement informatifs, sans effet sur le Elo
    @Column(nullable = false)
    private Integer bonusGivenCount = 0;

    @Column(nullable = false)
    private Integer bonusTakenCount = 0;

    public Player(String name) {
        this.name = name;
    }

    public void recordWin(int newRating, boolean bonus) {
        this.rating = newRating;
        this.winCount++;
        if (bonus) this.bonusGivenCount++;
    }

    public void recordLoss(int newRating, boolean bonus) {
        this.rating = newRating;
        this.lossCount++;
        if (bonus) this.bonusTakenCount++;
    }

    public void resetSeasonCounters() {
        this.rating = DEFAULT_RATING;
        this.winCount = 0;
        this.lossCount = 0;
        this.bonusGivenCount = 0;
        this.bonusTakenCount = 0;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        return id != null && id.equals(((Player) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
