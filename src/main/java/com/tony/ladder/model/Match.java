package com.tony.ladder.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Résultat immuable d'une rencontre 1v1.
 * L'ordre chronologique est (matchDate, id) : l'id IDENTITY sert de séquence d'insertion
 * pour départager les matchs joués au même instant.
 */
@Entity
@Table(name = "ladder_match")
@Getter @Setter @NoArgsConstructor
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "winner_id")
    private Player winner;

    @ManyToOne(optional = false)
    @JoinColumn(name = "loser_id")
    private Player loser;

    @ManyToOne(optional = false)
    @JoinColumn(name = "season_id")
    private Season season;

    @Column(nullable = false)
    private LocalDateTime matchDate;

    // Victoire blanche : le vainqueur "donne" un bonus, le perdant le "prend"
    @Column(nullable = false)
    private boolean bonus = false;

    public Match(Player winner, Player loser, Season season, LocalDateTime matchDate, boolean bonus) {
        this.winner = winner;
        this.loser = loser;
        this.season = season;
        this.matchDate = matchDate;
        this.bonus = bonus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        return id != null && id.equals(((Match) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
