package com.tony.ladder.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Elo d'un joueur APRÈS un match. Exactement deux lignes par match (vainqueur et perdant),
 * entièrement régénérables depuis le journal des matchs.
 */
@Entity
@Table(name = "rating_history", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"match_id", "player_id"})
})
@Getter @Setter @NoArgsConstructor
public class RatingHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "match_id")
    private Match match;

    @ManyToOne(optional = false)
    @JoinColumn(name = "player_id")
    private Player player;

    @Column(nullable = false)
    private Integer rating;

    public RatingHistoryEntry(Match match, Player player, int rating) {
        this.match = match;
        this.player = player;
        this.rating = rating;
    }
}
