package com.tony.ladder.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Bilan d'un joueur sur une saison, tel qu'après son dernier match de cette saison.
 * N'existe que pour les couples (saison, joueur) ayant au moins un match.
 */
@Entity
@Table(name = "season_snapshot", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"season_id", "player_id"})
})
@Getter @Setter @NoArgsConstructor
public class SeasonSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "season_id")
    private Season season;

    @ManyToOne(optional = false)
    @JoinColumn(name = "player_id")
    private Player player;

    @Column(nullable = false)
    private Integer rating;

    @Column(nullable = false)
    private Integer winCount;

    @Column(nullable = false)
    private Integer lossCount;

    public SeasonSnapshot(Season season, Player player) {
        this.season = season;
        this.player = player;
    }

    public void update(int rating, int winCount, int lossCount) {
        this.rating = rating;
        this.winCount = winCount;
        this.lossCount = lossCount;
    }
}
