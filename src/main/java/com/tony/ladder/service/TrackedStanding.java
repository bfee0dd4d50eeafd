package com.tony.ladder.service;

import com.tony.ladder.model.Player;
import lombok.Getter;

import java.util.Objects;

/**
 * État reconstitué d'un joueur pendant un rejeu.
 * Repart de zéro dès que le joueur apparaît dans une autre saison que la précédente.
 */
@Getter
public class TrackedStanding {

    private Long seasonId;
    private int rating = Player.DEFAULT_RATING;
    private int winCount;
    private int lossCount;

    void enterSeason(Long seasonId) {
        if (Objects.equals(this.seasonId, seasonId)) return;
        this.seasonId = seasonId;
        this.rating = Player.DEFAULT_RATING;
        this.winCount = 0;
        this.lossCount = 0;
    }

    void recordWin(int newRating) {
        this.rating = newRating;
        this.winCount++;
    }

    void recordLoss(int newRating) {
        this.rating = newRating;
        this.lossCount++;
    }
}
