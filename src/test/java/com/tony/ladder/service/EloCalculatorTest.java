package com.tony.ladder.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EloCalculatorTest {

    private static final int K = 32;

    @Test
    @DisplayName("À Elo égal, le vainqueur prend exactement K/2")
    void equalRatingsExchangeHalfK() {
        EloCalculator.RatingPair result = EloCalculator.rate(1000, 1000, K);

        assertThat(result.winnerRating()).isEqualTo(1016);
        assertThat(result.loserRating()).isEqualTo(984);
    }

    @Test
    @DisplayName("Un favori qui gagne prend moins de points qu'un outsider")
    void upsetIsWorthMoreThanExpectedWin() {
        EloCalculator.RatingPair favouriteWins = EloCalculator.rate(1200, 1000, K);
        EloCalculator.RatingPair underdogWins = EloCalculator.rate(1000, 1200, K);

        assertThat(favouriteWins.winnerRating()).isEqualTo(1208);
        assertThat(favouriteWins.loserRating()).isEqualTo(992);
        assertThat(underdogWins.winnerRating()).isEqualTo(1024);
        assertThat(underdogWins.loserRating()).isEqualTo(1176);
    }

    @Test
    @DisplayName("Somme nulle à l'arrondi près (±1) sur toute une grille de classements")
    void ratingExchangeIsZeroSumUpToRounding() {
        for (int winner = 400; winner <= 2400; winner += 37) {
            for (int loser = 400; loser <= 2400; loser += 41) {
                EloCalculator.RatingPair result = EloCalculator.rate(winner, loser, K);
                int drift = (result.winnerRating() + result.loserRating()) - (winner + loser);

                assertThat(Math.abs(drift)).as("dérive pour %d vs %d", winner, loser).isLessThanOrEqualTo(1);
                assertThat(result.winnerRating()).isGreaterThanOrEqualTo(winner);
                assertThat(result.loserRating()).isLessThanOrEqualTo(loser);
            }
        }
    }

    @Test
    void halvesAreRoundedAwayFromZero() {
        assertThat(EloCalculator.round(2.5)).isEqualTo(3);
        assertThat(EloCalculator.round(-2.5)).isEqualTo(-3);
        assertThat(EloCalculator.round(1030.49)).isEqualTo(1030);
        assertThat(EloCalculator.round(969.5)).isEqualTo(970);
    }

    @Test
    void sameInputsAlwaysGiveSameOutputs() {
        assertThat(EloCalculator.rate(1016, 984, K)).isEqualTo(EloCalculator.rate(1016, 984, K));
        assertThat(EloCalculator.rate(1016, 984, K)).isEqualTo(new EloCalculator.RatingPair(1031, 969));
    }
}
