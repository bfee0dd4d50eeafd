package com.tony.ladder.service;

/**
 * Calcul Elo pur pour un match 1v1 (victoire/défaite, pas de nul). Aucun état.
 *
 * Espérance du vainqueur : E = 1 / (1 + 10^((eloPerdant - eloVainqueur) / 400))
 * Nouveau Elo            : R' = arrondi(R + K * (Réel - Attendu))
 *
 * L'arrondi se fait à l'entier le plus proche, les demis s'éloignant de zéro (2.5 -> 3, -2.5 -> -3).
 * Le chemin live et les rejeux passent tous deux par ici.
 */
public final class EloCalculator {

    private EloCalculator() {
    }

    public static double expectedScore(int rating, int opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / 400.0));
    }

    public static RatingPair rate(int winnerRating, int loserRating, int kFactor) {
        double expectedWinner = expectedScore(winnerRating, loserRating);
        double expectedLoser = 1.0 - expectedWinner;

        int newWinnerRating = round(winnerRating + kFactor * (1.0 - expectedWinner));
        int newLoserRating = round(loserRating + kFactor * (0.0 - expectedLoser));
        return new RatingPair(newWinnerRating, newLoserRating);
    }

    static int round(double value) {
        long magnitude = Math.round(Math.abs(value));
        return (int) (value < 0 ? -magnitude : magnitude);
    }

    public record RatingPair(int winnerRating, int loserRating) {
    }
}
