package com.tony.ladder.service;

import com.tony.ladder.model.Match;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parcours chronologique unique partagé par les deux rejeux.
 * Ne lit que le journal des matchs : aucun accès aux joueurs ni aux saisons en base.
 */
@Component
@RequiredArgsConstructor
public class MatchReplayer {

    private final EloService eloService;

    @FunctionalInterface
    public interface ReplayListener {
        // Appelé après application du match, avec l'état à jour des deux joueurs
        void onMatch(Match match, TrackedStanding winner, TrackedStanding loser);
    }

    public void replay(List<Match> matches, ReplayListener listener) {
        Map<Long, TrackedStanding> standings = new HashMap<>();

        for (Match match : MatchChronology.order(matches)) {
            Long seasonId = match.getSeason().getId();
            TrackedStanding winner = standings.computeIfAbsent(match.getWinner().getId(), id -> new TrackedStanding());
            TrackedStanding loser = standings.computeIfAbsent(match.getLoser().getId(), id -> new TrackedStanding());
            winner.enterSeason(seasonId);
            loser.enterSeason(seasonId);

            EloCalculator.RatingPair ratings = eloService.rate(winner.getRating(), loser.getRating());
            winner.recordWin(ratings.winnerRating());
            loser.recordLoss(ratings.loserRating());

            listener.onMatch(match, winner, loser);
        }
    }
}
