package com.tony.ladder.service;

import com.tony.ladder.config.LadderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Point d'entrée unique du calcul Elo : le facteur K vient de la configuration,
 * une seule fois, pour le chemin live comme pour les rejeux.
 */
@Service
@RequiredArgsConstructor
public class EloService {

    private final LadderProperties properties;

    public EloCalculator.RatingPair rate(int winnerRating, int loserRating) {
        return EloCalculator.rate(winnerRating, loserRating, properties.getElo().getVolatility());
    }
}
