package com.tony.ladder.service;

import com.tony.ladder.exception.InvalidMatchException;
import com.tony.ladder.exception.MatchOrderingException;
import com.tony.ladder.model.Match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordre canonique du journal des matchs : date du match, puis séquence d'insertion (id).
 */
public final class MatchChronology {

    public static final Comparator<Match> ORDER =
            Comparator.comparing(Match::getMatchDate).thenComparing(Match::getId);

    private MatchChronology() {
    }

    /**
     * Valide chaque match puis renvoie une copie triée du journal.
     *
     * @throws InvalidMatchException   si un match est inexploitable
     * @throws MatchOrderingException si deux matchs ne peuvent pas être départagés
     */
    public static List<Match> order(List<Match> matches) {
        matches.forEach(MatchChronology::validate);

        List<Match> ordered = new ArrayList<>(matches);
        ordered.sort(ORDER);

        for (int i = 1; i < ordered.size(); i++) {
            Match previous = ordered.get(i - 1);
            Match current = ordered.get(i);
            if (ORDER.compare(previous, current) == 0) {
                throw new MatchOrderingException(String.format(
                        "Matchs indiscernables : id %d joué le %s apparaît deux fois",
                        current.getId(), current.getMatchDate()));
            }
        }
        return ordered;
    }

    public static void validate(Match match) {
        if (match.getId() == null) {
            throw new MatchOrderingException("Match sans séquence d'insertion (id null) le " + match.getMatchDate());
        }
        if (match.getMatchDate() == null) {
            throw new InvalidMatchException("Match " + match.getId() + " sans date");
        }
        if (match.getSeason() == null || match.getSeason().getId() == null) {
            throw new InvalidMatchException("Match " + match.getId() + " rattaché à une saison inconnue");
        }
        if (match.getWinner() == null || match.getLoser() == null
                || match.getWinner().getId() == null || match.getLoser().getId() == null) {
            throw new InvalidMatchException("Match " + match.getId() + " sans vainqueur ou sans perdant");
        }
        if (match.getWinner().getId().equals(match.getLoser().getId())) {
            throw new InvalidMatchException("Match " + match.getId() + " : un joueur ne peut pas se battre lui-même");
        }
    }
}
