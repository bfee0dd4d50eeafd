package com.tony.ladder.service;

import com.tony.ladder.exception.InvalidMatchException;
import com.tony.ladder.exception.MatchOrderingException;
import com.tony.ladder.model.Match;
import com.tony.ladder.model.Player;
import com.tony.ladder.model.Season;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.tony.ladder.service.LadderFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchChronologyTest {

    private static final LocalDateTime EVENING = LocalDateTime.of(2026, 1, 10, 20, 0);

    private Player alice;
    private Player bob;
    private Season season;

    @BeforeEach
    void setUp() {
        alice = player(1L, "Alice");
        bob = player(2L, "Bob");
        season = season(1L, LocalDate.of(2026, 1, 1), null);
    }

    @Test
    @DisplayName("Trie par date puis par séquence d'insertion pour les matchs simultanés")
    void ordersByDateThenInsertionSequence() {
        Match late = match(1L, alice, bob, season, EVENING.plusDays(1));
        Match sameTimeSecond = match(7L, bob, alice, season, EVENING);
        Match sameTimeFirst = match(3L, alice, bob, season, EVENING);

        List<Match> ordered = MatchChronology.order(List.of(late, sameTimeSecond, sameTimeFirst));

        assertThat(ordered).extracting(Match::getId).containsExactly(3L, 7L, 1L);
    }

    @Test
    void sameMatchTwiceIsAnOrderingAmbiguity() {
        Match m = match(4L, alice, bob, season, EVENING);

        assertThatThrownBy(() -> MatchChronology.order(List.of(m, m)))
                .isInstanceOf(MatchOrderingException.class);
    }

    @Test
    void matchWithoutInsertionSequenceIsRejected() {
        Match m = new Match(alice, bob, season, EVENING, false);

        assertThatThrownBy(() -> MatchChronology.order(List.of(m)))
                .isInstanceOf(MatchOrderingException.class);
    }

    @Test
    void matchAgainstSelfIsRejected() {
        Match m = match(5L, alice, alice, season, EVENING);

        assertThatThrownBy(() -> MatchChronology.validate(m))
                .isInstanceOf(InvalidMatchException.class)
                .hasMessageContaining("lui-même");
    }

    @Test
    void matchWithUnknownSeasonIsRejected() {
        Match m = match(6L, alice, bob, null, EVENING);

        assertThatThrownBy(() -> MatchChronology.validate(m))
                .isInstanceOf(InvalidMatchException.class)
                .hasMessageContaining("saison inconnue");
    }
}
