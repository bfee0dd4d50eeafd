package com.tony.ladder.service;

import com.tony.ladder.exception.SeasonConfigurationException;
import com.tony.ladder.model.Season;
import com.tony.ladder.model.SeasonStatus;
import com.tony.ladder.repository.PlayerRepository;
import com.tony.ladder.repository.SeasonRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static com.tony.ladder.service.LadderFixtures.season;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeasonServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);
    private static final LocalDate YESTERDAY = TODAY.minusDays(1);

    @Mock
    private SeasonRepository seasonRepository;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SeasonService seasonService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneId.of("UTC")).toInstant(), ZoneId.of("UTC"));
        seasonService = new SeasonService(seasonRepository, playerRepository, new LadderLock(),
                new TransactionTemplate(transactionManager), clock);
    }

    @Test
    @DisplayName("Une saison qui commence aujourd'hui devient active et remet tous les joueurs à zéro")
    void newSeasonIsActivatedAndPlayersReset() {
        Season season = season(1L, TODAY, null);
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of());
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of(season));

        seasonService.runSeasonTransition();

        assertThat(season.isActive()).isTrue();
        verify(seasonRepository).save(season);
        verify(playerRepository, times(1)).resetSeasonCounters(1000);
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("Une saison active terminée hier expire sans toucher aux joueurs")
    void expiredSeasonIsDeactivatedWithoutReset() {
        Season season = season(1L, YESTERDAY.minusDays(10), YESTERDAY);
        season.setActive(true);
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of(season));
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of());

        seasonService.runSeasonTransition();

        assertThat(season.isActive()).isFalse();
        assertThat(season.statusOn(TODAY)).isEqualTo(SeasonStatus.EXPIRED);
        verify(playerRepository, never()).resetSeasonCounters(anyInt());
    }

    @Test
    @DisplayName("Une saison en cours reste active et ne redéclenche jamais la remise à zéro")
    void ongoingSeasonStaysActiveAcrossRepeatedRuns() {
        Season season = season(1L, YESTERDAY, TODAY.plusMonths(2));
        season.setActive(true);
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of(season));
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of(season));

        seasonService.runSeasonTransition();
        seasonService.runSeasonTransition();
        seasonService.runSeasonTransition();

        assertThat(season.isActive()).isTrue();
        verify(seasonRepository, never()).save(any());
        verify(playerRepository, never()).resetSeasonCounters(anyInt());
    }

    @Test
    void handoverExpiresOldSeasonAndActivatesNewOneOnce() {
        Season previous = season(1L, TODAY.minusMonths(3), YESTERDAY);
        previous.setActive(true);
        Season next = season(2L, TODAY, null);
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of(previous));
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of(next));

        seasonService.runSeasonTransition();

        assertThat(previous.isActive()).isFalse();
        assertThat(next.isActive()).isTrue();
        verify(playerRepository, times(1)).resetSeasonCounters(1000);
    }

    @Test
    @DisplayName("Deux saisons couvrant aujourd'hui : erreur de configuration, rien n'est appliqué")
    void overlappingSeasonsAreAConfigurationError() {
        Season first = season(1L, YESTERDAY, null);
        Season second = season(2L, TODAY, TODAY.plusDays(30));
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of());
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of(first, second));

        assertThatThrownBy(() -> seasonService.runSeasonTransition())
                .isInstanceOf(SeasonConfigurationException.class)
                .hasMessageContaining("2 saisons");

        verify(playerRepository, never()).resetSeasonCounters(anyInt());
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void activeSeasonOtherThanTheCoveringOneIsAConfigurationError() {
        Season stray = season(1L, TODAY.plusDays(5), null);
        stray.setActive(true);
        Season current = season(2L, YESTERDAY, TODAY.plusDays(4));
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of(stray));
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of(current));

        assertThatThrownBy(() -> seasonService.runSeasonTransition())
                .isInstanceOf(SeasonConfigurationException.class);

        assertThat(current.isActive()).isFalse();
        verify(playerRepository, never()).resetSeasonCounters(anyInt());
    }

    @Test
    void noSeasonCoveringTodayLeavesEverythingInactive() {
        when(seasonRepository.findByActiveTrue()).thenReturn(List.of());
        when(seasonRepository.findCovering(TODAY)).thenReturn(List.of());

        seasonService.runSeasonTransition();

        verify(seasonRepository, never()).save(any());
        verifyNoInteractions(playerRepository);
    }

    @Test
    void pendingSeasonIsNotActivated() {
        Season upcoming = season(3L, TODAY.plusDays(1), null);

        assertThat(upcoming.statusOn(TODAY)).isEqualTo(SeasonStatus.PENDING);
        assertThat(upcoming.covers(TODAY)).isFalse();
        assertThat(upcoming.covers(TODAY.plusDays(1))).isTrue();
    }
}
