package com.tony.ladder.service;

import com.tony.ladder.exception.SeasonConfigurationException;
import com.tony.ladder.model.Player;
import com.tony.ladder.model.Season;
import com.tony.ladder.repository.PlayerRepository;
import com.tony.ladder.repository.SeasonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Machine à états des saisons : PENDING -> ACTIVE -> EXPIRED.
 * Idempotente, peut être relancée autant de fois que voulu (le job tourne chaque nuit).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonService {

    private final SeasonRepository seasonRepository;
    private final PlayerRepository playerRepository;
    private final LadderLock ladderLock;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public void runSeasonTransition() {
        LocalDate today = LocalDate.now(clock);
        ladderLock.runExclusive(() -> transactionTemplate.executeWithoutResult(status -> transition(today)));
    }

    private void transition(LocalDate today) {
        // 1. Expiration des saisons actives terminées avant aujourd'hui
        List<Season> active = seasonRepository.findByActiveTrue();
        for (Season season : active) {
            if (season.isEndedBefore(today)) {
                season.setActive(false);
                seasonRepository.save(season);
                log.info("🏁 Saison '{}' expirée (fin le {})", season.getName(), season.getEndDate());
            }
        }
        List<Season> stillActive = active.stream().filter(Season::isActive).toList();

        // 2. Recherche de LA saison qui couvre aujourd'hui
        List<Season> covering = seasonRepository.findCovering(today);
        if (covering.size() > 1) {
            throw new SeasonConfigurationException(String.format(
                    "%d saisons couvrent le %s : %s", covering.size(), today, names(covering)));
        }
        if (covering.isEmpty()) {
            if (!stillActive.isEmpty()) {
                throw new SeasonConfigurationException(String.format(
                        "Saison(s) active(s) %s alors qu'aucune saison ne couvre le %s", names(stillActive), today));
            }
            log.warn("⚠️ Aucune saison ne couvre le {} : aucune saison active", today);
            return;
        }

        Season current = covering.get(0);
        List<Season> others = stillActive.stream().filter(s -> !s.equals(current)).toList();
        if (!others.isEmpty()) {
            throw new SeasonConfigurationException(String.format(
                    "Saison(s) %s encore active(s) alors que '%s' couvre le %s", names(others), current.getName(), today));
        }

        // 3. Déjà active : surtout ne pas relancer la remise à zéro
        if (current.isActive()) {
            log.debug("Saison '{}' déjà active, rien à faire", current.getName());
            return;
        }

        current.setActive(true);
        seasonRepository.save(current);
        int resetCount = playerRepository.resetSeasonCounters(Player.DEFAULT_RATING);
        log.info("🚀 Saison '{}' activée, compteurs remis à zéro pour {} joueurs", current.getName(), resetCount);
    }

    private static String names(List<Season> seasons) {
        return seasons.stream().map(Season::getName).collect(Collectors.joining(", ", "[", "]"));
    }
}
