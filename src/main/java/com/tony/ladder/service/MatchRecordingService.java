package com.tony.ladder.service;

import com.tony.ladder.exception.InvalidMatchException;
import com.tony.ladder.exception.ResourceNotFoundException;
import com.tony.ladder.model.*;
import com.tony.ladder.model.dto.MatchRequest;
import com.tony.ladder.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Chemin live : enregistre un match et met à jour les compteurs de saison des deux joueurs.
 *
 * Match, Elo, compteurs, lignes d'historique et bilans de saison sont écrits dans une seule
 * transaction : tout ou rien. Le calcul passe par {@link EloService}, comme les rejeux.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchRecordingService {

    private final MatchRepository matchRepository;
    private final PlayerRepository playerRepository;
    private final SeasonRepository seasonRepository;
    private final RatingHistoryEntryRepository historyRepository;
    private final SeasonSnapshotRepository snapshotRepository;
    private final EloService eloService;
    private final LadderLock ladderLock;
    private final TransactionTemplate transactionTemplate;

    public Match recordMatch(MatchRequest request) {
        return ladderLock.callShared(() -> transactionTemplate.execute(status -> applyMatch(request)));
    }

    private Match applyMatch(MatchRequest request) {
        if (request.getWinnerId().equals(request.getLoserId())) {
            throw new InvalidMatchException("Un joueur ne peut pas se battre lui-même");
        }

        Season season = seasonRepository.findById(request.getSeasonId())
                .orElseThrow(() -> new ResourceNotFoundException("Saison", request.getSeasonId()));
        if (!season.covers(request.getMatchDate().toLocalDate())) {
            throw new InvalidMatchException(String.format("Le %s est hors de la saison '%s'",
                    request.getMatchDate().toLocalDate(), season.getName()));
        }

        // Les compteurs des joueurs sont ceux de la saison active : un match d'une autre saison ne peut pas s'y appliquer
        if (!season.isActive()) {
            throw new InvalidMatchException(String.format("La saison '%s' n'est pas active", season.getName()));
        }

        // Verrou des joueurs avant le contrôle d'antidatage : un match concurrent déjà validé est alors visible
        List<Player> locked = playerRepository.findAllByIdForUpdate(List.of(request.getWinnerId(), request.getLoserId()));

        // Pas de match antidaté : l'ordre d'insertion doit rester l'ordre chronologique
        matchRepository.findTopByOrderByMatchDateDescIdDesc().ifPresent(last -> {
            if (request.getMatchDate().isBefore(last.getMatchDate())) {
                throw new InvalidMatchException(String.format(
                        "Match antidaté : %s est antérieur au dernier match enregistré (%s)",
                        request.getMatchDate(), last.getMatchDate()));
            }
        });

        Player winner = pick(locked, request.getWinnerId());
        Player loser = pick(locked, request.getLoserId());

        Match match = matchRepository.save(
                new Match(winner, loser, season, request.getMatchDate(), request.isBonus()));

        EloCalculator.RatingPair ratings = eloService.rate(winner.getRating(), loser.getRating());
        winner.recordWin(ratings.winnerRating(), match.isBonus());
        loser.recordLoss(ratings.loserRating(), match.isBonus());
        playerRepository.saveAll(List.of(winner, loser));

        historyRepository.saveAll(List.of(
                new RatingHistoryEntry(match, winner, ratings.winnerRating()),
                new RatingHistoryEntry(match, loser, ratings.loserRating())));

        updateSnapshot(season, winner);
        updateSnapshot(season, loser);

        log.info("🏆 Match #{} : {} ({}) bat {} ({})", match.getId(),
                winner.getName(), winner.getRating(), loser.getName(), loser.getRating());
        return match;
    }

    private void updateSnapshot(Season season, Player player) {
        SeasonSnapshot snapshot = snapshotRepository.findBySeasonAndPlayer(season, player)
                .orElseGet(() -> new SeasonSnapshot(season, player));
        snapshot.update(player.getRating(), player.getWinCount(), player.getLossCount());
        snapshotRepository.save(snapshot);
    }

    private static Player pick(List<Player> players, Long id) {
        return players.stream()
                .filter(p -> p.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Joueur", id));
    }
}
