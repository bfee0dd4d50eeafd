package com.tony.ladder.service;

import com.tony.ladder.exception.ReplayFailedException;
import com.tony.ladder.model.Match;
import com.tony.ladder.model.RatingHistoryEntry;
import com.tony.ladder.repository.MatchRepository;
import com.tony.ladder.repository.RatingHistoryEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconstruit tout l'historique Elo (deux lignes par match) à partir du seul journal des matchs.
 * Ne touche ni aux compteurs des joueurs ni aux bilans de saison.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingHistoryReplayService {

    private final MatchRepository matchRepository;
    private final RatingHistoryEntryRepository historyRepository;
    private final MatchReplayer matchReplayer;
    private final LadderLock ladderLock;
    private final TransactionTemplate transactionTemplate;

    public void replayRatingHistory() {
        long start = System.currentTimeMillis();
        log.info("🔄 Rejeu de l'historique Elo...");
        Integer written;
        try {
            written = ladderLock.callExclusive(() -> transactionTemplate.execute(status -> rewriteHistory()));
        } catch (RuntimeException e) {
            log.error("❌ Rejeu de l'historique Elo annulé, historique existant conservé", e);
            throw new ReplayFailedException("historique Elo", e);
        }
        log.info("✅ Historique Elo régénéré : {} lignes en {} ms", written, System.currentTimeMillis() - start);
    }

    private Integer rewriteHistory() {
        List<Match> matches = matchRepository.findAllByOrderByMatchDateAscIdAsc();

        // Calcul complet AVANT toute suppression : un match illisible fait tout échouer
        List<RatingHistoryEntry> entries = new ArrayList<>(matches.size() * 2);
        matchReplayer.replay(matches, (match, winner, loser) -> {
            entries.add(new RatingHistoryEntry(match, match.getWinner(), winner.getRating()));
            entries.add(new RatingHistoryEntry(match, match.getLoser(), loser.getRating()));
        });

        historyRepository.deleteAllInBatch();
        historyRepository.saveAll(entries);
        return entries.size();
    }
}
