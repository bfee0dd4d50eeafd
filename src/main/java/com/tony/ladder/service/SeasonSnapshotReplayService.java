package com.tony.ladder.service;

import com.tony.ladder.exception.ReplayFailedException;
import com.tony.ladder.model.Match;
import com.tony.ladder.model.Player;
import com.tony.ladder.model.Season;
import com.tony.ladder.model.SeasonSnapshot;
import com.tony.ladder.repository.MatchRepository;
import com.tony.ladder.repository.SeasonSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;

/**
 * Reconstruit un bilan (Elo, victoires, défaites) par couple (saison, joueur) ayant joué,
 * tel qu'après le dernier match du joueur dans cette saison.
 * Les bilans existants sont réécrits sur place, ceux sans match correspondant sont supprimés.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonSnapshotReplayService {

    private final MatchRepository matchRepository;
    private final SeasonSnapshotRepository snapshotRepository;
    private final MatchReplayer matchReplayer;
    private final LadderLock ladderLock;
    private final TransactionTemplate transactionTemplate;

    public void replaySeasonSnapshots() {
        long start = System.currentTimeMillis();
        log.info("🔄 Rejeu des bilans de saison...");
        Integer written;
        try {
            written = ladderLock.callExclusive(() -> transactionTemplate.execute(status -> rewriteSnapshots()));
        } catch (RuntimeException e) {
            log.error("❌ Rejeu des bilans de saison annulé, bilans existants conservés", e);
            throw new ReplayFailedException("bilans de saison", e);
        }
        log.info("✅ Bilans de saison régénérés : {} bilans en {} ms", written, System.currentTimeMillis() - start);
    }

    private Integer rewriteSnapshots() {
        List<Match> matches = matchRepository.findAllByOrderByMatchDateAscIdAsc();

        // Le dernier état vu pour un couple (saison, joueur) écrase les précédents
        Map<SeasonPlayerKey, SeasonTotals> totals = new LinkedHashMap<>();
        matchReplayer.replay(matches, (match, winner, loser) -> {
            Season season = match.getSeason();
            totals.put(SeasonPlayerKey.of(season, match.getWinner()), SeasonTotals.of(season, match.getWinner(), winner));
            totals.put(SeasonPlayerKey.of(season, match.getLoser()), SeasonTotals.of(season, match.getLoser(), loser));
        });

        Map<SeasonPlayerKey, SeasonSnapshot> existing = new HashMap<>();
        for (SeasonSnapshot snapshot : snapshotRepository.findAll()) {
            existing.put(SeasonPlayerKey.of(snapshot.getSeason(), snapshot.getPlayer()), snapshot);
        }

        List<SeasonSnapshot> toSave = new ArrayList<>(totals.size());
        for (Map.Entry<SeasonPlayerKey, SeasonTotals> entry : totals.entrySet()) {
            SeasonTotals t = entry.getValue();
            SeasonSnapshot snapshot = existing.remove(entry.getKey());
            if (snapshot == null) {
                snapshot = new SeasonSnapshot(t.season(), t.player());
            }
            snapshot.update(t.rating(), t.winCount(), t.lossCount());
            toSave.add(snapshot);
        }

        // Reste : bilans orphelins (plus aucun match pour ce couple)
        if (!existing.isEmpty()) {
            log.info("🧹 Suppression de {} bilans sans match", existing.size());
            snapshotRepository.deleteAll(existing.values());
        }
        snapshotRepository.saveAll(toSave);
        return toSave.size();
    }

    private record SeasonPlayerKey(Long seasonId, Long playerId) {
        static SeasonPlayerKey of(Season season, Player player) {
            return new SeasonPlayerKey(season.getId(), player.getId());
        }
    }

    private record SeasonTotals(Season season, Player player, int rating, int winCount, int lossCount) {
        static SeasonTotals of(Season season, Player player, TrackedStanding standing) {
            return new SeasonTotals(season, player, standing.getRating(), standing.getWinCount(), standing.getLossCount());
        }
    }
}
