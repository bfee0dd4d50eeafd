package com.tony.ladder.controller;

import com.tony.ladder.service.RatingHistoryReplayService;
import com.tony.ladder.service.SeasonService;
import com.tony.ladder.service.SeasonSnapshotReplayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final SeasonService seasonService;
    private final RatingHistoryReplayService ratingHistoryReplayService;
    private final SeasonSnapshotReplayService seasonSnapshotReplayService;

    // Même traitement que le job de minuit, utile pour rattraper un jour manqué
    @PostMapping("/season-transition")
    public ResponseEntity<String> runSeasonTransition() {
        log.info("🚀 Transition de saison manuelle demandée par l'admin");
        seasonService.runSeasonTransition();
        return ResponseEntity.ok("Transition de saison effectuée.");
    }

    /**
     * Régénère tout l'historique Elo depuis le journal des matchs (backfill ou réparation).
     * En cas d'échec, l'historique existant reste intact.
     */
    @PostMapping("/replay/rating-history")
    public ResponseEntity<String> replayRatingHistory() {
        log.info("🚀 Rejeu de l'historique Elo demandé par l'admin");
        ratingHistoryReplayService.replayRatingHistory();
        return ResponseEntity.ok("Historique Elo régénéré.");
    }

    @PostMapping("/replay/season-snapshots")
    public ResponseEntity<String> replaySeasonSnapshots() {
        log.info("🚀 Rejeu des bilans de saison demandé par l'admin");
        seasonSnapshotReplayService.replaySeasonSnapshots();
        return ResponseEntity.ok("Bilans de saison régénérés.");
    }
}
