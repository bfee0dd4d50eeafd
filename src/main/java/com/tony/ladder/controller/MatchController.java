package com.tony.ladder.controller;

import com.tony.ladder.model.Match;
import com.tony.ladder.model.dto.MatchRequest;
import com.tony.ladder.model.dto.RatingHistoryView;
import com.tony.ladder.model.dto.StandingView;
import com.tony.ladder.repository.MatchRepository;
import com.tony.ladder.repository.RatingHistoryEntryRepository;
import com.tony.ladder.repository.SeasonSnapshotRepository;
import com.tony.ladder.service.MatchRecordingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchController {

    private final MatchRecordingService matchRecordingService;
    private final MatchRepository matchRepository;
    private final RatingHistoryEntryRepository historyRepository;
    private final SeasonSnapshotRepository snapshotRepository;

    @PostMapping
    public ResponseEntity<Match> recordMatch(@Valid @RequestBody MatchRequest request) {
        return ResponseEntity.ok(matchRecordingService.recordMatch(request));
    }

    // Journal chronologique sur une période (bornes incluses)
    @GetMapping
    public ResponseEntity<List<Match>> getMatches(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                  @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(matchRepository.findByMatchDateBetweenOrderByMatchDateAscIdAsc(
                from.atStartOfDay(), to.plusDays(1).atStartOfDay().minusNanos(1)));
    }

    @GetMapping("/seasons/{seasonId}")
    public ResponseEntity<List<Match>> getSeasonMatches(@PathVariable Long seasonId) {
        return ResponseEntity.ok(matchRepository.findBySeasonIdOrderByMatchDateAscIdAsc(seasonId));
    }

    // Courbe Elo d'un joueur, du plus ancien au plus récent match
    @GetMapping("/players/{playerId}/history")
    public ResponseEntity<List<RatingHistoryView>> getPlayerHistory(@PathVariable Long playerId) {
        return ResponseEntity.ok(historyRepository.findByPlayerChronologically(playerId).stream()
                .map(RatingHistoryView::from)
                .toList());
    }

    @GetMapping("/seasons/{seasonId}/standings")
    public ResponseEntity<List<StandingView>> getSeasonStandings(@PathVariable Long seasonId) {
        return ResponseEntity.ok(snapshotRepository.findBySeasonIdOrderByRatingDesc(seasonId).stream()
                .map(StandingView::from)
                .toList());
    }
}
