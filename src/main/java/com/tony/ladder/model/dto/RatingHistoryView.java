package com.tony.ladder.model.dto;

import com.tony.ladder.model.RatingHistoryEntry;

import java.time.LocalDateTime;

public record RatingHistoryView(Long matchId, Long seasonId, LocalDateTime matchDate, int rating) {

    public static RatingHistoryView from(RatingHistoryEntry entry) {
        return new RatingHistoryView(
                entry.getMatch().getId(),
                entry.getMatch().getSeason().getId(),
                entry.getMatch().getMatchDate(),
                entry.getRating());
    }
}
