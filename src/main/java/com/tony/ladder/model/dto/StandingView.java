package com.tony.ladder.model.dto;

import com.tony.ladder.model.SeasonSnapshot;

public record StandingView(Long playerId, String playerName, int rating, int winCount, int lossCount) {

    public static StandingView from(SeasonSnapshot snapshot) {
        return new StandingView(
                snapshot.getPlayer().getId(),
                snapshot.getPlayer().getName(),
                snapshot.getRating(),
                snapshot.getWinCount(),
                snapshot.getLossCount());
    }
}
