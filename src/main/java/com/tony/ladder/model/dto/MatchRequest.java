package com.tony.ladder.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchRequest {

    @NotNull(message = "Le vainqueur est requis")
    private Long winnerId;

    @NotNull(message = "Le perdant est requis")
    private Long loserId;

    @NotNull(message = "La saison est requise")
    private Long seasonId;

    @NotNull(message = "La date du match est requise")
    private LocalDateTime matchDate;

    private boolean bonus;
}
