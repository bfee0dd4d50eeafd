package com.tony.ladder.model.dto;

import java.time.Instant;

/**
 * Format d'erreur commun à toute l'API.
 */
public record ApiError(
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public ApiError(String code, String message, String path) {
        this(code, message, path, Instant.now());
    }
}
