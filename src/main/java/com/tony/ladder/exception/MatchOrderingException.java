package com.tony.ladder.exception;

/**
 * Deux matchs impossibles à départager chronologiquement (même date, pas de séquence d'insertion).
 */
public class MatchOrderingException extends LadderException {

    public MatchOrderingException(String message) {
        super(message);
    }
}
