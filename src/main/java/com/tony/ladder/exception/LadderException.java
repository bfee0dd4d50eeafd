package com.tony.ladder.exception;

/**
 * Racine des erreurs métier du classement. Toujours remontée, jamais avalée.
 */
public abstract class LadderException extends RuntimeException {

    protected LadderException(String message) {
        super(message);
    }

    protected LadderException(String message, Throwable cause) {
        super(message, cause);
    }
}
