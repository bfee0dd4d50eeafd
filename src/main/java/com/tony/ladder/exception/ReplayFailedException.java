package com.tony.ladder.exception;

/**
 * Un rejeu a échoué en cours de route. La transaction a été annulée :
 * les tables dérivées sont restées dans leur état d'avant le rejeu.
 */
public class ReplayFailedException extends LadderException {

    public ReplayFailedException(String replay, Throwable cause) {
        super(String.format("Rejeu '%s' annulé : %s", replay, cause.getMessage()), cause);
    }
}
