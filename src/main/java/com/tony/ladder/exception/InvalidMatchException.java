package com.tony.ladder.exception;

public class InvalidMatchException extends LadderException {

    public InvalidMatchException(String message) {
        super(message);
    }
}
