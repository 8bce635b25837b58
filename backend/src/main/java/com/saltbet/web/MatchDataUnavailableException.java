package com.saltbet.web;

public class MatchDataUnavailableException extends RuntimeException {

    public MatchDataUnavailableException(String message) {
        super(message);
    }

    public MatchDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
