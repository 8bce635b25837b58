package com.saltbet.web;

public class LedgerStoreUnavailableException extends RuntimeException {

    public LedgerStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
