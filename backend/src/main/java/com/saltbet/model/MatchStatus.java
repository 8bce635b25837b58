package com.saltbet.model;

public enum MatchStatus {
    OPEN,
    LOCKED,
    SETTLED
}
