package com.saltbet.model;

/**
 * The two competitor colours a stake can back.
 */
public enum Side {
    RED,
    BLUE;

    public Side opposite() {
        return this == RED ? BLUE : RED;
    }
}
