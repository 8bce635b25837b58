package com.saltbet.service;

import java.util.Objects;

/**
 * Match identity tokens of the form {@code <blueId>-<redId>-<freshness>}.
 * Two tokens refer to the same pairing when their first two fields agree.
 */
public final class BoutToken {

    private static final String SEPARATOR = "-";

    private BoutToken() {
    }

    public static String of(long fighterBlueId, long fighterRedId, String freshnessToken) {
        return fighterBlueId + SEPARATOR + fighterRedId + SEPARATOR + freshnessToken;
    }

    public static boolean samePairing(String first, String second) {
        if (first == null || second == null) {
            return false;
        }
        String[] a = first.split(SEPARATOR, 3);
        String[] b = second.split(SEPARATOR, 3);
        if (a.length < 2 || b.length < 2) {
            return false;
        }
        return Objects.equals(a[0], b[0]) && Objects.equals(a[1], b[1]);
    }
}
