package com.saltbet.service;

import com.saltbet.model.SideTotals;

/**
 * Receives the side totals each time the broadcast throttle fires.
 */
@FunctionalInterface
public interface TotalsListener {

    void onTotals(SideTotals totals);
}
