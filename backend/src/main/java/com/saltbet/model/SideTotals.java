package com.saltbet.model;

import java.math.BigDecimal;

public record SideTotals(
        BigDecimal red,
        BigDecimal blue
) {

    public static SideTotals empty() {
        return new SideTotals(BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(2));
    }

    public BigDecimal of(Side side) {
        return side == Side.RED ? red : blue;
    }

    public BigDecimal sum() {
        return red.add(blue);
    }
}
