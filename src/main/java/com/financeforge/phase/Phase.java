package com.financeforge.phase;

import java.util.List;

/**
 * Financial state of a portfolio. Recomputed from current inputs, never stored.
 */
public enum Phase {
    CRISIS(List.of(Strategy.MINIMUMS_FIRST, Strategy.AVALANCHE)),
    RECOVERY(List.of(Strategy.AVALANCHE, Strategy.BALANCE_TRANSFER_ARBITRAGE)),
    GROWTH(List.of(Strategy.BALANCE_TRANSFER_ARBITRAGE, Strategy.AVALANCHE, Strategy.SURPLUS_INVESTING));

    private final List<Strategy> strategies;

    Phase(List<Strategy> strategies) {
        this.strategies = strategies;
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }
}
