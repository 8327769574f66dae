package com.financeforge.phase;

/**
 * Debt strategies a phase can make applicable.
 */
public enum Strategy {
    /** Cover every contractual minimum before anything else. */
    MINIMUMS_FIRST,
    /** Direct surplus funds at the highest-rate balance. */
    AVALANCHE,
    /** Move balances from high-rate to low-rate facilities. */
    BALANCE_TRANSFER_ARBITRAGE,
    /** Redirect surplus beyond debt service to savings or investments. */
    SURPLUS_INVESTING
}
