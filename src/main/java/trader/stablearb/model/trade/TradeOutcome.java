package trader.stablearb.model.trade;

public enum TradeOutcome {
    /** Both legs filled. */
    COMPLETED,
    /** Sell leg failed, no funds left the ledger. */
    ABORTED,
    /** Sell leg filled, buy leg did not; funds are held in the counter-currency. */
    PARTIAL
}
