package trader.stablearb.model;

/**
 * Currencies held by the ledger. XRP is the traded asset, the two stablecoins
 * are the quote currencies of the two markets and are valued at par.
 */
public enum Currency {
    XRP,
    USDT,
    USDC;

    public boolean isStablecoin() {
        return this != XRP;
    }
}
