package trader.stablearb.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two quoted markets for the same asset.
 */
@Getter
@RequiredArgsConstructor
public enum Market {
    XRP_USDT("XRPUSDT", Currency.XRP, Currency.USDT),
    XRP_USDC("XRPUSDC", Currency.XRP, Currency.USDC);

    private final String exchangeSymbol;
    private final Currency baseCurrency;
    private final Currency quoteCurrency;

    public Market counterpart() {
        return this == XRP_USDT ? XRP_USDC : XRP_USDT;
    }

    /**
     * Currency that leaves the ledger when an order on this market is filled.
     */
    public Currency spentCurrency(OrderSide side) {
        return side == OrderSide.SELL ? baseCurrency : quoteCurrency;
    }

    /**
     * Currency that is credited to the ledger when an order on this market is filled.
     */
    public Currency receivedCurrency(OrderSide side) {
        return side == OrderSide.SELL ? quoteCurrency : baseCurrency;
    }
}
