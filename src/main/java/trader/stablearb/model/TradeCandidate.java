package trader.stablearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A detected opportunity sized for execution: sell on {@code sellMarket}, buy back on {@code buyMarket}.
 */
@Value
@Builder
public class TradeCandidate {
    Market sellMarket;
    Market buyMarket;
    BigDecimal requestedAmount;
    BigDecimal sellPrice;
    BigDecimal buyPrice;
    SpreadSnapshot snapshot;
    Instant detectedAt;

    public BigDecimal getSpreadPercentage() {
        return snapshot.getSpreadPercentage();
    }

    public Currency getSellCurrency() {
        return sellMarket.spentCurrency(OrderSide.SELL);
    }
}
