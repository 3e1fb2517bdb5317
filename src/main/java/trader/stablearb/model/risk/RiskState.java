package trader.stablearb.model.risk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Inputs to a single risk decision, recomputed for every candidate and never persisted.
 */
@Value
@Builder
public class RiskState {
    /** Instant the decision is made at; staleness is judged against it. */
    Instant asOf;
    BigDecimal volumeTradedToday;
    BigDecimal realizedProfitLossToday;
    @Singular("freeBalance")
    Map<Currency, BigDecimal> freeBalances;
    @Singular("volatility")
    Map<Market, Double> volatilities;
    double successRateRecent;
    Duration cooldownRemaining;

    public BigDecimal freeBalance(Currency currency) {
        return freeBalances.getOrDefault(currency, BigDecimal.ZERO);
    }

    public double volatility(Market market) {
        return volatilities.getOrDefault(market, 0.0);
    }
}
