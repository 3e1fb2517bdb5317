package trader.stablearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class TradeStatistics {
    long totalAttempts;
    long completed;
    long aborted;
    long partial;
    long awaitingReconciliation;
    BigDecimal realizedProfitLoss;
    BigDecimal realizedProfitLossToday;
    BigDecimal volumeToday;
    double successRate;
    Map<Market, Double> volatility;
}
