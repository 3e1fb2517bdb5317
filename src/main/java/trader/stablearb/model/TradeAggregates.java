package trader.stablearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TradeAggregates {
    long attempts;
    long completed;
    long aborted;
    long partial;
    long awaitingReconciliation;
    BigDecimal realizedProfitLoss;

    public static TradeAggregates empty() {
        return TradeAggregates.builder().realizedProfitLoss(BigDecimal.ZERO).build();
    }
}
