package trader.stablearb.model.trade;

import lombok.Builder;
import lombok.Value;
import trader.stablearb.model.Market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Immutable terminal record of a {@link TradeAttempt}, as handed to the store.
 */
@Value
@Builder
public class TradeRecord {
    String id;
    Instant detectedAt;
    Instant closedAt;
    Market sellMarket;
    Market buyMarket;
    BigDecimal requestedAmount;
    BigDecimal expectedSpreadPercentage;
    TradeState finalState;
    TradeOutcome outcome;
    LegRecord sellLeg;
    LegRecord buyLeg;
    BigDecimal realizedProfitLoss;
    String failureReason;
    boolean requiresReconciliation;
    List<StateTransition> transitions;

    /**
     * Asset amount that actually changed hands on the sell leg; this is what counts against the daily volume limit.
     */
    public BigDecimal getTradedVolume() {
        return sellLeg.getFilledAmount() == null ? BigDecimal.ZERO : sellLeg.getFilledAmount();
    }
}
