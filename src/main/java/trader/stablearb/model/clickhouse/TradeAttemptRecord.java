package trader.stablearb.model.clickhouse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Flat row of the {@code trade_attempts} table.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class TradeAttemptRecord {
    private String id;
    private LocalDateTime detectedAt;
    private LocalDateTime closedAt;
    private String sellMarket;
    private String buyMarket;
    private BigDecimal requestedAmount;
    private BigDecimal expectedSpreadPercent;
    private String finalState;
    private String outcome;
    private BigDecimal sellFilledAmount;
    private BigDecimal sellFilledPrice;
    private BigDecimal buyFilledAmount;
    private BigDecimal buyFilledPrice;
    private int buySubmissions;
    private BigDecimal realizedProfitLoss;
    private String failureReason;
    private boolean requiresReconciliation;
    private String transitions;
}
