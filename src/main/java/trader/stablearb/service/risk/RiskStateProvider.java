package trader.stablearb.service.risk;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Market;
import trader.stablearb.model.risk.RiskState;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeRecord;
import trader.stablearb.service.ledger.BalanceLedger;
import trader.stablearb.service.monitor.PriceMonitor;
import trader.stablearb.service.store.TradeStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles the {@link RiskState} for one decision from the ledger, the monitor and the trade store.
 */
@Service
@RequiredArgsConstructor
public class RiskStateProvider {

    private final BalanceLedger ledger;
    private final PriceMonitor priceMonitor;
    private final TradeStore tradeStore;
    private final ArbitrageProperties properties;
    private final Clock clock;

    /**
     * @param lastAttemptClosedAt close time of the engine's last attempt, {@code null} to fall back to the store
     */
    public RiskState currentState(Instant lastAttemptClosedAt) {
        Instant now = clock.instant();
        Instant startOfDay = startOfDay(now);

        RiskState.RiskStateBuilder builder = RiskState.builder()
                .asOf(now)
                .volumeTradedToday(tradeStore.volumeSince(startOfDay))
                .realizedProfitLossToday(tradeStore.realizedProfitLossSince(startOfDay))
                .successRateRecent(successRate(tradeStore.recent(properties.getRisk().getSuccessRateWindow())))
                .cooldownRemaining(cooldownRemaining(now, Optional.ofNullable(lastAttemptClosedAt).or(tradeStore::lastClosedAt)));

        for (Map.Entry<Currency, Balance> entry : ledger.snapshot().entrySet()) {
            builder.freeBalance(entry.getKey(), entry.getValue().getFree());
        }
        for (Market market : Market.values()) {
            builder.volatility(market, priceMonitor.volatility(market));
        }
        return builder.build();
    }

    public static Instant startOfDay(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    static double successRate(List<TradeRecord> records) {
        if (records.isEmpty()) {
            return 1.0;
        }
        long completed = records.stream().filter(r -> r.getOutcome() == TradeOutcome.COMPLETED).count();
        return (double) completed / records.size();
    }

    private Duration cooldownRemaining(Instant now, Optional<Instant> lastClosedAt) {
        Duration cooldown = properties.getRisk().getCooldown();
        return lastClosedAt
                .map(closedAt -> cooldown.minus(Duration.between(closedAt, now)))
                .filter(remaining -> remaining.compareTo(Duration.ZERO) > 0)
                .orElse(Duration.ZERO);
    }
}
