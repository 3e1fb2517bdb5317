package trader.stablearb.service.statistics;

import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import trader.stablearb.model.Market;
import trader.stablearb.model.TradeAggregates;
import trader.stablearb.model.TradeStatistics;
import trader.stablearb.service.monitor.PriceMonitor;
import trader.stablearb.service.risk.RiskStateProvider;
import trader.stablearb.service.store.TradeStore;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate figures for the read API, computed from the stored records.
 */
@Service
@RequiredArgsConstructor
public class TradeStatisticsService {
    private final TradeStore tradeStore;
    private final PriceMonitor priceMonitor;
    private final Clock clock;

    @Observed(name = "arbitrage.statistics")
    public TradeStatistics statistics() {
        TradeAggregates aggregates = tradeStore.aggregate();
        Instant startOfDay = RiskStateProvider.startOfDay(clock.instant());

        Map<Market, Double> volatility = new EnumMap<>(Market.class);
        for (Market market : Market.values()) {
            volatility.put(market, priceMonitor.volatility(market));
        }

        return TradeStatistics.builder()
                .totalAttempts(aggregates.getAttempts())
                .completed(aggregates.getCompleted())
                .aborted(aggregates.getAborted())
                .partial(aggregates.getPartial())
                .awaitingReconciliation(aggregates.getAwaitingReconciliation())
                .realizedProfitLoss(aggregates.getRealizedProfitLoss())
                .realizedProfitLossToday(tradeStore.realizedProfitLossSince(startOfDay))
                .volumeToday(tradeStore.volumeSince(startOfDay))
                .successRate(aggregates.getAttempts() == 0
                        ? 0.0
                        : (double) aggregates.getCompleted() / aggregates.getAttempts())
                .volatility(volatility)
                .build();
    }
}
