package trader.stablearb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;
import trader.stablearb.service.ledger.BalanceLedger;
import trader.stablearb.service.monitor.PriceMonitor;
import trader.stablearb.service.store.TradeStore;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PriceLoggerService {

    private final PriceMonitor priceMonitor;
    private final BalanceLedger ledger;
    private final TradeStore tradeStore;
    private final Clock clock;

    /**
     * Logs the current spread and balances and stores a balance snapshot.
     */
    @Scheduled(fixedRateString = "${arbitrage.ledger.snapshot-interval:PT1M}",
            initialDelayString = "${arbitrage.ledger.snapshot-interval:PT1M}")
    public void logSpreadAndBalances() {
        log.info("=== Scheduled spread logging ===");
        priceMonitor.latestSpread().ifPresentOrElse(
                snapshot -> log.info("Spread {}% (USDT {} / USDC {})",
                        snapshot.getSpreadPercentage(),
                        snapshot.getQuoteA().getPrice(),
                        snapshot.getQuoteB().getPrice()),
                () -> log.info("Spread not available yet"));

        Map<Currency, Balance> balances = ledger.snapshot();
        balances.values().forEach(b -> log.info("{}: free {} locked {}",
                b.getCurrency(), b.getFree().toPlainString(), b.getLocked().toPlainString()));
        tradeStore.saveBalanceSnapshot(balances, clock.instant());
    }
}
