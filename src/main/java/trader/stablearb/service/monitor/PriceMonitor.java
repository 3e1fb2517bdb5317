package trader.stablearb.service.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.Market;
import trader.stablearb.model.Quote;
import trader.stablearb.model.SpreadSnapshot;
import trader.stablearb.service.store.TradeStore;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls both markets on independent schedules and publishes the latest quote pair and spread.
 * <p>
 * A failed poll leaves the previous quote in place with its original timestamp, so a dead feed
 * shows up downstream as a stale snapshot rather than as an explicit error.
 */
@Slf4j
@Service
public class PriceMonitor {

    private final PriceFeed priceFeed;
    private final TradeStore tradeStore;
    private final ArbitrageProperties.Feed feedProperties;
    private final Clock clock;
    private final Counter pollFailures;

    private final Map<Market, QuoteHistory> histories = new EnumMap<>(Market.class);
    private final Map<Market, AtomicReference<Quote>> latestQuotes = new EnumMap<>(Market.class);
    private final AtomicReference<SpreadSnapshot> latestSnapshot = new AtomicReference<>();
    private final Object snapshotLock = new Object();
    private final Scheduler pollScheduler = Schedulers.newParallel("price-poll", Market.values().length);
    private Disposable.Composite pollers = Disposables.composite();

    public PriceMonitor(PriceFeed priceFeed,
                        TradeStore tradeStore,
                        ArbitrageProperties properties,
                        Clock clock,
                        MeterRegistry meterRegistry) {
        this.priceFeed = priceFeed;
        this.tradeStore = tradeStore;
        this.feedProperties = properties.getFeed();
        this.clock = clock;
        this.pollFailures = Counter.builder("price.feed.failures")
                .description("Failed or timed out price polls")
                .register(meterRegistry);

        for (Market market : Market.values()) {
            histories.put(market, new QuoteHistory(feedProperties.getHistoryCapacity(), feedProperties.getHistoryWindow()));
            latestQuotes.put(market, new AtomicReference<>());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (pollers.size() > 0) {
            return;
        }
        if (pollers.isDisposed()) {
            pollers = Disposables.composite();
        }
        for (Market market : Market.values()) {
            Duration interval = feedProperties.pollIntervalFor(market);
            log.info("Starting price poller for {} every {}", market, interval);
            pollers.add(Flux.interval(Duration.ZERO, interval, pollScheduler)
                    .onBackpressureDrop(tick -> log.debug("Skipping poll of {}, previous one still running", market))
                    .concatMap(tick -> pollOnce(market), 1)
                    .subscribe());
        }
    }

    public synchronized void stop() {
        pollers.dispose();
        log.info("Price pollers stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
        pollScheduler.dispose();
    }

    /**
     * One poll of one market. Never completes with an error.
     */
    public Mono<Void> pollOnce(Market market) {
        return priceFeed.getQuote(market)
                .timeout(feedProperties.getTimeout())
                .doOnNext(this::onQuote)
                .onErrorResume(error -> {
                    pollFailures.increment();
                    if (error instanceof TimeoutException) {
                        log.warn("Price poll for {} timed out after {}", market, feedProperties.getTimeout());
                    } else {
                        log.warn("Price poll for {} failed: {}", market, error.getMessage());
                    }
                    return Mono.empty();
                })
                .then();
    }

    void onQuote(Quote quote) {
        Market market = quote.getMarket();
        histories.get(market).append(quote);
        publish(quote);
        log.debug("Latest price for {}: {} at {}", market, quote.getPrice(), quote.getTimestamp());
        tradeStore.bufferQuote(quote);
    }

    /**
     * Stores the quote and recomputes the snapshot as one step, so the published snapshot always
     * pairs the latest quotes of both markets even when the two pollers report at the same time.
     */
    private void publish(Quote quote) {
        synchronized (snapshotLock) {
            latestQuotes.get(quote.getMarket()).set(quote);
            Quote usdt = latestQuotes.get(Market.XRP_USDT).get();
            Quote usdc = latestQuotes.get(Market.XRP_USDC).get();
            if (usdt != null && usdc != null) {
                latestSnapshot.set(SpreadSnapshot.of(usdt, usdc, clock.instant()));
            }
        }
    }

    public Optional<SpreadSnapshot> latestSpread() {
        return Optional.ofNullable(latestSnapshot.get());
    }

    public Optional<Quote> latestQuote(Market market) {
        return Optional.ofNullable(latestQuotes.get(market).get());
    }

    public double volatility(Market market) {
        QuoteHistory history = histories.get(market);
        history.prune(clock.instant());
        return history.volatility();
    }

    public List<Quote> history(Market market) {
        return histories.get(market).snapshot();
    }
}
