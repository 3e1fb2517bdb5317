package trader.stablearb.service.engine;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.Quote;
import trader.stablearb.model.SpreadSnapshot;
import trader.stablearb.model.trade.OrderFill;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeRecord;
import trader.stablearb.service.execution.OrderPlacementService;
import trader.stablearb.service.execution.TradeExecutor;
import trader.stablearb.service.ledger.BalanceLedger;
import trader.stablearb.service.monitor.PriceMonitor;
import trader.stablearb.service.risk.RiskController;
import trader.stablearb.service.risk.RiskStateProvider;
import trader.stablearb.service.store.InMemoryTradeStore;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static trader.stablearb.model.trade.TradeRecordFixtures.partial;

@ExtendWith(MockitoExtension.class)
class ArbitrageEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private PriceMonitor priceMonitor;

    private SimpleMeterRegistry meterRegistry;
    private ArbitrageProperties properties;
    private BalanceLedger ledger;
    private InMemoryTradeStore tradeStore;
    private List<TradeRecord> notified;
    private Clock clock;
    private ArbitrageEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new ArbitrageProperties();
        properties.getRisk().setCooldown(Duration.ZERO);
        properties.getExecution().setTakerFeeRate(BigDecimal.ZERO);
        properties.getExecution().setOrderTimeout(Duration.ofMillis(100));
        properties.getExecution().setBuyMaxAttempts(2);
        properties.getExecution().setBuyInitialBackoff(Duration.ofMillis(1));
        properties.getExecution().setBuyMaxBackoff(Duration.ofMillis(5));
        properties.getEngine().setTickInterval(Duration.ofMillis(5));
        properties.getEngine().setShutdownTimeout(Duration.ofSeconds(5));
        ledger = new BalanceLedger(Map.of(
                Currency.XRP, new BigDecimal("100000"),
                Currency.USDT, new BigDecimal("100000"),
                Currency.USDC, new BigDecimal("100000")));
        tradeStore = new InMemoryTradeStore();
        notified = new CopyOnWriteArrayList<>();
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    private ArbitrageEngine engine(OrderPlacementService placement) {
        RiskStateProvider riskStateProvider = new RiskStateProvider(ledger, priceMonitor, tradeStore, properties, clock);
        TradeExecutor executor = new TradeExecutor(placement, ledger, properties, clock, meterRegistry,
                meterRegistry.counter("arbitrage.partial.failures"));
        TradeListener listener = notified::add;
        engine = new ArbitrageEngine(priceMonitor, riskStateProvider, new RiskController(properties), executor,
                ledger, tradeStore, List.of(listener), properties, clock, meterRegistry,
                meterRegistry.counter("arbitrage.attempts"));
        return engine;
    }

    private static SpreadSnapshot spread(String usdt, String usdc, Instant quotedAt) {
        return SpreadSnapshot.of(
                Quote.builder().market(Market.XRP_USDT).price(new BigDecimal(usdt)).timestamp(quotedAt).build(),
                Quote.builder().market(Market.XRP_USDC).price(new BigDecimal(usdc)).timestamp(quotedAt).build(),
                quotedAt);
    }

    private static OrderPlacementService filling(AtomicInteger submissions) {
        return (market, side, amount) -> {
            submissions.incrementAndGet();
            return Mono.just(OrderFill.builder()
                    .orderId("test")
                    .filledAmount(amount)
                    .filledPrice(side == OrderSide.SELL ? new BigDecimal("0.52") : new BigDecimal("0.50"))
                    .build());
        };
    }

    @Test
    void skipsTheTickWhenQuotesAreStale() {
        AtomicInteger submissions = new AtomicInteger();
        ArbitrageEngine engine = engine(filling(submissions));
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.52", "0.50", NOW.minusSeconds(120))));

        Optional<TradeRecord> result = engine.tick();

        assertThat(result).isEmpty();
        assertThat(submissions).hasValue(0);
        assertThat(tradeStore.recent(10)).isEmpty();
        assertThat(meterRegistry.find("arbitrage.rejections").counters()).isEmpty();
    }

    @Test
    void skipsTheTickWhenNoSpreadIsAvailable() {
        ArbitrageEngine engine = engine(filling(new AtomicInteger()));
        when(priceMonitor.latestSpread()).thenReturn(Optional.empty());

        assertThat(engine.tick()).isEmpty();
    }

    @Test
    void executesAnApprovedCandidateAndPersistsTheRecord() {
        ArbitrageEngine engine = engine(filling(new AtomicInteger()));
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.52", "0.50", NOW)));

        TradeRecord record = engine.tick().orElseThrow();

        assertThat(record.getOutcome()).isEqualTo(TradeOutcome.COMPLETED);
        assertThat(record.getSellMarket()).isEqualTo(Market.XRP_USDT);
        assertThat(record.getBuyMarket()).isEqualTo(Market.XRP_USDC);
        assertThat(tradeStore.recent(10)).containsExactly(record);
        assertThat(tradeStore.lastBalanceSnapshot()).isEqualTo(ledger.snapshot());
        assertThat(notified).containsExactly(record);
        assertThat(meterRegistry.counter("arbitrage.attempts").count()).isEqualTo(1.0);
        assertThat(engine.status().getLastAttemptClosedAt()).isEqualTo(NOW);
    }

    @Test
    void countsRejectionsPerReason() {
        ArbitrageEngine engine = engine(filling(new AtomicInteger()));
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.50", "0.50", NOW)));

        assertThat(engine.tick()).isEmpty();
        assertThat(engine.tick()).isEmpty();

        assertThat(meterRegistry.counter("arbitrage.rejections", "reason", "spread_too_small").count()).isEqualTo(2.0);
        assertThat(engine.status().getLastRejection()).isEqualTo("spread_too_small");
    }

    @Test
    void partialFailurePausesTradingUntilAcknowledged() {
        // given
        AtomicBoolean buyWorks = new AtomicBoolean(false);
        ArbitrageEngine engine = engine((market, side, amount) -> {
            if (side == OrderSide.BUY && !buyWorks.get()) {
                return Mono.never();
            }
            return Mono.just(OrderFill.builder()
                    .orderId("test")
                    .filledAmount(amount)
                    .filledPrice(side == OrderSide.SELL ? new BigDecimal("0.52") : new BigDecimal("0.50"))
                    .build());
        });
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.52", "0.50", NOW)));

        // when
        TradeRecord partial = engine.tick().orElseThrow();
        buyWorks.set(true);

        // then
        assertThat(partial.getOutcome()).isEqualTo(TradeOutcome.PARTIAL);
        assertThat(partial.isRequiresReconciliation()).isTrue();
        assertThat(engine.status().isReconciliationPending()).isTrue();
        assertThat(engine.status().getPendingReconciliationAttemptId()).isEqualTo(partial.getId());
        assertThat(engine.tick()).isEmpty();

        assertThat(engine.acknowledgeReconciliation()).isTrue();
        assertThat(engine.acknowledgeReconciliation()).isFalse();
        assertThat(engine.tick()).get().extracting(TradeRecord::getOutcome).isEqualTo(TradeOutcome.COMPLETED);
    }

    @Test
    void startAndStopAreIdempotent() {
        ArbitrageEngine engine = engine(filling(new AtomicInteger()));

        engine.stop();
        assertThat(engine.isRunning()).isFalse();

        engine.start();
        engine.start();
        assertThat(engine.isRunning()).isTrue();

        engine.stop();
        engine.stop();
        assertThat(engine.isRunning()).isFalse();

        engine.start();
        assertThat(engine.isRunning()).isTrue();
    }

    @Test
    void neverRunsTwoAttemptsAtOnce() throws InterruptedException {
        // given
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger sells = new AtomicInteger();
        ArbitrageEngine engine = engine((market, side, amount) -> Mono.defer(() -> {
                    int current = inFlight.incrementAndGet();
                    maxInFlight.accumulateAndGet(current, Math::max);
                    if (side == OrderSide.SELL) {
                        sells.incrementAndGet();
                    }
                    return Mono.just(OrderFill.builder()
                            .orderId("test")
                            .filledAmount(amount)
                            .filledPrice(side == OrderSide.SELL ? new BigDecimal("0.52") : new BigDecimal("0.50"))
                            .build());
                })
                .delayElement(Duration.ofMillis(10))
                .doOnNext(fill -> inFlight.decrementAndGet()));
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.52", "0.50", NOW)));

        // when
        engine.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (sells.get() < 5 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        engine.stop();

        // then
        assertThat(sells.get()).isGreaterThanOrEqualTo(5);
        assertThat(maxInFlight).hasValue(1);
        assertThat(tradeStore.recent(100)).allSatisfy(r -> assertThat(r.getOutcome()).isEqualTo(TradeOutcome.COMPLETED));
    }

    @Test
    void stopWaitsForTheAttemptInFlight() throws InterruptedException {
        // given
        CountDownLatch sellSubmitted = new CountDownLatch(1);
        ArbitrageEngine engine = engine((market, side, amount) -> {
            sellSubmitted.countDown();
            return Mono.just(OrderFill.builder()
                            .orderId("test")
                            .filledAmount(amount)
                            .filledPrice(side == OrderSide.SELL ? new BigDecimal("0.52") : new BigDecimal("0.50"))
                            .build())
                    .delayElement(Duration.ofMillis(30));
        });
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.52", "0.50", NOW)));

        // when
        engine.start();
        assertThat(sellSubmitted.await(5, TimeUnit.SECONDS)).isTrue();
        engine.stop();

        // then
        List<TradeRecord> records = tradeStore.recent(100);
        assertThat(records).isNotEmpty();
        assertThat(records).allSatisfy(r -> assertThat(r.getOutcome()).isEqualTo(TradeOutcome.COMPLETED));
        assertThat(engine.status().isAttemptInFlight()).isFalse();
    }

    @Test
    void unacknowledgedPartialFromAPreviousRunKeepsTradingPaused() {
        // given
        TradeRecord flagged = partial(NOW.minusSeconds(600), "100");
        tradeStore.save(flagged);
        AtomicInteger submissions = new AtomicInteger();
        ArbitrageEngine engine = engine(filling(submissions));

        // when
        engine.start();
        engine.stop();

        // then
        assertThat(engine.status().isReconciliationPending()).isTrue();
        assertThat(engine.status().getPendingReconciliationAttemptId()).isEqualTo(flagged.getId());
        assertThat(engine.tick()).isEmpty();
        assertThat(submissions).hasValue(0);

        assertThat(engine.acknowledgeReconciliation()).isTrue();
        assertThat(tradeStore.pendingReconciliation()).isEmpty();
        assertThat(tradeStore.aggregate().getAwaitingReconciliation()).isZero();

        ArbitrageEngine restarted = engine(filling(submissions));
        restarted.start();
        restarted.stop();
        assertThat(restarted.status().isReconciliationPending()).isFalse();
    }

    @Test
    void ledgerInvariantViolationHaltsTheEngine() throws InterruptedException {
        // given
        AtomicInteger submissions = new AtomicInteger();
        ArbitrageEngine engine = engine((market, side, amount) -> {
            submissions.incrementAndGet();
            // a buy this expensive cannot be covered by any free balance
            return Mono.just(OrderFill.builder()
                    .orderId("test")
                    .filledAmount(amount)
                    .filledPrice(side == OrderSide.SELL ? new BigDecimal("0.52") : new BigDecimal("5000"))
                    .build());
        });
        when(priceMonitor.latestSpread()).thenReturn(Optional.of(spread("0.52", "0.50", NOW)));

        // when
        engine.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (engine.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        // then
        assertThat(engine.isRunning()).isFalse();
        assertThat(engine.status().getHaltReason()).contains("exceeds available funds");
        assertThat(submissions).hasValue(2);
    }
}
