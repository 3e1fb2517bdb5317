package trader.stablearb.service.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.EngineStatus;
import trader.stablearb.model.Market;
import trader.stablearb.model.SpreadSnapshot;
import trader.stablearb.model.TradeCandidate;
import trader.stablearb.model.risk.RiskState;
import trader.stablearb.model.risk.RiskVerdict;
import trader.stablearb.model.trade.TradeAttempt;
import trader.stablearb.model.trade.TradeRecord;
import trader.stablearb.service.execution.TradeExecutor;
import trader.stablearb.service.ledger.BalanceLedger;
import trader.stablearb.service.ledger.LedgerInvariantViolationException;
import trader.stablearb.service.monitor.PriceMonitor;
import trader.stablearb.service.risk.RiskController;
import trader.stablearb.service.risk.RiskStateProvider;
import trader.stablearb.service.store.TradeStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The control loop. Ticks run one at a time on a single dedicated thread with a fixed delay between them,
 * and an approved candidate is executed on that same thread, so at most one attempt is ever in flight.
 * <p>
 * A PARTIAL attempt pauses trading until {@link #acknowledgeReconciliation()} is called. The pause is
 * restored from the store on {@link #start()}, so a restart does not lift it.
 */
@Slf4j
@Service
public class ArbitrageEngine {

    private final PriceMonitor priceMonitor;
    private final RiskStateProvider riskStateProvider;
    private final RiskController riskController;
    private final TradeExecutor tradeExecutor;
    private final BalanceLedger ledger;
    private final TradeStore tradeStore;
    private final List<TradeListener> listeners;
    private final ArbitrageProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter tradeAttemptsCounter;
    private final Timer tickTimer;

    private volatile ScheduledExecutorService scheduler;

    private volatile boolean attemptInFlight;
    private volatile String pendingReconciliation;
    private volatile String haltReason;
    private volatile Instant lastTickAt;
    private volatile Instant lastAttemptClosedAt;
    private volatile String lastRejection;

    public ArbitrageEngine(PriceMonitor priceMonitor,
                           RiskStateProvider riskStateProvider,
                           RiskController riskController,
                           TradeExecutor tradeExecutor,
                           BalanceLedger ledger,
                           TradeStore tradeStore,
                           List<TradeListener> listeners,
                           ArbitrageProperties properties,
                           Clock clock,
                           MeterRegistry meterRegistry,
                           @Qualifier("tradeAttemptsCounter") Counter tradeAttemptsCounter) {
        this.priceMonitor = priceMonitor;
        this.riskStateProvider = riskStateProvider;
        this.riskController = riskController;
        this.tradeExecutor = tradeExecutor;
        this.ledger = ledger;
        this.tradeStore = tradeStore;
        this.listeners = listeners;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.tradeAttemptsCounter = tradeAttemptsCounter;
        this.tickTimer = Timer.builder("arbitrage.engine.tick")
                .description("Duration of one engine tick, execution included")
                .register(meterRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getEngine().isAutoStart()) {
            start();
        } else {
            log.info("Engine auto start disabled, waiting for POST /api/engine/start");
        }
    }

    /**
     * Starts the loop. No-op when already running.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.debug("Engine already running");
            return;
        }
        Duration tick = properties.getEngine().getTickInterval();
        haltReason = null;
        tradeStore.pendingReconciliation().ifPresent(attemptId -> {
            pendingReconciliation = attemptId;
            log.error("Attempt {} still awaits reconciliation, trading stays paused until it is acknowledged", attemptId);
        });
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "arbitrage-engine");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::safeTick, 0, tick.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Engine started, tick interval {}", tick);
    }

    /**
     * Stops scheduling new ticks and waits for the in-flight attempt, bounded by the shutdown timeout.
     * No-op when already stopped.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!isRunning()) {
            log.debug("Engine already stopped");
            return;
        }
        ScheduledExecutorService current = scheduler;
        current.shutdown();
        Duration timeout = properties.getEngine().getShutdownTimeout();
        try {
            if (!current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("In-flight attempt did not finish within {}, engine thread abandoned", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the engine to stop");
        }
        log.info("Engine stopped");
    }

    public boolean isRunning() {
        ScheduledExecutorService current = scheduler;
        return current != null && !current.isShutdown();
    }

    /**
     * Records the acknowledgement of the flagged attempt. Trading resumes once no other flagged attempt
     * remains unacknowledged.
     *
     * @return whether a flag was actually raised
     */
    public boolean acknowledgeReconciliation() {
        String attemptId = pendingReconciliation;
        if (attemptId == null) {
            return false;
        }
        tradeStore.acknowledgeReconciliation(attemptId, clock.instant());
        pendingReconciliation = tradeStore.pendingReconciliation().orElse(null);
        log.warn("Reconciliation of attempt {} acknowledged", attemptId);
        if (pendingReconciliation != null) {
            log.error("Attempt {} still awaits reconciliation", pendingReconciliation);
        }
        return true;
    }

    public EngineStatus status() {
        return EngineStatus.builder()
                .running(isRunning())
                .attemptInFlight(attemptInFlight)
                .reconciliationPending(pendingReconciliation != null)
                .pendingReconciliationAttemptId(pendingReconciliation)
                .haltReason(haltReason)
                .lastTickAt(lastTickAt)
                .lastAttemptClosedAt(lastAttemptClosedAt)
                .lastRejection(lastRejection)
                .build();
    }

    private void safeTick() {
        try {
            tickTimer.record(() -> {
                tick();
            });
        } catch (LedgerInvariantViolationException e) {
            log.error("Ledger invariant violated, halting the engine", e);
            halt(e.getMessage());
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            log.error("Engine tick failed", e);
        }
    }

    /**
     * One pass of the loop.
     *
     * @return the record of the attempt executed in this tick, if any
     */
    public Optional<TradeRecord> tick() {
        Instant now = clock.instant();
        lastTickAt = now;

        if (pendingReconciliation != null) {
            log.debug("Attempt {} awaits reconciliation, skipping tick", pendingReconciliation);
            return Optional.empty();
        }
        Optional<SpreadSnapshot> latest = priceMonitor.latestSpread();
        if (latest.isEmpty()) {
            log.debug("No spread available yet, skipping tick");
            return Optional.empty();
        }
        SpreadSnapshot snapshot = latest.get();
        Duration freshnessBound = properties.getFeed().getFreshnessBound();
        if (snapshot.isStale(now, freshnessBound)) {
            log.debug("Spread snapshot older than {}, skipping tick", freshnessBound);
            return Optional.empty();
        }

        TradeCandidate candidate = buildCandidate(snapshot, now);
        RiskState riskState = riskStateProvider.currentState(lastAttemptClosedAt);
        RiskVerdict verdict = riskController.evaluate(candidate, riskState);
        if (!verdict.isApproved()) {
            String code = verdict.getReason().getCode();
            lastRejection = code;
            meterRegistry.counter("arbitrage.rejections", "reason", code).increment();
            log.info("Candidate rejected [{}]: {}", code, verdict.getDetail());
            return Optional.empty();
        }

        lastRejection = null;
        tradeAttemptsCounter.increment();
        TradeAttempt attempt;
        attemptInFlight = true;
        try {
            attempt = tradeExecutor.execute(candidate, verdict.getExecutableAmount());
        } finally {
            attemptInFlight = false;
        }
        TradeRecord record = attempt.toRecord();
        onTerminal(record);
        return Optional.of(record);
    }

    private TradeCandidate buildCandidate(SpreadSnapshot snapshot, Instant now) {
        Market sellMarket = snapshot.higherMarket();
        Market buyMarket = snapshot.lowerMarket();
        return TradeCandidate.builder()
                .sellMarket(sellMarket)
                .buyMarket(buyMarket)
                .requestedAmount(properties.getExecution().getNominalAmount())
                .sellPrice(snapshot.quoteFor(sellMarket).getPrice())
                .buyPrice(snapshot.quoteFor(buyMarket).getPrice())
                .snapshot(snapshot)
                .detectedAt(now)
                .build();
    }

    private void onTerminal(TradeRecord record) {
        lastAttemptClosedAt = record.getClosedAt();
        if (record.isRequiresReconciliation()) {
            pendingReconciliation = record.getId();
            log.error("Trading paused until attempt {} is reconciled", record.getId());
        }
        tradeStore.save(record);
        tradeStore.saveBalanceSnapshot(ledger.snapshot(), record.getClosedAt());
        for (TradeListener listener : listeners) {
            try {
                listener.onTradeClosed(record);
            } catch (RuntimeException e) {
                log.warn("Trade listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void halt(String reason) {
        haltReason = reason;
        ScheduledExecutorService current = scheduler;
        if (current != null) {
            // called from the engine thread, so no waiting here
            current.shutdown();
        }
    }
}
