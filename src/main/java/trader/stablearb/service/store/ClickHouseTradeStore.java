package trader.stablearb.service.store;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import trader.stablearb.database.ClickHouseRepository;
import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Quote;
import trader.stablearb.model.TradeAggregates;
import trader.stablearb.model.clickhouse.BalanceSnapshotRecord;
import trader.stablearb.model.clickhouse.QuoteRecord;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeRecord;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ClickHouse backed store. Trade records are written synchronously; a record whose write fails is kept
 * in memory, counted by every read, and retried on each flush. Quotes are batched on the jdbc executor.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "clickhouse.enabled", havingValue = "true")
public class ClickHouseTradeStore implements TradeStore {
    private final ClickHouseRepository repository;
    private final Scheduler jdbcScheduler;
    private final Scheduler bufferScheduler = Schedulers.newSingle("clickhouse-flush");
    private final int quoteBatchSize;
    private final Duration flushInterval;

    private final Queue<QuoteRecord> quoteBuffer = new ConcurrentLinkedQueue<>();
    private final Queue<TradeRecord> pendingTrades = new ConcurrentLinkedQueue<>();
    private final Map<String, Instant> pendingAcks = new ConcurrentHashMap<>();
    private Disposable flusher;

    public ClickHouseTradeStore(ClickHouseRepository repository,
                                @Qualifier("jdbcExecutor") ExecutorService jdbcExecutor,
                                @Value("${clickhouse.batch-size:1000}") int quoteBatchSize,
                                @Value("${clickhouse.flush-interval:1s}") Duration flushInterval) {
        this.repository = repository;
        this.jdbcScheduler = Schedulers.fromExecutorService(jdbcExecutor);
        this.quoteBatchSize = quoteBatchSize;
        this.flushInterval = flushInterval;
    }

    @PostConstruct
    public void initBuffer() {
        flusher = Flux.interval(flushInterval, bufferScheduler)
                .onBackpressureDrop()
                .concatMap(tick -> flushAsync())
                .subscribe();
    }

    @Override
    public void save(TradeRecord record) {
        try {
            repository.saveTradeAttempt(TradeRecordMapper.toRow(record));
            log.debug("Saved trade record {}", record.getId());
        } catch (DataAccessException e) {
            log.error("Failed to save trade record {}, keeping it for retry", record.getId(), e);
            pendingTrades.add(record);
        }
    }

    @Override
    public void saveBalanceSnapshot(Map<Currency, Balance> balances, Instant at) {
        List<BalanceSnapshotRecord> rows = balances.values().stream()
                .map(b -> BalanceSnapshotRecord.builder()
                        .currency(b.getCurrency().name())
                        .free(b.getFree())
                        .locked(b.getLocked())
                        .timestamp(TradeRecordMapper.toUtc(at))
                        .build())
                .toList();
        Mono.fromRunnable(() -> repository.saveBalanceSnapshots(rows))
                .subscribeOn(jdbcScheduler)
                .subscribe(
                        v -> { },
                        e -> log.warn("Failed to save balance snapshot: {}", e.getMessage()));
    }

    @Override
    public void bufferQuote(Quote quote) {
        quoteBuffer.add(new QuoteRecord(
                quote.getMarket().name(),
                quote.getPrice(),
                quote.getVolume(),
                TradeRecordMapper.toUtc(quote.getTimestamp())));
        if (quoteBuffer.size() >= quoteBatchSize) {
            flushAsync().subscribe();
        }
    }

    @Override
    public BigDecimal volumeSince(Instant since) {
        return repository.sumVolumeSince(TradeRecordMapper.toUtc(since))
                .add(pendingSince(since).map(TradeRecord::getTradedVolume).reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Override
    public BigDecimal realizedProfitLossSince(Instant since) {
        return repository.sumProfitLossSince(TradeRecordMapper.toUtc(since))
                .add(pendingSince(since).map(TradeRecord::getRealizedProfitLoss)
                        .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Override
    public List<TradeRecord> recent(int limit) {
        return Stream.concat(
                        pendingTrades.stream(),
                        repository.findRecentTrades(limit).stream().map(TradeRecordMapper::fromRow))
                .sorted(Comparator.comparing(TradeRecord::getClosedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Instant> lastClosedAt() {
        Optional<Instant> stored = repository.findLastClosedAt().map(TradeRecordMapper::toInstant);
        Optional<Instant> pending = pendingTrades.stream()
                .map(TradeRecord::getClosedAt)
                .max(Comparator.naturalOrder());
        return Stream.of(stored, pending)
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());
    }

    @Override
    public TradeAggregates aggregate() {
        TradeAggregates stored = repository.aggregate();
        List<TradeRecord> pending = new ArrayList<>(pendingTrades);
        return TradeAggregates.builder()
                .attempts(stored.getAttempts() + pending.size())
                .completed(stored.getCompleted() + count(pending, TradeOutcome.COMPLETED))
                .aborted(stored.getAborted() + count(pending, TradeOutcome.ABORTED))
                .partial(stored.getPartial() + count(pending, TradeOutcome.PARTIAL))
                .awaitingReconciliation(unacknowledged().count())
                .realizedProfitLoss(stored.getRealizedProfitLoss().add(pending.stream()
                        .map(TradeRecord::getRealizedProfitLoss)
                        .reduce(BigDecimal.ZERO, BigDecimal::add)))
                .build();
    }

    @Override
    public Optional<String> pendingReconciliation() {
        return unacknowledged().findFirst();
    }

    @Override
    public void acknowledgeReconciliation(String attemptId, Instant at) {
        try {
            repository.saveReconciliationAck(attemptId, TradeRecordMapper.toUtc(at));
        } catch (DataAccessException e) {
            log.error("Failed to save reconciliation ack for {}, keeping it for retry", attemptId, e);
            pendingAcks.put(attemptId, at);
        }
    }

    // newest first, records that failed to save come before stored ones
    private Stream<String> unacknowledged() {
        Stream<String> unsaved = pendingTrades.stream()
                .filter(TradeRecord::isRequiresReconciliation)
                .sorted(Comparator.comparing(TradeRecord::getClosedAt).reversed())
                .map(TradeRecord::getId);
        return Stream.concat(unsaved, repository.findUnacknowledgedReconciliations().stream())
                .filter(id -> !pendingAcks.containsKey(id))
                .distinct();
    }

    private Mono<Void> flushAsync() {
        return Mono.fromRunnable(this::flush)
                .subscribeOn(jdbcScheduler)
                .onErrorResume(e -> {
                    log.warn("ClickHouse flush failed: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    synchronized void flush() {
        List<QuoteRecord> quotes = new ArrayList<>();
        QuoteRecord quote;
        while ((quote = quoteBuffer.poll()) != null) {
            quotes.add(quote);
        }
        if (!quotes.isEmpty()) {
            repository.saveQuotesBatch(quotes);
            log.debug("Saved {} quotes", quotes.size());
        }
        TradeRecord pending;
        while ((pending = pendingTrades.peek()) != null) {
            repository.saveTradeAttempt(TradeRecordMapper.toRow(pending));
            pendingTrades.remove();
            log.info("Saved previously failed trade record {}", pending.getId());
        }
        for (Map.Entry<String, Instant> ack : new ArrayList<>(pendingAcks.entrySet())) {
            repository.saveReconciliationAck(ack.getKey(), TradeRecordMapper.toUtc(ack.getValue()));
            pendingAcks.remove(ack.getKey());
            log.info("Saved previously failed reconciliation ack for {}", ack.getKey());
        }
    }

    private Stream<TradeRecord> pendingSince(Instant since) {
        return pendingTrades.stream().filter(r -> !r.getDetectedAt().isBefore(since));
    }

    private static long count(List<TradeRecord> records, TradeOutcome outcome) {
        return records.stream().filter(r -> r.getOutcome() == outcome).count();
    }

    @PreDestroy
    public void onDestroy() {
        if (flusher != null) {
            flusher.dispose();
        }
        try {
            flush();
        } catch (DataAccessException e) {
            log.error("Final ClickHouse flush failed, {} quotes and {} trade records lost",
                    quoteBuffer.size(), pendingTrades.size(), e);
        }
        bufferScheduler.dispose();
    }
}
