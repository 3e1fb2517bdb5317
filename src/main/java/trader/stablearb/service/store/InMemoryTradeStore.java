package trader.stablearb.service.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Quote;
import trader.stablearb.model.TradeAggregates;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Store used when ClickHouse is disabled. Records live for the lifetime of the process.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "clickhouse.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryTradeStore implements TradeStore {

    private final List<TradeRecord> records = new CopyOnWriteArrayList<>();
    private final Set<String> acknowledged = ConcurrentHashMap.newKeySet();
    private volatile Map<Currency, Balance> lastBalances = Collections.emptyMap();

    @Override
    public void save(TradeRecord record) {
        records.add(record);
        log.debug("Stored trade record {} ({})", record.getId(), record.getOutcome());
    }

    @Override
    public void saveBalanceSnapshot(Map<Currency, Balance> balances, Instant at) {
        lastBalances = Map.copyOf(balances);
    }

    @Override
    public void bufferQuote(Quote quote) {
        // the monitor keeps its own rolling history, nothing to persist here
    }

    @Override
    public BigDecimal volumeSince(Instant since) {
        return records.stream()
                .filter(r -> !r.getDetectedAt().isBefore(since))
                .map(TradeRecord::getTradedVolume)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public BigDecimal realizedProfitLossSince(Instant since) {
        return records.stream()
                .filter(r -> !r.getDetectedAt().isBefore(since))
                .map(TradeRecord::getRealizedProfitLoss)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public List<TradeRecord> recent(int limit) {
        List<TradeRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(TradeRecord::getClosedAt).reversed());
        return sorted.subList(0, Math.min(limit, sorted.size()));
    }

    @Override
    public Optional<Instant> lastClosedAt() {
        return records.stream()
                .map(TradeRecord::getClosedAt)
                .max(Comparator.naturalOrder());
    }

    @Override
    public TradeAggregates aggregate() {
        return TradeAggregates.builder()
                .attempts(records.size())
                .completed(count(TradeOutcome.COMPLETED))
                .aborted(count(TradeOutcome.ABORTED))
                .partial(count(TradeOutcome.PARTIAL))
                .awaitingReconciliation(records.stream().filter(this::awaitsReconciliation).count())
                .realizedProfitLoss(records.stream()
                        .map(TradeRecord::getRealizedProfitLoss)
                        .reduce(BigDecimal.ZERO, BigDecimal::add))
                .build();
    }

    @Override
    public Optional<String> pendingReconciliation() {
        return records.stream()
                .filter(this::awaitsReconciliation)
                .max(Comparator.comparing(TradeRecord::getClosedAt))
                .map(TradeRecord::getId);
    }

    @Override
    public void acknowledgeReconciliation(String attemptId, Instant at) {
        acknowledged.add(attemptId);
        log.debug("Reconciliation of {} acknowledged at {}", attemptId, at);
    }

    public Map<Currency, Balance> lastBalanceSnapshot() {
        return lastBalances;
    }

    private boolean awaitsReconciliation(TradeRecord record) {
        return record.isRequiresReconciliation() && !acknowledged.contains(record.getId());
    }

    private long count(TradeOutcome outcome) {
        return records.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
