package trader.stablearb.service.store;

import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Quote;
import trader.stablearb.model.TradeAggregates;
import trader.stablearb.model.trade.TradeRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store of terminal trade records, balance snapshots and quotes, plus the reads
 * the risk gate and the read API need.
 */
public interface TradeStore {

    void save(TradeRecord record);

    void saveBalanceSnapshot(Map<Currency, Balance> balances, Instant at);

    /**
     * Quotes are written in batches, a buffered quote may be lost on a crash.
     */
    void bufferQuote(Quote quote);

    /**
     * Asset volume sold by attempts detected at or after {@code since}.
     */
    BigDecimal volumeSince(Instant since);

    BigDecimal realizedProfitLossSince(Instant since);

    /**
     * Most recent records first.
     */
    List<TradeRecord> recent(int limit);

    Optional<Instant> lastClosedAt();

    TradeAggregates aggregate();

    /**
     * Id of the most recent attempt flagged for reconciliation that has not been acknowledged.
     */
    Optional<String> pendingReconciliation();

    /**
     * Appends an acknowledgement, after which the attempt no longer counts as awaiting reconciliation.
     */
    void acknowledgeReconciliation(String attemptId, Instant at);
}
