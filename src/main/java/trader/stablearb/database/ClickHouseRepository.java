package trader.stablearb.database;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.BeanPropertyRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import trader.stablearb.model.TradeAggregates;
import trader.stablearb.model.clickhouse.BalanceSnapshotRecord;
import trader.stablearb.model.clickhouse.QuoteRecord;
import trader.stablearb.model.clickhouse.TradeAttemptRecord;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Low level ClickHouse access. All timestamps are UTC.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "clickhouse.enabled", havingValue = "true")
public class ClickHouseRepository {
    private static final String QUOTE_SQL =
            "INSERT INTO quotes (market, price, volume, timestamp) VALUES (?, ?, ?, ?) " +
                    "SETTINGS input_format_allow_errors_ratio = 0.1";

    private static final String BALANCE_SQL =
            "INSERT INTO balance_snapshots (currency, free, locked, timestamp) VALUES (?, ?, ?, ?)";

    private static final String TRADE_SQL =
            "INSERT INTO trade_attempts " +
                    "(id, detected_at, closed_at, sell_market, buy_market, requested_amount, " +
                    "expected_spread_percent, final_state, outcome, sell_filled_amount, sell_filled_price, " +
                    "buy_filled_amount, buy_filled_price, buy_submissions, realized_profit_loss, " +
                    "failure_reason, requires_reconciliation, transitions) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String ACK_SQL =
            "INSERT INTO reconciliation_acks (attempt_id, acknowledged_at) VALUES (?, ?)";

    private static final String UNACKNOWLEDGED = "id NOT IN (SELECT attempt_id FROM reconciliation_acks)";

    private static final String SELECT_RECENT_TRADES_SQL =
            "SELECT * FROM trade_attempts ORDER BY closed_at DESC LIMIT ?";
    private static final String SELECT_VOLUME_SQL =
            "SELECT sum(sell_filled_amount) FROM trade_attempts WHERE detected_at >= ?";
    private static final String SELECT_PNL_SQL =
            "SELECT sum(realized_profit_loss) FROM trade_attempts WHERE detected_at >= ?";
    private static final String SELECT_LAST_CLOSED_SQL =
            "SELECT max(closed_at) AS last_closed, count() AS n FROM trade_attempts";
    private static final String SELECT_AGGREGATES_SQL =
            "SELECT count() AS attempts, " +
                    "countIf(outcome = 'COMPLETED') AS completed, " +
                    "countIf(outcome = 'ABORTED') AS aborted, " +
                    "countIf(outcome = 'PARTIAL') AS partial, " +
                    "countIf(requires_reconciliation = 1 AND " + UNACKNOWLEDGED + ") AS flagged, " +
                    "sum(realized_profit_loss) AS pnl " +
                    "FROM trade_attempts";
    private static final String SELECT_UNACKNOWLEDGED_SQL =
            "SELECT id FROM trade_attempts WHERE requires_reconciliation = 1 AND " + UNACKNOWLEDGED +
                    " ORDER BY closed_at DESC";

    private final JdbcTemplate clickHouseJdbcTemplate;

    public void saveQuotesBatch(List<QuoteRecord> records) {
        log.debug("Saving quote batch {}", records.size());
        List<Object[]> args = records.stream()
                .map(r -> new Object[]{r.getMarket(), r.getPrice(), r.getVolume(), r.getTimestamp()})
                .toList();
        clickHouseJdbcTemplate.batchUpdate(QUOTE_SQL, args);
    }

    public void saveBalanceSnapshots(List<BalanceSnapshotRecord> records) {
        List<Object[]> args = records.stream()
                .map(r -> new Object[]{r.getCurrency(), r.getFree(), r.getLocked(), r.getTimestamp()})
                .toList();
        clickHouseJdbcTemplate.batchUpdate(BALANCE_SQL, args);
    }

    public void saveTradeAttempt(TradeAttemptRecord r) {
        clickHouseJdbcTemplate.update(TRADE_SQL,
                r.getId(),
                r.getDetectedAt(),
                r.getClosedAt(),
                r.getSellMarket(),
                r.getBuyMarket(),
                r.getRequestedAmount(),
                r.getExpectedSpreadPercent(),
                r.getFinalState(),
                r.getOutcome(),
                r.getSellFilledAmount(),
                r.getSellFilledPrice(),
                r.getBuyFilledAmount(),
                r.getBuyFilledPrice(),
                r.getBuySubmissions(),
                r.getRealizedProfitLoss(),
                r.getFailureReason(),
                r.isRequiresReconciliation() ? 1 : 0,
                r.getTransitions());
    }

    public List<TradeAttemptRecord> findRecentTrades(int limit) {
        return clickHouseJdbcTemplate.query(
                SELECT_RECENT_TRADES_SQL,
                new BeanPropertyRowMapper<>(TradeAttemptRecord.class),
                limit);
    }

    public BigDecimal sumVolumeSince(LocalDateTime since) {
        return orZero(clickHouseJdbcTemplate.queryForObject(SELECT_VOLUME_SQL, BigDecimal.class, since));
    }

    public BigDecimal sumProfitLossSince(LocalDateTime since) {
        return orZero(clickHouseJdbcTemplate.queryForObject(SELECT_PNL_SQL, BigDecimal.class, since));
    }

    public Optional<LocalDateTime> findLastClosedAt() {
        // max() over an empty table yields the epoch, not NULL
        return clickHouseJdbcTemplate.queryForObject(SELECT_LAST_CLOSED_SQL, (rs, rowNum) ->
                rs.getLong("n") == 0
                        ? Optional.empty()
                        : Optional.of(rs.getObject("last_closed", LocalDateTime.class)));
    }

    public TradeAggregates aggregate() {
        return clickHouseJdbcTemplate.queryForObject(SELECT_AGGREGATES_SQL, (rs, rowNum) ->
                TradeAggregates.builder()
                        .attempts(rs.getLong("attempts"))
                        .completed(rs.getLong("completed"))
                        .aborted(rs.getLong("aborted"))
                        .partial(rs.getLong("partial"))
                        .awaitingReconciliation(rs.getLong("flagged"))
                        .realizedProfitLoss(orZero(rs.getBigDecimal("pnl")))
                        .build());
    }

    public void saveReconciliationAck(String attemptId, LocalDateTime acknowledgedAt) {
        clickHouseJdbcTemplate.update(ACK_SQL, attemptId, acknowledgedAt);
    }

    /**
     * Ids of flagged attempts without an acknowledgement, newest first.
     */
    public List<String> findUnacknowledgedReconciliations() {
        return clickHouseJdbcTemplate.queryForList(SELECT_UNACKNOWLEDGED_SQL, String.class);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
