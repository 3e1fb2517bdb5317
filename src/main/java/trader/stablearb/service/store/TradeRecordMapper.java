package trader.stablearb.service.store;

import lombok.experimental.UtilityClass;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.clickhouse.TradeAttemptRecord;
import trader.stablearb.model.trade.LegRecord;
import trader.stablearb.model.trade.LegState;
import trader.stablearb.model.trade.StateTransition;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeRecord;
import trader.stablearb.model.trade.TradeState;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts between {@link TradeRecord} and the flat {@code trade_attempts} row.
 * Transitions are stored as {@code FROM->TO@instant} joined by {@code ;}.
 */
@UtilityClass
class TradeRecordMapper {

    TradeAttemptRecord toRow(TradeRecord record) {
        return TradeAttemptRecord.builder()
                .id(record.getId())
                .detectedAt(toUtc(record.getDetectedAt()))
                .closedAt(toUtc(record.getClosedAt()))
                .sellMarket(record.getSellMarket().name())
                .buyMarket(record.getBuyMarket().name())
                .requestedAmount(record.getRequestedAmount())
                .expectedSpreadPercent(record.getExpectedSpreadPercentage())
                .finalState(record.getFinalState().name())
                .outcome(record.getOutcome().name())
                .sellFilledAmount(record.getSellLeg().getFilledAmount())
                .sellFilledPrice(record.getSellLeg().getFilledPrice())
                .buyFilledAmount(record.getBuyLeg().getFilledAmount())
                .buyFilledPrice(record.getBuyLeg().getFilledPrice())
                .buySubmissions(record.getBuyLeg().getSubmissions())
                .realizedProfitLoss(record.getRealizedProfitLoss())
                .failureReason(record.getFailureReason())
                .requiresReconciliation(record.isRequiresReconciliation())
                .transitions(encodeTransitions(record.getTransitions()))
                .build();
    }

    /**
     * Rebuilds a record from its row. Per-leg order ids, requested prices and errors are not stored.
     */
    TradeRecord fromRow(TradeAttemptRecord row) {
        Market sellMarket = Market.valueOf(row.getSellMarket());
        Market buyMarket = Market.valueOf(row.getBuyMarket());
        return TradeRecord.builder()
                .id(row.getId())
                .detectedAt(toInstant(row.getDetectedAt()))
                .closedAt(toInstant(row.getClosedAt()))
                .sellMarket(sellMarket)
                .buyMarket(buyMarket)
                .requestedAmount(row.getRequestedAmount())
                .expectedSpreadPercentage(row.getExpectedSpreadPercent())
                .finalState(TradeState.valueOf(row.getFinalState()))
                .outcome(TradeOutcome.valueOf(row.getOutcome()))
                .sellLeg(leg(OrderSide.SELL, sellMarket, row.getSellFilledAmount(), row.getSellFilledPrice(), 1))
                .buyLeg(leg(OrderSide.BUY, buyMarket, row.getBuyFilledAmount(), row.getBuyFilledPrice(),
                        row.getBuySubmissions()))
                .realizedProfitLoss(row.getRealizedProfitLoss())
                .failureReason(row.getFailureReason())
                .requiresReconciliation(row.isRequiresReconciliation())
                .transitions(decodeTransitions(row.getTransitions()))
                .build();
    }

    String encodeTransitions(List<StateTransition> transitions) {
        return transitions.stream()
                .map(t -> t.getFrom() + "->" + t.getTo() + "@" + t.getAt())
                .collect(Collectors.joining(";"));
    }

    List<StateTransition> decodeTransitions(String encoded) {
        List<StateTransition> result = new ArrayList<>();
        if (encoded == null || encoded.isBlank()) {
            return result;
        }
        for (String part : encoded.split(";")) {
            int arrow = part.indexOf("->");
            int at = part.indexOf('@');
            if (arrow < 0 || at < arrow) {
                throw new IllegalArgumentException("Malformed transition: " + part);
            }
            result.add(new StateTransition(
                    TradeState.valueOf(part.substring(0, arrow)),
                    TradeState.valueOf(part.substring(arrow + 2, at)),
                    Instant.parse(part.substring(at + 1))));
        }
        return result;
    }

    LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    Instant toInstant(LocalDateTime utc) {
        return utc.toInstant(ZoneOffset.UTC);
    }

    private LegRecord leg(OrderSide side, Market market, BigDecimal filledAmount, BigDecimal filledPrice,
                          int submissions) {
        boolean filled = filledAmount != null && filledAmount.signum() > 0;
        return LegRecord.builder()
                .side(side)
                .market(market)
                .filledAmount(filledAmount == null ? BigDecimal.ZERO : filledAmount)
                .filledPrice(filledPrice)
                .state(filled ? LegState.FILLED : LegState.FAILED)
                .submissions(submissions)
                .build();
    }
}
