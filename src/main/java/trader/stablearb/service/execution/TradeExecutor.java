package trader.stablearb.service.execution;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.config.metrics.TimerUtils;
import trader.stablearb.model.Currency;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.TradeCandidate;
import trader.stablearb.model.trade.OrderFill;
import trader.stablearb.model.trade.OrderLeg;
import trader.stablearb.model.trade.TradeAttempt;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeState;
import trader.stablearb.service.ledger.BalanceLedger;
import trader.stablearb.service.ledger.InsufficientFundsException;
import trader.stablearb.service.ledger.LedgerInvariantViolationException;
import trader.stablearb.service.ledger.Reservation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs one attempt through the sell-first state machine.
 * <p>
 * The asset is sold on the higher market first. Only a filled sell is followed by the buy on the lower
 * market, sized to the sold amount and retried with exponential backoff. A buy leg that never fills leaves
 * the attempt PARTIAL and flagged for reconciliation.
 * <p>
 * Blocks the calling thread until the attempt is closed.
 */
@Slf4j
@Service
public class TradeExecutor {
    private static final int AMOUNT_SCALE = 8;

    private final OrderPlacementService orderPlacement;
    private final BalanceLedger ledger;
    private final ArbitrageProperties.Execution execution;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter partialFailures;

    public TradeExecutor(OrderPlacementService orderPlacement,
                         BalanceLedger ledger,
                         ArbitrageProperties properties,
                         Clock clock,
                         MeterRegistry meterRegistry,
                         @Qualifier("partialFailuresCounter") Counter partialFailures) {
        this.orderPlacement = orderPlacement;
        this.ledger = ledger;
        this.execution = properties.getExecution();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.partialFailures = partialFailures;
    }

    public TradeAttempt execute(TradeCandidate candidate, BigDecimal amount) {
        TradeAttempt attempt = new TradeAttempt(candidate, amount);
        log.info("Attempt {}: sell {} {} on {} at ~{}, buy back on {} at ~{} (spread {}%)",
                attempt.getId(), amount.toPlainString(), candidate.getSellCurrency(), attempt.getSellMarket(),
                candidate.getSellPrice(), attempt.getBuyMarket(), candidate.getBuyPrice(),
                candidate.getSpreadPercentage());

        if (executeSell(attempt)) {
            executeBuy(attempt);
        }
        log.info("Attempt {} closed {} in state {}, P&L {}", attempt.getId(), attempt.getOutcome(),
                attempt.getState(), attempt.getRealizedProfitLoss().toPlainString());
        return attempt;
    }

    private boolean executeSell(TradeAttempt attempt) {
        OrderLeg leg = attempt.getSellLeg();
        Currency asset = leg.getMarket().spentCurrency(OrderSide.SELL);

        Reservation reservation;
        try {
            reservation = ledger.reserve(asset, leg.getRequestedAmount());
        } catch (InsufficientFundsException e) {
            attempt.transitionTo(TradeState.SELLING, clock.instant());
            abort(attempt, e.getMessage());
            return false;
        }

        attempt.transitionTo(TradeState.SELLING, clock.instant());
        leg.markSubmitted();
        OrderFill fill;
        try {
            fill = submit(leg, leg.getRequestedAmount()).block();
        } catch (RuntimeException e) {
            ledger.release(reservation);
            abort(attempt, describe(e));
            return false;
        }
        if (fill == null || !isFilled(fill)) {
            ledger.release(reservation);
            abort(attempt, "sell order not filled");
            return false;
        }

        // unfilled remainder goes back to free
        ledger.settleSpend(reservation, fill.getFilledAmount());
        ledger.settleReceive(leg.getMarket().receivedCurrency(OrderSide.SELL), proceeds(fill));
        leg.markFilled(fill);
        attempt.transitionTo(TradeState.SELL_FILLED, clock.instant());
        log.info("Attempt {}: sold {} at {} (slippage {})", attempt.getId(),
                fill.getFilledAmount().toPlainString(), fill.getFilledPrice(), leg.getSlippage());
        return true;
    }

    private void executeBuy(TradeAttempt attempt) {
        OrderLeg sellLeg = attempt.getSellLeg();
        OrderLeg leg = attempt.getBuyLeg();
        BigDecimal amount = sellLeg.getFilledAmount();
        leg.setRequestedAmount(amount);
        Currency funding = leg.getMarket().spentCurrency(OrderSide.BUY);
        BigDecimal budget = amount.multiply(leg.getRequestedPrice())
                .multiply(BigDecimal.ONE.add(execution.getBuyPriceBuffer()))
                .multiply(BigDecimal.ONE.add(execution.getTakerFeeRate()))
                .setScale(AMOUNT_SCALE, RoundingMode.UP);

        attempt.transitionTo(TradeState.BUYING, clock.instant());
        Reservation reservation;
        try {
            reservation = ledger.reserve(funding, budget);
        } catch (InsufficientFundsException e) {
            leg.markFailed(e.getMessage());
            attempt.transitionTo(TradeState.BUY_FAILED, clock.instant());
            leavePartial(attempt, "buy leg not funded: " + e.getMessage());
            return;
        }

        try {
            completeBuy(attempt, reservation, amount);
        } catch (LedgerInvariantViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (attempt.isClosed()) {
                throw e;
            }
            // the sell has settled, the attempt closes flagged
            if (reservation.isActive()) {
                ledger.release(reservation);
            }
            if (attempt.getState() == TradeState.BUYING) {
                leg.markFailed(describe(e));
                attempt.transitionTo(TradeState.BUY_FAILED, clock.instant());
            }
            leavePartial(attempt, "buy leg failed after " + leg.getSubmissions() + " submission(s): " + describe(e));
        }
    }

    private void completeBuy(TradeAttempt attempt, Reservation reservation, BigDecimal amount) {
        OrderLeg leg = attempt.getBuyLeg();
        OrderFill fill = buyWithRetry(attempt, leg, amount).block();
        if (fill == null) {
            throw new OrderRejectedException(leg.getMarket(), leg.getSide(), "no fill reported");
        }

        BigDecimal cost = cost(fill);
        settleBuyCost(reservation, cost);
        ledger.settleReceive(leg.getMarket().receivedCurrency(OrderSide.BUY), fill.getFilledAmount());
        leg.markFilled(fill);

        if (!withinInventoryTolerance(amount, fill.getFilledAmount())) {
            attempt.transitionTo(TradeState.BUY_FAILED, clock.instant());
            leavePartial(attempt, "buy leg short filled: " + fill.getFilledAmount().toPlainString()
                    + " of " + amount.toPlainString());
            return;
        }

        attempt.setRealizedProfitLoss(proceeds(attempt.getSellLeg()).subtract(cost)
                .setScale(AMOUNT_SCALE, RoundingMode.HALF_UP));
        attempt.transitionTo(TradeState.COMPLETED, clock.instant());
        attempt.close(TradeOutcome.COMPLETED, clock.instant());
    }

    private Mono<OrderFill> buyWithRetry(TradeAttempt attempt, OrderLeg leg, BigDecimal amount) {
        Mono<OrderFill> single = Mono.defer(() -> {
                    if (attempt.getState() == TradeState.BUY_FAILED) {
                        attempt.transitionTo(TradeState.BUYING, clock.instant());
                    }
                    leg.markSubmitted();
                    return submit(leg, amount);
                })
                .flatMap(fill -> isFilled(fill)
                        ? Mono.just(fill)
                        : Mono.<OrderFill>error(new OrderRejectedException(leg.getMarket(), leg.getSide(),
                                "nothing filled")))
                .doOnError(e -> {
                    leg.markFailed(describe(e));
                    attempt.transitionTo(TradeState.BUY_FAILED, clock.instant());
                    log.warn("Attempt {}: buy submission {}/{} failed: {}", attempt.getId(),
                            leg.getSubmissions(), execution.getBuyMaxAttempts(), describe(e));
                });
        if (execution.getBuyMaxAttempts() <= 1) {
            return single;
        }
        return single.retryWhen(Retry.backoff(execution.getBuyMaxAttempts() - 1, execution.getBuyInitialBackoff())
                .maxBackoff(execution.getBuyMaxBackoff())
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private static boolean isFilled(OrderFill fill) {
        return fill.getFilledAmount() != null && fill.getFilledAmount().signum() > 0 && fill.getFilledPrice() != null;
    }

    private Mono<OrderFill> submit(OrderLeg leg, BigDecimal amount) {
        Duration timeout = execution.getOrderTimeout();
        return TimerUtils.timedMono(
                () -> orderPlacement.submitOrder(leg.getMarket(), leg.getSide(), amount).timeout(timeout),
                meterRegistry, "arbitrage.order.latency",
                "market", leg.getMarket().name(), "side", leg.getSide().name());
    }

    private void settleBuyCost(Reservation reservation, BigDecimal cost) {
        if (cost.compareTo(reservation.getAmount()) <= 0) {
            ledger.settleSpend(reservation, cost);
            return;
        }
        // the price moved past the buffer, cover the difference from free balance
        BigDecimal excess = cost.subtract(reservation.getAmount());
        try {
            Reservation extra = ledger.reserve(reservation.getCurrency(), excess);
            ledger.settleSpend(reservation);
            ledger.settleSpend(extra);
        } catch (InsufficientFundsException e) {
            throw new LedgerInvariantViolationException("Buy fill cost " + cost.toPlainString() + " "
                    + reservation.getCurrency() + " exceeds available funds: " + e.getMessage());
        }
    }

    private boolean withinInventoryTolerance(BigDecimal sold, BigDecimal bought) {
        BigDecimal drift = sold.subtract(bought).abs();
        return drift.compareTo(sold.multiply(execution.getInventoryTolerance())) <= 0;
    }

    private void abort(TradeAttempt attempt, String reason) {
        attempt.getSellLeg().markFailed(reason);
        attempt.transitionTo(TradeState.SELL_FAILED, clock.instant());
        attempt.setFailureReason(reason);
        attempt.close(TradeOutcome.ABORTED, clock.instant());
        log.warn("Attempt {} aborted before any fill: {}", attempt.getId(), reason);
    }

    private void leavePartial(TradeAttempt attempt, String reason) {
        attempt.setFailureReason(reason);
        attempt.close(TradeOutcome.PARTIAL, clock.instant());
        partialFailures.increment();
        log.error("Attempt {} left an open position: sold {} {} on {} without buying back. Reconciliation required. {}",
                attempt.getId(), attempt.getSellLeg().getFilledAmount().toPlainString(),
                attempt.getSellLeg().getMarket().getBaseCurrency(), attempt.getSellMarket(), reason);
    }

    private BigDecimal proceeds(OrderFill fill) {
        return fill.getNotional().multiply(BigDecimal.ONE.subtract(execution.getTakerFeeRate()));
    }

    private BigDecimal proceeds(OrderLeg filledLeg) {
        return filledLeg.getFilledNotional().multiply(BigDecimal.ONE.subtract(execution.getTakerFeeRate()));
    }

    private BigDecimal cost(OrderFill fill) {
        return fill.getNotional().multiply(BigDecimal.ONE.add(execution.getTakerFeeRate()));
    }

    private static String describe(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof TimeoutException) {
            return "order timed out";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
