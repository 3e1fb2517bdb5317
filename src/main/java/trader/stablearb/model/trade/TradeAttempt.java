package trader.stablearb.model.trade;

import lombok.Getter;
import lombok.Setter;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.TradeCandidate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A single sell-first attempt. Owned by the engine while in flight; once closed it can only be read
 * and converted to a {@link TradeRecord}.
 */
@Getter
public class TradeAttempt {
    private final String id;
    private final Instant detectedAt;
    private final Market sellMarket;
    private final Market buyMarket;
    private final BigDecimal requestedAmount;
    private final BigDecimal expectedSpreadPercentage;
    private final OrderLeg sellLeg;
    private final OrderLeg buyLeg;
    private final List<StateTransition> transitions = new ArrayList<>();

    private TradeState state = TradeState.PLANNED;
    private TradeOutcome outcome;
    private Instant closedAt;
    @Setter
    private BigDecimal realizedProfitLoss = BigDecimal.ZERO;
    @Setter
    private String failureReason;
    private boolean requiresReconciliation;

    public TradeAttempt(TradeCandidate candidate, BigDecimal executableAmount) {
        this.id = UUID.randomUUID().toString();
        this.detectedAt = candidate.getDetectedAt();
        this.sellMarket = candidate.getSellMarket();
        this.buyMarket = candidate.getBuyMarket();
        this.requestedAmount = executableAmount;
        this.expectedSpreadPercentage = candidate.getSpreadPercentage();
        this.sellLeg = new OrderLeg(OrderSide.SELL, sellMarket, executableAmount, candidate.getSellPrice());
        this.buyLeg = new OrderLeg(OrderSide.BUY, buyMarket, executableAmount, candidate.getBuyPrice());
    }

    public void transitionTo(TradeState target, Instant at) {
        ensureOpen();
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + target + " for attempt " + id);
        }
        transitions.add(new StateTransition(state, target, at));
        state = target;
    }

    public void close(TradeOutcome outcome, Instant at) {
        ensureOpen();
        this.outcome = outcome;
        this.closedAt = at;
        this.requiresReconciliation = outcome == TradeOutcome.PARTIAL;
    }

    public boolean isClosed() {
        return closedAt != null;
    }

    public List<StateTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public TradeRecord toRecord() {
        if (!isClosed()) {
            throw new IllegalStateException("Attempt " + id + " is still in flight (" + state + ")");
        }
        return TradeRecord.builder()
                .id(id)
                .detectedAt(detectedAt)
                .closedAt(closedAt)
                .sellMarket(sellMarket)
                .buyMarket(buyMarket)
                .requestedAmount(requestedAmount)
                .expectedSpreadPercentage(expectedSpreadPercentage)
                .finalState(state)
                .outcome(outcome)
                .sellLeg(LegRecord.from(sellLeg))
                .buyLeg(LegRecord.from(buyLeg))
                .realizedProfitLoss(realizedProfitLoss)
                .failureReason(failureReason)
                .requiresReconciliation(requiresReconciliation)
                .transitions(List.copyOf(transitions))
                .build();
    }

    private void ensureOpen() {
        if (isClosed()) {
            throw new IllegalStateException("Attempt " + id + " is closed in state " + state);
        }
    }
}
