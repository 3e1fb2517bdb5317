package trader.stablearb.model.trade;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the sell-first state machine.
 */
public enum TradeState {
    PLANNED,
    SELLING,
    SELL_FILLED,
    SELL_FAILED,
    BUYING,
    COMPLETED,
    BUY_FAILED;

    static {
        PLANNED.next = EnumSet.of(SELLING);
        SELLING.next = EnumSet.of(SELL_FILLED, SELL_FAILED);
        SELL_FILLED.next = EnumSet.of(BUYING);
        SELL_FAILED.next = EnumSet.noneOf(TradeState.class);
        BUYING.next = EnumSet.of(COMPLETED, BUY_FAILED);
        COMPLETED.next = EnumSet.noneOf(TradeState.class);
        // a failed buy leg goes back to BUYING while retries remain
        BUY_FAILED.next = EnumSet.of(BUYING);
    }

    private Set<TradeState> next;

    public boolean canTransitionTo(TradeState target) {
        return next.contains(target);
    }
}
