package trader.stablearb.model.trade;

import lombok.Value;

import java.time.Instant;

@Value
public class StateTransition {
    TradeState from;
    TradeState to;
    Instant at;
}
