package trader.stablearb.service.execution;

import lombok.Getter;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;

@Getter
public class OrderRejectedException extends RuntimeException {
    private final Market market;
    private final OrderSide side;

    public OrderRejectedException(Market market, OrderSide side, String message) {
        super(side + " order on " + market + " rejected: " + message);
        this.market = market;
        this.side = side;
    }
}
