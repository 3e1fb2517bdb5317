package trader.stablearb.service.execution;

import reactor.core.publisher.Mono;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.trade.OrderFill;

import java.math.BigDecimal;

/**
 * Places a market order for {@code amount} of the base asset. The returned {@link Mono} emits the fill,
 * or errors with {@link OrderRejectedException} when the venue refuses the order.
 */
public interface OrderPlacementService {

    Mono<OrderFill> submitOrder(Market market, OrderSide side, BigDecimal amount);
}
