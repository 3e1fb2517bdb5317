package trader.stablearb.service.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.Quote;
import trader.stablearb.model.trade.OrderFill;
import trader.stablearb.service.monitor.PriceMonitor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Simulated venue: fills the whole amount at the monitor's latest quote after a fixed latency,
 * moved against the trader by the configured slippage.
 */
@Slf4j
@Service
public class PaperOrderPlacementService implements OrderPlacementService {
    private final PriceMonitor priceMonitor;
    private final ArbitrageProperties.Paper paper;

    public PaperOrderPlacementService(PriceMonitor priceMonitor, ArbitrageProperties properties) {
        this.priceMonitor = priceMonitor;
        this.paper = properties.getPaper();
    }

    @Override
    public Mono<OrderFill> submitOrder(Market market, OrderSide side, BigDecimal amount) {
        return Mono.defer(() -> {
                    Quote quote = priceMonitor.latestQuote(market)
                            .orElseThrow(() -> new OrderRejectedException(market, side, "no market price"));
                    BigDecimal adverse = side == OrderSide.SELL
                            ? BigDecimal.ONE.subtract(paper.getSlippage())
                            : BigDecimal.ONE.add(paper.getSlippage());
                    BigDecimal price = quote.getPrice().multiply(adverse).setScale(8, RoundingMode.HALF_UP);
                    OrderFill fill = OrderFill.builder()
                            .orderId("paper-" + UUID.randomUUID())
                            .filledAmount(amount)
                            .filledPrice(price)
                            .build();
                    log.info("Paper {} {} {} filled at {}", side, amount.toPlainString(), market, price.toPlainString());
                    return Mono.just(fill);
                })
                .delaySubscription(paper.getLatency());
    }
}
