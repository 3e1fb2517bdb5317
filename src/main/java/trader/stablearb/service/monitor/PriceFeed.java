package trader.stablearb.service.monitor;

import reactor.core.publisher.Mono;
import trader.stablearb.model.Market;
import trader.stablearb.model.Quote;

/**
 * Pull source of point-in-time quotes. Failures are signalled as errors on the returned {@link Mono}.
 */
public interface PriceFeed {

    Mono<Quote> getQuote(Market market);
}
