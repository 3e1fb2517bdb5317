package trader.stablearb.service.monitor;

import org.junit.jupiter.api.Test;
import trader.stablearb.model.Market;
import trader.stablearb.model.Quote;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QuoteHistoryTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private static Quote quote(String price, Instant at) {
        return Quote.builder().market(Market.XRP_USDT).price(new BigDecimal(price)).timestamp(at).build();
    }

    @Test
    void keepsOnlyTheNewestQuotesUpToCapacity() {
        QuoteHistory history = new QuoteHistory(3, Duration.ofHours(1));
        for (int i = 0; i < 5; i++) {
            history.append(quote("0.5" + i, NOW.plusSeconds(i)));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.snapshot().get(0).getPrice()).isEqualByComparingTo("0.52");
        assertThat(history.latest()).get().extracting(Quote::getPrice).isEqualTo(new BigDecimal("0.54"));
    }

    @Test
    void prunesQuotesOlderThanTheWindow() {
        QuoteHistory history = new QuoteHistory(100, Duration.ofMinutes(1));
        history.append(quote("0.50", NOW));
        history.append(quote("0.51", NOW.plusSeconds(30)));

        history.prune(NOW.plusSeconds(75));

        assertThat(history.snapshot()).extracting(Quote::getPrice).containsExactly(new BigDecimal("0.51"));
    }

    @Test
    void ignoresOutOfOrderQuotes() {
        QuoteHistory history = new QuoteHistory(100, Duration.ofHours(1));
        history.append(quote("0.50", NOW.plusSeconds(10)));
        history.append(quote("0.49", NOW));

        assertThat(history.size()).isEqualTo(1);
    }

    @Test
    void volatilityIsZeroWithTooFewSamples() {
        QuoteHistory history = new QuoteHistory(100, Duration.ofHours(1));
        history.append(quote("0.50", NOW));
        history.append(quote("0.60", NOW.plusSeconds(1)));

        assertThat(history.volatility()).isZero();
    }

    @Test
    void volatilityIsTheSampleStandardDeviationOfPercentReturns() {
        QuoteHistory history = new QuoteHistory(100, Duration.ofHours(1));
        history.append(quote("100", NOW));
        history.append(quote("101", NOW.plusSeconds(1)));
        history.append(quote("100", NOW.plusSeconds(2)));

        // returns: +1%, -0.990099%
        double r1 = 1.0;
        double r2 = -100.0 / 101.0;
        double mean = (r1 + r2) / 2;
        double expected = Math.sqrt(((r1 - mean) * (r1 - mean) + (r2 - mean) * (r2 - mean)) / 1);
        assertThat(history.volatility()).isCloseTo(expected, within(1e-9));
    }

    @Test
    void flatPricesHaveNoVolatility() {
        QuoteHistory history = new QuoteHistory(100, Duration.ofHours(1));
        for (int i = 0; i < 10; i++) {
            history.append(quote("0.5", NOW.plusSeconds(i)));
        }

        assertThat(history.volatility()).isZero();
    }
}
