package trader.stablearb.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SpreadSnapshotTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private static Quote quote(Market market, String price, Instant at) {
        return Quote.builder().market(market).price(new BigDecimal(price)).timestamp(at).build();
    }

    @Test
    void spreadIsRelativeToTheLowerPrice() {
        SpreadSnapshot snapshot = SpreadSnapshot.of(
                quote(Market.XRP_USDT, "0.52", NOW),
                quote(Market.XRP_USDC, "0.50", NOW),
                NOW);

        assertThat(snapshot.getSpreadAbsolute()).isEqualByComparingTo("0.02");
        assertThat(snapshot.getSpreadPercentage()).isEqualByComparingTo("4.0");
        assertThat(snapshot.higherMarket()).isEqualTo(Market.XRP_USDT);
        assertThat(snapshot.lowerMarket()).isEqualTo(Market.XRP_USDC);
    }

    @Test
    void directionFollowsTheHigherQuote() {
        SpreadSnapshot snapshot = SpreadSnapshot.of(
                quote(Market.XRP_USDT, "0.4990", NOW),
                quote(Market.XRP_USDC, "0.5010", NOW),
                NOW);

        assertThat(snapshot.higherMarket()).isEqualTo(Market.XRP_USDC);
        assertThat(snapshot.quoteFor(Market.XRP_USDC).getPrice()).isEqualByComparingTo("0.5010");
    }

    @Test
    void identicalPricesGiveZeroSpread() {
        SpreadSnapshot snapshot = SpreadSnapshot.of(
                quote(Market.XRP_USDT, "0.50", NOW),
                quote(Market.XRP_USDC, "0.50", NOW),
                NOW);

        assertThat(snapshot.getSpreadPercentage()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void staleWhenEitherQuoteIsOlderThanTheBound() {
        SpreadSnapshot snapshot = SpreadSnapshot.of(
                quote(Market.XRP_USDT, "0.52", NOW.minusSeconds(120)),
                quote(Market.XRP_USDC, "0.50", NOW),
                NOW);

        assertThat(snapshot.isStale(NOW, Duration.ofSeconds(30))).isTrue();
        assertThat(snapshot.isStale(NOW, Duration.ofSeconds(120))).isFalse();
    }
}
