package trader.stablearb.model;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Spread between the latest USDT and USDC quotes. The two quotes may have different ages,
 * so freshness is always checked per quote.
 */
@Value
public class SpreadSnapshot {
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int PERCENT_SCALE = 6;

    Quote quoteA;
    Quote quoteB;
    BigDecimal spreadAbsolute;
    BigDecimal spreadPercentage;
    Instant computedAt;

    public static SpreadSnapshot of(Quote usdtQuote, Quote usdcQuote, Instant computedAt) {
        BigDecimal priceA = usdtQuote.getPrice();
        BigDecimal priceB = usdcQuote.getPrice();
        BigDecimal absolute = priceA.subtract(priceB).abs();
        BigDecimal lower = priceA.min(priceB);

        BigDecimal percentage = lower.signum() == 0
                ? BigDecimal.ZERO
                : absolute.multiply(HUNDRED).divide(lower, PERCENT_SCALE, RoundingMode.HALF_UP);

        return new SpreadSnapshot(usdtQuote, usdcQuote, absolute, percentage, computedAt);
    }

    public boolean isStale(Instant now, Duration freshnessBound) {
        return quoteA.isStaleAt(now, freshnessBound) || quoteB.isStaleAt(now, freshnessBound);
    }

    public Quote quoteFor(Market market) {
        return quoteA.getMarket() == market ? quoteA : quoteB;
    }

    /**
     * Market quoting the higher price. Ties resolve to the USDT market.
     */
    public Market higherMarket() {
        return quoteA.getPrice().compareTo(quoteB.getPrice()) >= 0 ? quoteA.getMarket() : quoteB.getMarket();
    }

    public Market lowerMarket() {
        return higherMarket().counterpart();
    }
}
