package trader.stablearb.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import trader.stablearb.model.Currency;
import trader.stablearb.model.Market;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "arbitrage")
public class ArbitrageProperties {

    @Valid
    private Feed feed = new Feed();
    @Valid
    private Risk risk = new Risk();
    @Valid
    private Execution execution = new Execution();
    @Valid
    private Engine engine = new Engine();
    @Valid
    private Ledger ledger = new Ledger();
    @Valid
    private Paper paper = new Paper();

    @Data
    public static class Feed {
        private Map<Market, Duration> pollInterval = new EnumMap<>(Map.of(
                Market.XRP_USDT, Duration.ofSeconds(2),
                Market.XRP_USDC, Duration.ofSeconds(2)));
        @NotNull
        private Duration timeout = Duration.ofSeconds(3);
        @NotNull
        private Duration freshnessBound = Duration.ofSeconds(30);
        @Min(2)
        private int historyCapacity = 500;
        @NotNull
        private Duration historyWindow = Duration.ofMinutes(30);

        public Duration pollIntervalFor(Market market) {
            return pollInterval.getOrDefault(market, Duration.ofSeconds(2));
        }
    }

    @Data
    public static class Risk {
        /** Minimum spread, in percent of the lower price. */
        @DecimalMin("0.0")
        private BigDecimal minSpreadPercent = new BigDecimal("0.3");
        /** Spreads above this are treated as bad data. */
        @DecimalMin("0.0")
        private BigDecimal maxSpreadPercent = new BigDecimal("10");
        @DecimalMin("0.0")
        private BigDecimal dailyVolumeLimit = new BigDecimal("5000");
        /** Fraction of the free balance that a trade may never consume. */
        @DecimalMin("0.0")
        private BigDecimal safetyMarginFraction = new BigDecimal("0.1");
        /** Absolute reserve, the larger of the two margins applies. */
        @DecimalMin("0.0")
        private BigDecimal safetyMarginAbsolute = BigDecimal.ZERO;
        /** Ceiling for the rolling standard deviation of returns, in percent. */
        private double volatilityCeiling = 2.0;
        @NotNull
        private Duration cooldown = Duration.ofSeconds(30);
        @DecimalMin("0.0")
        private BigDecimal perTradeCap = new BigDecimal("1000");
        @DecimalMin("0.0")
        private BigDecimal maxDailyLoss = new BigDecimal("100");
        /**
         * Volatility, in percent, at which the approved amount is left unscaled. Above 1.2 and 1.5 times
         * this value the amount is cut to 75% and 50%, below half of it the amount may grow by 25%.
         */
        @DecimalMin(value = "0.0", inclusive = false)
        private BigDecimal sizingReferenceVolatility = new BigDecimal("0.5");
        /** Number of recent records the success rate is computed over. */
        @Min(1)
        private int successRateWindow = 20;
        /** Below this share of completed attempts in the window the approved amount is halved. */
        private double cautiousSuccessRate = 0.7;
    }

    @Data
    public static class Execution {
        @DecimalMin("0.0")
        private BigDecimal nominalAmount = new BigDecimal("100");
        @NotNull
        private Duration orderTimeout = Duration.ofSeconds(10);
        /** Total buy leg submissions, the first one included. */
        @Min(1)
        private int buyMaxAttempts = 3;
        @NotNull
        private Duration buyInitialBackoff = Duration.ofMillis(500);
        @NotNull
        private Duration buyMaxBackoff = Duration.ofSeconds(5);
        /** Extra quote currency locked on top of the expected buy cost to absorb price moves. */
        @DecimalMin("0.0")
        private BigDecimal buyPriceBuffer = new BigDecimal("0.01");
        /** Taker fee per leg, as a fraction of the notional. */
        @DecimalMin("0.0")
        private BigDecimal takerFeeRate = new BigDecimal("0.0006");
        /** Maximum relative asset inventory drift accepted for a completed attempt. */
        @DecimalMin("0.0")
        private BigDecimal inventoryTolerance = new BigDecimal("0.001");
    }

    @Data
    public static class Engine {
        @NotNull
        private Duration tickInterval = Duration.ofSeconds(1);
        private boolean autoStart = false;
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Ledger {
        private Map<Currency, BigDecimal> initialBalances = new EnumMap<>(Map.of(
                Currency.XRP, new BigDecimal("10000"),
                Currency.USDT, new BigDecimal("5000"),
                Currency.USDC, new BigDecimal("5000")));
        @NotNull
        private Duration snapshotInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Paper {
        @NotNull
        private Duration latency = Duration.ofMillis(50);
        /** Adverse price move applied to simulated fills, as a fraction. */
        @DecimalMin("0.0")
        private BigDecimal slippage = BigDecimal.ZERO;
    }
}
