package trader.stablearb.service.risk;

import org.springframework.stereotype.Service;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.Currency;
import trader.stablearb.model.OrderSide;
import trader.stablearb.model.TradeCandidate;
import trader.stablearb.model.risk.RejectionReason;
import trader.stablearb.model.risk.RiskState;
import trader.stablearb.model.risk.RiskVerdict;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Pure risk gate. Checks run in a fixed order and the first failing one decides the verdict.
 * The controller reads only its arguments and the configured limits.
 */
@Service
public class RiskController {

    private final ArbitrageProperties.Risk limits;
    private final Duration freshnessBound;
    private final BigDecimal buyPriceBuffer;
    private final BigDecimal takerFeeRate;

    public RiskController(ArbitrageProperties properties) {
        this.limits = properties.getRisk();
        this.freshnessBound = properties.getFeed().getFreshnessBound();
        this.buyPriceBuffer = properties.getExecution().getBuyPriceBuffer();
        this.takerFeeRate = properties.getExecution().getTakerFeeRate();
    }

    public RiskVerdict evaluate(TradeCandidate candidate, RiskState state) {
        BigDecimal spread = candidate.getSpreadPercentage();
        BigDecimal requested = candidate.getRequestedAmount();

        BigDecimal requiredSpread = requiredSpreadPercent();
        if (spread.compareTo(requiredSpread) < 0) {
            return RiskVerdict.reject(RejectionReason.SPREAD_TOO_SMALL,
                    "Spread " + spread.toPlainString() + "% < " + requiredSpread.toPlainString()
                            + "% (minimum " + limits.getMinSpreadPercent().toPlainString() + "% plus fees)");
        }

        if (candidate.getSnapshot().isStale(state.getAsOf(), freshnessBound)) {
            return RiskVerdict.reject(RejectionReason.STALE_PRICE,
                    "A quote is older than " + freshnessBound);
        }

        BigDecimal projectedVolume = state.getVolumeTradedToday().add(requested);
        if (projectedVolume.compareTo(limits.getDailyVolumeLimit()) > 0) {
            return RiskVerdict.reject(RejectionReason.DAILY_LIMIT_EXCEEDED,
                    "Would exceed daily limit: " + projectedVolume.toPlainString()
                            + " > " + limits.getDailyVolumeLimit().toPlainString());
        }

        BigDecimal sellAvailable = availableAfterMargin(state.freeBalance(candidate.getSellCurrency()));
        if (requested.compareTo(sellAvailable) > 0) {
            return RiskVerdict.reject(RejectionReason.INSUFFICIENT_SAFETY_MARGIN,
                    "Insufficient " + candidate.getSellCurrency() + " with safety margin: "
                            + requested.toPlainString() + " > " + sellAvailable.toPlainString());
        }
        Currency buyFunding = candidate.getBuyMarket().spentCurrency(OrderSide.BUY);
        BigDecimal buyCost = requested.multiply(candidate.getBuyPrice())
                .multiply(BigDecimal.ONE.add(buyPriceBuffer))
                .multiply(BigDecimal.ONE.add(takerFeeRate));
        BigDecimal buyAvailable = availableAfterMargin(state.freeBalance(buyFunding));
        if (buyCost.compareTo(buyAvailable) > 0) {
            return RiskVerdict.reject(RejectionReason.INSUFFICIENT_SAFETY_MARGIN,
                    "Insufficient " + buyFunding + " with safety margin for the buy leg: "
                            + buyCost.toPlainString() + " > " + buyAvailable.toPlainString());
        }

        double volatility = Math.max(
                state.volatility(candidate.getSellMarket()),
                state.volatility(candidate.getBuyMarket()));
        if (volatility > limits.getVolatilityCeiling()) {
            return RiskVerdict.reject(RejectionReason.VOLATILITY_TOO_HIGH,
                    String.format("Volatility %.4f%% > %.4f%%", volatility, limits.getVolatilityCeiling()));
        }

        Duration cooldownRemaining = state.getCooldownRemaining();
        if (cooldownRemaining != null && cooldownRemaining.compareTo(Duration.ZERO) > 0) {
            return RiskVerdict.reject(RejectionReason.COOLDOWN_ACTIVE,
                    "Cooldown active for another " + cooldownRemaining.toMillis() + " ms");
        }

        if (spread.compareTo(limits.getMaxSpreadPercent()) > 0) {
            return RiskVerdict.reject(RejectionReason.SPREAD_SUSPICIOUS,
                    "Spread " + spread.toPlainString() + "% is above the plausible maximum of "
                            + limits.getMaxSpreadPercent().toPlainString() + "%");
        }

        if (limits.getMaxDailyLoss().signum() > 0
                && state.getRealizedProfitLossToday().compareTo(limits.getMaxDailyLoss().negate()) <= 0) {
            return RiskVerdict.reject(RejectionReason.DAILY_LOSS_LIMIT,
                    "Daily loss " + state.getRealizedProfitLossToday().toPlainString()
                            + " reached the limit of " + limits.getMaxDailyLoss().toPlainString());
        }

        BigDecimal remainingVolume = limits.getDailyVolumeLimit().subtract(state.getVolumeTradedToday());
        BigDecimal executable = requested
                .min(sizeForConditions(requested, volatility, spread, state.getSuccessRateRecent()))
                .min(sellAvailable)
                .min(limits.getPerTradeCap())
                .min(remainingVolume);
        return RiskVerdict.approve(executable);
    }

    /**
     * The configured minimum spread plus the taker fee paid on both legs, in percent.
     */
    BigDecimal requiredSpreadPercent() {
        return limits.getMinSpreadPercent().add(takerFeeRate.multiply(BigDecimal.valueOf(200)));
    }

    /**
     * Scales the requested amount down in volatile markets or after a run of failed attempts, and up when
     * the market is calm or the spread is wide. The result still goes through the caps, so it never exceeds
     * the requested amount.
     */
    BigDecimal sizeForConditions(BigDecimal requested, double volatility, BigDecimal spread, double successRate) {
        double factor = volatility / limits.getSizingReferenceVolatility().doubleValue();
        BigDecimal scale;
        if (factor > 1.5) {
            scale = new BigDecimal("0.5");
        } else if (factor > 1.2) {
            scale = new BigDecimal("0.75");
        } else if (factor < 0.5) {
            scale = new BigDecimal("1.25");
        } else {
            scale = BigDecimal.ONE;
        }
        if (spread.compareTo(new BigDecimal("0.5")) > 0) {
            BigDecimal spreadMultiplier = BigDecimal.ONE
                    .add(spread.divide(BigDecimal.valueOf(100), 8, RoundingMode.HALF_UP))
                    .min(new BigDecimal("1.5"));
            scale = scale.multiply(spreadMultiplier);
        }
        if (successRate < limits.getCautiousSuccessRate()) {
            scale = scale.multiply(new BigDecimal("0.5"));
        }
        return requested.multiply(scale).setScale(8, RoundingMode.DOWN);
    }

    /**
     * Free balance minus the safety margin, which is the larger of the absolute reserve and the
     * configured fraction of the free balance.
     */
    BigDecimal availableAfterMargin(BigDecimal free) {
        BigDecimal margin = free.multiply(limits.getSafetyMarginFraction()).max(limits.getSafetyMarginAbsolute());
        BigDecimal available = free.subtract(margin);
        return available.signum() < 0 ? BigDecimal.ZERO : available;
    }
}
