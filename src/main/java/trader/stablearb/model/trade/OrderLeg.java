package trader.stablearb.model.trade;

import lombok.Data;
import lombok.NoArgsConstructor;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Data
@NoArgsConstructor
public class OrderLeg {
    private OrderSide side;
    private Market market;
    private BigDecimal requestedAmount;
    private BigDecimal requestedPrice;
    private BigDecimal filledAmount = BigDecimal.ZERO;
    private BigDecimal filledPrice;
    private String orderId;
    private LegState state = LegState.PENDING;
    private String error;
    private int submissions;

    public OrderLeg(OrderSide side, Market market, BigDecimal requestedAmount, BigDecimal requestedPrice) {
        this.side = side;
        this.market = market;
        this.requestedAmount = requestedAmount;
        this.requestedPrice = requestedPrice;
    }

    public void markSubmitted() {
        submissions++;
        state = LegState.SUBMITTED;
        error = null;
    }

    public void markFilled(OrderFill fill) {
        orderId = fill.getOrderId();
        filledAmount = fill.getFilledAmount();
        filledPrice = fill.getFilledPrice();
        state = LegState.FILLED;
    }

    public void markFailed(String reason) {
        state = LegState.FAILED;
        error = reason;
    }

    public BigDecimal getFilledNotional() {
        if (filledPrice == null) {
            return BigDecimal.ZERO;
        }
        return filledAmount.multiply(filledPrice);
    }

    /**
     * Relative price deviation against the requested price, positive when the fill was worse.
     */
    public BigDecimal getSlippage() {
        if (filledPrice == null || requestedPrice == null || requestedPrice.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal diff = side == OrderSide.SELL
                ? requestedPrice.subtract(filledPrice)
                : filledPrice.subtract(requestedPrice);
        return diff.divide(requestedPrice, 8, RoundingMode.HALF_UP);
    }
}
