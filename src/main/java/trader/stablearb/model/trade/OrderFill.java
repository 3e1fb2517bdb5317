package trader.stablearb.model.trade;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fill reported by the order placement capability. A partial fill reports the filled amount only.
 */
@Value
@Builder
public class OrderFill {
    String orderId;
    BigDecimal filledAmount;
    BigDecimal filledPrice;

    public BigDecimal getNotional() {
        return filledAmount.multiply(filledPrice);
    }
}
