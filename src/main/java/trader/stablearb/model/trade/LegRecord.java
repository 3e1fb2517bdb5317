package trader.stablearb.model.trade;

import lombok.Builder;
import lombok.Value;
import trader.stablearb.model.Market;
import trader.stablearb.model.OrderSide;

import java.math.BigDecimal;

@Value
@Builder
public class LegRecord {
    OrderSide side;
    Market market;
    BigDecimal requestedAmount;
    BigDecimal requestedPrice;
    BigDecimal filledAmount;
    BigDecimal filledPrice;
    String orderId;
    LegState state;
    String error;
    int submissions;
    BigDecimal slippage;

    public static LegRecord from(OrderLeg leg) {
        return LegRecord.builder()
                .side(leg.getSide())
                .market(leg.getMarket())
                .requestedAmount(leg.getRequestedAmount())
                .requestedPrice(leg.getRequestedPrice())
                .filledAmount(leg.getFilledAmount())
                .filledPrice(leg.getFilledPrice())
                .orderId(leg.getOrderId())
                .state(leg.getState())
                .error(leg.getError())
                .submissions(leg.getSubmissions())
                .slippage(leg.getSlippage())
                .build();
    }
}
