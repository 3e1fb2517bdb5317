package trader.stablearb.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Balance {
    Currency currency;
    BigDecimal free;
    BigDecimal locked;

    public BigDecimal getTotal() {
        return free.add(locked);
    }
}
