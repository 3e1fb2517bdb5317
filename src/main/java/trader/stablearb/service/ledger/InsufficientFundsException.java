package trader.stablearb.service.ledger;

import lombok.Getter;
import trader.stablearb.model.Currency;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends Exception {
    private final Currency currency;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientFundsException(Currency currency, BigDecimal requested, BigDecimal available) {
        super("Insufficient " + currency + " balance: requested " + requested.toPlainString()
                + ", free " + available.toPlainString());
        this.currency = currency;
        this.requested = requested;
        this.available = available;
    }
}
