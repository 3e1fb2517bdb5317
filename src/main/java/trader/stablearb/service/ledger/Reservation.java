package trader.stablearb.service.ledger;

import lombok.Getter;
import lombok.ToString;
import trader.stablearb.model.Currency;

import java.math.BigDecimal;

/**
 * Handle on an amount moved from free to locked. It can be released or settled exactly once.
 */
@Getter
@ToString
public final class Reservation {

    enum Status {
        ACTIVE,
        RELEASED,
        SETTLED
    }

    private final long id;
    private final Currency currency;
    private final BigDecimal amount;
    // guarded by the ledger lock
    private Status status = Status.ACTIVE;

    Reservation(long id, Currency currency, BigDecimal amount) {
        this.id = id;
        this.currency = currency;
        this.amount = amount;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    void close(Status closedAs) {
        this.status = closedAs;
    }
}
