package trader.stablearb.service.ledger;

/**
 * The ledger was asked to do something that can only happen through a programming error.
 * Never caught for recovery.
 */
public class LedgerInvariantViolationException extends IllegalStateException {

    public LedgerInvariantViolationException(String message) {
        super(message);
    }
}
