package trader.stablearb.service.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import trader.stablearb.config.ArbitrageProperties;
import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory view of free and locked amounts per currency.
 * <p>
 * Every mutation and every snapshot runs under one lock, so a reader never sees a reservation
 * half applied. {@code free + locked} per currency only changes through
 * {@link #settleSpend} (funds leave) and {@link #settleReceive} (funds arrive).
 */
@Slf4j
@Service
public class BalanceLedger {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Currency, BigDecimal> free = new EnumMap<>(Currency.class);
    private final Map<Currency, BigDecimal> locked = new EnumMap<>(Currency.class);
    private final AtomicLong reservationIds = new AtomicLong();

    @Autowired
    public BalanceLedger(ArbitrageProperties properties) {
        this(properties.getLedger().getInitialBalances());
    }

    public BalanceLedger(Map<Currency, BigDecimal> initialBalances) {
        for (Currency currency : Currency.values()) {
            BigDecimal initial = initialBalances.getOrDefault(currency, BigDecimal.ZERO);
            if (initial.signum() < 0) {
                throw new IllegalArgumentException("Initial " + currency + " balance must not be negative: " + initial);
            }
            free.put(currency, initial);
            locked.put(currency, BigDecimal.ZERO);
        }
        log.info("Balance ledger initialized with {}", initialBalances);
    }

    /**
     * Moves {@code amount} from free to locked. All or nothing.
     */
    public Reservation reserve(Currency currency, BigDecimal amount) throws InsufficientFundsException {
        requirePositive(amount, "reserve");
        lock.lock();
        try {
            BigDecimal available = free.get(currency);
            if (amount.compareTo(available) > 0) {
                throw new InsufficientFundsException(currency, amount, available);
            }
            free.put(currency, available.subtract(amount));
            locked.put(currency, locked.get(currency).add(amount));
            Reservation reservation = new Reservation(reservationIds.incrementAndGet(), currency, amount);
            log.info("Locked {} {} (reservation #{})", amount.toPlainString(), currency, reservation.getId());
            return reservation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a reservation to the free balance. Calling it twice is an invariant violation.
     */
    public void release(Reservation reservation) {
        lock.lock();
        try {
            ensureActive(reservation, "release");
            Currency currency = reservation.getCurrency();
            unlock(currency, reservation.getAmount());
            free.put(currency, free.get(currency).add(reservation.getAmount()));
            reservation.close(Reservation.Status.RELEASED);
            log.info("Released {} {} (reservation #{})",
                    reservation.getAmount().toPlainString(), currency, reservation.getId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * The whole reserved amount left the system.
     */
    public void settleSpend(Reservation reservation) {
        settleSpend(reservation, reservation.getAmount());
    }

    /**
     * {@code spent} of the reserved amount left the system, the remainder goes back to free.
     */
    public void settleSpend(Reservation reservation, BigDecimal spent) {
        if (spent.signum() < 0) {
            throw new LedgerInvariantViolationException("Negative spend " + spent + " for reservation #" + reservation.getId());
        }
        lock.lock();
        try {
            ensureActive(reservation, "settle");
            if (spent.compareTo(reservation.getAmount()) > 0) {
                throw new LedgerInvariantViolationException("Spend " + spent.toPlainString()
                        + " exceeds reservation #" + reservation.getId() + " of " + reservation.getAmount().toPlainString());
            }
            Currency currency = reservation.getCurrency();
            unlock(currency, reservation.getAmount());
            BigDecimal remainder = reservation.getAmount().subtract(spent);
            if (remainder.signum() > 0) {
                free.put(currency, free.get(currency).add(remainder));
            }
            reservation.close(Reservation.Status.SETTLED);
            log.info("Settled spend of {} {} (reservation #{}, returned {})",
                    spent.toPlainString(), currency, reservation.getId(), remainder.toPlainString());
        } finally {
            lock.unlock();
        }
    }

    public void settleReceive(Currency currency, BigDecimal amount) {
        if (amount.signum() < 0) {
            throw new LedgerInvariantViolationException("Negative receive " + amount + " " + currency);
        }
        lock.lock();
        try {
            free.put(currency, free.get(currency).add(amount));
            log.info("Received {} {}", amount.toPlainString(), currency);
        } finally {
            lock.unlock();
        }
    }

    public Map<Currency, Balance> snapshot() {
        lock.lock();
        try {
            Map<Currency, Balance> result = new EnumMap<>(Currency.class);
            for (Currency currency : Currency.values()) {
                result.put(currency, new Balance(currency, free.get(currency), locked.get(currency)));
            }
            return Collections.unmodifiableMap(result);
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal free(Currency currency) {
        lock.lock();
        try {
            return free.get(currency);
        } finally {
            lock.unlock();
        }
    }

    private void unlock(Currency currency, BigDecimal amount) {
        BigDecimal remaining = locked.get(currency).subtract(amount);
        if (remaining.signum() < 0) {
            throw new LedgerInvariantViolationException("Locked " + currency + " would go negative: " + remaining);
        }
        locked.put(currency, remaining);
    }

    private void ensureActive(Reservation reservation, String operation) {
        if (!reservation.isActive()) {
            throw new LedgerInvariantViolationException("Cannot " + operation + " reservation #"
                    + reservation.getId() + ", it is already " + reservation.getStatus());
        }
    }

    private void requirePositive(BigDecimal amount, String operation) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerInvariantViolationException("Cannot " + operation + " non-positive amount " + amount);
        }
    }
}
