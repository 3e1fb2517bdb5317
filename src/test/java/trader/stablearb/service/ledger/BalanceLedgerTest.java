package trader.stablearb.service.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import trader.stablearb.model.Balance;
import trader.stablearb.model.Currency;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BalanceLedgerTest {

    private BalanceLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new BalanceLedger(Map.of(
                Currency.XRP, new BigDecimal("1000"),
                Currency.USDT, new BigDecimal("500"),
                Currency.USDC, new BigDecimal("500")));
    }

    @Test
    void reserveMovesFreeToLocked() throws Exception {
        ledger.reserve(Currency.XRP, new BigDecimal("100"));

        Balance xrp = ledger.snapshot().get(Currency.XRP);
        assertThat(xrp.getFree()).isEqualByComparingTo("900");
        assertThat(xrp.getLocked()).isEqualByComparingTo("100");
        assertThat(xrp.getTotal()).isEqualByComparingTo("1000");
    }

    @Test
    void reserveNeverPartiallyReserves() {
        assertThatThrownBy(() -> ledger.reserve(Currency.USDT, new BigDecimal("500.01")))
                .isInstanceOf(InsufficientFundsException.class)
                .hasMessageContaining("USDT");

        Balance usdt = ledger.snapshot().get(Currency.USDT);
        assertThat(usdt.getFree()).isEqualByComparingTo("500");
        assertThat(usdt.getLocked()).isEqualByComparingTo("0");
    }

    @Test
    void releaseRestoresTheExactPreviousState() throws Exception {
        Map<Currency, Balance> before = ledger.snapshot();

        Reservation reservation = ledger.reserve(Currency.XRP, new BigDecimal("250"));
        ledger.release(reservation);

        assertThat(ledger.snapshot()).isEqualTo(before);
    }

    @Test
    void settleSpendRemovesFundsAndReturnsTheUnspentPart() throws Exception {
        Reservation reservation = ledger.reserve(Currency.USDC, new BigDecimal("60"));

        ledger.settleSpend(reservation, new BigDecimal("50"));

        Balance usdc = ledger.snapshot().get(Currency.USDC);
        assertThat(usdc.getFree()).isEqualByComparingTo("450");
        assertThat(usdc.getLocked()).isEqualByComparingTo("0");
    }

    @Test
    void settleReceiveCreditsFreeBalance() {
        ledger.settleReceive(Currency.USDT, new BigDecimal("52"));

        assertThat(ledger.free(Currency.USDT)).isEqualByComparingTo("552");
    }

    @Test
    void releasingTwiceIsAnInvariantViolation() throws Exception {
        Reservation reservation = ledger.reserve(Currency.XRP, BigDecimal.TEN);
        ledger.release(reservation);

        assertThatThrownBy(() -> ledger.release(reservation))
                .isInstanceOf(LedgerInvariantViolationException.class)
                .hasMessageContaining("RELEASED");
    }

    @Test
    void settlingAReleasedReservationIsAnInvariantViolation() throws Exception {
        Reservation reservation = ledger.reserve(Currency.XRP, BigDecimal.TEN);
        ledger.release(reservation);

        assertThatThrownBy(() -> ledger.settleSpend(reservation))
                .isInstanceOf(LedgerInvariantViolationException.class);
    }

    @Test
    void spendingMoreThanReservedIsAnInvariantViolation() throws Exception {
        Reservation reservation = ledger.reserve(Currency.XRP, BigDecimal.TEN);

        assertThatThrownBy(() -> ledger.settleSpend(reservation, new BigDecimal("10.5")))
                .isInstanceOf(LedgerInvariantViolationException.class);
        assertThat(reservation.isActive()).isTrue();
    }

    @Test
    void nonPositiveReservationIsRejected() {
        assertThatThrownBy(() -> ledger.reserve(Currency.XRP, BigDecimal.ZERO))
                .isInstanceOf(LedgerInvariantViolationException.class);
    }

    @Test
    void randomOperationSequencesConserveTotalsAndStayNonNegative() {
        // given
        Random random = new Random(42);
        List<Reservation> open = new ArrayList<>();
        BigDecimal expectedTotal = new BigDecimal("1000");

        // when
        for (int i = 0; i < 2_000; i++) {
            int op = random.nextInt(4);
            if (op == 0) {
                BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(300));
                try {
                    open.add(ledger.reserve(Currency.XRP, amount));
                } catch (InsufficientFundsException e) {
                    assertThat(e.getRequested()).isGreaterThan(e.getAvailable());
                }
            } else if (op == 1 && !open.isEmpty()) {
                ledger.release(open.remove(random.nextInt(open.size())));
            } else if (op == 2 && !open.isEmpty()) {
                Reservation reservation = open.remove(random.nextInt(open.size()));
                BigDecimal spent = reservation.getAmount().multiply(BigDecimal.valueOf(random.nextInt(101)))
                        .divide(BigDecimal.valueOf(100));
                ledger.settleSpend(reservation, spent);
                expectedTotal = expectedTotal.subtract(spent);
            } else if (op == 3) {
                BigDecimal amount = BigDecimal.valueOf(random.nextInt(50));
                ledger.settleReceive(Currency.XRP, amount);
                expectedTotal = expectedTotal.add(amount);
            }

            // then
            Balance xrp = ledger.snapshot().get(Currency.XRP);
            assertThat(xrp.getFree().signum()).isGreaterThanOrEqualTo(0);
            assertThat(xrp.getLocked().signum()).isGreaterThanOrEqualTo(0);
            assertThat(xrp.getTotal()).isEqualByComparingTo(expectedTotal);
        }
    }
}
