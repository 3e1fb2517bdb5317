package trader.stablearb.service.monitor;

import trader.stablearb.model.Quote;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, time-ordered quote history of one market. Bounded both by capacity and by age,
 * whichever is smaller.
 */
class QuoteHistory {
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final int capacity;
    private final Duration window;
    private final Deque<Quote> quotes = new ArrayDeque<>();

    QuoteHistory(int capacity, Duration window) {
        this.capacity = capacity;
        this.window = window;
    }

    synchronized void append(Quote quote) {
        Quote last = quotes.peekLast();
        if (last != null && quote.getTimestamp().isBefore(last.getTimestamp())) {
            // out-of-order responses never rewrite history
            return;
        }
        quotes.addLast(quote);
        while (quotes.size() > capacity) {
            quotes.removeFirst();
        }
        prune(quote.getTimestamp());
    }

    synchronized void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!quotes.isEmpty() && quotes.peekFirst().getTimestamp().isBefore(cutoff)) {
            quotes.removeFirst();
        }
    }

    synchronized Optional<Quote> latest() {
        return Optional.ofNullable(quotes.peekLast());
    }

    synchronized List<Quote> snapshot() {
        return List.copyOf(quotes);
    }

    synchronized int size() {
        return quotes.size();
    }

    /**
     * Sample standard deviation of simple returns between consecutive quotes, in percent.
     * Zero when there are fewer than two returns.
     */
    synchronized double volatility() {
        if (quotes.size() < 3) {
            return 0.0;
        }
        double[] returns = new double[quotes.size() - 1];
        Iterator<Quote> it = quotes.iterator();
        BigDecimal previous = it.next().getPrice();
        int i = 0;
        while (it.hasNext()) {
            BigDecimal current = it.next().getPrice();
            returns[i++] = current.subtract(previous)
                    .divide(previous, MathContext.DECIMAL64)
                    .multiply(HUNDRED)
                    .doubleValue();
            previous = current;
        }

        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;

        double sumSquares = 0.0;
        for (double r : returns) {
            sumSquares += (r - mean) * (r - mean);
        }
        return Math.sqrt(sumSquares / (returns.length - 1));
    }
}
