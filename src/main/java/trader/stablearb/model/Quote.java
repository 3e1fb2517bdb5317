package trader.stablearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class Quote {
    Market market;
    BigDecimal price;
    Instant timestamp;
    // optional, 24h volume reported by the feed
    BigDecimal volume;

    public Duration ageAt(Instant now) {
        Duration age = Duration.between(timestamp, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    public boolean isStaleAt(Instant now, Duration freshnessBound) {
        return ageAt(now).compareTo(freshnessBound) > 0;
    }
}
