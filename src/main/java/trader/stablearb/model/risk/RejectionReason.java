package trader.stablearb.model.risk;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RejectionReason {
    SPREAD_TOO_SMALL("spread_too_small"),
    STALE_PRICE("stale_price"),
    DAILY_LIMIT_EXCEEDED("daily_limit_exceeded"),
    INSUFFICIENT_SAFETY_MARGIN("insufficient_safety_margin"),
    VOLATILITY_TOO_HIGH("volatility_too_high"),
    COOLDOWN_ACTIVE("cooldown_active"),
    SPREAD_SUSPICIOUS("spread_suspicious"),
    DAILY_LOSS_LIMIT("daily_loss_limit");

    private final String code;
}
