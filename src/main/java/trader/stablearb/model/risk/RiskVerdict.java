package trader.stablearb.model.risk;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RiskVerdict {
    boolean approved;
    RejectionReason reason;
    String detail;
    BigDecimal executableAmount;

    public static RiskVerdict approve(BigDecimal executableAmount) {
        return new RiskVerdict(true, null, "All risk checks passed", executableAmount);
    }

    public static RiskVerdict reject(RejectionReason reason, String detail) {
        return new RiskVerdict(false, reason, detail, BigDecimal.ZERO);
    }
}
