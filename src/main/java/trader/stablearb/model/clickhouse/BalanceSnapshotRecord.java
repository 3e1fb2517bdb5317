package trader.stablearb.model.clickhouse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class BalanceSnapshotRecord {
    private String currency;
    private BigDecimal free;
    private BigDecimal locked;
    private LocalDateTime timestamp;
}
