package trader.stablearb.model.clickhouse;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class QuoteRecord {
    private String market;
    private BigDecimal price;
    private BigDecimal volume;
    private LocalDateTime timestamp;
}
