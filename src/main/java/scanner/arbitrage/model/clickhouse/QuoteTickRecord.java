package scanner.arbitrage.model.clickhouse;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class QuoteTickRecord {
    private LocalDateTime timestamp;
    private String venue;
    private String symbol;
    private BigDecimal price;
    private BigDecimal bid;
    private BigDecimal ask;
}
