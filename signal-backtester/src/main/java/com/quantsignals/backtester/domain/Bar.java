package com.quantsignals.backtester.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Represents a single daily OHLCV bar.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Bar {

    private String symbol;
    private LocalDate date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;

    /**
     * A bar is usable only when every field is present, prices are positive and
     * volume is non-negative.
     */
    @JsonIgnore
    public boolean isComplete() {
        return date != null
                && isPositive(open)
                && isPositive(high)
                && isPositive(low)
                && isPositive(close)
                && volume != null
                && volume >= 0;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
