package com.quantsignals.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Persistent daily bar, one row per symbol and date.
 */
@Entity
@Table(name = "historical_bars", uniqueConstraints = {
        @UniqueConstraint(name = "uk_bar_symbol_date", columnNames = { "symbol", "bar_date" })
}, indexes = {
        @Index(name = "idx_bar_symbol_date", columnList = "symbol, bar_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalBar {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "bar_date", nullable = false)
    private LocalDate date;

    @Column(name = "open", precision = 14, scale = 4)
    private BigDecimal open;

    @Column(name = "high", precision = 14, scale = 4)
    private BigDecimal high;

    @Column(name = "low", precision = 14, scale = 4)
    private BigDecimal low;

    @Column(name = "close", precision = 14, scale = 4)
    private BigDecimal close;

    @Column(name = "volume")
    private Long volume;

    public Bar toBar() {
        return Bar.builder()
                .symbol(this.symbol)
                .date(this.date)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume)
                .build();
    }

    public static HistoricalBar fromBar(Bar bar) {
        return HistoricalBar.builder()
                .symbol(bar.getSymbol())
                .date(bar.getDate())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .build();
    }
}
