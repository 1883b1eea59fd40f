package com.quantsignals.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.quantsignals.backtester.domain.Signal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Response DTO for the current signal of a symbol. Action is BUY, SELL or HOLD.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalResponse {

    public static final String HOLD = "HOLD";

    private String symbol;
    private String action;
    private BigDecimal price;
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;
    private Double confidence;
    private String strategy;
    private String reason;
    private Map<String, Double> indicators;

    public static SignalResponse hold(String symbol) {
        return SignalResponse.builder()
                .symbol(symbol)
                .action(HOLD)
                .build();
    }

    public static SignalResponse from(Signal signal) {
        return SignalResponse.builder()
                .symbol(signal.getSymbol())
                .action(signal.getType().name())
                .price(signal.getPrice())
                .date(signal.getDate())
                .confidence(signal.getConfidence())
                .strategy(signal.getStrategy().name())
                .reason(signal.getReason())
                .indicators(signal.getIndicators())
                .build();
    }
}
