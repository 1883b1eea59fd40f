package com.quantsignals.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for a multi-symbol backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchBacktestRequest {

    @NotEmpty(message = "At least one symbol is required")
    @Size(max = 100, message = "At most 100 symbols per batch")
    private List<@NotBlank(message = "Symbols must not be blank") String> symbols;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    @DecimalMin(value = "0", inclusive = false, message = "Position size fraction must be positive")
    @DecimalMax(value = "1", message = "Position size fraction must not exceed 1")
    private BigDecimal positionSizeFraction;
}
