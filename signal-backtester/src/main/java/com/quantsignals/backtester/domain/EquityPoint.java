package com.quantsignals.backtester.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class EquityPoint {
    LocalDate date;
    BigDecimal value;
}
