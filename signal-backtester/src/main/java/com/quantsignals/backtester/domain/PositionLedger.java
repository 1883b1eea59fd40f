package com.quantsignals.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cash, open positions and the trade log of one backtest run.
 * <p>
 * Holds at most one position per symbol and never lets cash go negative.
 * All amounts are exact; nothing on the buy or sell path is rounded except
 * the share count, which is floored.
 */
@Slf4j
public class PositionLedger {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal commissionRate;
    private BigDecimal cash;
    private final Map<String, Position> openPositions = new LinkedHashMap<>();
    private final List<Trade> tradeLog = new ArrayList<>();

    public PositionLedger(BigDecimal initialCash, BigDecimal commissionRate) {
        if (initialCash == null || initialCash.signum() < 0) {
            throw new InvalidConfigurationException("Initial cash must not be negative, got " + initialCash);
        }
        if (commissionRate == null || commissionRate.signum() < 0 || commissionRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidConfigurationException("Commission rate must be within [0, 1), got " + commissionRate);
        }
        this.cash = initialCash;
        this.commissionRate = commissionRate;
    }

    /**
     * Open a position sized as a fraction of current cash.
     * A buy while a position is open, or without enough cash, is a no-op.
     *
     * @return the opened position, or empty when nothing was bought
     */
    public Optional<Position> buy(String symbol, BigDecimal price, LocalDate date, BigDecimal fraction) {
        if (openPositions.containsKey(symbol)) {
            log.debug("Ignoring BUY for {} on {}: position already open", symbol, date);
            return Optional.empty();
        }
        requireFraction(fraction);

        long shares = cash.multiply(fraction).divide(price, 0, RoundingMode.DOWN).longValueExact();
        if (shares <= 0) {
            log.debug("Ignoring BUY for {} on {}: {} cash buys no shares at {}", symbol, date, cash, price);
            return Optional.empty();
        }

        BigDecimal notional = price.multiply(BigDecimal.valueOf(shares));
        BigDecimal commission = notional.multiply(commissionRate);
        BigDecimal cost = notional.add(commission);
        if (cash.compareTo(cost) < 0) {
            log.info("Insufficient cash for {} on {}: need {}, have {}", symbol, date, cost, cash);
            return Optional.empty();
        }

        Position position = Position.builder()
                .symbol(symbol)
                .shares(shares)
                .entryPrice(price)
                .entryDate(date)
                .costBasis(cost)
                .entryCommission(commission)
                .build();

        cash = cash.subtract(cost);
        openPositions.put(symbol, position);
        log.debug("BUY {} {} at {} on {}, cost {}", shares, symbol, price, date, cost);
        return Optional.of(position);
    }

    /**
     * Close the open position for {@code symbol}. A sell while flat is a no-op.
     */
    public Optional<Trade> sell(String symbol, BigDecimal price, LocalDate date) {
        return close(symbol, price, date, false);
    }

    /**
     * Close the open position at end of run.
     */
    public Optional<Trade> forceClose(String symbol, BigDecimal price, LocalDate date) {
        return close(symbol, price, date, true);
    }

    private Optional<Trade> close(String symbol, BigDecimal price, LocalDate date, boolean forced) {
        Position position = openPositions.remove(symbol);
        if (position == null) {
            log.debug("Ignoring SELL for {} on {}: no open position", symbol, date);
            return Optional.empty();
        }

        BigDecimal gross = position.marketValue(price);
        BigDecimal exitCommission = gross.multiply(commissionRate);
        BigDecimal proceeds = gross.subtract(exitCommission);
        BigDecimal profit = proceeds.subtract(position.getCostBasis());
        BigDecimal returnPct = position.getCostBasis().signum() == 0
                ? BigDecimal.ZERO
                : profit.divide(position.getCostBasis(), 6, RoundingMode.HALF_UP).multiply(HUNDRED);

        Trade trade = Trade.builder()
                .symbol(symbol)
                .shares(position.getShares())
                .entryPrice(position.getEntryPrice())
                .entryDate(position.getEntryDate())
                .exitPrice(price)
                .exitDate(date)
                .costBasis(position.getCostBasis())
                .proceeds(proceeds)
                .commission(position.getEntryCommission().add(exitCommission))
                .profit(profit)
                .returnPct(returnPct)
                .forcedExit(forced)
                .build();

        cash = cash.add(proceeds);
        tradeLog.add(trade);
        log.debug("{} {} {} at {} on {}, profit {}", forced ? "FORCED SELL" : "SELL",
                position.getShares(), symbol, price, date, profit);
        return Optional.of(trade);
    }

    static void requireFraction(BigDecimal fraction) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidConfigurationException("Position size fraction must be within (0, 1], got " + fraction);
        }
    }

    public BigDecimal getCash() {
        return cash;
    }

    public boolean hasPosition(String symbol) {
        return openPositions.containsKey(symbol);
    }

    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(openPositions.get(symbol));
    }

    public List<Trade> getTradeLog() {
        return Collections.unmodifiableList(tradeLog);
    }

    /**
     * Cash plus the market value of every open position at the given prices.
     */
    public BigDecimal getPortfolioValue(Map<String, BigDecimal> prices) {
        BigDecimal value = cash;
        for (Position position : openPositions.values()) {
            BigDecimal price = prices.get(position.getSymbol());
            if (price == null) {
                throw new IllegalArgumentException("No price for open position " + position.getSymbol());
            }
            value = value.add(position.marketValue(price));
        }
        return value;
    }

    public BigDecimal getPortfolioValue(String symbol, BigDecimal price) {
        return getPortfolioValue(Map.of(symbol, price));
    }
}
