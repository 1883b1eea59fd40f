package com.quantsignals.backtester.config;

import com.quantsignals.backtester.signal.SignalConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings bound from the {@code trading.*} section of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    private int rsiPeriod = 14;
    private double rsiOversold = 30.0;
    private double rsiOverbought = 70.0;

    private Macd macd = new Macd();
    private Bollinger bollinger = new Bollinger();
    private Sma sma = new Sma();
    private Stochastic stochastic = new Stochastic();

    private int williamsPeriod = 14;
    private int atrPeriod = 14;
    private int minHistoryBars = 50;

    private BigDecimal commissionRate = new BigDecimal("0.001");
    private BigDecimal initialCapital = new BigDecimal("100000");
    private BigDecimal defaultPositionSize = new BigDecimal("0.1");
    private int signalLookbackDays = 180;

    private Batch batch = new Batch();

    public SignalConfig toSignalConfig() {
        return SignalConfig.builder()
                .rsiPeriod(rsiPeriod)
                .rsiOversold(rsiOversold)
                .rsiOverbought(rsiOverbought)
                .macdFast(macd.getFast())
                .macdSlow(macd.getSlow())
                .macdSignal(macd.getSignal())
                .bollingerPeriod(bollinger.getPeriod())
                .bollingerStdDev(bollinger.getStdDev())
                .smaShort(sma.getShortPeriod())
                .smaLong(sma.getLongPeriod())
                .stochasticK(stochastic.getK())
                .stochasticD(stochastic.getD())
                .williamsPeriod(williamsPeriod)
                .atrPeriod(atrPeriod)
                .minHistoryBars(minHistoryBars)
                .build();
    }

    @Data
    public static class Macd {
        private int fast = 12;
        private int slow = 26;
        private int signal = 9;
    }

    @Data
    public static class Bollinger {
        private int period = 20;
        private double stdDev = 2.0;
    }

    @Data
    public static class Sma {
        private int shortPeriod = 10;
        private int longPeriod = 50;
    }

    @Data
    public static class Stochastic {
        private int k = 14;
        private int d = 3;
    }

    /**
     * Worker pool and retry policy for multi-symbol runs.
     */
    @Data
    public static class Batch {
        private int concurrency = 10;
        private Duration symbolTimeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(500);
    }
}
