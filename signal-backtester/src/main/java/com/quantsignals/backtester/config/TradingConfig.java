package com.quantsignals.backtester.config;

import com.quantsignals.backtester.signal.SignalGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the signal generator from the bound trading settings.
 */
@Configuration
@EnableConfigurationProperties(TradingProperties.class)
@Slf4j
public class TradingConfig {

    @Bean
    public SignalGenerator signalGenerator(TradingProperties properties) {
        SignalGenerator generator = new SignalGenerator(properties.toSignalConfig());
        log.info("Signal generator configured: {}", generator.getConfig());
        return generator;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
