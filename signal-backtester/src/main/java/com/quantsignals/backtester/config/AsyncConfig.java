package com.quantsignals.backtester.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded worker pool for multi-symbol backtests.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "batchExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService batchExecutorService(TradingProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getConcurrency(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("BacktestWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
