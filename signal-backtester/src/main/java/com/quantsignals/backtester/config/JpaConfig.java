package com.quantsignals.backtester.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the bar store.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.quantsignals.backtester.repository")
@EnableTransactionManagement
public class JpaConfig {
}
