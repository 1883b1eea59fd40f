package com.quantsignals.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Signal Backtester service.
 */
@SpringBootApplication
public class SignalBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalBacktesterApplication.class, args);
    }

}
