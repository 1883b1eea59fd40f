package com.quantsignals.backtester.controller;

import com.quantsignals.backtester.controller.dto.SignalResponse;
import com.quantsignals.backtester.service.SignalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * REST controller for current trading signals.
 */
@RestController
@RequestMapping("/signals")
@RequiredArgsConstructor
@Slf4j
public class SignalController {

    private final SignalService signalService;

    @GetMapping("/{symbol}")
    public ResponseEntity<SignalResponse> getSignal(@PathVariable String symbol) {

        log.info("GET /signals/{}", symbol);

        SignalResponse response = signalService.generateSignal(symbol)
                .map(SignalResponse::from)
                .orElseGet(() -> SignalResponse.hold(symbol.trim().toUpperCase(Locale.ROOT)));

        return ResponseEntity.ok(response);
    }
}
