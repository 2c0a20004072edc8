package com.tradeintel.intelligence.controller;

import com.tradeintel.common.exception.InvalidOutcomeException;
import com.tradeintel.intelligence.LedgerRows;
import com.tradeintel.intelligence.service.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LedgerControllerTest {

    private LedgerService ledgerService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ledgerService = mock(LedgerService.class);
        client = WebTestClient
            .bindToController(new LedgerController(ledgerService))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("accepted outcome → 201 with the stored row")
    void recordCreated() {
        when(ledgerService.record(any())).thenReturn(Mono.just(LedgerRows.closed(42, "NVDA", "alpha", 2.5, "VWAP Cross")));

        client.post().uri("/api/v1/ledger/outcomes")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("symbol", "NVDA", "engine", "alpha", "returnPercent", 2.5))
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.id").isEqualTo(42)
            .jsonPath("$.resolution").isEqualTo("WIN")
            .jsonPath("$.signals[0]").isEqualTo("VWAP Cross");
    }

    @Test
    @DisplayName("inconsistent outcome → 400 with the MalformedRecord kind")
    void recordRejected() {
        when(ledgerService.record(any())).thenReturn(Mono.error(
            new InvalidOutcomeException("resolution WIN inconsistent with return -3.0000% (expected LOSS)")));

        client.post().uri("/api/v1/ledger/outcomes")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("symbol", "NVDA", "resolution", "WIN", "returnPercent", -3.0))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorKind").isEqualTo("MALFORMED_RECORD");
    }

    @Test
    @DisplayName("recent outcomes are streamed as a JSON array")
    void recent() {
        when(ledgerService.recent("NVDA", 5)).thenReturn(Flux.just(
            LedgerRows.closed(2, "NVDA", "alpha", -1.0),
            LedgerRows.closed(1, "NVDA", "alpha", 2.0)));

        client.get().uri("/api/v1/ledger/outcomes/NVDA?limit=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[0].resolution").isEqualTo("LOSS");
    }
}
