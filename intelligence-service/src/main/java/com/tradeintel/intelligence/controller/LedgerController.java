package com.tradeintel.intelligence.controller;

import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.intelligence.dto.RecordOutcomeRequest;
import com.tradeintel.intelligence.service.LedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<TradeOutcome>> record(@RequestBody RecordOutcomeRequest request) {
        log.info("Outcome received. symbol={} engine={} resolution={}",
                 request.symbol(), request.engine(), request.resolution());
        return ledgerService.record(request)
            .map(saved -> ResponseEntity.status(HttpStatus.CREATED).body(saved));
    }

    @GetMapping("/outcomes/{symbol}")
    public Flux<TradeOutcome> recent(@PathVariable String symbol,
                                     @RequestParam(defaultValue = "0") int limit) {
        log.info("Recent outcomes requested. symbol={} limit={}", symbol, limit);
        return ledgerService.recent(symbol, limit);
    }
}
