package com.memeinsight.service.controller;

import com.memeinsight.common.model.InsightSnapshot;
import com.memeinsight.common.model.MarketSummary;
import com.memeinsight.common.model.ScoringWeights;
import com.memeinsight.common.model.TickerSnapshot;
import com.memeinsight.service.api.InsightService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/insight")
public class InsightController {

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<InsightSnapshot> snapshot() {
        return ResponseEntity.ok(insightService.snapshot());
    }

    @GetMapping("/tickers/{symbol}")
    public ResponseEntity<TickerSnapshot> ticker(@PathVariable String symbol) {
        return insightService.ticker(symbol)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/summary")
    public ResponseEntity<MarketSummary> summary() {
        return ResponseEntity.ok(insightService.summary());
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<InsightSnapshot>> refresh(@RequestParam(required = false) String symbol) {
        Mono<InsightSnapshot> cycle = symbol == null || symbol.isBlank()
            ? insightService.refreshNow()
            : insightService.refreshNow(symbol);
        return cycle.map(ResponseEntity::ok);
    }

    @PutMapping("/weighting")
    public ResponseEntity<ScoringWeights> setWeighting(@RequestBody ScoringWeights weights) {
        return ResponseEntity.ok(insightService.setWeighting(weights));
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<Map<String, Integer>> invalidateCache() {
        return ResponseEntity.ok(Map.of("invalidated", insightService.forceUpdateCache()));
    }

    @DeleteMapping("/history")
    public Mono<ResponseEntity<Void>> clearHistory() {
        return insightService.clearHistoricalData().thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @PostMapping("/sources/{source}/resume")
    public ResponseEntity<Map<String, Object>> resumeSource(@PathVariable String source) {
        boolean resumed = insightService.resumeSource(source);
        return ResponseEntity.ok(Map.<String, Object>of("source", source, "resumed", resumed));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
