package com.phillippitts.openmusic.presentation.controller;

import com.phillippitts.openmusic.service.cache.AdaptiveCache;
import com.phillippitts.openmusic.service.cache.CacheStatistics;
import com.phillippitts.openmusic.service.cache.OptimizationReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cache")
class CacheController {

    private final AdaptiveCache cache;

    CacheController(AdaptiveCache cache) {
        this.cache = cache;
    }

    @GetMapping("/stats")
    ResponseEntity<CacheStatistics> stats() {
        return ResponseEntity.ok(cache.statistics());
    }

    /** Runs one optimization pass now instead of waiting for the scheduler. */
    @PostMapping("/optimize")
    ResponseEntity<OptimizationReport> optimize() {
        return ResponseEntity.ok(cache.optimize());
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        cache.clear();
        return ResponseEntity.noContent().build();
    }
}
