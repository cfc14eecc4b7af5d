package com.phillippitts.openmusic.presentation.controller;

import com.phillippitts.openmusic.domain.BackendConfig;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.service.resolver.BackendRegistry;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Operator view of the backend chain; changes apply to the next resolution attempt.
 */
@RestController
@RequestMapping("/backends")
class BackendController {

    private final BackendRegistry registry;

    BackendController(BackendRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    ResponseEntity<List<BackendView>> list() {
        return ResponseEntity.ok(registry.all().stream().map(BackendView::of).toList());
    }

    @PatchMapping("/{name}")
    ResponseEntity<BackendView> update(@PathVariable String name, @Validated @RequestBody BackendPatch patch) {
        BackendConfig updated = registry.update(name, new BackendRegistry.BackendUpdate(
                patch.enabled(),
                patch.timeoutMs() == null ? null : Duration.ofMillis(patch.timeoutMs()),
                patch.maxRetries(),
                patch.priority()));
        return ResponseEntity.ok(BackendView.of(updated));
    }

    record BackendPatch(Boolean enabled, @Positive Long timeoutMs, @Min(1) Integer maxRetries, Integer priority) {}

    record BackendView(String name, SourceKind kind, int priority, long timeoutMs, int maxRetries, boolean enabled) {
        static BackendView of(BackendConfig config) {
            return new BackendView(config.getName(), config.getKind(), config.getPriority(),
                    config.getTimeout().toMillis(), config.getMaxRetries(), config.isEnabled());
        }
    }
}
