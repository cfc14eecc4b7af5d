package com.phillippitts.openmusic.presentation.controller;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.service.playback.PlaybackCoordinator;
import com.phillippitts.openmusic.service.resolver.HierarchicalResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Ad-hoc resolution without touching any queue.
 */
@RestController
class ResolveController {

    private final HierarchicalResolver resolver;
    private final PlaybackCoordinator coordinator;

    ResolveController(HierarchicalResolver resolver, PlaybackCoordinator coordinator) {
        this.resolver = resolver;
        this.coordinator = coordinator;
    }

    @GetMapping("/resolve")
    ResponseEntity<List<Item>> resolve(@RequestParam("q") String query,
                                       @RequestParam(value = "limit", required = false) Integer limit) {
        List<Item> items = limit == null ? resolver.resolve(query) : resolver.resolve(query, limit);
        return ResponseEntity.ok(items);
    }

    /** Resolves a URL or query to its best item and returns a playable stream URL for it. */
    @GetMapping("/stream")
    ResponseEntity<Map<String, Object>> stream(@RequestParam("q") String query) {
        Item item = resolver.resolve(query, 1).get(0);
        return ResponseEntity.ok(Map.of(
                "item", item,
                "streamUrl", coordinator.streamUrl(item)
        ));
    }
}
