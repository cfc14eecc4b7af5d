package com.phillippitts.openmusic.presentation.controller;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.LoopMode;
import com.phillippitts.openmusic.service.playback.PlaybackCoordinator;
import com.phillippitts.openmusic.service.queue.FailureReport;
import com.phillippitts.openmusic.service.queue.QueueRegistry;
import com.phillippitts.openmusic.service.queue.QueueSnapshot;
import com.phillippitts.openmusic.service.queue.QueueStats;
import com.phillippitts.openmusic.service.queue.ResilientQueue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Per-session queue operations and playback feedback.
 */
@RestController
@RequestMapping("/sessions/{sessionId}")
class QueueController {

    private final PlaybackCoordinator coordinator;
    private final QueueRegistry queues;

    QueueController(PlaybackCoordinator coordinator, QueueRegistry queues) {
        this.coordinator = coordinator;
        this.queues = queues;
    }

    @PostMapping("/queue")
    ResponseEntity<Item> enqueue(@PathVariable String sessionId, @Valid @RequestBody EnqueueRequest request) {
        Item item = coordinator.request(sessionId, request.query(), request.requester());
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @PostMapping("/queue/next")
    ResponseEntity<Item> next(@PathVariable String sessionId) {
        return coordinator.next(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/queue")
    ResponseEntity<QueueSnapshot> snapshot(@PathVariable String sessionId) {
        return ResponseEntity.ok(queues.forSession(sessionId).snapshot());
    }

    @GetMapping("/queue/stats")
    ResponseEntity<QueueStats> stats(@PathVariable String sessionId) {
        return ResponseEntity.ok(queues.forSession(sessionId).stats());
    }

    @PutMapping("/queue/loop")
    ResponseEntity<Map<String, Object>> loop(@PathVariable String sessionId,
                                             @Valid @RequestBody LoopRequest request) {
        queues.forSession(sessionId).setLoopMode(request.mode());
        return ResponseEntity.ok(Map.of("loopMode", request.mode()));
    }

    @PutMapping("/queue/shuffle")
    ResponseEntity<Map<String, Object>> shuffle(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("shuffle", queues.forSession(sessionId).toggleShuffle()));
    }

    @PostMapping("/queue/skip")
    ResponseEntity<Map<String, Object>> skip(@PathVariable String sessionId,
                                             @RequestParam(value = "count", defaultValue = "1") int count) {
        return ResponseEntity.ok(Map.of("skipped", queues.forSession(sessionId).skip(count)));
    }

    @DeleteMapping("/queue")
    ResponseEntity<Map<String, Object>> clear(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("cleared", queues.forSession(sessionId).clear()));
    }

    @DeleteMapping("/queue/duplicates")
    ResponseEntity<Map<String, Object>> removeDuplicates(@PathVariable String sessionId) {
        ResilientQueue queue = queues.forSession(sessionId);
        return ResponseEntity.ok(Map.of("removed", queue.removeDuplicates()));
    }

    @PostMapping("/playback/success")
    ResponseEntity<Void> success(@PathVariable String sessionId, @Valid @RequestBody PlaybackReport report) {
        coordinator.reportSuccess(sessionId, report.url());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/playback/failure")
    ResponseEntity<FailureReport> failure(@PathVariable String sessionId, @Valid @RequestBody PlaybackReport report) {
        return ResponseEntity.ok(coordinator.reportFailure(sessionId, report.url(), report.reason()));
    }

    record EnqueueRequest(@NotBlank String query, String requester) {}

    record LoopRequest(@NotNull LoopMode mode) {}

    record PlaybackReport(@NotBlank String url, String reason) {}
}
