package com.livebundle.dispatch.api;

import com.livebundle.core.model.RebuildStatus;
import com.livebundle.core.scheduler.AutoRebuildService;
import com.livebundle.core.session.SessionIds;
import com.livebundle.core.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for auto-rebuild status, manual rebuilds and the global event stream.
 */
@RestController
@RequestMapping("/api/v1")
public class RebuildController {

    private static final Logger log = LoggerFactory.getLogger(RebuildController.class);

    private final AutoRebuildService autoRebuildService;
    private final SseStreamingService sseStreamingService;

    public RebuildController(AutoRebuildService autoRebuildService, SseStreamingService sseStreamingService) {
        this.autoRebuildService = autoRebuildService;
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping("/rebuild/status")
    public ResponseEntity<?> status() {
        return ResponseEntity.ok(autoRebuildService.getStatus());
    }

    /**
     * POST /api/v1/rebuild/{id}: Rebuild a session now and return the outcome.
     * Returns 409 when a build for the session is already running.
     */
    @PostMapping("/rebuild/{id}")
    public ResponseEntity<?> rebuild(@PathVariable String id) {
        if (!SessionIds.isValid(id)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid session id: " + id));
        }
        try {
            var outcome = autoRebuildService.manualRebuild(id);
            if (outcome.status() == RebuildStatus.SKIPPED_IN_PROGRESS) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
            }
            if (outcome.status() == RebuildStatus.SESSION_NOT_FOUND) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(outcome);
            }
            return ResponseEntity.ok(outcome);
        } catch (SessionNotFoundException e) {
            log.debug("Manual rebuild for unknown session {}", id);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/events: SSE stream of lifecycle events from every session.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAllEvents() {
        return sseStreamingService.createGlobalEmitter();
    }
}
