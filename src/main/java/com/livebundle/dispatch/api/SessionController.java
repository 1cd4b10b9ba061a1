package com.livebundle.dispatch.api;

import com.livebundle.core.build.BundleArtifacts;
import com.livebundle.core.model.BuildTarget;
import com.livebundle.core.model.Session;
import com.livebundle.core.session.SessionBusyException;
import com.livebundle.core.session.SessionCreationException;
import com.livebundle.core.session.SessionIds;
import com.livebundle.core.session.SessionLifecycleService;
import com.livebundle.core.session.SessionNotFoundException;
import com.livebundle.core.session.SessionRegistry;
import com.livebundle.core.session.WorkspaceMutexTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for session lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private static final MediaType JAVASCRIPT = MediaType.valueOf("application/javascript");

    private final SessionRegistry sessionRegistry;
    private final SessionLifecycleService lifecycleService;
    private final SseStreamingService sseStreamingService;
    private final BundleArtifacts bundleArtifacts;

    public SessionController(SessionRegistry sessionRegistry,
                             SessionLifecycleService lifecycleService,
                             SseStreamingService sseStreamingService,
                             BundleArtifacts bundleArtifacts) {
        this.sessionRegistry = sessionRegistry;
        this.lifecycleService = lifecycleService;
        this.sseStreamingService = sseStreamingService;
        this.bundleArtifacts = bundleArtifacts;
    }

    /**
     * POST /api/v1/sessions: Create a session from the template and start watching it.
     */
    @PostMapping
    public ResponseEntity<?> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        Path template = request != null && request.templatePath() != null && !request.templatePath().isBlank()
                ? Path.of(request.templatePath())
                : null;
        try {
            Session session = lifecycleService.create(template);
            return ResponseEntity.status(HttpStatus.CREATED).body(session);
        } catch (SessionCreationException e) {
            log.error("Session creation failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        } catch (WorkspaceMutexTimeoutException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/sessions: All live sessions, newest first. Sessions whose workspace vanished are pruned.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listSessions() {
        var sessions = sessionRegistry.listSessions();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessions", sessions);
        body.put("totalSessions", sessions.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        return ResponseEntity.ok(sessionRegistry.getStats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getSession(@PathVariable String id) {
        if (!SessionIds.isValid(id)) {
            return invalidId(id);
        }
        return sessionRegistry.resolveSession(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Session not found: " + id)));
    }

    /**
     * POST /api/v1/sessions/{id}/sync: Make the session current and (re)start its watcher.
     */
    @PostMapping("/{id}/sync")
    public ResponseEntity<?> syncSession(@PathVariable String id) {
        if (!SessionIds.isValid(id)) {
            return invalidId(id);
        }
        try {
            Session session = lifecycleService.sync(id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("session", session);
            return ResponseEntity.ok(body);
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (WorkspaceMutexTimeoutException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteSession(@PathVariable String id) {
        if (!SessionIds.isValid(id)) {
            return invalidId(id);
        }
        try {
            lifecycleService.cleanup(id);
            return ResponseEntity.ok(Map.of("success", true, "sessionId", id));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (SessionBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (WorkspaceMutexTimeoutException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * DELETE /api/v1/sessions: Remove every session that is not building.
     */
    @DeleteMapping
    public ResponseEntity<?> deleteAllSessions() {
        try {
            return ResponseEntity.ok(lifecycleService.cleanupAll());
        } catch (WorkspaceMutexTimeoutException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of the session's lifecycle events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (!SessionIds.isValid(id)) {
            return ResponseEntity.badRequest().build();
        }
        if (sessionRegistry.resolveSession(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * GET /api/v1/sessions/{id}/bundles/{target}: The last bundle built for {@code web} or a platform.
     */
    @GetMapping("/{id}/bundles/{target}")
    public ResponseEntity<?> getBundle(@PathVariable String id, @PathVariable String target) {
        return serveArtifact(id, target, false);
    }

    @GetMapping("/{id}/bundles/{target}/map")
    public ResponseEntity<?> getSourceMap(@PathVariable String id, @PathVariable String target) {
        return serveArtifact(id, target, true);
    }

    /**
     * GET /api/v1/sessions/{id}/bundles/{target}/info: Size and modification time of a built bundle.
     */
    @GetMapping("/{id}/bundles/{target}/info")
    public ResponseEntity<?> getBundleInfo(@PathVariable String id, @PathVariable String target) {
        if (!SessionIds.isValid(id)) {
            return invalidId(id);
        }
        try {
            BuildTarget buildTarget = bundleArtifacts.resolveTarget(target);
            return bundleArtifacts.info(id, buildTarget)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> notBuilt(buildTarget));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    private ResponseEntity<?> serveArtifact(String id, String target, boolean sourceMap) {
        if (!SessionIds.isValid(id)) {
            return invalidId(id);
        }
        try {
            BuildTarget buildTarget = bundleArtifacts.resolveTarget(target);
            Optional<Path> file = sourceMap
                    ? bundleArtifacts.sourceMap(id, buildTarget)
                    : bundleArtifacts.bundle(id, buildTarget);
            if (file.isEmpty()) {
                return notBuilt(buildTarget);
            }
            return ResponseEntity.ok()
                    .contentType(sourceMap ? MediaType.APPLICATION_JSON : JAVASCRIPT)
                    .cacheControl(CacheControl.noCache())
                    .body(Files.readAllBytes(file.get()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            log.error("Could not read {} artifact of session {}", target, id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    private static ResponseEntity<?> notBuilt(BuildTarget target) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "No " + target + " bundle built yet"));
    }

    private static ResponseEntity<?> invalidId(String id) {
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid session id: " + id));
    }
}
