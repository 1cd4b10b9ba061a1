package com.livebundle.core.build;

import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.events.EventBus;
import com.livebundle.core.events.LiveBundleEvent;
import com.livebundle.core.logging.MdcContext;
import com.livebundle.core.metrics.LivebundleMetrics;
import com.livebundle.core.model.ActiveBuild;
import com.livebundle.core.model.BuildResult;
import com.livebundle.core.model.BuildTarget;
import com.livebundle.core.model.RebuildOutcome;
import com.livebundle.core.model.RebuildStatus;
import com.livebundle.core.model.Session;
import com.livebundle.core.session.ActiveBuildGuard;
import com.livebundle.core.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs rebuilds of session workspaces into a web bundle and one bundle per mobile platform.
 * <p>
 * At most one build runs per session: a request arriving while the session is building
 * is dropped and reported as {@link RebuildStatus#SKIPPED_IN_PROGRESS}. Every build that
 * starts publishes exactly one {@code rebuild-started} and one {@code rebuild-completed}
 * event and always releases its in-flight entry, whatever the compilers do.
 * <p>
 * The web target decides overall success. Mobile platforms are compiled in parallel on
 * the build executor and are attempted even when the web target fails. A failing or
 * crashing target only marks its own result as failed.
 */
@Service
public class BuildOrchestrator implements ActiveBuildGuard {

    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    static final String WEB_BUNDLE_NAME = "session-app.js";

    private final ConcurrentHashMap<String, ActiveBuild> activeBuilds = new ConcurrentHashMap<>();

    private final SessionRegistry sessionRegistry;
    private final Compiler webCompiler;
    private final Compiler mobileCompiler;
    private final EventBus eventBus;
    private final LivebundleMetrics metrics;
    private final ExecutorService rebuildExecutor;
    private final ExecutorService buildExecutor;
    private final LivebundleProperties properties;

    public BuildOrchestrator(SessionRegistry sessionRegistry,
                             @Qualifier("webCompiler") Compiler webCompiler,
                             @Qualifier("mobileCompiler") Compiler mobileCompiler,
                             EventBus eventBus,
                             LivebundleMetrics metrics,
                             @Qualifier("rebuildExecutor") ExecutorService rebuildExecutor,
                             @Qualifier("buildExecutor") ExecutorService buildExecutor,
                             LivebundleProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.webCompiler = webCompiler;
        this.mobileCompiler = mobileCompiler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.rebuildExecutor = rebuildExecutor;
        this.buildExecutor = buildExecutor;
        this.properties = properties;
    }

    /**
     * Rebuilds all targets of a session on the calling thread.
     *
     * @param sessionId       session to build
     * @param triggerFilePath workspace-relative path of the change that caused the rebuild
     * @return the outcome; never throws for build failures
     */
    public RebuildOutcome executeRebuild(String sessionId, String triggerFilePath) {
        if (activeBuilds.containsKey(sessionId)) {
            return skipInProgress(sessionId, triggerFilePath);
        }

        var session = sessionRegistry.resolveSession(sessionId);
        if (session.isEmpty()) {
            log.warn("Rebuild requested for unknown session {}", sessionId);
            var payload = new LinkedHashMap<String, Object>();
            payload.put("triggerFile", triggerFilePath);
            payload.put("success", false);
            payload.put("error", "Session not found");
            eventBus.publish(LiveBundleEvent.REBUILD_COMPLETED, sessionId, payload);
            metrics.recordRebuild("not_found");
            return RebuildOutcome.sessionNotFound(sessionId, triggerFilePath);
        }

        var active = new ActiveBuild(sessionId, Instant.now(), triggerFilePath);
        if (activeBuilds.putIfAbsent(sessionId, active) != null) {
            return skipInProgress(sessionId, triggerFilePath);
        }

        long start = System.currentTimeMillis();
        MdcContext.setSession(sessionId);
        try {
            log.info("Rebuilding session {} (trigger: {})", sessionId, triggerFilePath);
            var started = new LinkedHashMap<String, Object>();
            started.put("triggerFile", triggerFilePath);
            eventBus.publish(LiveBundleEvent.REBUILD_STARTED, sessionId, started);

            RebuildOutcome outcome;
            String error;
            try {
                var results = buildAllTargets(session.get());
                var web = results.get(0);
                long totalBytes = results.stream()
                        .filter(BuildResult::success)
                        .mapToLong(BuildResult::bundleSizeBytes)
                        .sum();
                outcome = new RebuildOutcome(sessionId, triggerFilePath, RebuildStatus.COMPLETED,
                        web.success(), System.currentTimeMillis() - start, totalBytes, List.copyOf(results));
                error = web.error();
            } catch (RuntimeException e) {
                log.error("Rebuild of session {} failed unexpectedly", sessionId, e);
                outcome = new RebuildOutcome(sessionId, triggerFilePath, RebuildStatus.COMPLETED,
                        false, System.currentTimeMillis() - start, 0, List.of());
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }

            publishCompleted(outcome, error);
            metrics.recordRebuild(outcome.success() ? "completed" : "failed");
            log.info("Rebuild of session {} finished in {}ms (success={}, {} bytes)",
                    sessionId, outcome.durationMs(), outcome.success(), outcome.totalBundleBytes());
            return outcome;
        } finally {
            activeBuilds.remove(sessionId, active);
            MdcContext.clear();
        }
    }

    /**
     * Runs {@link #executeRebuild} on the rebuild executor.
     */
    public CompletableFuture<RebuildOutcome> submitRebuild(String sessionId, String triggerFilePath) {
        return CompletableFuture.supplyAsync(() -> executeRebuild(sessionId, triggerFilePath), rebuildExecutor);
    }

    @Override
    public boolean isBuilding(String sessionId) {
        return sessionId != null && activeBuilds.containsKey(sessionId);
    }

    /** Snapshot of the builds currently executing. */
    public List<ActiveBuild> activeBuilds() {
        return List.copyOf(activeBuilds.values());
    }

    private RebuildOutcome skipInProgress(String sessionId, String triggerFilePath) {
        log.info("Build already in progress for session {}, skipping (trigger: {})", sessionId, triggerFilePath);
        metrics.recordDeduplicated();
        metrics.recordRebuild("skipped");
        return RebuildOutcome.skipped(sessionId, triggerFilePath);
    }

    private List<BuildResult> buildAllTargets(Session session) {
        var results = new ArrayList<BuildResult>();
        MdcContext.setTarget(session.sessionId(), BuildTarget.WEB);
        try {
            results.add(buildTarget(session, BuildTarget.web()));
        } finally {
            MdcContext.clearTarget();
        }

        var futures = new ArrayList<Map.Entry<BuildTarget, CompletableFuture<BuildResult>>>();
        for (String platform : properties.getPlatforms()) {
            var target = BuildTarget.mobile(platform);
            CompletableFuture<BuildResult> future;
            try {
                future = CompletableFuture.supplyAsync(() -> {
                    MdcContext.setTarget(session.sessionId(), target.toString());
                    try {
                        return buildTarget(session, target);
                    } finally {
                        MdcContext.clear();
                    }
                }, buildExecutor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(
                        BuildResult.failed(session.sessionId(), target, 0, "Build executor unavailable"));
            }
            futures.add(Map.entry(target, future));
        }

        for (var entry : futures) {
            try {
                results.add(entry.getValue().join());
            } catch (CompletionException e) {
                var cause = e.getCause() != null ? e.getCause() : e;
                log.error("Mobile build for {} failed unexpectedly", entry.getKey(), cause);
                results.add(BuildResult.failed(session.sessionId(), entry.getKey(), 0, cause.getMessage()));
            }
        }
        return results;
    }

    /**
     * Compiles one target and writes its artifacts. Compile failures become a failed result.
     */
    BuildResult buildTarget(Session session, BuildTarget target) {
        long start = System.currentTimeMillis();
        Path entryFile = session.workspacePath().resolve(properties.getEntryFile());
        if (!Files.isRegularFile(entryFile)) {
            log.warn("Entry file not found for {}: {}", target, entryFile);
            metrics.recordBuildDuration(target.toString(), false, System.currentTimeMillis() - start);
            return BuildResult.failed(session.sessionId(), target, System.currentTimeMillis() - start,
                    "Entry file not found: " + properties.getEntryFile());
        }

        try {
            var options = target.isWeb()
                    ? CompileOptions.web(properties.isDev(), properties.isMinify())
                    : CompileOptions.mobile(target.platform(), properties.isDev(), properties.isMinify());
            var compiler = target.isWeb() ? webCompiler : mobileCompiler;
            var output = compiler.compile(entryFile, session.workspacePath(), options);

            Path bundle = bundlePath(session, target);
            Files.createDirectories(bundle.getParent());
            Files.writeString(bundle, output.code(), StandardCharsets.UTF_8);
            Path sourceMap = null;
            if (output.sourceMap() != null) {
                sourceMap = BundleArtifacts.sourceMapOf(bundle);
                Files.writeString(sourceMap, output.sourceMap(), StandardCharsets.UTF_8);
            }

            long size = Files.size(bundle);
            long duration = System.currentTimeMillis() - start;
            metrics.recordBuildDuration(target.toString(), true, duration);
            metrics.recordBundleSize(target.toString(), size);
            log.info("Built {} for session {} ({} bytes, {}ms)", target, session.sessionId(), size, duration);
            return BuildResult.succeeded(session.sessionId(), target, bundle.toString(),
                    sourceMap == null ? null : sourceMap.toString(), size, duration);
        } catch (CompileException | IOException e) {
            long duration = System.currentTimeMillis() - start;
            metrics.recordBuildDuration(target.toString(), false, duration);
            log.warn("Build of {} failed for session {}: {}", target, session.sessionId(), e.getMessage());
            return BuildResult.failed(session.sessionId(), target, duration, e.getMessage());
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - start;
            metrics.recordBuildDuration(target.toString(), false, duration);
            log.error("Compiler crashed building {} for session {}", target, session.sessionId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return BuildResult.failed(session.sessionId(), target, duration, message);
        }
    }

    static Path bundlePath(Session session, BuildTarget target) {
        if (target.isWeb()) {
            return session.distPath().resolve(WEB_BUNDLE_NAME);
        }
        return session.mobileDistPath()
                .resolve("%s.%s.bundle".formatted(session.sessionId(), target.platform()));
    }

    private void publishCompleted(RebuildOutcome outcome, String error) {
        var buildResult = new LinkedHashMap<String, Object>();
        var web = outcome.resultFor(BuildTarget.WEB);
        if (web != null && web.outputPath() != null) {
            buildResult.put("compiledAppPath", web.outputPath());
        }
        buildResult.put("totalBundleBytes", outcome.totalBundleBytes());
        buildResult.put("results", outcome.results());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("triggerFile", outcome.triggerFile());
        payload.put("duration", outcome.durationMs());
        payload.put("success", outcome.success());
        payload.put("buildResult", buildResult);
        if (error != null) {
            payload.put("error", error);
        }
        eventBus.publish(LiveBundleEvent.REBUILD_COMPLETED, outcome.sessionId(), payload);
    }
}
