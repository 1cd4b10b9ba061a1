package com.livebundle.core.health;

import com.livebundle.core.build.CommandLineCompiler;
import com.livebundle.core.build.Compiler;
import com.livebundle.core.session.SessionRegistry;
import com.livebundle.core.watch.WorkspaceWatcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SessionRegistry sessionRegistry;
    private final WorkspaceWatcherService watcherService;
    private final Compiler webCompiler;
    private final Compiler mobileCompiler;

    public HealthCheckService(
            SessionRegistry sessionRegistry,
            WorkspaceWatcherService watcherService,
            @Autowired(required = false) @Qualifier("webCompiler") Compiler webCompiler,
            @Autowired(required = false) @Qualifier("mobileCompiler") Compiler mobileCompiler) {
        this.sessionRegistry = sessionRegistry;
        this.watcherService = watcherService;
        this.webCompiler = webCompiler;
        this.mobileCompiler = mobileCompiler;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSessionsRoot());
        results.add(checkCompilers());
        results.add(checkWatchers());
        return results;
    }

    HealthStatus checkSessionsRoot() {
        var root = sessionRegistry.getSessionsRoot();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.warn("Sessions root health check failed: {}", e.getMessage());
            return new HealthStatus("sessions-root", HealthStatus.Status.DOWN,
                    "Cannot create " + root + ": " + e.getMessage(), Map.of("path", root.toString()));
        }
        if (!Files.isWritable(root)) {
            return new HealthStatus("sessions-root", HealthStatus.Status.DOWN,
                    "Sessions root is not writable", Map.of("path", root.toString()));
        }
        return new HealthStatus("sessions-root", HealthStatus.Status.UP,
                "Sessions root writable", Map.of("path", root.toString()));
    }

    HealthStatus checkCompilers() {
        if (webCompiler == null || mobileCompiler == null) {
            return new HealthStatus("compilers", HealthStatus.Status.DOWN,
                    "Compiler not configured (web=%s, mobile=%s)".formatted(webCompiler != null, mobileCompiler != null),
                    Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("web", describe(webCompiler));
        metadata.put("mobile", describe(mobileCompiler));
        return new HealthStatus("compilers", HealthStatus.Status.UP, "Web and mobile compilers configured", metadata);
    }

    HealthStatus checkWatchers() {
        var active = watcherService.activeWatchers();
        return new HealthStatus("watchers", HealthStatus.Status.UP,
                active.size() + " active watcher(s)",
                Map.of("count", String.valueOf(active.size()),
                        "exclusive", String.valueOf(watcherService.isExclusive())));
    }

    private static String describe(Compiler compiler) {
        if (compiler instanceof CommandLineCompiler cli) {
            return cli.getCommandTemplate();
        }
        return compiler.getClass().getSimpleName();
    }
}
