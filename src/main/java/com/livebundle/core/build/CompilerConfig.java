package com.livebundle.core.build;

import com.livebundle.core.config.LivebundleProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CompilerConfig {

    @Bean
    @Qualifier("webCompiler")
    public Compiler webCompiler(LivebundleProperties properties) {
        return new CommandLineCompiler("web", properties.getWebCommand(),
                Duration.ofSeconds(properties.getCompileTimeoutSeconds()));
    }

    @Bean
    @Qualifier("mobileCompiler")
    public Compiler mobileCompiler(LivebundleProperties properties) {
        return new CommandLineCompiler("mobile", properties.getMobileCommand(),
                Duration.ofSeconds(properties.getCompileTimeoutSeconds()));
    }

    /**
     * Runs one rebuild per session at a time; each rebuild compiles the web target itself.
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("rebuildExecutor")
    public ExecutorService rebuildExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "rebuild-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Per-platform compiles fanned out by a rebuild. Rebuilds themselves never run here.
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("buildExecutor")
    public ExecutorService buildExecutor(LivebundleProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), r -> {
            var t = new Thread(r, "build-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
