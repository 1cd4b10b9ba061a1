package com.livebundle.core.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link Compiler} that shells out to an external bundler via {@link ProcessBuilder}.
 * <p>
 * The command template is split on whitespace and each token has its placeholders
 * substituted, so substituted paths never need quoting:
 * <pre>
 *   {entry} {workspace} {platform} {dev} {minify} {out} {sourceMap}
 * </pre>
 * The bundler writes to {@code {out}} inside a scratch directory; the bundle (and
 * the source map, when one was written) is read back and the scratch directory removed.
 */
public class CommandLineCompiler implements Compiler {

    private static final Logger log = LoggerFactory.getLogger(CommandLineCompiler.class);

    private static final int OUTPUT_TAIL_LINES = 20;

    private final String name;
    private final String commandTemplate;
    private final Duration timeout;

    public CommandLineCompiler(String name, String commandTemplate, Duration timeout) {
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("Compiler '" + name + "' has no command configured");
        }
        this.name = name;
        this.commandTemplate = commandTemplate;
        this.timeout = timeout;
    }

    public String getName() {
        return name;
    }

    public String getCommandTemplate() {
        return commandTemplate;
    }

    @Override
    public CompileOutput compile(Path entryFile, Path workspaceRoot, CompileOptions options) throws CompileException {
        long start = System.currentTimeMillis();
        Path scratch;
        try {
            scratch = Files.createTempDirectory("livebundle-" + name + "-");
        } catch (IOException e) {
            throw new CompileException("Could not create scratch directory: " + e.getMessage(), e);
        }

        try {
            Path out = scratch.resolve("bundle.js");
            Path sourceMap = scratch.resolve("bundle.js.map");
            Path processLog = scratch.resolve("process.log");

            var values = new HashMap<String, String>();
            values.put("entry", entryFile.toString());
            values.put("workspace", workspaceRoot.toString());
            values.put("platform", options.platform() == null ? "" : options.platform());
            values.put("dev", String.valueOf(options.dev()));
            values.put("minify", String.valueOf(options.minify()));
            values.put("out", out.toString());
            values.put("sourceMap", sourceMap.toString());
            var command = expand(commandTemplate, values);

            log.debug("Running {} compiler: {}", name, String.join(" ", command));
            int exitCode = run(command, workspaceRoot, processLog);
            if (exitCode != 0) {
                throw new CompileException("%s compiler exited with code %d: %s"
                        .formatted(name, exitCode, tail(processLog)));
            }
            if (!Files.isRegularFile(out)) {
                throw new CompileException("%s compiler produced no output: %s".formatted(name, tail(processLog)));
            }

            String code = Files.readString(out, StandardCharsets.UTF_8);
            String map = Files.isRegularFile(sourceMap) ? Files.readString(sourceMap, StandardCharsets.UTF_8) : null;
            log.debug("{} compiler finished in {}ms", name, System.currentTimeMillis() - start);
            return new CompileOutput(code, map);
        } catch (IOException e) {
            throw new CompileException("%s compiler I/O failure: %s".formatted(name, e.getMessage()), e);
        } finally {
            deleteQuietly(scratch);
        }
    }

    private int run(List<String> command, Path workDir, Path processLog) throws IOException, CompileException {
        var process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(processLog.toFile())
                .start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CompileException("%s compiler timed out after %ds"
                        .formatted(name, timeout.toSeconds()));
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CompileException(name + " compiler interrupted", e);
        }
    }

    /**
     * Splits the template on whitespace and substitutes {@code {key}} placeholders per token.
     * Unknown placeholders are left as-is.
     */
    static List<String> expand(String template, Map<String, String> values) {
        var tokens = new ArrayList<String>();
        for (String token : template.trim().split("\\s+")) {
            String expanded = token;
            for (var entry : values.entrySet()) {
                expanded = expanded.replace("{" + entry.getKey() + "}", entry.getValue());
            }
            tokens.add(expanded);
        }
        return tokens;
    }

    private static String tail(Path processLog) {
        try {
            var lines = Files.readAllLines(processLog, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - OUTPUT_TAIL_LINES);
            String joined = String.join("\n", lines.subList(from, lines.size())).trim();
            return joined.isEmpty() ? "(no output)" : joined;
        } catch (IOException e) {
            return "(output unavailable: " + e.getMessage() + ")";
        }
    }

    private static void deleteQuietly(Path dir) {
        try (var walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.debug("Could not remove scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
