package com.livebundle.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the client commands ({@code sessions}, {@code rebuild}, {@code status}, {@code watch})
 * inside the Spring context and reports their exit code to Boot.
 * <p>
 * {@code serve} is never handed to picocli: the embedded server keeps the process alive
 * on its own, see {@link #isServeMode(String...)}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String SERVE = "serve";

    private final LivebundleCommand livebundleCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LivebundleCommand livebundleCommand, IFactory factory) {
        this.livebundleCommand = livebundleCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand (the first argument that is not an option) is {@code serve}.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return SERVE.equals(arg);
            }
        }
        return false;
    }

    /**
     * Builds the command tree. A command that throws prints a one-line error and exits with
     * {@link CommandLine.ExitCode#SOFTWARE} instead of a stack trace.
     */
    static CommandLine commandLine(LivebundleCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    ConsoleOutput.error(cmd.getCommandName() + " failed: "
                            + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
                    return CommandLine.ExitCode.SOFTWARE;
                });
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            return;
        }
        exitCode = commandLine(livebundleCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
