package com.livebundle.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for livebundle.
 */
@Command(
        name = "livebundle",
        mixinStandardHelpOptions = true,
        version = "livebundle 0.1.0",
        description = "Live-editing sessions with debounced web and mobile rebuilds",
        subcommands = {
                ServeCommand.class,
                SessionsCommand.class,
                RebuildCommand.class,
                StatusCommand.class,
                WatchCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LivebundleCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
