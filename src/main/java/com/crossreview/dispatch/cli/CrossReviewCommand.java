package com.crossreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: serve, review, fingerprint.
 */
@Command(
        name = "crossreview",
        mixinStandardHelpOptions = true,
        version = "CrossReview 0.1.0",
        description = "Multi-agent code review: classify, review and cross-verify changed files",
        subcommands = {
                ServeCommand.class,
                ReviewCommand.class,
                FingerprintCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CrossReviewCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
