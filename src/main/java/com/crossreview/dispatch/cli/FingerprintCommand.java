package com.crossreview.dispatch.cli;

import com.crossreview.core.pipeline.FingerprintResult;
import com.crossreview.core.pipeline.ReviewOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: crossreview fingerprint &lt;project&gt; &lt;files...&gt;
 * <p>
 * Prints the diff fingerprint of each file, the version key the review cache uses.
 */
@Command(name = "fingerprint", mixinStandardHelpOptions = true,
        description = "Print the diff fingerprint of each changed file")
@Component
public class FingerprintCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project root (git working tree)")
    private String projectPath;

    @Parameters(index = "1..*", arity = "1..*", description = "Files relative to the project root")
    private List<String> files;

    private final ReviewOrchestrator orchestrator;

    public FingerprintCommand(ReviewOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        FingerprintResult result = orchestrator.computeFingerprints(projectPath, files);
        if (!result.success()) {
            ConsoleOutput.error(result.message());
            return 1;
        }
        result.fingerprints().forEach((path, hex) -> System.out.println(hex + "  " + path));
        return 0;
    }
}
