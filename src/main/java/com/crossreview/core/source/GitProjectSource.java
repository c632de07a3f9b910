package com.crossreview.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ProjectSource} backed by the local {@code git} CLI and file system.
 *
 * <p>This class shells out to {@code git} via {@link ProcessBuilder}. A file outside a repository,
 * a missing file or a failing command all yield an empty string.
 */
@Component
public class GitProjectSource implements ProjectSource {

    private static final Logger log = LoggerFactory.getLogger(GitProjectSource.class);

    @Override
    public String diff(String projectRoot, String path) {
        return runGitOutput(Path.of(projectRoot), "diff", "HEAD", "--", path);
    }

    @Override
    public String content(String projectRoot, String path) {
        Path file = Path.of(projectRoot).resolve(path);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }

    /**
     * Runs a git command and captures stdout.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments
     * @return captured stdout, or an empty string when git fails
     */
    String runGitOutput(Path workDir, String... args) {
        var command = new ArrayList<String>(List.of("git"));
        command.addAll(List.of(args));
        log.debug("Running (capture): {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Git command exited with code {}: {}", exitCode, String.join(" ", command));
                return "";
            }
            return output;
        } catch (IOException e) {
            log.warn("Git command failed: {}: {}", String.join(" ", command), e.getMessage());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }
}
