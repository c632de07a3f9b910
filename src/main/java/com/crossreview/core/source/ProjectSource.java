package com.crossreview.core.source;

/**
 * Read access to the working tree of the project under review.
 * Implementations return empty strings rather than throwing when a file cannot be read.
 */
public interface ProjectSource {

    /** Pending diff of {@code path} against HEAD. */
    String diff(String projectRoot, String path);

    /** Current full content of {@code path}. */
    String content(String projectRoot, String path);

    /** Import lines of {@code path}, newline separated. */
    default String imports(String projectRoot, String path) {
        return content(projectRoot, path).lines()
                .filter(line -> line.startsWith("import ") || line.startsWith("from "))
                .reduce((a, b) -> a + "\n" + b)
                .orElse("");
    }
}
