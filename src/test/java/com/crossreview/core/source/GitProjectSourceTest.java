package com.crossreview.core.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GitProjectSourceTest {

    private final GitProjectSource source = new GitProjectSource();

    @TempDir
    Path projectDir;

    @Test
    @DisplayName("content reads the working-tree file")
    void content() throws Exception {
        Files.createDirectories(projectDir.resolve("src"));
        Files.writeString(projectDir.resolve("src/a.ts"), "export const a = 1;\n");

        assertEquals("export const a = 1;\n", source.content(projectDir.toString(), "src/a.ts"));
    }

    @Test
    @DisplayName("a missing file reads as empty")
    void missingFile() {
        assertEquals("", source.content(projectDir.toString(), "nope.ts"));
    }

    @Test
    @DisplayName("imports keeps only import lines")
    void imports() throws Exception {
        Files.writeString(projectDir.resolve("a.py"), "import os\nfrom x import y\n\nprint(os.name)\n");

        assertEquals("import os\nfrom x import y", source.imports(projectDir.toString(), "a.py"));
    }

    @Test
    @DisplayName("diff outside a git repository is empty rather than an error")
    void diffOutsideRepository() {
        assertEquals("", source.diff(projectDir.toString(), "a.ts"));
    }
}
