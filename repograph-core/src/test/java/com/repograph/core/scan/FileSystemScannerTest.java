package com.repograph.core.scan;

import com.repograph.core.config.RepoGraphConfig.ScanConfig;
import com.repograph.core.index.FileIndex;
import com.repograph.core.model.DirectoryNode;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemScanner}.
 */
class FileSystemScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scan_buildsRelativeSortedTree() throws IOException {
        // Given
        write("src/utils.ts", "export const a = 1;");
        write("src/index.ts", "import { a } from './utils';");
        write("main.py", "import os");

        // When
        DirectoryNode root = new FileSystemScanner().scan(tempDir);
        FileIndex index = FileIndex.build(root);

        // Then
        assertThat(root.path()).isEmpty();
        assertThat(index.records())
            .extracting(FileRecord::path)
            .containsExactly("main.py", "src/index.ts", "src/utils.ts");
        assertThat(index.get("src/index.ts")).get()
            .satisfies(record -> {
                assertThat(record.language()).isEqualTo(Language.TYPESCRIPT);
                assertThat(record.content()).isEqualTo("import { a } from './utils';");
            });
    }

    @Test
    void scan_skipsIgnoredDirectoriesAndFiles() throws IOException {
        write("node_modules/react/index.js", "module.exports = {};");
        write(".git/config", "[core]");
        write(".DS_Store", "x");
        write("src/app.js", "require('react');");

        FileSystemScanner scanner = new FileSystemScanner();
        FileIndex index = FileIndex.build(scanner.scan(tempDir));

        assertThat(index.records()).extracting(FileRecord::path).containsExactly("src/app.js");
        assertThat(scanner.getFilesScanned()).isEqualTo(1);
    }

    @Test
    void scan_withCustomIgnoreList_usesIt() throws IOException {
        write("generated/api.ts", "export {}");
        write("node_modules/lib.js", "");

        ScanConfig config = new ScanConfig(null, List.of("generated"), List.of());
        FileIndex index = FileIndex.build(new FileSystemScanner(config).scan(tempDir));

        assertThat(index.records()).extracting(FileRecord::path).containsExactly("node_modules/lib.js");
    }

    @Test
    void scan_keepsOversizedAndBinaryFilesWithoutContent() throws IOException {
        write("big.ts", "import './a';".repeat(20));
        write("logo.png", "not really an image");
        write("small.ts", "import './big';");

        ScanConfig config = new ScanConfig(100L, null, null);
        FileIndex index = FileIndex.build(new FileSystemScanner(config).scan(tempDir));

        assertThat(index.get("big.ts")).get().extracting(FileRecord::content).isNull();
        assertThat(index.get("logo.png")).get().extracting(FileRecord::content).isNull();
        assertThat(index.get("small.ts")).get().extracting(FileRecord::content).isEqualTo("import './big';");
    }

    @Test
    void scan_withFile_throws() throws IOException {
        Path file = write("main.go", "package main");

        assertThatThrownBy(() -> new FileSystemScanner().scan(file))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Not a directory");
    }

    @Test
    void isTextFile_recognizesSourceExtensions() {
        assertThat(FileSystemScanner.isTextFile("main.RS")).isTrue();
        assertThat(FileSystemScanner.isTextFile("lib.mjs")).isTrue();
        assertThat(FileSystemScanner.isTextFile("image.png")).isFalse();
        assertThat(FileSystemScanner.isTextFile("Makefile")).isFalse();
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
