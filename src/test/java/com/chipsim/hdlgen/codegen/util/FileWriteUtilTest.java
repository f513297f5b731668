package com.chipsim.hdlgen.codegen.util;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FileWriteUtil.
 */
class FileWriteUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testExpandInputsMatchesExtensionCaseInsensitively() throws IOException {
        Files.writeString(tempDir.resolve("b-gate.JSON"), "{}");
        Files.writeString(tempDir.resolve("a-gate.json"), "{}");
        Files.writeString(tempDir.resolve("notes.txt"), "");
        Files.createDirectories(tempDir.resolve("nested.json"));
        Path explicit = tempDir.resolve("explicit.chip");

        List<Path> files = FileWriteUtil.expandInputs(List.of(tempDir, explicit), ".json");

        assertThat(files).containsExactly(
                tempDir.resolve("a-gate.json"), tempDir.resolve("b-gate.JSON"), explicit);
    }

    @Test
    void testWriteStringRefusesOverwriteWithoutForce() throws IOException {
        Path target = tempDir.resolve("out/Gate.hdl");
        FileWriteUtil.writeString(target, "first", false);

        assertThatThrownBy(() -> FileWriteUtil.writeString(target, "second", false))
                .isInstanceOf(FileAlreadyExistsException.class);

        FileWriteUtil.writeString(target, "second", true);
        assertThat(Files.readString(target)).isEqualTo("second");
    }
}
