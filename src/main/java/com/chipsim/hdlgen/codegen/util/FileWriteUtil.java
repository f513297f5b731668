package com.chipsim.hdlgen.codegen.util;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Like {@link #safeWriteString} but refuses to replace an existing file unless {@code force}.
     */
    public static void writeString(Path filePath, String content, boolean force) throws IOException {
        if (!force && Files.exists(filePath)) {
            throw new FileAlreadyExistsException(filePath.toString(), null, "use --force to overwrite");
        }
        safeWriteString(filePath, content);
    }

    /**
     * Expands directories to the files with the given extension they contain
     * (non-recursive, sorted by name). Plain files are returned as given.
     */
    public static List<Path> expandInputs(List<Path> inputs, String extension) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> stream = Files.list(input)) {
                    stream.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                files.add(input);
            }
        }
        return files;
    }
}
