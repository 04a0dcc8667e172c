package com.phasegate.core.attestation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads instructions from {@code <dir>/<taskId>.md}, falling back to {@code <dir>/default.md}.
 */
public class FileInstructionSource implements InstructionSource {

    static final String DEFAULT_FILE = "default.md";

    private final Path directory;

    public FileInstructionSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public String effectiveInstructions(String taskId) throws IOException {
        Path taskFile = directory.resolve(sanitize(taskId) + ".md");
        if (Files.isRegularFile(taskFile)) {
            return Files.readString(taskFile, StandardCharsets.UTF_8);
        }
        Path fallback = directory.resolve(DEFAULT_FILE);
        if (Files.isRegularFile(fallback)) {
            return Files.readString(fallback, StandardCharsets.UTF_8);
        }
        return "";
    }

    private static String sanitize(String taskId) {
        return taskId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
