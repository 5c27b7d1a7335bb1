package com.example.docredact.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * A per-request scratch directory, removed with everything in it on close.
 */
public class TempWorkspace implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TempWorkspace.class);

    private final Path directory;

    private TempWorkspace(Path directory) {
        this.directory = directory;
    }

    public static TempWorkspace create(Path root) throws IOException {
        Files.createDirectories(root);
        return new TempWorkspace(Files.createTempDirectory(root, "req-"));
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Path for a file inside the workspace. Only the last path segment of {@code fileName} is used.
     */
    public Path file(String prefix, String fileName) {
        return directory.resolve(prefix + UUID.randomUUID() + "_" + safeName(fileName));
    }

    public Path write(String fileName, byte[] content) throws IOException {
        Path target = file("", fileName);
        Files.write(target, content);
        return target;
    }

    static String safeName(String fileName) {
        if (fileName == null || fileName.isBlank()) return "document.pdf";
        String normalized = fileName.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1).replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isEmpty() || name.startsWith(".") ? "document.pdf" : name;
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            logger.warn("Failed to clean up workspace {}", directory, e);
        }
    }
}
