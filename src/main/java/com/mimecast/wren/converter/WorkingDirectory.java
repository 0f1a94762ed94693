package com.mimecast.wren.converter;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Scoped temporary directory, deleted on close.
 */
public class WorkingDirectory implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(WorkingDirectory.class);

    private final Path path;

    /**
     * Creates a new temporary directory.
     *
     * @param prefix Directory name prefix.
     * @throws IOException Unable to create directory.
     */
    public WorkingDirectory(String prefix) throws IOException {
        this.path = Files.createTempDirectory(prefix);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Writes file into the directory.
     *
     * @param name    File name, must not contain separators.
     * @param content Content bytes.
     * @return File written.
     * @throws IOException Unable to write.
     */
    public File write(String name, byte[] content) throws IOException {
        Path file = path.resolve(name).normalize();
        if (!file.getParent().equals(path)) {
            throw new IOException("Invalid working file name: " + name);
        }
        Files.write(file, content);
        return file.toFile();
    }

    @Override
    public void close() {
        try {
            FileUtils.deleteDirectory(path.toFile());
        } catch (IOException e) {
            log.warn("Unable to delete working directory {}: {}", path, e.getMessage());
        }
    }
}
