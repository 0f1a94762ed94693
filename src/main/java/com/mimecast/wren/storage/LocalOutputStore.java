package com.mimecast.wren.storage;

import com.mimecast.wren.exception.PathTraversalException;
import com.mimecast.wren.util.PathUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local filesystem output store.
 * <p>Files are written to a sibling temporary file first and moved into place.
 */
public class LocalOutputStore implements OutputStore {
    private static final Logger log = LogManager.getLogger(LocalOutputStore.class);

    private final Path root;

    /**
     * Constructs a new LocalOutputStore instance.
     *
     * @param root Store root directory.
     * @throws IOException Unable to create root directory.
     */
    public LocalOutputStore(Path root) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        Files.createDirectories(this.root);
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Path write(String relative, byte[] content) throws IOException {
        Path target;
        try {
            target = PathUtils.resolveInside(root, relative);
        } catch (PathTraversalException e) {
            throw new IOException(e.getMessage(), e);
        }

        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".wren-", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        log.debug("Stored {} bytes to {}", content.length, target);
        return target;
    }

    @Override
    public Path writeText(String relative, String content) throws IOException {
        return write(relative, content.getBytes(StandardCharsets.UTF_8));
    }
}
