package com.mimecast.wren.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Output store interface.
 * <p>Paths are relative to the store root and use forward slashes.
 */
public interface OutputStore {

    /**
     * Gets store root.
     *
     * @return Path.
     */
    Path getRoot();

    /**
     * Writes content, creating parent directories and replacing any existing file.
     *
     * @param relative Relative path.
     * @param content  Content bytes.
     * @return Written file path.
     * @throws IOException Unable to write or path escapes the root.
     */
    Path write(String relative, byte[] content) throws IOException;

    /**
     * Writes UTF-8 text.
     *
     * @param relative Relative path.
     * @param content  Text content.
     * @return Written file path.
     * @throws IOException Unable to write or path escapes the root.
     */
    Path writeText(String relative, String content) throws IOException;
}
