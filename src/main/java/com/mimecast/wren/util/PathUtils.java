package com.mimecast.wren.util;

import com.mimecast.wren.exception.PathTraversalException;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Path and filename utilities.
 */
public final class PathUtils {

    /**
     * Maximum filename length.
     */
    public static final int MAX_NAME_LENGTH = 255;

    /**
     * Replacement for empty names.
     */
    public static final String UNNAMED = "unnamed_file";

    private static final Pattern RESERVED = Pattern.compile("[\\\\/:*?\"<>|]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1f\\x7f]");
    private static final Pattern DRIVE = Pattern.compile("^[A-Za-z]:.*");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    /**
     * Private constructor for utility class.
     */
    private PathUtils() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks name for traversal: parent segments, absolute paths, drive letters and NUL bytes.
     *
     * @param name Name to check.
     * @return True if the name would escape its directory.
     */
    public static boolean isTraversal(String name) {
        if (name == null) {
            return false;
        }
        if (name.indexOf('\0') >= 0 || name.startsWith("/") || name.startsWith("\\") || DRIVE.matcher(name).matches()) {
            return true;
        }
        for (String segment : name.split("[/\\\\]")) {
            if (segment.equals("..")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sanitizes a filename for the local filesystem.
     * <p>Reserved characters become underscores, control characters and leading or trailing dots and spaces go.
     *
     * @param name Original name.
     * @return Safe name, never empty.
     */
    public static String sanitize(String name) {
        if (name == null) {
            return UNNAMED;
        }
        String clean = RESERVED.matcher(name).replaceAll("_");
        clean = CONTROL.matcher(clean).replaceAll("");
        clean = clean.replaceAll("^[. ]+|[. ]+$", "");
        if (clean.isEmpty()) {
            return UNNAMED;
        }
        if (clean.length() > MAX_NAME_LENGTH) {
            String extension = extension(clean);
            int keep = Math.max(1, MAX_NAME_LENGTH - extension.length());
            clean = clean.substring(0, keep) + extension;
        }
        return clean;
    }

    /**
     * Gets lower case extension with leading dot.
     *
     * @param name Filename.
     * @return Extension or empty string.
     */
    public static String extension(String name) {
        if (name == null) {
            return "";
        }
        String ext = FilenameUtils.getExtension(FilenameUtils.getName(name.replace('\\', '/')));
        return ext == null || ext.isEmpty() ? "" : "." + ext.toLowerCase(Locale.ROOT);
    }

    /**
     * Gets base name without extension.
     *
     * @param name Filename.
     * @return Base name.
     */
    public static String baseName(String name) {
        return FilenameUtils.getBaseName(name.replace('\\', '/'));
    }

    /**
     * Builds a unique name {@code base_timestamp_hash[_n].ext}.
     *
     * @param original Original name.
     * @param sourceId Source identifier hashed into the name.
     * @param instant  Timestamp.
     * @param counter  Collision counter, 0 for none.
     * @return Generated name.
     */
    public static String uniqueName(String original, String sourceId, Instant instant, int counter) {
        String safe = sanitize(original);
        String extension = extension(safe);
        String base = safe.substring(0, safe.length() - extension.length());
        if (base.isEmpty()) {
            base = UNNAMED;
        }

        String suffix = "_" + TIMESTAMP.format(instant) + "_" + DigestUtils.md5Hex(sourceId == null ? "" : sourceId).substring(0, 8)
                + (counter > 0 ? "_" + counter : "");
        int room = MAX_NAME_LENGTH - suffix.length() - extension.length();
        if (base.length() > room) {
            base = base.substring(0, Math.max(1, room));
        }
        return base + suffix + extension;
    }

    /**
     * Resolves a relative path inside a base directory.
     *
     * @param base     Base directory.
     * @param relative Relative path.
     * @return Resolved normalized path.
     * @throws PathTraversalException Path escapes base directory.
     */
    public static Path resolveInside(Path base, String relative) throws PathTraversalException {
        Path root = base.toAbsolutePath().normalize();
        if (relative == null || relative.indexOf('\0') >= 0) {
            throw new PathTraversalException("Invalid path: " + relative);
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new PathTraversalException("Path escapes output directory: " + relative);
        }
        return resolved;
    }
}
