package com.mimecast.wren.security;

import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.util.PathUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Attachment security validator.
 *
 * <p>Checks run in order and the first failure decides:
 * <ol>
 *     <li>Path traversal in the name</li>
 *     <li>Size between one byte and the policy maximum</li>
 *     <li>Blocked executable extensions</li>
 *     <li>Extension allow-list</li>
 *     <li>Magic-byte type against the extension</li>
 * </ol>
 */
public class AttachmentValidator {
    private static final Logger log = LogManager.getLogger(AttachmentValidator.class);

    private final FileTypeDetector detector;

    /**
     * Constructs a new AttachmentValidator instance.
     */
    public AttachmentValidator() {
        this(new FileTypeDetector());
    }

    /**
     * Constructs a new AttachmentValidator instance with given detector.
     *
     * @param detector FileTypeDetector instance.
     */
    public AttachmentValidator(FileTypeDetector detector) {
        this.detector = detector;
    }

    public FileTypeDetector getDetector() {
        return detector;
    }

    /**
     * Validates attachment.
     *
     * @param name         Original name.
     * @param content      Content bytes.
     * @param declaredType Declared content type, informational.
     * @param policy       ValidationPolicy instance.
     * @return ValidationOutcome instance.
     */
    public ValidationOutcome validate(String name, byte[] content, String declaredType, ValidationPolicy policy) {
        if (PathUtils.isTraversal(name)) {
            log.warn("Path traversal attempt in attachment name: {}", name);
            return ValidationOutcome.deny(ErrorKind.PATH_TRAVERSAL, "Path traversal in name: " + name, null);
        }

        long size = content == null ? 0 : content.length;
        if (size < 1) {
            return ValidationOutcome.deny(ErrorKind.FILE_SIZE, "Empty content: " + name, null);
        }
        if (size > policy.getMaxSize()) {
            return ValidationOutcome.deny(ErrorKind.FILE_SIZE,
                    "Size " + size + " exceeds limit " + policy.getMaxSize() + ": " + name, null);
        }

        String extension = PathUtils.extension(name);
        if (policy.getBlockedExtensions().contains(extension)) {
            log.warn("Blocked extension {} for attachment {}", extension, name);
            return ValidationOutcome.deny(ErrorKind.EXTENSION_NOT_ALLOWED, "Blocked extension " + extension + ": " + name, null);
        }
        if (!policy.getAllowedExtensions().isEmpty() && !policy.getAllowedExtensions().contains(extension)) {
            return ValidationOutcome.deny(ErrorKind.EXTENSION_NOT_ALLOWED,
                    "Extension " + (extension.isEmpty() ? "(none)" : extension) + " not allowed: " + name, null);
        }

        String detected = detector.detect(content);
        List<String> warnings = new ArrayList<>();
        if (!detector.matches(extension, detected)) {
            String reason = "Detected type " + detected + " does not match extension " + extension
                    + (declaredType != null ? " (declared " + declaredType + ")" : "") + ": " + name;
            if (!policy.isPermissiveTypes()) {
                log.warn("Type mismatch: {}", reason);
                return ValidationOutcome.deny(ErrorKind.TYPE_MISMATCH, reason, detected);
            }
            warnings.add(reason);
        }

        return ValidationOutcome.allow(detected, warnings);
    }
}
