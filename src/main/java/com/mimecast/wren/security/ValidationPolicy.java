package com.mimecast.wren.security;

import com.mimecast.wren.config.SecurityConfig;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Attachment validation policy.
 *
 * <p>Immutable, use the {@code with} methods to derive narrower policies.
 */
public class ValidationPolicy {

    private final long maxSize;
    private final Set<String> allowedExtensions;
    private final Set<String> blockedExtensions;
    private final boolean permissiveTypes;

    /**
     * Constructs a new ValidationPolicy instance.
     *
     * @param maxSize           Maximum size in bytes.
     * @param allowedExtensions Allowed extensions, empty allows any not blocked.
     * @param blockedExtensions Blocked extensions.
     * @param permissiveTypes   Warn instead of deny on type mismatch.
     */
    public ValidationPolicy(long maxSize, Set<String> allowedExtensions, Set<String> blockedExtensions, boolean permissiveTypes) {
        this.maxSize = maxSize;
        this.allowedExtensions = normalize(allowedExtensions);
        this.blockedExtensions = normalize(blockedExtensions);
        this.permissiveTypes = permissiveTypes;
    }

    /**
     * Builds policy from configuration.
     *
     * @param config SecurityConfig instance.
     * @return ValidationPolicy instance.
     */
    public static ValidationPolicy fromConfig(SecurityConfig config) {
        return new ValidationPolicy(
                config.getMaxAttachmentSize(),
                new LinkedHashSet<>(config.getAllowedExtensions()),
                new LinkedHashSet<>(config.getBlockedExtensions()),
                config.isPermissiveTypes()
        );
    }

    /**
     * Derives policy with a different size limit.
     *
     * @param maxSize Maximum size in bytes.
     * @return New ValidationPolicy.
     */
    public ValidationPolicy withMaxSize(long maxSize) {
        return new ValidationPolicy(maxSize, allowedExtensions, blockedExtensions, permissiveTypes);
    }

    /**
     * Derives policy restricted to given extensions.
     *
     * @param extensions Allowed extensions.
     * @return New ValidationPolicy.
     */
    public ValidationPolicy withAllowedExtensions(Set<String> extensions) {
        return new ValidationPolicy(maxSize, extensions, blockedExtensions, permissiveTypes);
    }

    public long getMaxSize() {
        return maxSize;
    }

    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public Set<String> getBlockedExtensions() {
        return blockedExtensions;
    }

    public boolean isPermissiveTypes() {
        return permissiveTypes;
    }

    private static Set<String> normalize(Set<String> extensions) {
        Set<String> set = new LinkedHashSet<>();
        if (extensions != null) {
            for (String extension : extensions) {
                String ext = extension.trim().toLowerCase(Locale.ROOT);
                set.add(ext.startsWith(".") ? ext : "." + ext);
            }
        }
        return set;
    }
}
