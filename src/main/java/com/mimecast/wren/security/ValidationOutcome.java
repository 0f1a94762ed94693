package com.mimecast.wren.security;

import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Explicit allow or deny decision with reason.
 */
public class ValidationOutcome {

    private final boolean allowed;
    private final ErrorKind kind;
    private final String reason;
    private final String detectedType;
    private final List<String> warnings;

    private ValidationOutcome(boolean allowed, ErrorKind kind, String reason, String detectedType, List<String> warnings) {
        this.allowed = allowed;
        this.kind = kind;
        this.reason = reason;
        this.detectedType = detectedType;
        this.warnings = warnings != null ? warnings : new ArrayList<>();
    }

    /**
     * Allow decision.
     *
     * @param detectedType Detected type.
     * @param warnings     Non fatal findings.
     * @return ValidationOutcome instance.
     */
    public static ValidationOutcome allow(String detectedType, List<String> warnings) {
        return new ValidationOutcome(true, null, "allowed", detectedType, warnings);
    }

    /**
     * Deny decision.
     *
     * @param kind         Error kind.
     * @param reason       Reason.
     * @param detectedType Detected type or null.
     * @return ValidationOutcome instance.
     */
    public static ValidationOutcome deny(ErrorKind kind, String reason, String detectedType) {
        return new ValidationOutcome(false, kind, reason, detectedType, null);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public String getDetectedType() {
        return detectedType;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Throws the matching validation exception when denied.
     *
     * @return Self when allowed.
     * @throws ValidationException Denied.
     */
    public ValidationOutcome throwIfDenied() throws ValidationException {
        if (!allowed) {
            throw ValidationException.of(kind, reason);
        }
        return this;
    }

    @Override
    public String toString() {
        return allowed ? "ALLOW" : "DENY " + kind + ": " + reason;
    }
}
