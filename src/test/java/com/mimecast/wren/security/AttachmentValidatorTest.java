package com.mimecast.wren.security;

import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.exception.TypeMismatchException;
import com.mimecast.wren.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttachmentValidatorTest {

    private static final byte[] PDF = "%PDF-1.4\n1 0 obj\n<<>>\nendobj\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PNG = new byte[]{(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 13, 'I', 'H', 'D', 'R'};

    private final AttachmentValidator validator = new AttachmentValidator();

    private static ValidationPolicy policy(boolean permissive) {
        return new ValidationPolicy(1024, Set.of("pdf", ".PNG", ".txt"), Set.of(".exe", ".bat"), permissive);
    }

    @Test
    void testAllowsMatchingType() {
        ValidationOutcome outcome = validator.validate("report.pdf", PDF, "application/pdf", policy(false));

        assertTrue(outcome.isAllowed(), outcome.toString());
        assertEquals("application/pdf", outcome.getDetectedType());
        assertTrue(outcome.getWarnings().isEmpty());

        assertTrue(validator.validate("Logo.PNG", PNG, null, policy(false)).isAllowed(), "Extension case ignored");
    }

    @Test
    void testPathTraversalCheckedFirst() {
        ValidationOutcome outcome = validator.validate("../../evil.exe", new byte[0], null, policy(false));

        assertFalse(outcome.isAllowed());
        assertEquals(ErrorKind.PATH_TRAVERSAL, outcome.getKind());
    }

    @Test
    void testSizeLimits() {
        assertEquals(ErrorKind.FILE_SIZE, validator.validate("empty.pdf", new byte[0], null, policy(false)).getKind());
        assertEquals(ErrorKind.FILE_SIZE, validator.validate("big.pdf", new byte[1025], null, policy(false)).getKind());
        assertTrue(validator.validate("exact.txt", "a".repeat(1024).getBytes(StandardCharsets.US_ASCII), null, policy(false)).isAllowed(),
                "Size equal to the limit is accepted");
    }

    @Test
    void testBlockedAndNotAllowedExtensions() {
        ValidationOutcome blocked = validator.validate("setup.exe", PDF, null, policy(false));
        assertEquals(ErrorKind.EXTENSION_NOT_ALLOWED, blocked.getKind());
        assertTrue(blocked.getReason().contains("Blocked"));

        ValidationOutcome unlisted = validator.validate("archive.zip", PDF, null, policy(false));
        assertEquals(ErrorKind.EXTENSION_NOT_ALLOWED, unlisted.getKind());

        ValidationOutcome none = validator.validate("README", PDF, null, policy(false));
        assertEquals(ErrorKind.EXTENSION_NOT_ALLOWED, none.getKind());
        assertTrue(none.getReason().contains("(none)"));
    }

    @Test
    void testTypeMismatch() {
        ValidationOutcome outcome = validator.validate("invoice.pdf", PNG, "application/pdf", policy(false));

        assertFalse(outcome.isAllowed());
        assertEquals(ErrorKind.TYPE_MISMATCH, outcome.getKind());
        assertEquals("image/png", outcome.getDetectedType());
        assertThrows(TypeMismatchException.class, outcome::throwIfDenied);
    }

    @Test
    void testPermissiveTypesWarnOnly() throws ValidationException {
        ValidationOutcome outcome = validator.validate("invoice.pdf", PNG, null, policy(true));

        assertTrue(outcome.isAllowed());
        assertEquals(1, outcome.getWarnings().size());
        assertSame(outcome, outcome.throwIfDenied());
    }

    @Test
    void testTextualExtensions() {
        assertTrue(validator.validate("notes.txt", "plain words".getBytes(StandardCharsets.UTF_8), null, policy(false)).isAllowed());
        assertFalse(validator.validate("notes.txt", PDF, null, policy(false)).isAllowed(), "PDF content is not text");
    }

    @Test
    void testEmptyAllowListAllowsAllButBlocked() {
        ValidationPolicy open = policy(false).withAllowedExtensions(Set.of());

        assertTrue(validator.validate("data.bin", PNG, null, open).isAllowed());
        assertFalse(validator.validate("run.bat", PNG, null, open).isAllowed());
    }

    @Test
    void testExtensionFor() {
        assertEquals(".pdf", FileTypeDetector.extensionFor("application/pdf"));
        assertEquals(".png", FileTypeDetector.extensionFor("image/png"));
        assertEquals(".bin", FileTypeDetector.extensionFor(null));
    }
}
