package com.mimecast.wren.mime;

import com.mimecast.wren.mime.parts.MimePart;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmailParserTest {

    private static EmailMessage parse(String eml) throws MalformedMessageException {
        return new EmailParser().parse(eml.getBytes(StandardCharsets.UTF_8));
    }

    private static String text(MimePart part) {
        return new String(part.getDecodedBytes(), StandardCharsets.UTF_8);
    }

    @Test
    void testSinglePart() throws MalformedMessageException {
        EmailMessage message = parse("From: a@example.com\r\n" +
                "Subject: Hello\r\n" +
                "Message-ID: <abc@example.com>\r\n" +
                "\r\n" +
                "Body line\r\n");

        assertEquals("Hello", message.getSubject());
        assertEquals("abc@example.com", message.getMessageId());
        assertEquals("1", message.getRoot().getId());
        assertEquals("text/plain", message.getRoot().getContentType(), "Missing Content-Type defaults to text/plain");
        assertEquals("Body line\r\n", text(message.getRoot()));
        assertTrue(message.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Nested alternative inside mixed with a regex special boundary")
    void testNestedAlternativeWithRegexBoundary() throws MalformedMessageException {
        String eml = "From: a@example.com\r\n" +
                "Subject: Nested\r\n" +
                "MIME-Version: 1.0\r\n" +
                "Content-Type: multipart/mixed; boundary=\"b+(x)?.*\"\r\n" +
                "\r\n" +
                "preamble\r\n" +
                "--b+(x)?.*\r\n" +
                "Content-Type: multipart/alternative; boundary=\"[alt]|^$\"\r\n" +
                "\r\n" +
                "--[alt]|^$\r\n" +
                "Content-Type: text/plain; charset=utf-8\r\n" +
                "\r\n" +
                "Plain body\r\n" +
                "--[alt]|^$\r\n" +
                "Content-Type: text/html; charset=utf-8\r\n" +
                "\r\n" +
                "<p>Html body</p>\r\n" +
                "--[alt]|^$--\r\n" +
                "\r\n" +
                "--b+(x)?.*\r\n" +
                "Content-Type: application/pdf; name=\"report.pdf\"\r\n" +
                "Content-Disposition: attachment; filename=\"report.pdf\"\r\n" +
                "Content-Transfer-Encoding: base64\r\n" +
                "\r\n" +
                "JVBERi0xLjQK\r\n" +
                "--b+(x)?.*--\r\n" +
                "epilogue\r\n";

        EmailMessage message = parse(eml);
        MimePart root = message.getRoot();

        assertEquals("multipart/mixed", root.getContentType());
        assertEquals(2, root.getChildren().size());

        MimePart alternative = message.findPart("1.1");
        assertEquals("multipart/alternative", alternative.getContentType());
        assertEquals(2, alternative.getChildren().size());
        assertEquals("Plain body", text(message.findPart("1.1.1")));
        assertEquals("<p>Html body</p>", text(message.findPart("1.1.2")));
        assertEquals("1.1", message.findPart("1.1.2").getParentId());

        MimePart pdf = message.findPart("1.2");
        assertEquals("report.pdf", pdf.getFilename());
        assertEquals("%PDF-1.4\n", text(pdf));

        List<MimePart> leaves = message.getLeaves();
        assertEquals(3, leaves.size());
        assertTrue(message.getWarnings().isEmpty(), "Well formed message has no warnings: " + message.getWarnings());
    }

    @Test
    void testMissingBoundaryDegradesToText() throws MalformedMessageException {
        EmailMessage message = parse("Subject: Broken\r\n" +
                "Content-Type: multipart/mixed\r\n" +
                "\r\n" +
                "--whatever\r\n" +
                "Some text\r\n");

        assertEquals("text/plain", message.getRoot().getContentType());
        assertTrue(text(message.getRoot()).contains("Some text"));
        assertEquals(1, message.getWarnings().size());
    }

    @Test
    void testUnmatchedBoundaryDegradesToText() throws MalformedMessageException {
        EmailMessage message = parse("Subject: Broken\r\n" +
                "Content-Type: multipart/mixed; boundary=\"expected\"\r\n" +
                "\r\n" +
                "--different\r\n" +
                "Some text\r\n");

        assertEquals("text/plain", message.getRoot().getContentType());
        assertTrue(message.getRoot().isLeaf());
        assertFalse(message.getWarnings().isEmpty());
    }

    @Test
    void testMissingCloseDelimiterWarns() throws MalformedMessageException {
        EmailMessage message = parse("Subject: Open\r\n" +
                "Content-Type: multipart/mixed; boundary=\"b\"\r\n" +
                "\r\n" +
                "--b\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "Only part\r\n");

        assertEquals(1, message.getRoot().getChildren().size());
        assertEquals("Only part\r\n", text(message.findPart("1.1")));
        assertTrue(message.getWarnings().get(0).contains("missing closing boundary"));
    }

    @Test
    void testEmbeddedMessage() throws MalformedMessageException {
        String eml = "Subject: Outer\r\n" +
                "Content-Type: multipart/mixed; boundary=\"outer\"\r\n" +
                "\r\n" +
                "--outer\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "See attached\r\n" +
                "--outer\r\n" +
                "Content-Type: message/rfc822\r\n" +
                "\r\n" +
                "Subject: Inner\r\n" +
                "Content-Type: multipart/mixed; boundary=\"inner\"\r\n" +
                "\r\n" +
                "--inner\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "Inner text\r\n" +
                "--inner--\r\n" +
                "--outer--\r\n";

        EmailMessage message = parse(eml);
        MimePart rfc822 = message.findPart("1.2");

        assertTrue(rfc822.isMessage());
        assertEquals(1, rfc822.getChildren().size());
        MimePart inner = message.findPart("1.2.1");
        assertEquals("multipart/mixed", inner.getContentType());
        assertEquals("Inner", inner.getHeaders().getDecoded("Subject"));
        assertEquals("Inner text", text(message.findPart("1.2.1.1")));
    }

    @Test
    void testQuotedPrintableAndFoldedHeader() throws MalformedMessageException {
        EmailMessage message = parse("Subject: A very long\r\n" +
                " folded subject\r\n" +
                "Content-Type: text/plain; charset=utf-8\r\n" +
                "Content-Transfer-Encoding: quoted-printable\r\n" +
                "\r\n" +
                "Caf=C3=A9 soft=\r\n" +
                "break\r\n");

        assertEquals("A very long folded subject", message.getSubject());
        assertEquals("Café softbreak\r\n", text(message.getRoot()));
    }

    @Test
    void testEnvelopeLineSkipped() throws MalformedMessageException {
        EmailMessage message = parse("From sender@example.com Mon Jan  1 00:00:00 2024\n" +
                "Subject: Mbox\n" +
                "\n" +
                "Body\n");

        assertEquals("Mbox", message.getSubject());
    }

    @Test
    void testEmptyInputIsMalformed() {
        assertThrows(MalformedMessageException.class, () -> new EmailParser().parse(new byte[0]));
    }

    @Test
    void testNoHeadersIsMalformed() {
        assertThrows(MalformedMessageException.class, () -> parse("just some text without headers\r\n"));
    }
}
