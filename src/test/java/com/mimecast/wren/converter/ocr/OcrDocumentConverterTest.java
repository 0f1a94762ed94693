package com.mimecast.wren.converter.ocr;

import com.mimecast.wren.config.OcrConfig;
import com.mimecast.wren.config.WrenConfig;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.exception.ExternalServiceException;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.resilience.Backoff;
import com.mimecast.wren.resilience.CircuitBreaker;
import com.mimecast.wren.resilience.CircuitState;
import com.mimecast.wren.resilience.ResilientExecutor;
import com.mimecast.wren.resilience.RetryPolicy;
import com.mimecast.wren.resilience.ServiceCallException;
import com.mimecast.wren.security.AttachmentValidator;
import com.mimecast.wren.security.ValidationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OcrDocumentConverterTest {

    private static final byte[] PDF = "%PDF-1.4\n1 0 obj\n<<>>\nendobj\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);
    private static final String BASE = "scan_20240101_000000_0a1b2c3d";
    private static final String PNG = "data:image/png;base64,iVBORw0KGgo=";

    private final ConversionContext context = new ConversionContext("msg-1",
            ValidationPolicy.fromConfig(new WrenConfig().getSecurity()), new AttachmentValidator(), Instant.now());

    private Map<String, Object> settings;
    private CircuitBreaker breaker;
    private FakeOcrService service;

    /**
     * OcrService returning a canned document after a number of failures.
     */
    private static class FakeOcrService implements OcrService {
        private final List<OcrRequest> requests = new ArrayList<>();
        private OcrDocument document;
        private int failures;
        private ServiceCallException failure;

        @Override
        public String getEndpoint() {
            return "https://ocr.example.com/v1/ocr";
        }

        @Override
        public OcrDocument process(String filename, File file, OcrRequest request) throws ServiceCallException {
            assertTrue(file.exists(), "Document staged before the call");
            requests.add(request);
            if (failures > 0) {
                failures--;
                throw failure;
            }
            return document;
        }
    }

    @BeforeEach
    void setUp() {
        settings = new HashMap<>();
        settings.put("apiKey", "test-key");
        breaker = new CircuitBreaker("ocr", 5, Duration.ofSeconds(300), Clock.systemUTC());

        List<OcrImage> first = List.of(
                new OcrImage("img-0.png", 0, 0, 200, 150, PNG),
                new OcrImage("img-1.png", 0, 0, 50, 50, PNG));
        List<OcrImage> third = List.of(new OcrImage("img-2.png", 0, 0, 300, 300, "!!!"));

        service = new FakeOcrService();
        service.document = new OcrDocument("mistral-ocr-2505", List.of(
                new OcrPage(0, "Page one\n", first),
                new OcrPage(1, null, List.of()),
                new OcrPage(2, "Page three", third)), 3);
    }

    private OcrDocumentConverter converter() {
        ResilientExecutor executor = new ResilientExecutor(breaker, new RetryPolicy(3, new Backoff(1000, 2.0, 30000)), millis -> {
        });
        return new OcrDocumentConverter(new OcrConfig(settings), "converted_pdf", service, executor);
    }

    private static Attachment attachment() {
        return new Attachment("Scan.pdf", BASE + ".pdf", PDF, "application/pdf", "1.2");
    }

    private static String text(OutputArtifact artifact) {
        return new String(artifact.getContent(), StandardCharsets.UTF_8);
    }

    @Test
    void testConvert() throws ConversionException {
        ConversionResult result = converter().convert(attachment(), context);

        assertEquals("Page one\n\n---\n\nPage three", result.getText());
        assertEquals(1, result.getAttempts());
        assertTrue(result.isPartial());
        assertTrue(result.getWarnings().contains("Page 2 returned no text"));
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.startsWith("Image img-2.png on page 3 skipped")));

        assertEquals(2, result.getArtifacts().size());
        OutputArtifact image = result.getArtifacts().get(0);
        assertEquals(OutputArtifact.Kind.IMAGE, image.getKind());
        assertEquals("converted_pdf/" + BASE + "_images/" + BASE + "_page_01_image_01.png", image.getPath());
        assertEquals(8, image.getContent().length);

        OutputArtifact markdown = result.getArtifacts().get(1);
        assertEquals("converted_pdf/" + BASE + ".md", markdown.getPath());
        String md = text(markdown);
        assertTrue(md.startsWith("---\nsource_file: Scan.pdf\n"));
        assertTrue(md.contains("model: mistral-ocr-2505\n"));
        assertTrue(md.contains("# PDF Conversion: Scan.pdf"));
        assertTrue(md.contains("extraction mode: **all**"));
        assertTrue(md.contains("![Image 1](" + BASE + "_images/" + BASE + "_page_01_image_01.png)"));

        assertEquals(1, result.getMetadata().get("images"));
        assertEquals(3, result.getMetadata().get("pagesProcessed"));
        assertTrue(service.requests.get(0).isIncludeImages());
    }

    @Test
    void testRetriedUntilSuccess() throws ConversionException {
        service.failures = 2;
        service.failure = ServiceCallException.timeout("Read timed out", null);

        ConversionResult result = converter().convert(attachment(), context);

        assertEquals(3, result.getAttempts());
        assertEquals(3, service.requests.size());
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(text(result.getArtifacts().get(1)).contains("attempts: 3\n"));
    }

    @Test
    void testPermanentFailure() {
        service.failures = 1;
        service.failure = ServiceCallException.forStatus(422, "Unprocessable document");

        ExternalServiceException e = assertThrows(ExternalServiceException.class, () -> converter().convert(attachment(), context));
        assertEquals(ErrorKind.EXTERNAL_SERVICE, e.getKind());
        assertEquals(1, e.getAttempts());
        assertEquals("Scan.pdf", e.getAttachmentName());
    }

    @Test
    void testTextModeSkipsImages() throws ConversionException {
        settings.put("extractionMode", "text");

        ConversionResult result = converter().convert(attachment(), context);

        assertFalse(service.requests.get(0).isIncludeImages());
        assertEquals(1, result.getArtifacts().size());
        assertEquals(0, result.getMetadata().get("images"));
        assertEquals("TEXT", result.getMetadata().get("extractionMode"));
    }

    @Test
    void testImagesModeSkipsText() throws ConversionException {
        settings.put("extractionMode", "images");

        ConversionResult result = converter().convert(attachment(), context);

        assertEquals("", result.getText());
        assertFalse(result.getWarnings().contains("Page 2 returned no text"));
        assertEquals(2, result.getArtifacts().size());
    }

    @Test
    void testImageLimit() throws ConversionException {
        settings.put("imageLimit", 1L);
        service.document = new OcrDocument("m", List.of(new OcrPage(0, "p", List.of(
                new OcrImage("a", 0, 0, 200, 200, PNG),
                new OcrImage("b", 0, 0, 200, 200, PNG)))), 1);

        ConversionResult result = converter().convert(attachment(), context);

        assertEquals(1, result.getMetadata().get("images"));
        assertFalse(result.isPartial());
    }

    @Test
    void testUnknownModeFallsBackToAll() {
        settings.put("extractionMode", "pictures");

        assertEquals(ExtractionMode.ALL, converter().getMode());
    }
}
