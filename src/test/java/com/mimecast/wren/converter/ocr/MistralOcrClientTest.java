package com.mimecast.wren.converter.ocr;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.wren.config.OcrConfig;
import com.mimecast.wren.resilience.ServiceCallException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MistralOcrClient.
 * <p>
 * MockWebServer plays the files and OCR endpoints so no API key or network access is needed.
 */
class MistralOcrClientTest {

    private static final String OCR_RESPONSE = "{" +
            "\"model\":\"mistral-ocr-2505\"," +
            "\"pages\":[" +
            "{\"index\":0,\"markdown\":\"# Invoice\\n\\nTotal: 42\",\"images\":[" +
            "{\"id\":\"img-0.jpeg\",\"top_left_x\":10,\"top_left_y\":20,\"bottom_right_x\":210,\"bottom_right_y\":170," +
            "\"image_base64\":\"data:image/jpeg;base64,/9j/4AAQ\"}]}," +
            "{\"index\":1,\"markdown\":\"Second page\",\"images\":[]}" +
            "]," +
            "\"usage_info\":{\"pages_processed\":2,\"doc_size_bytes\":1024}" +
            "}";

    private MockWebServer mockWebServer;
    private Map<String, Object> settings;
    private File pdf;

    @BeforeEach
    void setUp(@TempDir Path tmp) throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        settings = new HashMap<>();
        settings.put("baseUrl", mockWebServer.url("/").toString());
        settings.put("apiKey", "test-key");

        pdf = tmp.resolve("invoice.pdf").toFile();
        Files.writeString(pdf.toPath(), "%PDF-1.4\n%%EOF\n");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private MistralOcrClient client() {
        return new MistralOcrClient(new OcrConfig(settings));
    }

    private void enqueueUploadAndUrl() {
        mockWebServer.enqueue(new MockResponse().setBody("{\"id\":\"file-123\",\"object\":\"file\",\"purpose\":\"ocr\"}"));
        mockWebServer.enqueue(new MockResponse().setBody("{\"url\":\"https://files.example.com/signed/file-123\"}"));
    }

    @Test
    void testEndpoint() {
        assertEquals(mockWebServer.url("/v1/ocr").toString(), client().getEndpoint());
    }

    @Test
    void testProcess() throws Exception {
        enqueueUploadAndUrl();
        mockWebServer.enqueue(new MockResponse().setBody(OCR_RESPONSE));

        OcrDocument document = client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100));

        assertEquals("mistral-ocr-2505", document.getModel());
        assertEquals(2, document.getPages().size());
        assertEquals(2, document.getPagesProcessed());
        assertEquals("# Invoice\n\nTotal: 42", document.getPages().get(0).getMarkdown());

        OcrImage image = document.getPages().get(0).getImages().get(0);
        assertEquals(200, image.getWidth());
        assertEquals(150, image.getHeight());
        assertEquals(".jpg", image.getExtension());

        RecordedRequest upload = mockWebServer.takeRequest();
        assertEquals("POST", upload.getMethod());
        assertEquals("/v1/files", upload.getPath());
        assertEquals("Bearer test-key", upload.getHeader("Authorization"));
        String multipart = upload.getBody().readString(StandardCharsets.UTF_8);
        assertTrue(multipart.contains("name=\"purpose\""));
        assertTrue(multipart.contains("filename=\"invoice.pdf\""));
        assertTrue(multipart.contains("%PDF-1.4"));

        RecordedRequest url = mockWebServer.takeRequest();
        assertEquals("GET", url.getMethod());
        assertEquals("/v1/files/file-123/url?expiry=24", url.getPath());

        RecordedRequest ocr = mockWebServer.takeRequest();
        assertEquals("/v1/ocr", ocr.getPath());
        JsonObject payload = JsonParser.parseString(ocr.getBody().readString(StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("mistral-ocr-latest", payload.get("model").getAsString());
        assertEquals("document_url", payload.getAsJsonObject("document").get("type").getAsString());
        assertEquals("https://files.example.com/signed/file-123",
                payload.getAsJsonObject("document").get("document_url").getAsString());
        assertTrue(payload.get("include_image_base64").getAsBoolean());
        assertFalse(payload.has("image_limit"), "Zero limit means unlimited and is not sent");
        assertEquals(100, payload.get("image_min_size").getAsInt());
    }

    @Test
    void testImageLimitSent() throws Exception {
        enqueueUploadAndUrl();
        mockWebServer.enqueue(new MockResponse().setBody("{\"pages\":[]}"));

        OcrDocument document = client().process("invoice.pdf", pdf, new OcrRequest(false, 5, 50));

        assertTrue(document.getPages().isEmpty());
        mockWebServer.takeRequest();
        mockWebServer.takeRequest();
        JsonObject payload = JsonParser.parseString(mockWebServer.takeRequest().getBody().readString(StandardCharsets.UTF_8))
                .getAsJsonObject();
        assertEquals(5, payload.get("image_limit").getAsInt());
        assertFalse(payload.get("include_image_base64").getAsBoolean());
    }

    @Test
    void testServerErrorIsTransient() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("{\"message\":\"overloaded\"}"));

        ServiceCallException e = assertThrows(ServiceCallException.class,
                () -> client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100)));
        assertEquals(503, e.getStatusCode());
        assertTrue(e.isTransient());
        assertTrue(e.getMessage().contains("overloaded"));
    }

    @Test
    void testRateLimitIsTransient() {
        enqueueUploadAndUrl();
        mockWebServer.enqueue(new MockResponse().setResponseCode(429));

        ServiceCallException e = assertThrows(ServiceCallException.class,
                () -> client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100)));
        assertEquals(429, e.getStatusCode());
        assertTrue(e.isTransient());
    }

    @Test
    void testClientErrorIsPermanent() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"Unauthorized\"}"));

        ServiceCallException e = assertThrows(ServiceCallException.class,
                () -> client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100)));
        assertFalse(e.isTransient());
    }

    @Test
    void testInvalidJsonIsPermanent() {
        mockWebServer.enqueue(new MockResponse().setBody("{broken"));

        ServiceCallException e = assertThrows(ServiceCallException.class,
                () -> client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100)));
        assertFalse(e.isTransient());
    }

    @Test
    void testMissingFileId() {
        mockWebServer.enqueue(new MockResponse().setBody("{\"object\":\"file\"}"));

        ServiceCallException e = assertThrows(ServiceCallException.class,
                () -> client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100)));
        assertFalse(e.isTransient());
        assertEquals(1, mockWebServer.getRequestCount());
    }

    @Test
    void testTimeoutIsTransient() {
        settings.put("timeoutSeconds", 1L);
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        ServiceCallException e = assertThrows(ServiceCallException.class,
                () -> client().process("invoice.pdf", pdf, new OcrRequest(true, 0, 100)));
        assertTrue(e.isTransient());
        assertEquals(-1, e.getStatusCode());
    }

    @Test
    void testParseDocumentDefaults() {
        JsonObject json = JsonParser.parseString("{\"pages\":[{\"markdown\":\"\"},{\"markdown\":\"text\"}]}").getAsJsonObject();

        OcrDocument document = client().parseDocument(json);

        assertNull(document.getModel());
        assertEquals(2, document.getPagesProcessed(), "Falls back to page count");
        assertEquals(1, document.getPages().get(1).getIndex(), "Falls back to position");
        assertFalse(document.getPages().get(0).hasMarkdown());
    }
}
