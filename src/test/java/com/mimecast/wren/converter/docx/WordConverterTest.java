package com.mimecast.wren.converter.docx;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.wren.config.DocxConfig;
import com.mimecast.wren.config.WrenConfig;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.security.AttachmentValidator;
import com.mimecast.wren.security.ValidationPolicy;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class WordConverterTest {

    private static final String BASE = "memo_20240101_000000_0a1b2c3d";
    private static final String ROOT = "converted_docx/" + BASE + "/";
    private static final byte[] PNG = new byte[]{(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 0};

    private final ConversionContext context = new ConversionContext("msg-1",
            ValidationPolicy.fromConfig(new WrenConfig().getSecurity()), new AttachmentValidator(),
            Instant.parse("2024-01-01T00:00:00Z"));

    private static byte[] document() throws Exception {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.getProperties().getCoreProperties().setTitle("Quarterly memo");

            XWPFParagraph heading = document.createParagraph();
            heading.setStyle("Heading1");
            heading.createRun().setText("Overview");

            XWPFParagraph body = document.createParagraph();
            body.createRun().setText("Revenue ");
            XWPFRun bold = body.createRun();
            bold.setText("grew");
            bold.setBold(true);
            body.createRun().setText(" strongly.");

            XWPFTable table = document.createTable(2, 2);
            table.getRow(0).getCell(0).setText("Name");
            table.getRow(0).getCell(1).setText("Value");
            table.getRow(1).getCell(0).setText("Alpha");
            table.getRow(1).getCell(1).setText("1|2");

            XWPFParagraph pictures = document.createParagraph();
            pictures.createRun().addPicture(new ByteArrayInputStream(PNG), Document.PICTURE_TYPE_PNG, "logo.png",
                    Units.toEMU(10), Units.toEMU(10));
            pictures.createRun().addPicture(new ByteArrayInputStream(PNG), Document.PICTURE_TYPE_PNG, "logo.png",
                    Units.toEMU(10), Units.toEMU(10));

            document.write(out);
            return out.toByteArray();
        }
    }

    private static WordConverter converter(Map<String, Object> settings) {
        return new WordConverter(new DocxConfig(settings), "converted_docx");
    }

    private static Attachment attachment(byte[] content) {
        return new Attachment("Memo.docx", BASE + ".docx", content,
                "application/vnd.openxmlformats-officedocument.wordprocessingml.document", "1.3");
    }

    private static Optional<OutputArtifact> artifact(ConversionResult result, String path) {
        return result.getArtifacts().stream().filter(a -> a.getPath().equals(path)).findFirst();
    }

    private static String text(OutputArtifact artifact) {
        return new String(artifact.getContent(), StandardCharsets.UTF_8);
    }

    @Test
    void testMarkdown() throws Exception {
        ConversionResult result = converter(new HashMap<>()).convert(attachment(document()), context);

        assertEquals("# Overview\n\n" +
                "Revenue **grew** strongly.\n\n" +
                "| Name | Value |\n" +
                "| --- | --- |\n" +
                "| Alpha | 1\\|2 |", result.getText());

        String md = text(artifact(result, ROOT + BASE + ".md").orElseThrow());
        assertTrue(md.startsWith("---\n"));
        assertTrue(md.contains("title: Quarterly memo\n"));
        assertTrue(md.endsWith(result.getText()));
        assertEquals("Quarterly memo", result.getMetadata().get("title"));
    }

    @Test
    void testSideOutputs() throws Exception {
        ConversionResult result = converter(new HashMap<>()).convert(attachment(document()), context);

        assertTrue(artifact(result, ROOT + BASE + "_styles.json").isPresent());
        assertTrue(artifact(result, ROOT + "images/image_001.png").isPresent());
        assertFalse(artifact(result, ROOT + "images/image_002.png").isPresent(), "Identical pictures stored once");
        assertEquals(1, result.getMetadata().get("images"));

        JsonObject images = JsonParser.parseString(text(artifact(result, ROOT + "image_manifest.json").orElseThrow())).getAsJsonObject();
        assertEquals(1, images.get("unique_images").getAsInt());
        assertEquals("images/image_001.png", images.getAsJsonArray("images").get(0).getAsJsonObject().get("file").getAsString());

        JsonObject chunks = JsonParser.parseString(text(artifact(result, ROOT + "chunk_manifest.json").orElseThrow())).getAsJsonObject();
        assertEquals(1, chunks.get("total_chunks").getAsInt());
        assertEquals("hybrid", chunks.get("chunking_strategy").getAsString());
        String chunk = text(artifact(result, ROOT + "chunks/chunk_001.md").orElseThrow());
        assertTrue(chunk.startsWith("---\nchunk_id: 1\nsource: " + BASE + "\nstrategy: hybrid\n"));
        assertEquals(1, result.getChunks().size());

        JsonObject manifest = JsonParser.parseString(text(artifact(result, ROOT + "conversion_manifest.json").orElseThrow())).getAsJsonObject();
        assertEquals("Memo.docx", manifest.get("source_file").getAsString());
        assertEquals(BASE + ".md", manifest.get("main_output").getAsString());
        assertEquals("2024-01-01T00:00:00Z", manifest.get("conversion_time").getAsString());
        assertEquals(1, manifest.getAsJsonObject("metadata").getAsJsonObject("statistics").get("tables").getAsInt());
    }

    @Test
    void testStrategyNameIndependentOfDefaultLocale() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            ConversionResult result = converter(new HashMap<>()).convert(attachment(document()), context);

            JsonObject chunks = JsonParser.parseString(text(artifact(result, ROOT + "chunk_manifest.json").orElseThrow())).getAsJsonObject();
            assertEquals("hybrid", chunks.get("chunking_strategy").getAsString());
            assertTrue(text(artifact(result, ROOT + "chunks/chunk_001.md").orElseThrow()).contains("strategy: hybrid\n"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testFeaturesDisabled() throws Exception {
        Map<String, Object> chunking = new HashMap<>();
        chunking.put("enabled", false);
        Map<String, Object> settings = new HashMap<>();
        settings.put("extractStyles", false);
        settings.put("extractImages", false);
        settings.put("extractMetadata", false);
        settings.put("chunking", chunking);

        ConversionResult result = converter(settings).convert(attachment(document()), context);

        assertEquals(2, result.getArtifacts().size(), "Markdown and conversion manifest only");
        assertTrue(result.getChunks().isEmpty());
        assertTrue(text(artifact(result, ROOT + BASE + ".md").orElseThrow()).startsWith("# Overview"));
    }

    @Test
    void testUnknownStrategyFallsBack() throws Exception {
        Map<String, Object> chunking = new HashMap<>();
        chunking.put("strategy", "random");
        chunking.put("maxTokens", 4L);
        chunking.put("overlapTokens", 1L);
        Map<String, Object> settings = new HashMap<>();
        settings.put("chunking", chunking);

        ConversionResult result = converter(settings).convert(attachment(document()), context);

        assertTrue(result.getWarnings().contains("Unknown chunking strategy random, using hybrid"));
        assertTrue(result.getChunks().size() > 1);
        assertTrue(artifact(result, ROOT + "chunks/chunk_002.md").isPresent());
    }

    @Test
    void testNotAWordDocument() throws Exception {
        ByteArrayOutputStream zip = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(zip)) {
            out.putNextEntry(new ZipEntry("readme.txt"));
            out.write("hello".getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }

        ConversionException e = assertThrows(ConversionException.class,
                () -> converter(new HashMap<>()).convert(attachment(zip.toByteArray()), context));
        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, e.getKind());
        assertEquals("Memo.docx", e.getAttachmentName());
    }

    @Test
    void testHeadingLevel() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            assertEquals(0, DocxMarkdownWriter.headingLevel(paragraph, null));

            paragraph.setStyle("Heading3");
            assertEquals(3, DocxMarkdownWriter.headingLevel(paragraph, null));
            paragraph.setStyle("Title");
            assertEquals(1, DocxMarkdownWriter.headingLevel(paragraph, null));
            paragraph.setStyle("Heading9");
            assertEquals(6, DocxMarkdownWriter.headingLevel(paragraph, null));
            paragraph.setStyle("BodyText");
            assertEquals(0, DocxMarkdownWriter.headingLevel(paragraph, null));
        }
    }

    @Test
    void testEmphasize() {
        assertEquals(" **bold** ", DocxMarkdownWriter.emphasize(" bold ", "**"));
        assertEquals("***both***", DocxMarkdownWriter.emphasize("both", "***"));
        assertEquals("plain", DocxMarkdownWriter.emphasize("plain", ""));
    }
}
