package com.mimecast.wren.converter.docx;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mimecast.wren.chunking.Chunk;
import com.mimecast.wren.chunking.ChunkingEngine;
import com.mimecast.wren.chunking.ChunkingStrategy;
import com.mimecast.wren.config.ChunkingConfig;
import com.mimecast.wren.config.DocxConfig;
import com.mimecast.wren.converter.AbstractConverter;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.converter.WorkingDirectory;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ProcessingException;
import com.mimecast.wren.exception.UnsupportedFormatException;
import com.mimecast.wren.extraction.Attachment;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Word processor document converter.
 *
 * <p>Writes into {@code <outputDir>/<base>/}:
 * <ul>
 *     <li>{@code <base>.md} markdown with metadata front matter</li>
 *     <li>{@code <base>_styles.json} style manifest</li>
 *     <li>{@code images/} and {@code image_manifest.json}</li>
 *     <li>{@code chunks/chunk_NNN.md} and {@code chunk_manifest.json}</li>
 *     <li>{@code conversion_manifest.json}</li>
 * </ul>
 * <p>Styles, images, metadata and chunking are optional features, a failure in one is a warning.
 */
public class WordConverter extends AbstractConverter {

    private static final Set<String> EXTENSIONS = Set.of(".docx");

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private final DocxConfig config;
    private final DocxMarkdownWriter markdownWriter = new DocxMarkdownWriter();
    private final DocxMetadataExtractor metadataExtractor;
    private final DocxImageExtractor imageExtractor = new DocxImageExtractor();
    private final DocxStyleExtractor styleExtractor = new DocxStyleExtractor();
    private final ChunkingEngine chunkingEngine;

    /**
     * Constructs a new WordConverter instance.
     *
     * @param config    DocxConfig instance.
     * @param outputDir Output directory relative to the output root.
     */
    public WordConverter(DocxConfig config, String outputDir) {
        super(outputDir);
        this.config = config;
        this.metadataExtractor = new DocxMetadataExtractor(config.isIncludeCustomProperties());
        this.chunkingEngine = ChunkingEngine.fromConfig(config.getChunking());
    }

    @Override
    public String getName() {
        return "docx";
    }

    @Override
    protected Set<String> getExtensions() {
        return EXTENSIONS;
    }

    @Override
    protected long getMaxFileSize() {
        return config.getMaxFileSize();
    }

    @Override
    protected boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    protected ConversionResult convertInternal(Attachment attachment, ConversionContext context, String baseName,
                                               WorkingDirectory workDir) throws ConversionException, IOException {
        File source = workDir.write("source.docx", attachment.getContent());
        ConversionResult result = new ConversionResult(getName());
        String root = baseName + "/";

        try (InputStream in = Files.newInputStream(source.toPath());
             XWPFDocument document = open(in, attachment)) {

            String markdown = markdownWriter.write(document);

            Map<String, Object> metadata = Collections.emptyMap();
            if (config.isExtractMetadata()) {
                try {
                    metadata = metadataExtractor.extract(document);
                } catch (RuntimeException e) {
                    warn(result, "Metadata extraction failed", e);
                }
            }

            boolean stylesWritten = false;
            if (config.isExtractStyles()) {
                try {
                    String styles = GSON.toJson(styleExtractor.extract(document));
                    result.addArtifact(new OutputArtifact(artifactPath(root + baseName + "_styles.json"), styles, OutputArtifact.Kind.JSON));
                    stylesWritten = true;
                } catch (RuntimeException e) {
                    warn(result, "Style extraction failed", e);
                }
            }

            int imageCount = 0;
            if (config.isExtractImages()) {
                try {
                    List<DocxImage> images = imageExtractor.extract(document);
                    for (DocxImage image : images) {
                        result.addArtifact(new OutputArtifact(artifactPath(root + "images/" + image.getFileName()),
                                image.getData(), OutputArtifact.Kind.IMAGE));
                    }
                    if (!images.isEmpty()) {
                        result.addArtifact(new OutputArtifact(artifactPath(root + "image_manifest.json"),
                                GSON.toJson(DocxImageExtractor.manifest(images)), OutputArtifact.Kind.JSON));
                    }
                    imageCount = images.size();
                } catch (RuntimeException e) {
                    warn(result, "Image extraction failed", e);
                }
            }

            int chunkCount = 0;
            ChunkingConfig chunking = config.getChunking();
            if (chunking.isEnabled() && !markdown.isBlank()) {
                try {
                    chunkCount = writeChunks(markdown, baseName, root, chunking, result);
                } catch (IllegalArgumentException | IllegalStateException e) {
                    warn(result, "Chunking failed", e);
                }
            }

            result.addArtifact(new OutputArtifact(artifactPath(root + baseName + ".md"),
                    frontMatter(metadata) + markdown, OutputArtifact.Kind.MARKDOWN));

            Map<String, Object> features = new LinkedHashMap<>();
            features.put("metadata", config.isExtractMetadata());
            features.put("styles", stylesWritten);
            features.put("images", config.isExtractImages());
            features.put("chunking", chunking.isEnabled());

            Map<String, Object> manifest = new LinkedHashMap<>();
            manifest.put("source_file", attachment.getOriginalName());
            manifest.put("conversion_time", context.getTimestamp().toString());
            manifest.put("main_output", baseName + ".md");
            manifest.put("features_used", features);
            manifest.put("metadata", metadata);
            manifest.put("chunks_count", chunkCount);
            manifest.put("images_count", imageCount);
            manifest.put("warnings", new ArrayList<>(result.getWarnings()));
            result.addArtifact(new OutputArtifact(artifactPath(root + "conversion_manifest.json"),
                    GSON.toJson(manifest), OutputArtifact.Kind.JSON));

            result.setText(markdown);
            result.putMetadata("source", attachment.getOriginalName());
            result.putMetadata("images", imageCount);
            result.putMetadata("chunks", chunkCount);
            if (metadata.containsKey("title")) {
                result.putMetadata("title", metadata.get("title"));
            }
        }

        return result;
    }

    /**
     * Opens document.
     *
     * @param in         Document stream.
     * @param attachment Attachment instance.
     * @return XWPFDocument instance.
     * @throws ConversionException Encrypted or not a word processor document.
     */
    private XWPFDocument open(InputStream in, Attachment attachment) throws ConversionException {
        try {
            return new XWPFDocument(in);
        } catch (EncryptedDocumentException e) {
            throw new ProcessingException("Document is password protected: " + attachment.getOriginalName(), e);
        } catch (IOException | IllegalArgumentException | POIXMLException e) {
            throw new UnsupportedFormatException("Not a readable word processor document: " + attachment.getOriginalName(), e);
        }
    }

    /**
     * Chunks markdown and adds chunk artifacts.
     *
     * @param markdown Markdown text.
     * @param baseName Output base name.
     * @param root     Document output directory.
     * @param chunking ChunkingConfig instance.
     * @param result   ConversionResult instance.
     * @return Chunk count.
     */
    private int writeChunks(String markdown, String baseName, String root, ChunkingConfig chunking, ConversionResult result) {
        ChunkingStrategy strategy = ChunkingStrategy.fromString(chunking.getStrategy());
        if (strategy == null) {
            result.addWarning("Unknown chunking strategy " + chunking.getStrategy() + ", using hybrid");
            strategy = ChunkingStrategy.HYBRID;
        }

        List<Chunk> chunks = chunkingEngine.chunk(markdown, strategy, chunking.getMaxTokens(), chunking.getOverlapTokens());
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Chunk chunk : chunks) {
            int id = chunk.getIndex() + 1;
            String file = String.format("chunks/chunk_%03d.md", id);
            StringBuilder content = new StringBuilder("---\n")
                    .append("chunk_id: ").append(id).append('\n')
                    .append("source: ").append(baseName).append('\n')
                    .append("strategy: ").append(strategy.name().toLowerCase(Locale.ROOT)).append('\n')
                    .append("token_count: ").append(chunk.getTokenCount()).append('\n')
                    .append("start_index: ").append(chunk.getStart()).append('\n')
                    .append("end_index: ").append(chunk.getEnd()).append('\n');
            if (chunk.getOverlapTokens() > 0) {
                content.append("overlap_with_previous: ").append(chunk.getOverlapTokens()).append('\n');
            }
            content.append("---\n\n").append(chunk.getText());
            result.addArtifact(new OutputArtifact(artifactPath(root + file), content.toString(), OutputArtifact.Kind.CHUNK));

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("chunk_id", id);
            entry.put("file_path", file);
            entry.put("token_count", chunk.getTokenCount());
            entry.put("overlap_with_previous", chunk.getOverlapTokens());
            entries.add(entry);
        }

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("total_chunks", chunks.size());
        manifest.put("chunking_strategy", strategy.name().toLowerCase(Locale.ROOT));
        manifest.put("max_tokens", chunking.getMaxTokens());
        manifest.put("overlap_tokens", chunking.getOverlapTokens());
        manifest.put("chunks", entries);
        result.addArtifact(new OutputArtifact(artifactPath(root + "chunk_manifest.json"), GSON.toJson(manifest), OutputArtifact.Kind.JSON));

        result.setChunks(chunks);
        return chunks.size();
    }

    /**
     * Renders scalar metadata as front matter.
     *
     * @param metadata Metadata map.
     * @return Front matter or empty string.
     */
    static String frontMatter(Map<String, Object> metadata) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (entry.getValue() instanceof String || entry.getValue() instanceof Number) {
                sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }
        return sb.length() == 0 ? "" : "---\n" + sb + "---\n\n";
    }

    private void warn(ConversionResult result, String what, RuntimeException e) {
        log.warn("{}: {}", what, e.getMessage());
        result.addWarning(what + ": " + e.getMessage());
    }
}
