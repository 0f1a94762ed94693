package com.mimecast.wren.converter.ocr;

import com.mimecast.wren.config.OcrConfig;
import com.mimecast.wren.converter.AbstractConverter;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.converter.WorkingDirectory;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.resilience.ResilientExecutor;
import com.mimecast.wren.resilience.ResilientResult;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * OCR backed PDF converter.
 *
 * <p>Sends the document through the resilient executor to the OCR service and joins page markdown with the page
 * separator. Embedded images are kept when the mode asks for them, filtered by minimum edge size and count limit.
 * <p>Output is {@code <base>.md} with a metadata header, and images under {@code <base>_images/}.
 */
public class OcrDocumentConverter extends AbstractConverter {

    private static final Set<String> EXTENSIONS = Set.of(".pdf");

    private final OcrConfig config;
    private final OcrService service;
    private final ResilientExecutor executor;
    private final ExtractionMode mode;

    /**
     * Constructs a new OcrDocumentConverter instance.
     *
     * @param config    OcrConfig instance.
     * @param outputDir Output directory relative to the output root.
     * @param service   OcrService instance.
     * @param executor  ResilientExecutor guarding the service endpoint.
     */
    public OcrDocumentConverter(OcrConfig config, String outputDir, OcrService service, ResilientExecutor executor) {
        super(outputDir);
        this.config = config;
        this.service = service;
        this.executor = executor;
        ExtractionMode configured = ExtractionMode.fromString(config.getExtractionMode());
        this.mode = configured != null ? configured : ExtractionMode.ALL;
    }

    @Override
    public String getName() {
        return "ocr";
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

    public ExtractionMode getMode() {
        return mode;
    }

    @Override
    protected ConversionResult convertInternal(Attachment attachment, ConversionContext context, String baseName,
                                               WorkingDirectory workDir) throws ConversionException, IOException {
        File source = workDir.write(baseName + ".pdf", attachment.getContent());
        boolean keepImages = mode.includesImages() && config.isSaveImages();
        OcrRequest request = new OcrRequest(keepImages, config.getImageLimit(), config.getImageMinSize());

        ResilientResult<OcrDocument> call = executor.execute("ocr " + attachment.getOriginalName(),
                () -> service.process(attachment.getOriginalName(), source, request));
        OcrDocument document = call.getValue();

        ConversionResult result = new ConversionResult(getName()).setAttempts(call.getAttempts());
        String imagesDir = baseName + "_images";
        StringBuilder content = new StringBuilder();
        List<String> imageLinks = new ArrayList<>();
        int imageCount = 0;

        for (OcrPage page : document.getPages()) {
            if (mode.includesText()) {
                if (page.hasMarkdown()) {
                    if (content.length() > 0) {
                        content.append(config.getPageSeparator());
                    }
                    content.append(page.getMarkdown().trim());
                } else {
                    result.addWarning("Page " + (page.getIndex() + 1) + " returned no text");
                    result.setPartial(true);
                }
            }

            if (!keepImages) {
                continue;
            }
            int pageImage = 0;
            for (OcrImage image : page.getImages()) {
                if (config.getImageLimit() > 0 && imageCount >= config.getImageLimit()) {
                    break;
                }
                if (image.getWidth() < config.getImageMinSize() || image.getHeight() < config.getImageMinSize()) {
                    continue;
                }
                pageImage++;
                String name = String.format("%s_page_%02d_image_%02d%s", baseName, page.getIndex() + 1, pageImage,
                        image.getExtension());
                try {
                    byte[] bytes = image.decode();
                    result.addArtifact(new OutputArtifact(artifactPath(imagesDir + "/" + name), bytes, OutputArtifact.Kind.IMAGE));
                    imageCount++;
                    imageLinks.add("![Image " + imageCount + "](" + imagesDir + "/" + name + ")");
                } catch (IllegalArgumentException e) {
                    result.addWarning("Image " + image.getId() + " on page " + (page.getIndex() + 1) + " skipped: " + e.getMessage());
                    result.setPartial(true);
                }
            }
        }

        String text = content.toString();
        String markdown = header(attachment, document, imageCount, call.getAttempts())
                + "# PDF Conversion: " + attachment.getOriginalName() + "\n\n"
                + "Converted using " + getName() + " with extraction mode: **" + mode.name().toLowerCase(Locale.ROOT) + "**\n\n"
                + (text.isEmpty() ? "" : text + "\n\n")
                + (imageLinks.isEmpty() ? "" : "## Extracted Images\n\n" + String.join("\n", imageLinks) + "\n");

        result.addArtifact(new OutputArtifact(artifactPath(baseName + ".md"), markdown, OutputArtifact.Kind.MARKDOWN));
        result.setText(text);
        result.putMetadata("source", attachment.getOriginalName());
        result.putMetadata("model", document.getModel());
        result.putMetadata("extractionMode", mode.name());
        result.putMetadata("pages", document.getPages().size());
        result.putMetadata("pagesProcessed", document.getPagesProcessed());
        result.putMetadata("images", imageCount);
        result.putMetadata("endpoint", service.getEndpoint());

        log.debug("OCR of {} gave {} pages and {} images in {} attempts", attachment.getOriginalName(),
                document.getPages().size(), imageCount, call.getAttempts());
        return result;
    }

    private String header(Attachment attachment, OcrDocument document, int images, int attempts) {
        return "---\n"
                + "source_file: " + attachment.getOriginalName() + "\n"
                + "converter: " + getName() + "\n"
                + "model: " + (document.getModel() != null ? document.getModel() : config.getModel()) + "\n"
                + "extraction_mode: " + mode.name().toLowerCase(Locale.ROOT) + "\n"
                + "pages: " + document.getPages().size() + "\n"
                + "images: " + images + "\n"
                + "file_size: " + attachment.getSize() + "\n"
                + "attempts: " + attempts + "\n"
                + "---\n\n";
    }
}
