package com.mimecast.wren.converter;

import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ProcessingException;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.security.ValidationOutcome;
import com.mimecast.wren.security.ValidationPolicy;
import com.mimecast.wren.util.PathUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Set;

/**
 * Abstract base class for converters.
 *
 * <p>The {@link #convert(Attachment, ConversionContext)} method re-validates size and type against the converter's
 * own limits, derives the output base name and supplies a working directory that is always removed.
 * <br>Subclasses implement {@link #convertInternal(Attachment, ConversionContext, String, WorkingDirectory)}.
 * <p>Unexpected failures are wrapped in {@link ProcessingException}.
 */
public abstract class AbstractConverter implements Converter {
    protected final Logger log = LogManager.getLogger(getClass());

    /**
     * Output directory relative to the output root.
     */
    protected final String outputDir;

    /**
     * Constructs a new AbstractConverter instance.
     *
     * @param outputDir Output directory relative to the output root.
     */
    protected AbstractConverter(String outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Gets handled extensions, lower case with leading dot.
     *
     * @return Set of String.
     */
    protected abstract Set<String> getExtensions();

    /**
     * Gets maximum input size.
     *
     * @return Size in bytes.
     */
    protected abstract long getMaxFileSize();

    /**
     * Is converter enabled.
     *
     * @return Boolean.
     */
    protected abstract boolean isEnabled();

    @Override
    public boolean supports(Attachment attachment) {
        return isEnabled() && getExtensions().contains(attachment.getExtension());
    }

    @Override
    public final ConversionResult convert(Attachment attachment, ConversionContext context) throws ConversionException {
        long started = System.currentTimeMillis();

        ValidationPolicy policy = context.getPolicy()
                .withMaxSize(Math.min(context.getPolicy().getMaxSize(), getMaxFileSize()))
                .withAllowedExtensions(getExtensions());
        ValidationOutcome outcome = context.getValidator()
                .validate(attachment.getOriginalName(), attachment.getContent(), attachment.getDeclaredType(), policy);
        try {
            outcome.throwIfDenied();
        } catch (ConversionException e) {
            throw e.setAttachmentName(attachment.getOriginalName());
        }

        String baseName = PathUtils.baseName(attachment.getOutputName());
        try (WorkingDirectory workDir = new WorkingDirectory("wren-" + getName() + "-")) {
            ConversionResult result = convertInternal(attachment, context, baseName, workDir);
            outcome.getWarnings().forEach(result::addWarning);
            log.info("Converted {} with {} in {}ms: {} artifacts{}", attachment.getOriginalName(), getName(),
                    System.currentTimeMillis() - started, result.getArtifacts().size(), result.isPartial() ? " (partial)" : "");
            return result;

        } catch (ConversionException e) {
            if (e.getAttachmentName() == null) {
                e.setAttachmentName(attachment.getOriginalName());
            }
            throw e;

        } catch (IOException | RuntimeException e) {
            log.error("Conversion of {} with {} failed: {}", attachment.getOriginalName(), getName(), e.getMessage());
            throw new ProcessingException(getName() + " failed on " + attachment.getOriginalName() + ": " + e.getMessage(), e)
                    .setAttachmentName(attachment.getOriginalName());
        }
    }

    /**
     * Converts validated attachment.
     *
     * @param attachment Attachment instance.
     * @param context    ConversionContext instance.
     * @param baseName   Output base name derived from the unique attachment name.
     * @param workDir    Scoped working directory.
     * @return ConversionResult instance.
     * @throws ConversionException Classified failure.
     * @throws IOException         Unexpected I/O failure.
     */
    protected abstract ConversionResult convertInternal(Attachment attachment, ConversionContext context, String baseName,
                                                        WorkingDirectory workDir) throws ConversionException, IOException;

    /**
     * Gets artifact path under this converter's output directory.
     *
     * @param relative Path below the output directory.
     * @return Path relative to the output root.
     */
    protected String artifactPath(String relative) {
        return outputDir + "/" + relative;
    }

    public String getOutputDir() {
        return outputDir;
    }
}
