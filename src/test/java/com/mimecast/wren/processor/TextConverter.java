package com.mimecast.wren.processor;

import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.Converter;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ProcessingException;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.util.PathUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Converter for text attachments driven by the attachment content.
 * <p>Content {@code FAIL} raises a conversion error, {@code CRASH} a runtime error and {@code PARTIAL} gives a partial result.
 */
class TextConverter implements Converter {

    private final CountDownLatch latch;

    TextConverter() {
        this(null);
    }

    /**
     * Constructs a new TextConverter instance waiting on a latch before converting.
     *
     * @param latch Latch counted down and awaited by every conversion.
     */
    TextConverter(CountDownLatch latch) {
        this.latch = latch;
    }

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public boolean supports(Attachment attachment) {
        return ".txt".equals(attachment.getExtension());
    }

    @Override
    public ConversionResult convert(Attachment attachment, ConversionContext context) throws ConversionException {
        if (latch != null) {
            latch.countDown();
            try {
                if (!latch.await(5, TimeUnit.SECONDS)) {
                    throw new ProcessingException("Conversions did not run concurrently");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProcessingException("Interrupted", e);
            }
        }

        String content = new String(attachment.getContent(), StandardCharsets.UTF_8).trim();
        if (content.equals("FAIL")) {
            throw new ProcessingException("Cannot convert " + attachment.getOriginalName());
        }
        if (content.equals("CRASH")) {
            throw new IllegalStateException("Converter bug");
        }

        ConversionResult result = new ConversionResult(getName())
                .setText(content.toUpperCase(Locale.ROOT))
                .setAttempts(1)
                .addArtifact(new OutputArtifact("converted_text/" + PathUtils.baseName(attachment.getOutputName()) + ".md",
                        content.toUpperCase(Locale.ROOT), OutputArtifact.Kind.MARKDOWN));
        if (content.equals("PARTIAL")) {
            result.setPartial(true).addWarning("Only part of the text converted");
        }
        return result;
    }
}
