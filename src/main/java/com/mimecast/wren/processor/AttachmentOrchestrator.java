package com.mimecast.wren.processor;

import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.Converter;
import com.mimecast.wren.converter.ConverterRegistry;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.extraction.ExtractionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches attachments to converters on a bounded pool.
 *
 * <p>Each attachment goes to the first converter that supports it, or gets an {@code UNSUPPORTED_FORMAT} outcome.
 * <br>Every failure is caught at the attachment boundary and recorded, never propagated.
 * <p>On interruption pending work is cancelled, completed outcomes are kept and the interrupt flag is restored.
 */
public class AttachmentOrchestrator implements Closeable {
    private static final Logger log = LogManager.getLogger(AttachmentOrchestrator.class);

    private final ConverterRegistry registry;
    private final ExecutorService executor;

    /**
     * Constructs a new AttachmentOrchestrator instance.
     *
     * @param registry ConverterRegistry instance.
     * @param workers  Pool size.
     */
    public AttachmentOrchestrator(ConverterRegistry registry, int workers) {
        this.registry = registry;
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers));
    }

    /**
     * Processes all attachments of an extraction.
     *
     * @param extraction ExtractionResult instance.
     * @param context    ConversionContext instance.
     * @return ProcessingReport instance.
     */
    public ProcessingReport process(ExtractionResult extraction, ConversionContext context) {
        return process(extraction.getAttachments(), context);
    }

    /**
     * Processes attachments.
     *
     * @param attachments Attachments in order.
     * @param context     ConversionContext instance.
     * @return ProcessingReport with outcomes in attachment order.
     */
    public ProcessingReport process(List<Attachment> attachments, ConversionContext context) {
        List<AttachmentOutcome> outcomes = new ArrayList<>();
        List<Future<AttachmentOutcome>> futures = new ArrayList<>();
        List<Converter> converters = new ArrayList<>();

        for (Attachment attachment : attachments) {
            Optional<Converter> converter = registry.find(attachment);
            converters.add(converter.orElse(null));
            if (converter.isEmpty() || Thread.currentThread().isInterrupted()) {
                futures.add(null);
                continue;
            }
            futures.add(executor.submit(() -> convert(converter.get(), attachment, context)));
        }

        boolean interrupted = Thread.currentThread().isInterrupted();
        for (int i = 0; i < attachments.size(); i++) {
            Attachment attachment = attachments.get(i);
            Converter converter = converters.get(i);
            Future<AttachmentOutcome> future = futures.get(i);

            if (converter == null) {
                log.info("No converter for {}", attachment.getOriginalName());
                outcomes.add(AttachmentOutcome.unsupported(attachment));
                continue;
            }
            if (future == null || interrupted) {
                if (future != null) {
                    future.cancel(true);
                }
                outcomes.add(AttachmentOutcome.cancelled(attachment, converter.getName()));
                continue;
            }

            try {
                outcomes.add(future.get());
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                outcomes.add(AttachmentOutcome.cancelled(attachment, converter.getName()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Conversion of {} failed unexpectedly: {}", attachment.getOriginalName(), cause.getMessage());
                outcomes.add(AttachmentOutcome.failed(attachment, converter.getName(), String.valueOf(cause.getMessage())));
            }
        }

        if (interrupted) {
            log.warn("Processing of {} interrupted, pending attachments cancelled", context.getMessageId());
            Thread.currentThread().interrupt();
        }

        ProcessingReport report = new ProcessingReport(context.getMessageId(), outcomes);
        log.info("Processed attachments of {}: {}", context.getMessageId(), report);
        return report;
    }

    /**
     * Converts one attachment inside the failure boundary.
     *
     * @param converter  Converter instance.
     * @param attachment Attachment instance.
     * @param context    ConversionContext instance.
     * @return AttachmentOutcome instance.
     */
    private AttachmentOutcome convert(Converter converter, Attachment attachment, ConversionContext context) {
        long started = System.currentTimeMillis();
        try {
            ConversionResult result = converter.convert(attachment, context);
            return AttachmentOutcome.converted(attachment, result, System.currentTimeMillis() - started);

        } catch (ConversionException e) {
            log.warn("Conversion of {} with {} failed with {}: {}", attachment.getOriginalName(), converter.getName(),
                    e.getKind(), e.getMessage());
            return AttachmentOutcome.failed(attachment, converter.getName(), e, System.currentTimeMillis() - started);

        } catch (RuntimeException e) {
            log.error("Converter {} crashed on {}: {}", converter.getName(), attachment.getOriginalName(), e.getMessage(), e);
            return AttachmentOutcome.failed(attachment, converter.getName(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Shuts down the pool.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
