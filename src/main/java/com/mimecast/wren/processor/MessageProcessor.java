package com.mimecast.wren.processor;

import com.mimecast.wren.config.WrenConfig;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.extraction.EmailExtractor;
import com.mimecast.wren.extraction.ExtractionResult;
import com.mimecast.wren.extraction.InlineImage;
import com.mimecast.wren.extraction.Position;
import com.mimecast.wren.mime.MalformedMessageException;
import com.mimecast.wren.security.AttachmentValidator;
import com.mimecast.wren.security.ValidationOutcome;
import com.mimecast.wren.security.ValidationPolicy;
import com.mimecast.wren.storage.MessageLayout;
import com.mimecast.wren.storage.MetadataDocument;
import com.mimecast.wren.storage.OutputStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processes one message end to end.
 *
 * <p>Steps:
 * <ol>
 *     <li>Extract body text, attachments and inline images</li>
 *     <li>Validate and preserve attachments and inline images</li>
 *     <li>Convert preserved attachments through the orchestrator</li>
 *     <li>Write body text, converter artifacts and the metadata document</li>
 * </ol>
 * <p>Attachments denied by validation are recorded, never written or converted.
 */
public class MessageProcessor {
    private static final Logger log = LogManager.getLogger(MessageProcessor.class);

    private final WrenConfig config;
    private final OutputStore store;
    private final AttachmentOrchestrator orchestrator;
    private final EmailExtractor extractor;
    private final AttachmentValidator validator;
    private final Clock clock;

    /**
     * Constructs a new MessageProcessor instance.
     *
     * @param config       WrenConfig instance.
     * @param store        OutputStore instance.
     * @param orchestrator AttachmentOrchestrator instance.
     */
    public MessageProcessor(WrenConfig config, OutputStore store, AttachmentOrchestrator orchestrator) {
        this(config, store, orchestrator, new EmailExtractor(), new AttachmentValidator(), Clock.systemUTC());
    }

    /**
     * Constructs a new MessageProcessor instance.
     *
     * @param config       WrenConfig instance.
     * @param store        OutputStore instance.
     * @param orchestrator AttachmentOrchestrator instance.
     * @param extractor    EmailExtractor instance.
     * @param validator    AttachmentValidator instance.
     * @param clock        Clock for processing timestamps.
     */
    public MessageProcessor(WrenConfig config, OutputStore store, AttachmentOrchestrator orchestrator,
                            EmailExtractor extractor, AttachmentValidator validator, Clock clock) {
        this.config = config;
        this.store = store;
        this.orchestrator = orchestrator;
        this.extractor = extractor;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Processes message.
     *
     * @param raw    Raw message bytes.
     * @param source Input source description.
     * @return MessageOutcome instance.
     * @throws MalformedMessageException Top level structure unparseable.
     * @throws IOException               Unable to write output.
     */
    public MessageOutcome process(byte[] raw, String source) throws MalformedMessageException, IOException {
        Instant now = clock.instant();
        ExtractionResult extraction = extractor.extract(raw);
        MessageLayout layout = new MessageLayout(config.getOutput(), extraction.getMessageId());
        ValidationPolicy policy = ValidationPolicy.fromConfig(config.getSecurity());

        MetadataDocument metadata = new MetadataDocument(extraction.getMessageId(), source, extraction.getSubject(), now.toString())
                .setHeaders(extraction.getHeaders().toMap());
        extraction.getWarnings().forEach(metadata::addWarning);

        store.writeText(layout.plainTextPath(), extraction.getBodyText());
        metadata.putBody("plain", layout.plainTextPath());
        if (extraction.getHtmlBody() != null) {
            store.writeText(layout.htmlPath(), extraction.getHtmlBody());
            metadata.putBody("html", layout.htmlPath());
        }

        Map<Attachment, MetadataDocument.AttachmentEntry> entries = new LinkedHashMap<>();
        Map<Attachment, AttachmentOutcome> rejected = new LinkedHashMap<>();
        List<Attachment> accepted = new ArrayList<>();
        for (Attachment attachment : extraction.getAttachments()) {
            MetadataDocument.AttachmentEntry entry = new MetadataDocument.AttachmentEntry(attachment.getOriginalName(),
                    attachment.getOutputName(), attachment.getPartId(), attachment.getSize(), attachment.getSha256(),
                    attachment.getDeclaredType(), attachment.getDetectedType());
            entries.put(attachment, entry);

            ValidationOutcome outcome = validator.validate(attachment.getOriginalName(), attachment.getContent(),
                    attachment.getDeclaredType(), policy);
            outcome.getWarnings().forEach(entry::addWarning);
            if (outcome.isAllowed()) {
                String path = layout.attachmentPath(attachment.getOutputName());
                store.write(path, attachment.getContent());
                entry.setPath(path);
                accepted.add(attachment);
            } else {
                log.warn("Attachment {} rejected: {}", attachment.getOriginalName(), outcome.getReason());
                rejected.put(attachment, AttachmentOutcome.rejected(attachment, outcome.getKind(), outcome.getReason()));
            }
        }

        for (InlineImage image : extraction.getImages()) {
            String path = null;
            if (image.getContent().length > 0 && image.getContent().length <= policy.getMaxSize()) {
                path = layout.inlineImagePath(image.getOutputName());
                store.write(path, image.getContent());
            } else {
                metadata.addWarning("Inline image " + image.getContentId() + " not stored, size " + image.getContent().length);
            }
            metadata.addInlineImage(new MetadataDocument.ImageEntry(image.getContentId(), image.getOriginalContentId(),
                    image.getOriginalName(), image.getOutputName(), path, image.getPartId(), image.getContent().length,
                    image.getDetectedType()));
        }

        for (Position position : extraction.getPositions()) {
            metadata.addPosition(new MetadataDocument.PositionEntry(position.getMarkerId(), position.getKind().getLabel(),
                    position.getIndex(), position.getOffset(), position.getFilename(), position.getPartId()));
        }

        ConversionContext context = new ConversionContext(extraction.getMessageId(), policy, validator, now);
        ProcessingReport converted = orchestrator.process(accepted, context);
        Map<Attachment, AttachmentOutcome> byAttachment = new LinkedHashMap<>(rejected);
        for (AttachmentOutcome outcome : converted.getOutcomes()) {
            byAttachment.put(outcome.getAttachment(), outcome);
        }

        List<AttachmentOutcome> outcomes = new ArrayList<>();
        for (Attachment attachment : extraction.getAttachments()) {
            AttachmentOutcome outcome = byAttachment.get(attachment);
            outcomes.add(outcome);
            MetadataDocument.AttachmentEntry entry = entries.get(attachment);
            entry.setStatus(outcome.getStatus().name(), outcome.getConverter(),
                    outcome.getErrorKind() != null ? outcome.getErrorKind().name() : null, outcome.getReason())
                    .setPartialOutput(outcome.getPartialOutput())
                    .setAttempts(outcome.getAttempts());

            if (outcome.getResult() != null) {
                for (OutputArtifact artifact : outcome.getResult().getArtifacts()) {
                    store.write(artifact.getPath(), artifact.getContent());
                    entry.addArtifact(artifact.getPath());
                }
                outcome.getResult().getWarnings().forEach(entry::addWarning);
            }
            metadata.addAttachment(entry);
        }

        store.writeText(layout.metadataPath(), metadata.toJson());
        ProcessingReport report = new ProcessingReport(extraction.getMessageId(), outcomes);
        log.info("Processed {} from {}: {}", extraction.getMessageId(), source, report);
        return MessageOutcome.processed(source, report, layout.metadataPath());
    }
}
