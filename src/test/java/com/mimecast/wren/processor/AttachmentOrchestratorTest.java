package com.mimecast.wren.processor;

import com.mimecast.wren.config.WrenConfig;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConverterRegistry;
import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.security.AttachmentValidator;
import com.mimecast.wren.security.ValidationPolicy;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class AttachmentOrchestratorTest {

    private final ConversionContext context = new ConversionContext("msg-1",
            ValidationPolicy.fromConfig(new WrenConfig().getSecurity()), new AttachmentValidator(), Instant.now());

    private static Attachment attachment(String name, String content) {
        return new Attachment(name, name, content.getBytes(StandardCharsets.UTF_8), "text/plain", "1");
    }

    @Test
    void testUnsupportedDoesNotStopOthers() {
        List<Attachment> attachments = List.of(
                attachment("a.txt", "alpha"),
                attachment("b.zip", "PK"),
                attachment("c.txt", "gamma"),
                attachment("d.txt", "delta"));

        try (AttachmentOrchestrator orchestrator = new AttachmentOrchestrator(new ConverterRegistry().register(new TextConverter()), 2)) {
            ProcessingReport report = orchestrator.process(attachments, context);

            assertEquals(4, report.getOutcomes().size());
            assertEquals(3, report.getSuccessCount());
            assertEquals(1, report.getFailureCount());
            assertEquals(1, report.count(ErrorKind.UNSUPPORTED_FORMAT));

            for (int i = 0; i < attachments.size(); i++) {
                assertSame(attachments.get(i), report.getOutcomes().get(i).getAttachment(), "Outcomes keep attachment order");
            }
            assertEquals(AttachmentOutcome.Status.UNSUPPORTED, report.getOutcomes().get(1).getStatus());
            assertEquals("GAMMA", report.getOutcomes().get(2).getResult().getText());
        }
    }

    @Test
    void testFailuresIsolated() {
        List<Attachment> attachments = List.of(
                attachment("fail.txt", "FAIL"),
                attachment("crash.txt", "CRASH"),
                attachment("partial.txt", "PARTIAL"),
                attachment("ok.txt", "fine"));

        try (AttachmentOrchestrator orchestrator = new AttachmentOrchestrator(new ConverterRegistry().register(new TextConverter()), 4)) {
            ProcessingReport report = orchestrator.process(attachments, context);
            List<AttachmentOutcome> outcomes = report.getOutcomes();

            assertEquals(AttachmentOutcome.Status.FAILED, outcomes.get(0).getStatus());
            assertEquals(ErrorKind.PROCESSING, outcomes.get(0).getErrorKind());
            assertEquals("Cannot convert fail.txt", outcomes.get(0).getReason());
            assertEquals("text", outcomes.get(0).getConverter());

            assertEquals(AttachmentOutcome.Status.FAILED, outcomes.get(1).getStatus());
            assertTrue(outcomes.get(1).getReason().contains("IllegalStateException"));

            assertEquals(AttachmentOutcome.Status.PARTIAL, outcomes.get(2).getStatus());
            assertTrue(outcomes.get(2).isSuccess());
            assertEquals("converted_text/partial.md", outcomes.get(2).getPartialOutput());

            assertEquals(AttachmentOutcome.Status.CONVERTED, outcomes.get(3).getStatus());
            assertEquals(2, report.getSuccessCount());
            assertEquals(2, report.getFailures().size());
        }
    }

    @Test
    void testConversionsRunConcurrently() {
        CountDownLatch latch = new CountDownLatch(3);
        List<Attachment> attachments = List.of(attachment("a.txt", "a"), attachment("b.txt", "b"), attachment("c.txt", "c"));

        try (AttachmentOrchestrator orchestrator = new AttachmentOrchestrator(new ConverterRegistry().register(new TextConverter(latch)), 3)) {
            ProcessingReport report = orchestrator.process(attachments, context);

            assertEquals(3, report.getSuccessCount(), report.toString());
        }
    }

    @Test
    void testEmpty() {
        try (AttachmentOrchestrator orchestrator = new AttachmentOrchestrator(new ConverterRegistry(), 1)) {
            ProcessingReport report = orchestrator.process(List.of(), context);

            assertTrue(report.getOutcomes().isEmpty());
            assertEquals("msg-1", report.getMessageId());
        }
    }
}
