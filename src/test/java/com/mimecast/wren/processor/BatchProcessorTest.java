package com.mimecast.wren.processor;

import com.mimecast.wren.config.WrenConfig;
import com.mimecast.wren.converter.ConverterRegistry;
import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.mime.MalformedMessageException;
import com.mimecast.wren.storage.LocalOutputStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchProcessorTest {

    @TempDir
    Path tmp;

    private AttachmentOrchestrator orchestrator;
    private BatchProcessor batch;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        output = tmp.resolve("output");
        orchestrator = new AttachmentOrchestrator(new ConverterRegistry().register(new TextConverter()), 2);
        batch = new BatchProcessor(new MessageProcessor(new WrenConfig(), new LocalOutputStore(output), orchestrator), 2);
    }

    @AfterEach
    void tearDown() {
        batch.close();
        orchestrator.close();
    }

    private Path message(String name, String content) throws IOException {
        return Files.writeString(tmp.resolve(name), content);
    }

    @Test
    void testMalformedMessageOnlyFailsItself() throws IOException {
        List<Path> inputs = List.of(
                message("one.eml", "Message-ID: <one@x>\r\nSubject: one\r\n\r\nBody one\r\n"),
                message("empty.eml", ""),
                message("two.eml", MessageProcessorTest.MESSAGE));

        BatchReport report = batch.process(inputs);

        assertEquals(3, report.getOutcomes().size());
        assertEquals(2, report.getProcessedCount());
        assertEquals(1, report.getFailedCount());
        assertEquals(0, report.getCancelled());

        MessageOutcome failed = report.getOutcomes().get(1);
        assertEquals(ErrorKind.MALFORMED_MESSAGE, failed.getErrorKind());
        assertEquals(inputs.get(1).toString(), failed.getSource());

        assertTrue(Files.exists(output.resolve("one@x_metadata.json")));
        assertTrue(Files.exists(output.resolve("m1@example.com_metadata.json")));
    }

    @Test
    void testMissingFile() {
        MessageOutcome outcome = batch.processOne(tmp.resolve("missing.eml"));

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.PROCESSING, outcome.getErrorKind());
    }

    @Test
    void testCancelledBatchSkipsInputs() throws IOException {
        batch.cancel();

        BatchReport report = batch.process(List.of(message("one.eml", "Subject: one\r\n\r\nBody\r\n")));

        assertTrue(batch.isCancelled());
        assertTrue(report.getOutcomes().isEmpty());
        assertEquals(1, report.getCancelled());
    }

    @Test
    void testCancelKeepsRunningMessage() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        MessageProcessor slow = new MessageProcessor(new WrenConfig(), new LocalOutputStore(output), orchestrator) {
            @Override
            public MessageOutcome process(byte[] raw, String source) throws MalformedMessageException, IOException {
                started.countDown();
                try {
                    if (!proceed.await(5, TimeUnit.SECONDS)) {
                        throw new IOException("Not released");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted", e);
                }
                return super.process(raw, source);
            }
        };
        List<Path> inputs = List.of(
                message("one.eml", "Message-ID: <one@x>\r\nSubject: one\r\n\r\nBody one\r\n"),
                message("two.eml", "Message-ID: <two@x>\r\nSubject: two\r\n\r\nBody two\r\n"));

        try (BatchProcessor single = new BatchProcessor(slow, 1)) {
            CompletableFuture<BatchReport> running = CompletableFuture.supplyAsync(() -> single.process(inputs));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            single.cancel();
            proceed.countDown();
            BatchReport report = running.get(10, TimeUnit.SECONDS);

            assertEquals(1, report.getOutcomes().size(), "Running message is reported");
            assertTrue(report.getOutcomes().get(0).isSuccess());
            assertEquals(1, report.getCancelled());
        }

        assertTrue(Files.exists(output.resolve("one@x_metadata.json")));
        assertFalse(Files.exists(output.resolve("two@x_metadata.json")));
    }
}
