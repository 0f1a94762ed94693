package com.mimecast.wren.processor;

import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.mime.MalformedMessageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Processes many messages on a bounded pool.
 *
 * <p>A malformed or unreadable message aborts only itself.
 * <br>{@link #cancel()} stops messages that have not started. Messages already running finish and their outcomes
 * are reported, so the report matches what was written.
 */
public class BatchProcessor implements Closeable {
    private static final Logger log = LogManager.getLogger(BatchProcessor.class);

    private final MessageProcessor processor;
    private final ExecutorService executor;
    private final List<Task> pending = new ArrayList<>();
    private volatile boolean cancelled = false;

    /**
     * Constructs a new BatchProcessor instance.
     *
     * @param processor MessageProcessor instance.
     * @param workers   Pool size.
     */
    public BatchProcessor(MessageProcessor processor, int workers) {
        this.processor = processor;
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers));
    }

    /**
     * Processes message files.
     *
     * @param inputs Message file paths.
     * @return BatchReport instance.
     */
    public BatchReport process(List<Path> inputs) {
        List<Task> tasks = new ArrayList<>();
        synchronized (pending) {
            for (Path input : inputs) {
                if (cancelled) {
                    break;
                }
                Task task = new Task();
                task.future = executor.submit(() -> task.claim() ? processOne(input) : null);
                tasks.add(task);
                pending.add(task);
            }
        }

        List<MessageOutcome> outcomes = new ArrayList<>();
        int skipped = inputs.size() - tasks.size();
        for (Task task : tasks) {
            try {
                MessageOutcome outcome = task.future.get();
                if (outcome != null) {
                    outcomes.add(outcome);
                } else {
                    skipped++;
                }
            } catch (CancellationException e) {
                skipped++;
            } catch (InterruptedException e) {
                cancel();
                skipped++;
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Message processing failed unexpectedly: {}", cause.getMessage());
                outcomes.add(MessageOutcome.failed("unknown", ErrorKind.PROCESSING, cause.getMessage()));
            }
        }

        synchronized (pending) {
            pending.removeAll(tasks);
        }

        BatchReport report = new BatchReport(outcomes, skipped);
        log.info("Batch of {} messages done: {}", inputs.size(), report);
        return report;
    }

    /**
     * Processes one message file inside the failure boundary.
     *
     * @param input Message file path.
     * @return MessageOutcome instance.
     */
    MessageOutcome processOne(Path input) {
        String source = input.toString();
        try {
            return processor.process(Files.readAllBytes(input), source);

        } catch (MalformedMessageException e) {
            log.warn("Malformed message {}: {}", source, e.getMessage());
            return MessageOutcome.failed(source, ErrorKind.MALFORMED_MESSAGE, e.getMessage());

        } catch (IOException e) {
            log.error("Unable to process {}: {}", source, e.getMessage());
            return MessageOutcome.failed(source, ErrorKind.PROCESSING, e.getMessage());

        } catch (RuntimeException e) {
            log.error("Processing of {} crashed: {}", source, e.getMessage(), e);
            return MessageOutcome.failed(source, ErrorKind.PROCESSING, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Cancels messages not yet started.
     */
    public void cancel() {
        cancelled = true;
        int stopped = 0;
        synchronized (pending) {
            for (Task task : pending) {
                if (task.claim()) {
                    task.future.cancel(false);
                    stopped++;
                }
            }
        }
        log.warn("Batch cancelled, {} messages not started", stopped);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Submitted message, claimed once by either its worker or {@link #cancel()}.
     */
    private static class Task {
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private volatile Future<MessageOutcome> future;

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }
    }

    /**
     * Shuts down the pool.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
