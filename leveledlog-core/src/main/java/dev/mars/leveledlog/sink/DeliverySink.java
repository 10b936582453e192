/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.leveledlog.sink;

import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adds a synchronous or asynchronous delivery mode to any sink.
 * <p>
 * <b>Synchronous:</b> {@code log} and {@code print} run the delegate on the caller's
 * thread and propagate its failures.
 * <p>
 * <b>Asynchronous:</b> the call takes a private snapshot of the record (or a copy of
 * the arguments), submits one fire-and-forget task and returns at once without error.
 * Tasks are never awaited or cancelled, so deliveries to the same sink carry no
 * ordering guarantee and may still be running at process exit. A failing task is
 * reported on the {@value #DIAGNOSTICS_LOGGER} logger; it never reaches the caller.
 */
public final class DeliverySink implements PrintingSink, CloseableSink {

    /** SLF4J logger receiving failures of background deliveries. */
    public static final String DIAGNOSTICS_LOGGER = "dev.mars.leveledlog.diagnostics";

    private static final Logger DIAGNOSTICS = LoggerFactory.getLogger(DIAGNOSTICS_LOGGER);

    private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(new DaemonThreadFactory());

    private final String name;
    private final Sink delegate;
    private final boolean async;
    private final Executor executor;

    /**
     * @param name     label used in diagnostics, e.g. {@code file:/var/log/app.log}
     * @param delegate the sink doing the actual I/O
     * @param async    whether deliveries run in the background
     * @param executor runs background deliveries
     */
    public DeliverySink(String name, Sink delegate, boolean async, Executor executor) {
        this.name = Objects.requireNonNull(name, "name");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.async = async;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public DeliverySink(String name, Sink delegate, boolean async) {
        this(name, delegate, async, DEFAULT_EXECUTOR);
    }

    /**
     * Shared pool of daemon threads used when no executor is given.
     */
    public static Executor defaultExecutor() {
        return DEFAULT_EXECUTOR;
    }

    public String name() {
        return name;
    }

    public boolean isAsync() {
        return async;
    }

    public Sink delegate() {
        return delegate;
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        if (!async) {
            delegate.log(level, calldepth, record);
            return;
        }
        LogRecord snapshot = record.snapshot();
        submit(() -> delegate.log(level, calldepth, snapshot), "log record #" + record.id());
    }

    @Override
    public void print(Object... args) {
        if (!(delegate instanceof Printer printer)) {
            throw new UnsupportedOperationException("Sink does not support print: " + name);
        }
        if (!async) {
            printer.print(args);
            return;
        }
        Object[] copy = args.clone();
        submit(() -> printer.print(copy), "print");
    }

    private void submit(Runnable delivery, String operation) {
        try {
            executor.execute(() -> {
                try {
                    delivery.run();
                } catch (RuntimeException e) {
                    DIAGNOSTICS.error("Async delivery to {} failed ({}): {}", name, operation, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            DIAGNOSTICS.error("Async delivery to {} rejected ({}): {}", name, operation, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (delegate instanceof CloseableSink closeable) {
            closeable.close();
        }
    }

    @Override
    public String toString() {
        return "DeliverySink{" + name + (async ? ", async" : ", sync") + '}';
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "leveledlog-async-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
