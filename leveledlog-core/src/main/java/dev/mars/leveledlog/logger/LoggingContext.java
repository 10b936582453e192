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
package dev.mars.leveledlog.logger;

import dev.mars.leveledlog.core.Formatter;
import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.LineFormatter;
import dev.mars.leveledlog.core.LogRecord;
import dev.mars.leveledlog.sink.CloseableSink;
import dev.mars.leveledlog.sink.DeliverySink;
import dev.mars.leveledlog.sink.FileSinkRegistry;
import dev.mars.leveledlog.sink.LeveledSink;
import dev.mars.leveledlog.sink.LeveledSinkProxy;
import dev.mars.leveledlog.sink.ModuleLevelSink;
import dev.mars.leveledlog.sink.MultiSink;
import dev.mars.leveledlog.sink.Sink;
import dev.mars.leveledlog.sink.SinkException;
import dev.mars.leveledlog.sink.StreamSink;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.IntConsumer;

/**
 * The logging state of one process, created and owned by its entry point.
 * <p>
 * Holds the current default {@link LeveledSink}, the default {@link Formatter},
 * the registry of loggers, the file sink identity cache, the executor for
 * background deliveries and the exit handler used by {@link Logger#fatal}.
 * <pre>
 * LoggingContext context = LoggingContext.builder()
 *     .defaultLevel(Level.INFO)
 *     .moduleLevel("svc.api", Level.WARNING)
 *     .build();
 * Logger log = context.logger("svc.api.http");
 * log.error("request failed:", cause);
 * </pre>
 * A process should own a single context. File sinks are cached per
 * {@link FileSinkRegistry}, so two contexts with their own caches would each open
 * the same file. Contexts that must coexist share one cache through
 * {@link Builder#fileSinks(FileSinkRegistry)}.
 */
public final class LoggingContext implements Closeable {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingContext.class);

    private final LoggerRegistry loggers;
    private final FileSinkRegistry fileSinks;
    private final boolean ownsFileSinks;
    private final Executor executor;
    private final IntConsumer exitHandler;
    private final Formatter initialFormatter;
    private final Level initialLevel;

    private volatile LeveledSink sink;
    private volatile Formatter formatter;

    private LoggingContext(Builder builder) {
        this.executor = builder.executor;
        this.exitHandler = builder.exitHandler;
        this.initialFormatter = builder.formatter;
        this.initialLevel = builder.defaultLevel;
        this.formatter = builder.formatter;
        this.ownsFileSinks = builder.fileSinks == null;
        this.fileSinks = ownsFileSinks ? new FileSinkRegistry(builder.executor) : builder.fileSinks;
        this.loggers = new LoggerRegistry(module -> new ModuleLogger(module, this));

        List<Sink> sinks = builder.sinks.isEmpty() ? List.of(StreamSink.stderr()) : builder.sinks;
        setSinks(sinks);
        sink.setLevel(builder.defaultLevel, "");
        builder.moduleLevels.forEach((module, level) -> sink.setLevel(level, module));

        LOG.info("Logging context initialized: sinks={}, defaultLevel={}, moduleLevels={}",
                sinks.size(), builder.defaultLevel, builder.moduleLevels);
    }

    /** Context logging to stderr with default level DEBUG. */
    public static LoggingContext create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Default sink
    // ========================================================================

    /**
     * Replaces the default sink. A single sink gets a module-level table of its own;
     * several sinks are combined in a {@link MultiSink}.
     * The new sink starts with an empty threshold table.
     *
     * @return the new default sink
     */
    public LeveledSink setSinks(List<? extends Sink> sinks) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("At least one sink is required");
        }
        LeveledSink leveled = sinks.size() == 1
                ? ModuleLevelSink.wrap(sinks.get(0))
                : new MultiSink(sinks);
        this.sink = leveled;
        LOG.debug("Default sink replaced: {}", leveled);
        return leveled;
    }

    public LeveledSink setSinks(Sink... sinks) {
        return setSinks(List.of(sinks));
    }

    /** The current default sink. */
    public LeveledSink sink() {
        return sink;
    }

    /**
     * Returns a sink that forwards every call to whatever the default sink is at
     * that moment, following later {@link #setSinks} calls.
     */
    public LeveledSink sinkProxy() {
        return new LeveledSinkProxy(this::sink);
    }

    public void setLevel(Level level, String module) {
        sink.setLevel(level, module);
    }

    public Level getLevel(String module) {
        return sink.getLevel(module);
    }

    public boolean isEnabledFor(Level level, String module) {
        return sink.isEnabledFor(level, module);
    }

    // ========================================================================
    // Loggers and formatting
    // ========================================================================

    /** Returns the logger for {@code module}, creating it on first use. */
    public Logger logger(String module) {
        return loggers.getOrCreate(module);
    }

    public LoggerRegistry loggers() {
        return loggers;
    }

    public Formatter formatter() {
        return formatter;
    }

    /** Sets the formatter used by records created from now on. */
    public void setFormatter(Formatter formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public FileSinkRegistry fileSinks() {
        return fileSinks;
    }

    public Executor executor() {
        return executor;
    }

    /** Hands {@code status} to the exit handler (default {@link System#exit}). */
    public void exit(int status) {
        LOG.debug("Exit requested with status {}", status);
        exitHandler.accept(status);
    }

    /**
     * Restores the initial state: stderr sink, initial default level and formatter,
     * system clock and a sequence counter starting at zero.
     */
    public void reset() {
        LogRecord.resetState();
        setSinks(StreamSink.stderr());
        sink.setLevel(initialLevel, "");
        formatter = initialFormatter;
        LOG.debug("Logging context reset");
    }

    /**
     * Closes the default sink if it owns resources, then every cached file sink
     * unless the file sink cache was handed in through the builder.
     */
    @Override
    public void close() {
        LeveledSink current = sink;
        if (current instanceof CloseableSink closeable) {
            try {
                closeable.close();
            } catch (SinkException e) {
                LOG.warn("Error closing default sink: {}", e.getMessage());
            }
        }
        if (ownsFileSinks) {
            fileSinks.closeAll();
        }
        LOG.info("Logging context closed");
    }

    /**
     * Builder for {@link LoggingContext}.
     */
    public static final class Builder {
        private final List<Sink> sinks = new ArrayList<>();
        private final Map<String, Level> moduleLevels = new LinkedHashMap<>();
        private Level defaultLevel = Level.DEBUG;
        private Formatter formatter = LineFormatter.standard();
        private Executor executor = DeliverySink.defaultExecutor();
        private IntConsumer exitHandler = System::exit;
        private FileSinkRegistry fileSinks;

        private Builder() {
        }

        /** Adds a default sink (default: stderr when none is added). */
        public Builder sink(Sink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        /** Sets the threshold of the {@code ""} entry (default: DEBUG). */
        public Builder defaultLevel(Level level) {
            this.defaultLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        /** Sets the threshold for one module. */
        public Builder moduleLevel(String module, Level level) {
            this.moduleLevels.put(module, Objects.requireNonNull(level, "level"));
            return this;
        }

        public Builder formatter(Formatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        /** Sets the executor for background deliveries (default: shared daemon pool). */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /** Sets what {@link Logger#fatal} calls after logging (default: {@link System#exit}). */
        public Builder exitHandler(IntConsumer exitHandler) {
            this.exitHandler = Objects.requireNonNull(exitHandler, "exitHandler");
            return this;
        }

        /**
         * Uses a file sink cache shared with other contexts (default: a cache of this
         * context's own). The caller owns it and closes it with {@link FileSinkRegistry#closeAll()}.
         */
        public Builder fileSinks(FileSinkRegistry fileSinks) {
            this.fileSinks = Objects.requireNonNull(fileSinks, "fileSinks");
            return this;
        }

        public LoggingContext build() {
            return new LoggingContext(this);
        }
    }
}
