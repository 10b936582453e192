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

import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.Messages;
import dev.mars.leveledlog.core.LogRecord;
import dev.mars.leveledlog.core.Redaction;
import dev.mars.leveledlog.sink.DeliverySink;
import dev.mars.leveledlog.sink.LeveledSink;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link Logger} bound to a module of a {@link LoggingContext}.
 * <p>
 * Records go to the sink set with {@link #setSink}, or else to the context's
 * default sink at the time of the call. A runtime exception thrown by the sink is
 * reported on the diagnostics logger and never reaches the caller; only
 * {@link #panic} throws, with {@link LogPanicException}.
 */
public final class ModuleLogger implements Logger {

    private static final org.slf4j.Logger DIAGNOSTICS = LoggerFactory.getLogger(DeliverySink.DIAGNOSTICS_LOGGER);

    /** Brings the call depth up to the caller of the level methods. */
    private static final int BASE_CALLDEPTH = 2;

    private final String module;
    private final LoggingContext context;
    private volatile LeveledSink sink;
    private volatile int extraCalldepth;

    public ModuleLogger(String module, LoggingContext context) {
        this.module = module == null ? "" : module;
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public String module() {
        return module;
    }

    /**
     * Adds call depth for wrappers that expose these methods one level up.
     */
    public void setExtraCalldepth(int extraCalldepth) {
        this.extraCalldepth = extraCalldepth;
    }

    @Override
    public void setSink(LeveledSink sink) {
        this.sink = sink;
    }

    @Override
    public LeveledSink sink() {
        return sink;
    }

    @Override
    public boolean isEnabledFor(Level level) {
        return effectiveSink().isEnabledFor(level, module);
    }

    private LeveledSink effectiveSink() {
        LeveledSink own = sink;
        return own != null ? own : context.sink();
    }

    private void log(Level level, String format, Object... args) {
        LeveledSink target = effectiveSink();
        if (!target.isEnabledFor(level, module)) {
            return;
        }
        LogRecord record = LogRecord.create(module, level, format, context.formatter(), args);
        try {
            target.log(level, BASE_CALLDEPTH + extraCalldepth, record);
        } catch (RuntimeException e) {
            DIAGNOSTICS.error("Delivery of record #{} for module '{}' failed: {}",
                    record.id(), module, e.getMessage(), e);
        }
    }

    @Override
    public void fatal(Object... args) {
        log(Level.CRITICAL, null, args);
        context.exit(1);
    }

    @Override
    public void fatalf(String format, Object... args) {
        log(Level.CRITICAL, format, args);
        context.exit(1);
    }

    @Override
    public void panic(Object... args) {
        log(Level.CRITICAL, null, args);
        throw new LogPanicException(Messages.sprint(Redaction.redactAll(args)));
    }

    @Override
    public void panicf(String format, Object... args) {
        log(Level.CRITICAL, format, args);
        throw new LogPanicException(Messages.format(format, Redaction.redactAll(args)));
    }

    @Override
    public void critical(Object... args) {
        log(Level.CRITICAL, null, args);
    }

    @Override
    public void criticalf(String format, Object... args) {
        log(Level.CRITICAL, format, args);
    }

    @Override
    public void error(Object... args) {
        log(Level.ERROR, null, args);
    }

    @Override
    public void errorf(String format, Object... args) {
        log(Level.ERROR, format, args);
    }

    @Override
    public void warning(Object... args) {
        log(Level.WARNING, null, args);
    }

    @Override
    public void warningf(String format, Object... args) {
        log(Level.WARNING, format, args);
    }

    @Override
    public void notice(Object... args) {
        log(Level.NOTICE, null, args);
    }

    @Override
    public void noticef(String format, Object... args) {
        log(Level.NOTICE, format, args);
    }

    @Override
    public void info(Object... args) {
        log(Level.INFO, null, args);
    }

    @Override
    public void infof(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    @Override
    public void debug(Object... args) {
        log(Level.DEBUG, null, args);
    }

    @Override
    public void debugf(String format, Object... args) {
        log(Level.DEBUG, format, args);
    }

    @Override
    public String toString() {
        return "ModuleLogger{" + module + '}';
    }
}
