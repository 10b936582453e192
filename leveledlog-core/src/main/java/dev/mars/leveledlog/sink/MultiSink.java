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

import java.util.ArrayList;
import java.util.List;

/**
 * Fans one record out to several sinks.
 * <p>
 * Each constituent gets its own module-level table (see {@link ModuleLevelSink#wrap}),
 * so thresholds can differ per destination. Sinks are called in construction order,
 * on the caller's thread, and each one receives its own {@link LogRecord#snapshot()}.
 * <p>
 * <b>Error policy:</b> a failing sink never stops delivery to the sinks after it;
 * all failures are collected and thrown together once every sink has been tried.
 */
public final class MultiSink implements LeveledSink, PrintingSink, CloseableSink {

    private final List<Sink> sinks;
    private final List<LeveledSink> leveled;

    /**
     * @param sinks the destinations, at least one, in delivery order
     */
    public MultiSink(List<? extends Sink> sinks) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("MultiSink needs at least one sink");
        }
        this.sinks = List.copyOf(sinks);
        List<LeveledSink> wrapped = new ArrayList<>(sinks.size());
        for (Sink sink : this.sinks) {
            wrapped.add(ModuleLevelSink.wrap(sink));
        }
        this.leveled = List.copyOf(wrapped);
    }

    public MultiSink(Sink... sinks) {
        this(List.of(sinks));
    }

    /** The constituents, each behind its own threshold table. */
    public List<LeveledSink> sinks() {
        return leveled;
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        List<RuntimeException> failures = new ArrayList<>();
        for (LeveledSink sink : leveled) {
            if (!sink.isEnabledFor(level, record.module())) {
                continue;
            }
            try {
                sink.log(level, calldepth + 1, record.snapshot());
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw SinkException.aggregate("log record #" + record.id(), leveled.size(), failures);
        }
    }

    /**
     * Prints to every constituent that supports printing.
     */
    @Override
    public void print(Object... args) {
        List<RuntimeException> failures = new ArrayList<>();
        int attempted = 0;
        for (Sink sink : sinks) {
            if (sink instanceof Printer printer) {
                attempted++;
                try {
                    printer.print(args.clone());
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            }
        }
        if (!failures.isEmpty()) {
            throw SinkException.aggregate("print", attempted, failures);
        }
    }

    /**
     * Returns the most verbose threshold among the constituents.
     */
    @Override
    public Level getLevel(String module) {
        Level result = Level.CRITICAL;
        for (LeveledSink sink : leveled) {
            result = Level.mostVerbose(result, sink.getLevel(module));
        }
        return result;
    }

    /**
     * Applies the threshold to every constituent.
     */
    @Override
    public void setLevel(Level level, String module) {
        for (LeveledSink sink : leveled) {
            sink.setLevel(level, module);
        }
    }

    /**
     * Returns true if at least one constituent is enabled.
     */
    @Override
    public boolean isEnabledFor(Level level, String module) {
        for (LeveledSink sink : leveled) {
            if (sink.isEnabledFor(level, module)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        List<RuntimeException> failures = new ArrayList<>();
        int attempted = 0;
        for (Sink sink : sinks) {
            if (sink instanceof CloseableSink closeable) {
                attempted++;
                try {
                    closeable.close();
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            }
        }
        if (!failures.isEmpty()) {
            throw SinkException.aggregate("close", attempted, failures);
        }
    }

    @Override
    public String toString() {
        return "MultiSink" + sinks;
    }
}
