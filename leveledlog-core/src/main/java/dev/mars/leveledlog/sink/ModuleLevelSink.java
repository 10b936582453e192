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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link LeveledSink} backed by a module-to-threshold table in front of another sink.
 * <p>
 * <b>Resolution:</b> the threshold for {@code a.b.c} is the first explicit entry found
 * among {@code a.b.c}, {@code a.b}, {@code a} and {@code ""}. When no entry exists at all,
 * every level is enabled and {@link #getLevel} reports {@link Level#DEBUG}.
 * <p>
 * <b>Thread Safety:</b>
 * The table is guarded by a read/write lock; lookups never block each other.
 */
public final class ModuleLevelSink implements LeveledSink, PrintingSink, CloseableSink {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleLevelSink.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Level> levels = new HashMap<>();
    private final Sink delegate;

    private ModuleLevelSink(Sink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Adds a module-level table in front of {@code sink}, unless it already is leveled.
     */
    public static LeveledSink wrap(Sink sink) {
        if (sink instanceof LeveledSink leveled) {
            return leveled;
        }
        return new ModuleLevelSink(sink);
    }

    /** The sink records are forwarded to. */
    public Sink delegate() {
        return delegate;
    }

    @Override
    public Level getLevel(String module) {
        return resolve(module).orElse(Level.DEBUG);
    }

    @Override
    public void setLevel(Level level, String module) {
        Objects.requireNonNull(level, "level");
        String key = module == null ? "" : module;
        lock.writeLock().lock();
        try {
            levels.put(key, level);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Threshold set: module='{}', level={}", key, level);
    }

    @Override
    public boolean isEnabledFor(Level level, String module) {
        return resolve(module)
                .map(level::isAtLeastAsSevereAs)
                .orElse(true);
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        delegate.log(level, calldepth + 1, record);
    }

    @Override
    public void print(Object... args) {
        if (!(delegate instanceof Printer printer)) {
            throw new UnsupportedOperationException("Sink does not support print: " + delegate);
        }
        printer.print(args);
    }

    @Override
    public void close() {
        if (delegate instanceof CloseableSink closeable) {
            closeable.close();
        }
    }

    /**
     * Longest-matching-prefix lookup over the dot-delimited segments of {@code module}.
     */
    private Optional<Level> resolve(String module) {
        String name = module == null ? "" : module;
        lock.readLock().lock();
        try {
            while (true) {
                Level level = levels.get(name);
                if (level != null) {
                    return Optional.of(level);
                }
                if (name.isEmpty()) {
                    return Optional.empty();
                }
                int dot = name.lastIndexOf('.');
                name = dot < 0 ? "" : name.substring(0, dot);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "ModuleLevelSink{" + delegate + '}';
    }
}
