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
package dev.mars.leveledlog.core;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One log event.
 * <p>
 * A record carries two lazily computed, memoized views: the {@linkplain #message() message}
 * and the {@linkplain #formatted(int) formatted line}. Both caches are plain fields.
 * <p>
 * <b>Thread Safety:</b>
 * A record instance must not be materialized from more than one thread. Every delivery
 * path that may run concurrently with another works on its own {@link #snapshot()},
 * which owns a private copy of the argument array and its own caches.
 */
public final class LogRecord {

    /** Process-wide sequence; every record created through any logger draws from it. */
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private static volatile Clock clock = Clock.systemDefaultZone();

    private final long id;
    private final Instant time;
    private final String module;
    private final Level level;
    private final String format;
    private final Formatter formatter;
    private final Object[] args;

    private String message;
    private String formatted;

    private LogRecord(long id, Instant time, String module, Level level, String format,
                   Formatter formatter, Object[] args, String message, String formatted) {
        this.id = id;
        this.time = time;
        this.module = module;
        this.level = level;
        this.format = format;
        this.formatter = formatter;
        this.args = args;
        this.message = message;
        this.formatted = formatted;
    }

    /**
     * Creates a record with the next sequence id, stamped with the current clock.
     * The argument array is kept by reference.
     *
     * @param module    dot-delimited module name
     * @param level     the level the record is emitted at
     * @param format    format string, or null to join the arguments with spaces
     * @param formatter renders {@link #formatted(int)}
     * @param args      the log arguments
     * @return the new record
     */
    public static LogRecord create(String module, Level level, String format, Formatter formatter, Object... args) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(formatter, "formatter");
        return new LogRecord(
                SEQUENCE.incrementAndGet(),
                clock.instant(),
                module == null ? "" : module,
                level,
                format,
                formatter,
                args == null ? new Object[0] : args,
                null,
                null);
    }

    /**
     * Replaces the clock used to stamp new records.
     */
    public static void useClock(Clock newClock) {
        clock = Objects.requireNonNull(newClock, "clock");
    }

    /**
     * Restores the system clock and resets the sequence counter to zero.
     * Only meant for a full state reset between tests.
     */
    public static void resetState() {
        SEQUENCE.set(0);
        clock = Clock.systemDefaultZone();
    }

    public long id() {
        return id;
    }

    public Instant time() {
        return time;
    }

    public String module() {
        return module;
    }

    public Level level() {
        return level;
    }

    public Optional<String> format() {
        return Optional.ofNullable(format);
    }

    public Formatter formatter() {
        return formatter;
    }

    /**
     * Read-only view of the arguments. After the message has been rendered,
     * redactable arguments appear in their redacted form.
     */
    public List<Object> args() {
        return Collections.unmodifiableList(Arrays.asList(args));
    }

    /**
     * Returns the message, rendering it on first call.
     * <p>
     * On first call every {@link Redactable} argument is replaced in place by its
     * redacted form, then the message is rendered from the format string, or from the
     * space-joined arguments when there is none.
     */
    public String message() {
        if (message == null) {
            for (int i = 0; i < args.length; i++) {
                if (args[i] instanceof Redactable redactable) {
                    args[i] = redactable.redacted();
                }
            }
            message = format != null
                    ? Messages.format(format, args)
                    : Messages.joinWithSpaces(args);
        }
        return message;
    }

    /**
     * Returns the formatted log line, rendering it on first call.
     *
     * @param calldepth stack-depth hint handed to the formatter
     */
    public String formatted(int calldepth) {
        if (formatted == null) {
            StringBuilder out = new StringBuilder(64);
            formatter.format(calldepth + 1, this, out);
            formatted = out.toString();
        }
        return formatted;
    }

    /**
     * Finalizes the message and returns the immutable projection of this record.
     */
    public RecordData data() {
        return new RecordData(id, time, module, level, message());
    }

    /**
     * Returns an independent copy for a separate delivery path.
     * <p>
     * The copy shares the identity fields, owns a copy of the argument array and
     * starts with whatever this record has already materialized.
     */
    public LogRecord snapshot() {
        return new LogRecord(id, time, module, level, format, formatter, args.clone(), message, formatted);
    }

    /**
     * Returns a snapshot that renders its formatted line with {@code newFormatter}.
     * The message cache is kept, the formatted cache is not.
     */
    public LogRecord withFormatter(Formatter newFormatter) {
        Objects.requireNonNull(newFormatter, "formatter");
        return new LogRecord(id, time, module, level, format, newFormatter, args.clone(), message, null);
    }

    @Override
    public String toString() {
        return "LogRecord{" +
                "id=" + id +
                ", time=" + time +
                ", module='" + module + '\'' +
                ", level=" + level +
                '}';
    }
}
