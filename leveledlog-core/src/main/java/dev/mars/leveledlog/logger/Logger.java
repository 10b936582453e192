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
import dev.mars.leveledlog.sink.LeveledSink;

/**
 * Creates log records for one module and passes them to a {@link LeveledSink}.
 * <p>
 * Plain variants join their arguments with spaces; {@code ...f} variants apply a
 * {@link String#format(String, Object...)} pattern.
 */
public interface Logger {

    /** The module records are created for. */
    String module();

    /** Returns true if a record at {@code level} would be emitted. */
    boolean isEnabledFor(Level level);

    /** Overrides the context's default sink for this logger. */
    void setSink(LeveledSink sink);

    /** The sink set with {@link #setSink}, or null when the context default applies. */
    LeveledSink sink();

    /** Logs at CRITICAL, then terminates the process with status 1. */
    void fatal(Object... args);

    void fatalf(String format, Object... args);

    /** Logs at CRITICAL, then throws {@link LogPanicException} with the rendered message. */
    void panic(Object... args);

    void panicf(String format, Object... args);

    void critical(Object... args);

    void criticalf(String format, Object... args);

    void error(Object... args);

    void errorf(String format, Object... args);

    void warning(Object... args);

    void warningf(String format, Object... args);

    void notice(Object... args);

    void noticef(String format, Object... args);

    void info(Object... args);

    void infof(String format, Object... args);

    void debug(Object... args);

    void debugf(String format, Object... args);
}
