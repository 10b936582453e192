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

/**
 * A destination for log records.
 * <p>
 * The core only ever calls {@link #log}, {@link Printer#print} and
 * {@link CloseableSink#close}; it never inspects sink internals.
 */
@FunctionalInterface
public interface Sink {

    /**
     * Delivers a record.
     *
     * @param level     the level the record is emitted at
     * @param calldepth stack-depth hint, incremented by each wrapping layer
     * @param record    the record to deliver
     * @throws SinkException if delivery fails
     */
    void log(Level level, int calldepth, LogRecord record);
}
