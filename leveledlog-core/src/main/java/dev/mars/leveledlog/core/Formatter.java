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

/**
 * Renders a complete log line for a {@link LogRecord}.
 * <p>
 * Called at most once per record instance, from {@link LogRecord#formatted(int)}.
 */
@FunctionalInterface
public interface Formatter {

    /**
     * Appends the rendered line (without trailing newline) to {@code out}.
     *
     * @param calldepth stack-depth hint for source-location attribution
     * @param record    the record to render
     * @param out       the buffer receiving the line
     */
    void format(int calldepth, LogRecord record, StringBuilder out);
}
