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

/**
 * A {@link Sink} with a per-module threshold table.
 * <p>
 * Callers check {@link #isEnabledFor} before building and logging a record.
 */
public interface LeveledSink extends Sink {

    /**
     * Returns the effective threshold for a module.
     *
     * @param module dot-delimited module name; {@code ""} is the default entry
     */
    Level getLevel(String module);

    /**
     * Sets the threshold for a module; {@code ""} sets the default.
     */
    void setLevel(Level level, String module);

    /**
     * Returns true if a record at {@code level} for {@code module} should be emitted.
     */
    boolean isEnabledFor(Level level, String module);
}
