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

import java.time.Instant;

/**
 * Fully evaluated, immutable projection of a {@link LogRecord}.
 * <p>
 * Handed to sinks that need a stable value, e.g. for JSON encoding.
 *
 * @param id      the record's sequence number
 * @param time    capture time
 * @param module  dot-delimited module name
 * @param level   the level the record was emitted at
 * @param message the rendered (redacted) message
 */
public record RecordData(long id, Instant time, String module, Level level, String message) {
}
