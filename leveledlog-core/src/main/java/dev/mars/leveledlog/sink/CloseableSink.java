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

import java.io.Closeable;

/**
 * A {@link Sink} that owns a releasable resource (file handle, HTTP client).
 */
public interface CloseableSink extends Sink, Closeable {

    /**
     * Releases the resource. Idempotent.
     *
     * @throws SinkException if the resource cannot be released
     */
    @Override
    void close();
}
