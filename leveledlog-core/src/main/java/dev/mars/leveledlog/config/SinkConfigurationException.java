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
package dev.mars.leveledlog.config;

import dev.mars.leveledlog.sink.SinkException;

/**
 * Exception thrown when a configured sink cannot be decoded, parsed or opened.
 */
public class SinkConfigurationException extends SinkException {

    public SinkConfigurationException(String message) {
        super(message);
    }

    public SinkConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    static SinkConfigurationException forSink(int index, String dst, String problem, Throwable cause) {
        return new SinkConfigurationException("Sink #" + index + " '" + dst + "': " + problem, cause);
    }
}
