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

import java.util.List;

/**
 * Exception thrown when a sink fails to deliver, print or close.
 */
public class SinkException extends RuntimeException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Combines several failures into one exception; each failure is attached
     * as a suppressed exception.
     *
     * @param operation what was attempted, e.g. {@code "log record #12"}
     * @param total     how many sinks were attempted
     * @param failures  the failures, at least one
     */
    public static SinkException aggregate(String operation, int total, List<? extends RuntimeException> failures) {
        SinkException aggregated = new SinkException(
                failures.size() + " of " + total + " sinks failed to " + operation
                        + ": " + failures.get(0).getMessage());
        for (RuntimeException failure : failures) {
            aggregated.addSuppressed(failure);
        }
        return aggregated;
    }
}
