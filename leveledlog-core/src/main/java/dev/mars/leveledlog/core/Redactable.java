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
 * A log argument carrying sensitive data (passwords, tokens).
 * <p>
 * When a {@link LogRecord} renders its message, every argument implementing this
 * interface is replaced by {@link #redacted()} before formatting, so the raw
 * value never reaches a sink.
 *
 * @see Redaction#mask(String)
 */
@FunctionalInterface
public interface Redactable {

    /**
     * @return the value to render in place of this argument
     */
    Object redacted();
}
