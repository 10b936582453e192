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

import java.util.Map;

/**
 * One configured sink: a destination, an optional threshold and free-form options.
 * <p>
 * {@code dst} is an {@code http:}/{@code https:} URL, {@code -} or {@code _} for the
 * default sink, or a file path.
 */
public record SinkSpec(String dst, String level, Map<String, Object> options) {

    public SinkSpec {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static SinkSpec of(String dst) {
        return new SinkSpec(dst, null, null);
    }
}
