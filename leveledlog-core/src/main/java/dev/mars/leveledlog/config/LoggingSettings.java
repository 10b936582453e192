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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Declarative logging setup: a default threshold plus per-module entries.
 * <pre>
 * {
 *   "level": "INFO",
 *   "modules": [
 *     { "name": "svc.api", "level": "W",
 *       "sinks": [ { "dst": "/var/log/api.log", "options": { "truncate": true } } ] }
 *   ]
 * }
 * </pre>
 */
public record LoggingSettings(String level, List<ModuleSpec> modules) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public LoggingSettings {
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    /**
     * Reads settings from a JSON document.
     *
     * @throws SinkConfigurationException if the document cannot be decoded
     */
    public static LoggingSettings fromJson(String json) {
        try {
            return MAPPER.readValue(json, LoggingSettings.class);
        } catch (JsonProcessingException e) {
            throw new SinkConfigurationException("Invalid logging settings: " + e.getOriginalMessage(), e);
        }
    }
}
