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
package dev.mars.leveledlog.logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Loggers by module name. Get-or-create is atomic per module.
 */
public final class LoggerRegistry {

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private final Function<String, Logger> factory;

    public LoggerRegistry(Function<String, Logger> factory) {
        this.factory = factory;
    }

    /**
     * Returns the logger registered for {@code module}, if any.
     */
    public Optional<Logger> get(String module) {
        return Optional.ofNullable(loggers.get(module));
    }

    /**
     * Returns the logger for {@code module}, creating and registering it on first use.
     */
    public Logger getOrCreate(String module) {
        return loggers.computeIfAbsent(module, factory);
    }

    public int size() {
        return loggers.size();
    }
}
