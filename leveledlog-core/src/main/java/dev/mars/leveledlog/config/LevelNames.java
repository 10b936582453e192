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

import dev.mars.leveledlog.core.Level;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Textual level names accepted in configuration: full names and one-letter aliases,
 * case-insensitive.
 */
public final class LevelNames {

    private static final Map<String, Level> NAMES = Map.ofEntries(
            Map.entry("CRITICAL", Level.CRITICAL),
            Map.entry("C", Level.CRITICAL),
            Map.entry("ERROR", Level.ERROR),
            Map.entry("E", Level.ERROR),
            Map.entry("WARNING", Level.WARNING),
            Map.entry("W", Level.WARNING),
            Map.entry("NOTICE", Level.NOTICE),
            Map.entry("N", Level.NOTICE),
            Map.entry("INFO", Level.INFO),
            Map.entry("I", Level.INFO),
            Map.entry("DEBUG", Level.DEBUG),
            Map.entry("D", Level.DEBUG)
    );

    private LevelNames() {
    }

    /**
     * Looks up a level name or alias.
     */
    public static Optional<Level> lookup(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(NAMES.get(text.strip().toUpperCase(Locale.ROOT)));
    }

    /**
     * Parses a level name or alias, returning {@code fallback} for blank or unknown text.
     */
    public static Level parse(String text, Level fallback) {
        return lookup(text).orElse(fallback);
    }
}
