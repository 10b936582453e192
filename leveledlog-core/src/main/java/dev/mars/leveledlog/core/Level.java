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
 * Severity of a log record.
 * <p>
 * Constants are declared from most to least severe, so a lower ordinal means
 * a more severe level: {@code CRITICAL > ERROR > WARNING > NOTICE > INFO > DEBUG}.
 */
public enum Level {
    CRITICAL,
    ERROR,
    WARNING,
    NOTICE,
    INFO,
    DEBUG;

    /**
     * Returns true if this level passes a module configured at {@code threshold},
     * i.e. this level is at least as severe as the threshold.
     *
     * @param threshold the configured minimum severity
     * @return true if a record at this level should be emitted
     */
    public boolean isAtLeastAsSevereAs(Level threshold) {
        return ordinal() <= threshold.ordinal();
    }

    /**
     * Returns the more verbose (less severe) of the two levels.
     */
    public static Level mostVerbose(Level a, Level b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
