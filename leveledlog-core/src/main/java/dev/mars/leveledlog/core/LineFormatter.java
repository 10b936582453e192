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

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Default {@link Formatter}.
 * <p>
 * Layout: {@code <time> [<pid> ]<LEVL> [<module>]: <message>}, where {@code LEVL} is the
 * level name cut to four characters. With color enabled the line is wrapped in the
 * ANSI color of its level.
 *
 * <pre>
 * Formatter f = LineFormatter.builder()
 *     .timePattern("HH:mm:ss.SSS")
 *     .color(true)
 *     .build();
 * </pre>
 */
public final class LineFormatter implements Formatter {

    public static final String DEFAULT_TIME_PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";

    private static final String RESET = "\u001b[0m";

    private final DateTimeFormatter timeFormat;
    private final boolean color;
    private final boolean pid;

    private LineFormatter(Builder builder) {
        this.timeFormat = DateTimeFormatter.ofPattern(builder.timePattern).withZone(builder.zone);
        this.color = builder.color;
        this.pid = builder.pid;
    }

    /** Formatter with the default time pattern, no color and no pid. */
    public static LineFormatter standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void format(int calldepth, LogRecord record, StringBuilder out) {
        if (color) {
            out.append(colorOf(record.level()));
        }
        out.append(timeFormat.format(record.time())).append(' ');
        if (pid) {
            out.append(ProcessHandle.current().pid()).append(' ');
        }
        String name = record.level().name();
        out.append(name, 0, Math.min(4, name.length()))
                .append(" [").append(record.module()).append("]: ")
                .append(record.message());
        if (color) {
            out.append(RESET);
        }
    }

    private static String colorOf(Level level) {
        switch (level) {
            case CRITICAL:
                return "\u001b[35m";
            case ERROR:
                return "\u001b[31m";
            case WARNING:
                return "\u001b[33m";
            case NOTICE:
                return "\u001b[32m";
            case DEBUG:
                return "\u001b[36m";
            default:
                return "\u001b[37m";
        }
    }

    /**
     * Builder for {@link LineFormatter}.
     */
    public static final class Builder {
        private String timePattern = DEFAULT_TIME_PATTERN;
        private ZoneId zone = ZoneId.systemDefault();
        private boolean color;
        private boolean pid;

        private Builder() {
        }

        /** Sets the {@link DateTimeFormatter} pattern for the timestamp. */
        public Builder timePattern(String timePattern) {
            this.timePattern = timePattern;
            return this;
        }

        /** Sets the zone the timestamp is rendered in (default: system zone). */
        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        /** Wraps lines in ANSI level colors (default: false). */
        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        /** Adds the process id after the timestamp (default: false). */
        public Builder pid(boolean pid) {
            this.pid = pid;
            return this;
        }

        public LineFormatter build() {
            return new LineFormatter(this);
        }
    }
}
