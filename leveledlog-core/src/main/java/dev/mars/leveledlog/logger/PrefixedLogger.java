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

import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.sink.LeveledSink;

import java.util.Objects;

/**
 * Decorates a {@link Logger} so that every message starts with a fixed prefix.
 * <pre>
 * Logger http = PrefixedLogger.of(context.logger("svc.api"), "[http]");
 * http.info("listening on", 8080);   // "[http] -> listening on 8080"
 * </pre>
 */
public final class PrefixedLogger implements Logger {

    public static final String DEFAULT_SEPARATOR = " ->";

    private final Logger parent;
    private final String prefix;

    private PrefixedLogger(Logger parent, String prefix) {
        this.parent = Objects.requireNonNull(parent, "parent");
        this.prefix = prefix;
    }

    /** Prefixes with {@code prefix} followed by {@value #DEFAULT_SEPARATOR}. */
    public static PrefixedLogger of(Logger parent, String prefix) {
        return of(parent, prefix, DEFAULT_SEPARATOR);
    }

    public static PrefixedLogger of(Logger parent, String prefix, String separator) {
        return new PrefixedLogger(parent, prefix.strip() + separator);
    }

    public Logger parent() {
        return parent;
    }

    /** The full prefix, separator included. */
    public String prefix() {
        return prefix;
    }

    private Object[] prefixed(Object[] args) {
        Object[] result = new Object[(args == null ? 0 : args.length) + 1];
        result[0] = prefix;
        if (args != null) {
            System.arraycopy(args, 0, result, 1, args.length);
        }
        return result;
    }

    private String prefixed(String format) {
        return prefix + " " + format;
    }

    @Override
    public String module() {
        return parent.module();
    }

    @Override
    public boolean isEnabledFor(Level level) {
        return parent.isEnabledFor(level);
    }

    @Override
    public void setSink(LeveledSink sink) {
        parent.setSink(sink);
    }

    @Override
    public LeveledSink sink() {
        return parent.sink();
    }

    @Override
    public void fatal(Object... args) {
        parent.fatal(prefixed(args));
    }

    @Override
    public void fatalf(String format, Object... args) {
        parent.fatalf(prefixed(format), args);
    }

    @Override
    public void panic(Object... args) {
        parent.panic(prefixed(args));
    }

    @Override
    public void panicf(String format, Object... args) {
        parent.panicf(prefixed(format), args);
    }

    @Override
    public void critical(Object... args) {
        parent.critical(prefixed(args));
    }

    @Override
    public void criticalf(String format, Object... args) {
        parent.criticalf(prefixed(format), args);
    }

    @Override
    public void error(Object... args) {
        parent.error(prefixed(args));
    }

    @Override
    public void errorf(String format, Object... args) {
        parent.errorf(prefixed(format), args);
    }

    @Override
    public void warning(Object... args) {
        parent.warning(prefixed(args));
    }

    @Override
    public void warningf(String format, Object... args) {
        parent.warningf(prefixed(format), args);
    }

    @Override
    public void notice(Object... args) {
        parent.notice(prefixed(args));
    }

    @Override
    public void noticef(String format, Object... args) {
        parent.noticef(prefixed(format), args);
    }

    @Override
    public void info(Object... args) {
        parent.info(prefixed(args));
    }

    @Override
    public void infof(String format, Object... args) {
        parent.infof(prefixed(format), args);
    }

    @Override
    public void debug(Object... args) {
        parent.debug(prefixed(args));
    }

    @Override
    public void debugf(String format, Object... args) {
        parent.debugf(prefixed(format), args);
    }
}
