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

import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.LogRecord;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Late-bound {@link LeveledSink}: every call goes to whatever sink the accessor
 * returns at that moment.
 * <p>
 * Lets a logger bound early follow later replacement of a context's default sink.
 */
public final class LeveledSinkProxy implements LeveledSink {

    private final Supplier<? extends LeveledSink> current;

    public LeveledSinkProxy(Supplier<? extends LeveledSink> current) {
        this.current = Objects.requireNonNull(current, "current");
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        current.get().log(level, calldepth, record);
    }

    @Override
    public Level getLevel(String module) {
        return current.get().getLevel(module);
    }

    @Override
    public void setLevel(Level level, String module) {
        current.get().setLevel(level, module);
    }

    @Override
    public boolean isEnabledFor(Level level, String module) {
        return current.get().isEnabledFor(level, module);
    }
}
