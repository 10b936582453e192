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
import dev.mars.leveledlog.core.Messages;
import dev.mars.leveledlog.core.LogRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Test sink that keeps every record, print and close it receives.
 */
public class RecordingSink implements PrintingSink, CloseableSink {

    private final String name;
    private final List<LogRecord> records = Collections.synchronizedList(new ArrayList<>());
    private final List<Integer> calldepths = Collections.synchronizedList(new ArrayList<>());
    private final List<String> printed = Collections.synchronizedList(new ArrayList<>());
    private final List<String> trace;
    private volatile RuntimeException failure;
    private volatile int closeCount;

    public RecordingSink(String name) {
        this(name, null);
    }

    /**
     * @param trace shared list that receives {@code name} on every delivery, to check ordering
     */
    public RecordingSink(String name, List<String> trace) {
        this.name = name;
        this.trace = trace;
    }

    /** Makes every following call throw {@code failure}; null restores normal behavior. */
    public RecordingSink failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        if (trace != null) {
            trace.add(name);
        }
        if (failure != null) {
            throw failure;
        }
        records.add(record);
        calldepths.add(calldepth);
    }

    @Override
    public void print(Object... args) {
        if (failure != null) {
            throw failure;
        }
        printed.add(Messages.sprint(args));
    }

    @Override
    public void close() {
        closeCount++;
        if (failure != null) {
            throw failure;
        }
    }

    public List<LogRecord> records() {
        return List.copyOf(records);
    }

    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        for (LogRecord record : records()) {
            messages.add(record.message());
        }
        return messages;
    }

    public List<Integer> calldepths() {
        return List.copyOf(calldepths);
    }

    public List<String> printed() {
        return List.copyOf(printed);
    }

    public int closeCount() {
        return closeCount;
    }

    @Override
    public String toString() {
        return "RecordingSink{" + name + '}';
    }
}
