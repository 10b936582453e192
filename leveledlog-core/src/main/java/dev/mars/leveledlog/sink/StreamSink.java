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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes one formatted line per record to an {@link OutputStream}.
 * <p>
 * <b>Thread Safety:</b>
 * Writes are serialized on the sink, so records reach the stream in the order
 * their {@code log} calls acquired it.
 */
public final class StreamSink implements PrintingSink, CloseableSink {

    private final String name;
    private final OutputStream out;
    private final boolean ownsStream;
    private boolean closed;

    /**
     * @param name       label used in error messages, e.g. {@code file:/var/log/app.log}
     * @param out        the stream to write to
     * @param ownsStream whether {@link #close()} closes {@code out}
     */
    public StreamSink(String name, OutputStream out, boolean ownsStream) {
        this.name = Objects.requireNonNull(name, "name");
        this.out = Objects.requireNonNull(out, "out");
        this.ownsStream = ownsStream;
    }

    /** Sink on {@code System.err}; closing it leaves stderr open. */
    public static StreamSink stderr() {
        return new StreamSink("stderr", System.err, false);
    }

    public String name() {
        return name;
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        writeLine(record.formatted(calldepth + 1));
    }

    @Override
    public void print(Object... args) {
        writeLine(Messages.sprint(args));
    }

    private synchronized void writeLine(String line) {
        if (closed) {
            throw new SinkException("Sink " + name + " is closed");
        }
        try {
            out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new SinkException("Failed to write to " + name, e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!ownsStream) {
            return;
        }
        try {
            out.close();
        } catch (IOException e) {
            throw new SinkException("Failed to close " + name, e);
        }
    }

    @Override
    public String toString() {
        return "StreamSink{" + name + '}';
    }
}
