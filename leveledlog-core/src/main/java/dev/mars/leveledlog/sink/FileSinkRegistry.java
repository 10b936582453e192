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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystems;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identity cache for file sinks: at most one open sink per file.
 * <p>
 * The key is the absolute, normalized path. The first caller's {@link FileOptions}
 * decide how the file is opened; options passed by later callers for the same path
 * are ignored and the cached instance is returned.
 * <p>
 * <b>Thread Safety:</b>
 * Concurrent requests for the same path open the file exactly once. A failed open
 * leaves no entry behind, so a later request retries.
 */
public final class FileSinkRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FileSinkRegistry.class);

    private final Map<Path, DeliverySink> sinks = new ConcurrentHashMap<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private final Executor executor;

    /**
     * @param executor runs background deliveries of async file sinks
     */
    public FileSinkRegistry(Executor executor) {
        this.executor = executor;
    }

    public FileSinkRegistry() {
        this(DeliverySink.defaultExecutor());
    }

    /**
     * Returns the sink for {@code path}, opening the file if no sink exists yet.
     *
     * @param path    the log file
     * @param options how to open the file; ignored if a sink already exists
     * @return the process-wide sink instance for this file
     * @throws SinkException if the file cannot be opened
     */
    public DeliverySink acquire(Path path, FileOptions options) {
        Path key = path.toAbsolutePath().normalize();
        DeliverySink existing = sinks.get(key);
        if (existing != null) {
            LOG.debug("Reusing file sink: path={}", key);
            return existing;
        }
        try {
            return sinks.computeIfAbsent(key, p -> open(p, options));
        } catch (UncheckedIOException e) {
            LOG.error("Failed to open log file {}: {}", key, e.getCause().getMessage());
            throw new SinkException("Failed to open log file " + key, e.getCause());
        }
    }

    /**
     * Whether a sink for {@code path} is cached.
     */
    public boolean contains(Path path) {
        return sinks.containsKey(path.toAbsolutePath().normalize());
    }

    /**
     * Evicts and closes the sink for {@code path}. A later {@link #acquire} opens the
     * file again with that caller's options.
     *
     * @return true if a sink was cached for the path
     * @throws SinkException if the evicted sink fails to close
     */
    public boolean release(Path path) {
        Path key = path.toAbsolutePath().normalize();
        DeliverySink sink = sinks.remove(key);
        if (sink == null) {
            return false;
        }
        sink.close();
        LOG.debug("File sink released: path={}", key);
        return true;
    }

    /**
     * Number of files this registry has opened.
     */
    public int openCount() {
        return openCount.get();
    }

    /**
     * Number of cached sinks.
     */
    public int size() {
        return sinks.size();
    }

    /**
     * Closes every cached sink and empties the cache.
     *
     * @throws SinkException if any sink fails to close; all sinks are still attempted
     */
    public void closeAll() {
        List<RuntimeException> failures = new ArrayList<>();
        int total = 0;
        for (Path key : List.copyOf(sinks.keySet())) {
            DeliverySink sink = sinks.remove(key);
            if (sink == null) {
                continue;
            }
            total++;
            try {
                sink.close();
                LOG.debug("File sink closed: path={}", key);
            } catch (RuntimeException e) {
                LOG.warn("Error closing file sink {}: {}", key, e.getMessage());
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw SinkException.aggregate("close", total, failures);
        }
    }

    private DeliverySink open(Path path, FileOptions options) {
        FileOptions opts = options != null ? options : new FileOptions();
        Set<OpenOption> openOptions = new HashSet<>();
        openOptions.add(StandardOpenOption.CREATE);
        openOptions.add(StandardOpenOption.WRITE);
        openOptions.add(opts.isTruncate() ? StandardOpenOption.TRUNCATE_EXISTING : StandardOpenOption.APPEND);

        FileChannel channel;
        try {
            if (supportsPosix()) {
                Set<PosixFilePermission> perms = PosixFilePermissions.fromString(
                        opts.getPerm() != null ? opts.getPerm() : FileOptions.DEFAULT_PERM);
                channel = FileChannel.open(path, openOptions, PosixFilePermissions.asFileAttribute(perms));
            } else {
                channel = FileChannel.open(path, openOptions);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException(new IOException("Invalid permissions '" + opts.getPerm() + "'", e));
        }

        openCount.incrementAndGet();
        String name = "file:" + path;
        StreamSink writer = new StreamSink(name, Channels.newOutputStream(channel), true);
        LOG.info("File sink opened: path={}, options={}", path, opts);
        return new DeliverySink(name, writer, opts.isAsync(), executor);
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
