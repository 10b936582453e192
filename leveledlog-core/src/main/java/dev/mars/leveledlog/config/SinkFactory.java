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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.LogRecord;
import dev.mars.leveledlog.logger.LoggingContext;
import dev.mars.leveledlog.sink.CloseableSink;
import dev.mars.leveledlog.sink.DeliverySink;
import dev.mars.leveledlog.sink.FileOptions;
import dev.mars.leveledlog.sink.FileSinkRegistry;
import dev.mars.leveledlog.sink.HttpOptions;
import dev.mars.leveledlog.sink.HttpSink;
import dev.mars.leveledlog.sink.LeveledSink;
import dev.mars.leveledlog.sink.ModuleLevelSink;
import dev.mars.leveledlog.sink.MultiSink;
import dev.mars.leveledlog.sink.Sink;
import dev.mars.leveledlog.sink.SinkException;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds sinks from {@link SinkSpec}s and applies {@link LoggingSettings} to a {@link LoggingContext}.
 * <p>
 * Destinations:
 * <ul>
 *   <li>{@code http:...} / {@code https:...} - an {@link HttpSink} in a {@link DeliverySink}</li>
 *   <li>{@code -} or {@code _} - the context's default sink, followed through later replacements</li>
 *   <li>anything else - a file, shared through the context's file sink cache</li>
 * </ul>
 * Option keys are matched case-insensitively; unknown keys are rejected.
 * HTTP sinks created here are closed by {@link #close()}; file sinks belong to the context.
 */
public final class SinkFactory implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SinkFactory.class);

    private static final ObjectMapper OPTIONS_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final LoggingContext context;
    private final LeveledLogConfig config;
    private final List<CloseableSink> owned = new ArrayList<>();

    public SinkFactory(LoggingContext context, LeveledLogConfig config) {
        this.context = Objects.requireNonNull(context, "context");
        this.config = Objects.requireNonNull(config, "config");
    }

    // ========================================================================
    // Sink construction
    // ========================================================================

    /**
     * Creates the sink described by {@code spec}.
     *
     * @param spec  the sink description
     * @param index position of the sink in its list, used in error messages
     * @throws SinkConfigurationException if options, URL or file cannot be used
     */
    public CloseableSink create(SinkSpec spec, int index) {
        return createAll(List.of(spec), index).get(0);
    }

    /**
     * Creates every sink of {@code specs}, in order.
     * <p>
     * All specs are validated before anything is opened. If an open still fails, the
     * files first opened by this call are closed and evicted from the file sink cache
     * and the HTTP sinks it created are closed.
     *
     * @throws SinkConfigurationException if any sink cannot be built
     */
    public List<CloseableSink> createAll(List<SinkSpec> specs) {
        return createAll(specs, 0);
    }

    private List<CloseableSink> createAll(List<SinkSpec> specs, int firstIndex) {
        List<PreparedSink> prepared = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            prepared.add(prepare(specs.get(i), firstIndex + i));
        }
        Opening opening = new Opening();
        try {
            List<CloseableSink> sinks = new ArrayList<>(prepared.size());
            for (PreparedSink sink : prepared) {
                sinks.add(open(sink, opening));
            }
            return sinks;
        } catch (RuntimeException e) {
            rollback(opening, e);
            throw e;
        }
    }

    /**
     * Checks a spec without opening anything: destination, options, URL, path and
     * the existence of the file's directory.
     */
    private PreparedSink prepare(SinkSpec spec, int index) {
        String dst = spec.dst();
        if (dst == null || dst.isBlank()) {
            throw SinkConfigurationException.forSink(index, dst, "destination is empty", null);
        }
        if (dst.startsWith("http:") || dst.startsWith("https:")) {
            HttpOptions options = new HttpOptions()
                    .timeout(config.httpTimeoutSeconds())
                    .async(config.asyncByDefault());
            decodeOptions(spec, index, options, "HTTP options");
            HttpUrl url = HttpUrl.parse(dst);
            if (url == null) {
                throw SinkConfigurationException.forSink(index, dst, "invalid URL", null);
            }
            return PreparedSink.http(index, dst, url, options);
        }
        if (dst.equals("-") || dst.equals("_")) {
            return PreparedSink.defaultSink(index, dst);
        }

        FileOptions options = new FileOptions()
                .perm(config.filePermissions())
                .async(config.asyncByDefault());
        decodeOptions(spec, index, options, "file options");
        Path path;
        try {
            path = Path.of(dst).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw SinkConfigurationException.forSink(index, dst, "invalid path: " + e.getReason(), e);
        }
        Path directory = path.getParent();
        if (directory != null && !Files.isDirectory(directory)) {
            throw SinkConfigurationException.forSink(index, dst, "directory does not exist: " + directory, null);
        }
        return PreparedSink.file(index, dst, path, options);
    }

    private CloseableSink open(PreparedSink prepared, Opening opening) {
        switch (prepared.kind()) {
            case HTTP: {
                HttpSink http = new HttpSink(prepared.url(), prepared.httpOptions());
                DeliverySink sink = new DeliverySink(prepared.url().toString(), http,
                        prepared.httpOptions().isAsync(), context.executor());
                synchronized (owned) {
                    owned.add(sink);
                }
                opening.httpSinks.add(sink);
                LOG.info("Configured HTTP sink #{}: url={}, async={}",
                        prepared.index(), prepared.url(), prepared.httpOptions().isAsync());
                return sink;
            }
            case DEFAULT:
                return new DefaultSinkHandle(context.sinkProxy());
            default: {
                FileSinkRegistry files = context.fileSinks();
                boolean cached = files.contains(prepared.path());
                DeliverySink sink;
                try {
                    sink = files.acquire(prepared.path(), prepared.fileOptions());
                } catch (SinkException e) {
                    throw SinkConfigurationException.forSink(prepared.index(), prepared.dst(), e.getMessage(), e);
                }
                if (!cached) {
                    opening.files.add(prepared.path());
                }
                return sink;
            }
        }
    }

    private void rollback(Opening opening, RuntimeException failure) {
        for (Path path : opening.files) {
            try {
                context.fileSinks().release(path);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        synchronized (owned) {
            owned.removeAll(opening.httpSinks);
        }
        for (CloseableSink sink : opening.httpSinks) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        LOG.warn("Sink construction failed, released {} file sink(s) and {} HTTP sink(s): {}",
                opening.files.size(), opening.httpSinks.size(), failure.getMessage());
    }

    private static void decodeOptions(SinkSpec spec, int index, Object defaults, String what) {
        if (spec.options().isEmpty()) {
            return;
        }
        try {
            OPTIONS_MAPPER.updateValue(defaults, spec.options());
        } catch (JsonMappingException e) {
            throw SinkConfigurationException.forSink(index, spec.dst(),
                    "cannot decode " + what + ": " + e.getOriginalMessage(), e);
        }
    }

    // ========================================================================
    // Settings
    // ========================================================================

    /**
     * Applies {@code settings}: default threshold, module thresholds, and for modules
     * with sinks a dedicated sink set bound to that module's logger.
     * <p>
     * Every sink of every module is validated, then opened, before any threshold or
     * logger is changed. On failure the thresholds and loggers are left as they were,
     * and the sinks this call opened are released as in {@link #createAll}. A file
     * opened with {@code truncate} before a later open failed stays truncated.
     *
     * @return the dedicated sink of each module that has one
     * @throws SinkConfigurationException if any sink cannot be built
     */
    public Map<String, LeveledSink> apply(LoggingSettings settings) {
        Level defaultLevel = LevelNames.parse(settings.level(), config.defaultLevel());

        List<List<PreparedSink>> prepared = new ArrayList<>();
        for (ModuleSpec module : settings.modules()) {
            List<PreparedSink> sinks = new ArrayList<>();
            for (int i = 0; i < module.sinks().size(); i++) {
                sinks.add(prepare(module.sinks().get(i), i));
            }
            prepared.add(sinks);
        }

        Map<String, LeveledSink> dedicated = new LinkedHashMap<>();
        Opening opening = new Opening();
        try {
            for (int m = 0; m < settings.modules().size(); m++) {
                ModuleSpec module = settings.modules().get(m);
                List<PreparedSink> sinks = prepared.get(m);
                if (sinks.isEmpty()) {
                    continue;
                }
                Level moduleLevel = LevelNames.parse(module.level(), defaultLevel);
                List<LeveledSink> leveled = new ArrayList<>();
                for (int i = 0; i < sinks.size(); i++) {
                    LeveledSink sink = ModuleLevelSink.wrap(open(sinks.get(i), opening));
                    sink.setLevel(LevelNames.parse(module.sinks().get(i).level(), moduleLevel), "");
                    leveled.add(sink);
                }
                dedicated.put(module.name(), new MultiSink(leveled));
            }
        } catch (RuntimeException e) {
            rollback(opening, e);
            throw e;
        }

        context.setLevel(defaultLevel, "");
        for (ModuleSpec module : settings.modules()) {
            if (module.level() != null && !module.level().isBlank()) {
                context.setLevel(LevelNames.parse(module.level(), defaultLevel), module.name());
            }
        }
        dedicated.forEach((module, sink) -> context.logger(module).setSink(sink));

        LOG.info("Applied logging settings: defaultLevel={}, modules={}, dedicatedSinks={}",
                defaultLevel, settings.modules().size(), dedicated.keySet());
        return dedicated;
    }

    /** Number of HTTP sinks this factory currently owns. */
    int ownedCount() {
        synchronized (owned) {
            return owned.size();
        }
    }

    /**
     * Closes the HTTP sinks created by this factory.
     *
     * @throws SinkException if any of them fails to close
     */
    @Override
    public void close() {
        List<CloseableSink> toClose;
        synchronized (owned) {
            toClose = new ArrayList<>(owned);
            owned.clear();
        }
        List<RuntimeException> failures = new ArrayList<>();
        for (CloseableSink sink : toClose) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw SinkException.aggregate("close", toClose.size(), failures);
        }
    }

    private enum Kind { HTTP, DEFAULT, FILE }

    /** A validated spec, ready to open. */
    private record PreparedSink(int index, String dst, Kind kind,
                                HttpUrl url, HttpOptions httpOptions,
                                Path path, FileOptions fileOptions) {

        static PreparedSink http(int index, String dst, HttpUrl url, HttpOptions options) {
            return new PreparedSink(index, dst, Kind.HTTP, url, options, null, null);
        }

        static PreparedSink defaultSink(int index, String dst) {
            return new PreparedSink(index, dst, Kind.DEFAULT, null, null, null, null);
        }

        static PreparedSink file(int index, String dst, Path path, FileOptions options) {
            return new PreparedSink(index, dst, Kind.FILE, null, null, path, options);
        }
    }

    /** What one construction call has opened so far. */
    private static final class Opening {
        private final List<Path> files = new ArrayList<>();
        private final List<CloseableSink> httpSinks = new ArrayList<>();
    }

    /**
     * Non-leveled handle on the default sink, so a module table placed in front of it
     * stays separate from the default sink's own table. Closing it does nothing.
     */
    private static final class DefaultSinkHandle implements CloseableSink {

        private final Sink target;

        DefaultSinkHandle(Sink target) {
            this.target = target;
        }

        @Override
        public void log(Level level, int calldepth, LogRecord record) {
            target.log(level, calldepth + 1, record);
        }

        @Override
        public void close() {
        }

        @Override
        public String toString() {
            return "DefaultSinkHandle";
        }
    }
}
