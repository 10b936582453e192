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

import dev.mars.leveledlog.core.*;
import dev.mars.leveledlog.logger.Logger;
import dev.mars.leveledlog.logger.LoggingContext;
import dev.mars.leveledlog.sink.CloseableSink;
import dev.mars.leveledlog.sink.DeliverySink;
import dev.mars.leveledlog.sink.FileOptions;
import dev.mars.leveledlog.sink.LeveledSink;
import dev.mars.leveledlog.sink.MultiSink;
import dev.mars.leveledlog.sink.RecordingSink;
import dev.mars.leveledlog.sink.SinkException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SinkFactory} and {@link LoggingSettings}.
 */
class SinkFactoryTest {

    @TempDir
    Path tempDir;

    private RecordingSink recording;
    private LoggingContext context;
    private SinkFactory factory;

    @BeforeEach
    void setUp() {
        LeveledLogConfig config = LeveledLogConfig.builder()
                .asyncByDefault(false)
                .defaultLevel(Level.DEBUG)
                .build();
        recording = new RecordingSink("default");
        context = config.contextBuilder().sink(recording).build();
        factory = new SinkFactory(context, config);
    }

    @AfterEach
    void tearDown() {
        factory.close();
        context.close();
        LogRecord.resetState();
    }

    private static LogRecord record(Level level, String message) {
        return LogRecord.create("m", level, null, (calldepth, r, out) -> out.append(r.message()), message);
    }

    // ========================================================================
    // Sink construction
    // ========================================================================

    @Nested
    @DisplayName("File destinations")
    class FileTests {

        @Test
        @DisplayName("Options are decoded case-insensitively over config defaults")
        void testFileOptions() throws Exception {
            Path path = tempDir.resolve("app.log");
            Files.writeString(path, "old\n");

            CloseableSink sink = factory.create(
                    new SinkSpec(path.toString(), null, Map.of("TRUNCATE", true, "Async", false)), 0);
            sink.log(Level.INFO, 0, record(Level.INFO, "fresh"));

            assertInstanceOf(DeliverySink.class, sink);
            assertFalse(((DeliverySink) sink).isAsync());
            assertEquals(List.of("fresh"), Files.readAllLines(path, StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Same path yields the cached sink")
        void testSamePathShared() {
            Path path = tempDir.resolve("shared.log");

            CloseableSink first = factory.create(SinkSpec.of(path.toString()), 0);
            CloseableSink second = factory.create(SinkSpec.of(path.toString()), 1);

            assertSame(first, second);
            assertEquals(1, context.fileSinks().openCount());
        }

        @Test
        @DisplayName("Async default comes from the configuration")
        void testAsyncDefaultFromConfig() {
            DeliverySink sink = (DeliverySink) factory.create(SinkSpec.of(tempDir.resolve("a.log").toString()), 0);

            assertFalse(sink.isAsync());
        }

        @Test
        @DisplayName("Unknown option key is rejected with index and destination")
        void testUnknownOption() {
            String dst = tempDir.resolve("x.log").toString();

            SinkConfigurationException error = assertThrows(SinkConfigurationException.class,
                    () -> factory.create(new SinkSpec(dst, null, Map.of("rotate", true)), 3));

            assertTrue(error.getMessage().startsWith("Sink #3 '" + dst + "'"), error.getMessage());
            assertEquals(0, context.fileSinks().size());
        }

        @Test
        @DisplayName("Wrongly typed option is rejected")
        void testWrongType() {
            assertThrows(SinkConfigurationException.class, () -> factory.create(
                    new SinkSpec(tempDir.resolve("x.log").toString(), null, Map.of("async", "maybe")), 0));
        }

        @Test
        @DisplayName("Missing directory is rejected before opening")
        void testMissingDirectory() {
            SinkConfigurationException error = assertThrows(SinkConfigurationException.class,
                    () -> factory.create(SinkSpec.of(tempDir.resolve("no/such/dir.log").toString()), 0));

            assertTrue(error.getMessage().contains("directory does not exist"), error.getMessage());
            assertEquals(0, context.fileSinks().openCount());
        }

        @Test
        @DisplayName("Open failure is a configuration error")
        void testOpenFailure() throws Exception {
            Path directory = Files.createDirectory(tempDir.resolve("logs"));

            SinkConfigurationException error = assertThrows(SinkConfigurationException.class,
                    () -> factory.create(SinkSpec.of(directory.toString()), 0));

            assertInstanceOf(SinkException.class, error.getCause());
            assertEquals(0, context.fileSinks().size());
        }

        @Test
        @DisplayName("A failed list releases the files it opened")
        void testCreateAllReleasesOnFailure() throws Exception {
            Path opened = tempDir.resolve("first.log");
            Path directory = Files.createDirectory(tempDir.resolve("logs"));

            assertThrows(SinkConfigurationException.class, () -> factory.createAll(List.of(
                    SinkSpec.of(opened.toString()), SinkSpec.of(directory.toString()))));

            assertFalse(context.fileSinks().contains(opened));
            assertEquals(0, context.fileSinks().size());
        }
    }

    @Nested
    @DisplayName("HTTP destinations")
    class HttpTests {

        private MockWebServer server;

        @BeforeEach
        void startServer() throws Exception {
            server = new MockWebServer();
            server.start();
        }

        @AfterEach
        void stopServer() throws Exception {
            server.shutdown();
        }

        @Test
        @DisplayName("HTTP options are decoded and applied")
        void testHttpSink() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200));
            String dst = server.url("/ingest").toString();

            CloseableSink sink = factory.create(new SinkSpec(dst, null, Map.of("formatted", true, "timeout", 3)), 0);
            sink.log(Level.ERROR, 0, record(Level.ERROR, "boom"));

            RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
            assertNotNull(request);
            assertEquals("POST", request.getMethod());
            assertEquals("boom", request.getBody().readUtf8());
        }

        @Test
        @DisplayName("Invalid URL is rejected")
        void testInvalidUrl() {
            SinkConfigurationException error = assertThrows(SinkConfigurationException.class,
                    () -> factory.create(SinkSpec.of("http://"), 2));

            assertTrue(error.getMessage().contains("#2"), error.getMessage());
        }
    }

    @Test
    @DisplayName("Dash forwards to the current default sink")
    void testDefaultSinkDestination() {
        CloseableSink dash = factory.create(SinkSpec.of("-"), 0);
        CloseableSink underscore = factory.create(SinkSpec.of("_"), 1);
        RecordingSink replacement = new RecordingSink("replacement");

        dash.log(Level.INFO, 0, record(Level.INFO, "one"));
        context.setSinks(replacement);
        underscore.log(Level.INFO, 0, record(Level.INFO, "two"));
        dash.close();

        assertEquals(List.of("one"), recording.messages());
        assertEquals(List.of("two"), replacement.messages());
        assertEquals(0, replacement.closeCount());
    }

    @Test
    @DisplayName("Blank destination is rejected")
    void testBlankDestination() {
        assertThrows(SinkConfigurationException.class, () -> factory.create(SinkSpec.of(" "), 0));
    }

    // ========================================================================
    // Settings
    // ========================================================================

    @Test
    @DisplayName("Applying settings sets thresholds and module sinks")
    void testApplySettings() throws Exception {
        Path audit = tempDir.resolve("audit.log");
        String json = "{"
                + "\"level\": \"I\","
                + "\"modules\": ["
                + "  {\"name\": \"svc.api\", \"level\": \"W\"},"
                + "  {\"name\": \"audit\", \"level\": \"N\", \"sinks\": ["
                + "     {\"dst\": \"" + audit.toString().replace("\\", "\\\\") + "\", \"options\": {\"async\": false}},"
                + "     {\"dst\": \"-\", \"level\": \"E\"}"
                + "  ]}"
                + "]}";

        Map<String, LeveledSink> dedicated = factory.apply(LoggingSettings.fromJson(json));

        assertEquals(Level.INFO, context.getLevel("svc.db"));
        assertEquals(Level.WARNING, context.getLevel("svc.api.http"));
        assertInstanceOf(MultiSink.class, dedicated.get("audit"));

        Logger auditLog = context.logger("audit");
        assertSame(dedicated.get("audit"), auditLog.sink());
        auditLog.info("dropped");
        auditLog.notice("user alice logged in");
        auditLog.error("tampering detected");
        context.logger("svc.api").info("dropped too");

        List<String> lines = Files.readAllLines(audit, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).endsWith("NOTI [audit]: user alice logged in"), lines.get(0));
        assertTrue(lines.get(1).endsWith("ERRO [audit]: tampering detected"), lines.get(1));
        assertEquals(List.of("tampering detected"), recording.messages());
    }

    @Test
    @DisplayName("A failing sink leaves thresholds and files unchanged")
    void testApplyFailureLeavesLevels() throws Exception {
        Path precious = tempDir.resolve("precious.log");
        Files.writeString(precious, "precious\n");
        LoggingSettings settings = new LoggingSettings("ERROR", List.of(
                new ModuleSpec("audit", null, List.of(new SinkSpec(precious.toString(), null, Map.of("truncate", true)))),
                new ModuleSpec("svc", "CRITICAL", List.of(SinkSpec.of(tempDir.resolve("no/dir/x.log").toString())))));

        assertThrows(SinkConfigurationException.class, () -> factory.apply(settings));

        assertEquals(Level.DEBUG, context.getLevel(""));
        assertEquals(Level.DEBUG, context.getLevel("svc"));
        assertNull(context.logger("svc").sink());
        assertNull(context.logger("audit").sink());
        assertEquals("precious\n", Files.readString(precious, StandardCharsets.UTF_8));
        assertEquals(0, context.fileSinks().size());
        assertEquals(0, context.fileSinks().openCount());
    }

    @Test
    @DisplayName("An open failure releases the sinks opened before it")
    void testApplyOpenFailureReleasesSinks() throws Exception {
        Path shared = tempDir.resolve("shared.log");
        DeliverySink existing = context.fileSinks().acquire(shared, new FileOptions().async(false));
        Path fresh = tempDir.resolve("fresh.log");
        Path directory = Files.createDirectory(tempDir.resolve("logs"));
        LoggingSettings settings = new LoggingSettings("I", List.of(
                new ModuleSpec("audit", "N", List.of(
                        SinkSpec.of(shared.toString()),
                        SinkSpec.of(fresh.toString()),
                        SinkSpec.of("http://localhost:9/ingest"))),
                new ModuleSpec("svc", null, List.of(SinkSpec.of(directory.toString())))));

        SinkConfigurationException error = assertThrows(SinkConfigurationException.class,
                () -> factory.apply(settings));

        assertTrue(error.getMessage().startsWith("Sink #0 '" + directory + "'"), error.getMessage());
        assertSame(existing, context.fileSinks().acquire(shared, null));
        assertFalse(context.fileSinks().contains(fresh));
        assertEquals(1, context.fileSinks().size());
        assertEquals(0, factory.ownedCount());
        assertEquals(Level.DEBUG, context.getLevel("audit"));

        factory.apply(new LoggingSettings("I", List.of(
                new ModuleSpec("audit", "N", List.of(SinkSpec.of(fresh.toString()))))));
        assertTrue(context.fileSinks().contains(fresh));
        assertEquals(3, context.fileSinks().openCount());
    }

    @Test
    @DisplayName("Module without level inherits the default")
    void testModuleWithoutLevel() {
        factory.apply(new LoggingSettings("W", List.of(new ModuleSpec("quiet", null, null))));

        assertEquals(Level.WARNING, context.getLevel("quiet"));
        assertNull(context.logger("quiet").sink());
    }

    @Test
    @DisplayName("Malformed settings document is rejected")
    void testMalformedSettings() {
        assertThrows(SinkConfigurationException.class, () -> LoggingSettings.fromJson("{\"level\": "));
        assertThrows(SinkConfigurationException.class, () -> LoggingSettings.fromJson("{\"lvl\": \"I\"}"));
    }

    @Test
    @DisplayName("Null collections become empty")
    void testRecordDefaults() {
        assertTrue(new LoggingSettings(null, null).modules().isEmpty());
        assertTrue(new ModuleSpec(null, null, null).sinks().isEmpty());
        assertEquals("", new ModuleSpec(null, null, null).name());
        assertTrue(SinkSpec.of("-").options().isEmpty());
    }
}
