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
import dev.mars.leveledlog.core.LineFormatter;
import dev.mars.leveledlog.core.LogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ModuleLevelSink}: prefix lookup, fail-open defaults and forwarding.
 */
class ModuleLevelSinkTest {

    private RecordingSink target;
    private LeveledSink sink;

    @BeforeEach
    void setUp() {
        target = new RecordingSink("target");
        sink = ModuleLevelSink.wrap(target);
    }

    @Nested
    @DisplayName("Threshold resolution")
    class Resolution {

        @Test
        @DisplayName("Empty table enables everything and reports DEBUG")
        void testEmptyTableFailsOpen() {
            for (Level level : Level.values()) {
                assertTrue(sink.isEnabledFor(level, "any.module"));
            }
            assertEquals(Level.DEBUG, sink.getLevel("any.module"));
            assertEquals(Level.DEBUG, sink.getLevel(""));
        }

        @Test
        @DisplayName("Longest dot-segment prefix wins")
        void testLongestPrefix() {
            sink.setLevel(Level.INFO, "");
            sink.setLevel(Level.ERROR, "svc");
            sink.setLevel(Level.WARNING, "svc.api");

            assertEquals(Level.WARNING, sink.getLevel("svc.api.http"));
            assertEquals(Level.WARNING, sink.getLevel("svc.api"));
            assertEquals(Level.ERROR, sink.getLevel("svc.db"));
            assertEquals(Level.INFO, sink.getLevel("other"));
            assertEquals(Level.INFO, sink.getLevel("svcx"));
        }

        @Test
        @DisplayName("Threshold filters less severe levels")
        void testIsEnabledFor() {
            sink.setLevel(Level.DEBUG, "");
            sink.setLevel(Level.WARNING, "svc.api");

            assertFalse(sink.isEnabledFor(Level.NOTICE, "svc.api.http"));
            assertFalse(sink.isEnabledFor(Level.INFO, "svc.api.http"));
            assertTrue(sink.isEnabledFor(Level.WARNING, "svc.api.http"));
            assertTrue(sink.isEnabledFor(Level.CRITICAL, "svc.api.http"));
            assertTrue(sink.isEnabledFor(Level.DEBUG, "svc.db"));
        }

        @Test
        @DisplayName("Specific entry without default leaves other modules open")
        void testSpecificEntryOnly() {
            sink.setLevel(Level.CRITICAL, "noisy");

            assertFalse(sink.isEnabledFor(Level.ERROR, "noisy.child"));
            assertTrue(sink.isEnabledFor(Level.DEBUG, "quiet"));
        }

        @Test
        @DisplayName("Later set replaces earlier")
        void testOverwrite() {
            sink.setLevel(Level.ERROR, "m");
            sink.setLevel(Level.INFO, "m");

            assertEquals(Level.INFO, sink.getLevel("m"));
        }
    }

    @Test
    void testWrap_ReturnsLeveledSinkUnchanged() {
        assertSame(sink, ModuleLevelSink.wrap(sink));
        assertNotSame(ModuleLevelSink.wrap(target), ModuleLevelSink.wrap(target));
    }

    @Test
    void testLog_ForwardsWithoutFilteringAndAddsCalldepth() {
        sink.setLevel(Level.CRITICAL, "");
        LogRecord record = LogRecord.create("m", Level.DEBUG, null, LineFormatter.standard(), "x");

        sink.log(Level.DEBUG, 4, record);

        assertEquals(List.of(record), target.records());
        assertEquals(List.of(5), target.calldepths());
    }

    @Test
    void testPrint_UnsupportedWithoutPrinter() {
        LeveledSink plain = ModuleLevelSink.wrap((level, calldepth, record) -> { });

        assertThrows(UnsupportedOperationException.class, () -> ((Printer) plain).print("x"));
    }

    @Test
    void testPrintAndClose_Delegate() {
        ModuleLevelSink wrapped = (ModuleLevelSink) sink;

        wrapped.print("a", 1);
        wrapped.close();

        assertEquals(List.of("a1"), target.printed());
        assertEquals(1, target.closeCount());
        assertSame(target, wrapped.delegate());
    }

    @Test
    void testConcurrentSetAndRead() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        if (id % 2 == 0) {
                            sink.setLevel(Level.values()[i % Level.values().length], "svc.m" + (i % 10));
                        } else {
                            sink.isEnabledFor(Level.INFO, "svc.m" + (i % 10) + ".child");
                            sink.getLevel("svc");
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        sink.setLevel(Level.ERROR, "svc.m3");
        assertEquals(Level.ERROR, sink.getLevel("svc.m3.child"));
    }
}
