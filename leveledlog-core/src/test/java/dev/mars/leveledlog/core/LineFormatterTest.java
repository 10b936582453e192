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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class LineFormatterTest {

    private LineFormatter formatter;

    @BeforeEach
    void setUp() {
        LogRecord.useClock(Clock.fixed(Instant.parse("2024-01-02T03:04:05.678Z"), ZoneOffset.UTC));
        formatter = LineFormatter.builder().zone(ZoneOffset.UTC).build();
    }

    @AfterEach
    void tearDown() {
        LogRecord.resetState();
    }

    @Test
    void testLayout() {
        LogRecord record = LogRecord.create("svc.api", Level.WARNING, null, formatter, "slow request:", 1200, "ms");

        assertEquals("2024-01-02 03:04:05.678 WARN [svc.api]: slow request: 1200 ms", record.formatted(0));
    }

    @Test
    void testLevelCutToFourCharacters() {
        assertEquals("2024-01-02 03:04:05.678 CRIT [m]: x",
                LogRecord.create("m", Level.CRITICAL, null, formatter, "x").formatted(0));
        assertEquals("2024-01-02 03:04:05.678 DEBU [m]: x",
                LogRecord.create("m", Level.DEBUG, null, formatter, "x").formatted(0));
        assertEquals("2024-01-02 03:04:05.678 INFO [m]: x",
                LogRecord.create("m", Level.INFO, null, formatter, "x").formatted(0));
    }

    @Test
    void testCustomTimePattern() {
        LineFormatter shortTime = LineFormatter.builder().zone(ZoneOffset.UTC).timePattern("HH:mm:ss").build();

        assertEquals("03:04:05 ERRO [db]: down", LogRecord.create("db", Level.ERROR, null, shortTime, "down").formatted(0));
    }

    @Test
    void testColor() {
        LineFormatter colored = LineFormatter.builder().zone(ZoneOffset.UTC).color(true).build();

        String line = LogRecord.create("m", Level.ERROR, null, colored, "x").formatted(0);

        assertTrue(line.startsWith("\u001b[31m"), line);
        assertTrue(line.endsWith("\u001b[0m"), line);
    }

    @Test
    void testPid() {
        LineFormatter withPid = LineFormatter.builder().zone(ZoneOffset.UTC).pid(true).build();

        String line = LogRecord.create("m", Level.INFO, null, withPid, "x").formatted(0);

        assertEquals("2024-01-02 03:04:05.678 " + ProcessHandle.current().pid() + " INFO [m]: x", line);
    }
}
