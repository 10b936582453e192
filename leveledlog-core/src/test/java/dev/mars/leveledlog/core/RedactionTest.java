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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedactionTest {

    @Test
    void testMask() {
        assertEquals("******", Redaction.mask("s3cr3t"));
        assertEquals("", Redaction.mask(""));
        assertEquals("", Redaction.mask(null));
    }

    @Test
    void testSecret_RendersMasked() {
        Redactable secret = Redaction.secret("hunter2");

        assertEquals("*******", secret.redacted());
        assertEquals("*******", secret.toString());
    }

    @Test
    void testRedactAll_LeavesInputUntouched() {
        Redactable secret = Redaction.secret("token");
        Object[] args = {"user", secret};

        Object[] redacted = Redaction.redactAll(args);

        assertArrayEquals(new Object[]{"user", "*****"}, redacted);
        assertSame(secret, args[1]);
    }

    @Test
    void testRedactAll_Null() {
        assertEquals(0, Redaction.redactAll((Object[]) null).length);
    }
}
