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

/**
 * Helpers for {@link Redactable} implementations.
 */
public final class Redaction {

    private Redaction() {
    }

    /**
     * Returns a string of {@code *} with the same length as {@code value}.
     * A null value masks to the empty string.
     */
    public static String mask(String value) {
        if (value == null) {
            return "";
        }
        return "*".repeat(value.length());
    }

    /**
     * Returns a copy of {@code args} with every {@link Redactable} replaced by its
     * redacted form. The input array is left untouched.
     */
    public static Object[] redactAll(Object... args) {
        if (args == null) {
            return new Object[0];
        }
        Object[] copy = args.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] instanceof Redactable redactable) {
                copy[i] = redactable.redacted();
            }
        }
        return copy;
    }

    /**
     * Wraps a secret so that it renders masked in log output.
     *
     * @param secret the sensitive text
     * @return a redactable argument rendering as {@link #mask(String)}
     */
    public static Redactable secret(String secret) {
        return new Secret(secret);
    }

    private record Secret(String value) implements Redactable {

        @Override
        public Object redacted() {
            return mask(value);
        }

        @Override
        public String toString() {
            return mask(value);
        }
    }
}
