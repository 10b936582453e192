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

import java.util.Arrays;
import java.util.IllegalFormatException;

/**
 * Renders log arguments into message text.
 */
public final class Messages {

    private Messages() {
    }

    /**
     * Joins all arguments with a single space.
     */
    public static String joinWithSpaces(Object... args) {
        if (args == null || args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(render(args[i]));
        }
        return sb.toString();
    }

    /**
     * Concatenates the arguments, adding a space between two operands only
     * when neither of them is a string.
     */
    public static String sprint(Object... args) {
        if (args == null || args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0 && !(args[i - 1] instanceof CharSequence) && !(args[i] instanceof CharSequence)) {
                sb.append(' ');
            }
            sb.append(render(args[i]));
        }
        return sb.toString();
    }

    /**
     * Applies {@link String#format(String, Object...)}. A malformed format
     * never throws; the result then holds the format, the error and the raw
     * arguments.
     */
    public static String format(String format, Object... args) {
        try {
            return String.format(format, args);
        } catch (IllegalFormatException e) {
            return format + " %!(" + e.getClass().getSimpleName() + ") " + joinWithSpaces(args);
        }
    }

    /**
     * Renders one argument; arrays render element-wise.
     */
    public static String render(Object arg) {
        if (arg == null) {
            return "null";
        }
        if (arg.getClass().isArray()) {
            String wrapped = Arrays.deepToString(new Object[]{arg});
            return wrapped.substring(1, wrapped.length() - 1);
        }
        return String.valueOf(arg);
    }
}
