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

/**
 * Options for a file sink.
 * <p>
 * A mutable bean so that configuration decoders can overlay user values on defaults.
 * <table border="1">
 *   <tr><th>Option</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>async</td><td>deliver in the background</td><td>false</td></tr>
 *   <tr><td>truncate</td><td>truncate the file on open instead of appending</td><td>false</td></tr>
 *   <tr><td>perm</td><td>POSIX permissions for a newly created file</td><td>rw-rw-rw-</td></tr>
 * </table>
 */
public class FileOptions {

    public static final String DEFAULT_PERM = "rw-rw-rw-";

    private boolean async;
    private boolean truncate;
    private String perm = DEFAULT_PERM;

    public boolean isAsync() {
        return async;
    }

    public void setAsync(boolean async) {
        this.async = async;
    }

    public FileOptions async(boolean async) {
        this.async = async;
        return this;
    }

    public boolean isTruncate() {
        return truncate;
    }

    public void setTruncate(boolean truncate) {
        this.truncate = truncate;
    }

    public FileOptions truncate(boolean truncate) {
        this.truncate = truncate;
        return this;
    }

    public String getPerm() {
        return perm;
    }

    public void setPerm(String perm) {
        this.perm = perm;
    }

    public FileOptions perm(String perm) {
        this.perm = perm;
        return this;
    }

    @Override
    public String toString() {
        return "FileOptions{" +
                "async=" + async +
                ", truncate=" + truncate +
                ", perm=" + perm +
                '}';
    }
}
