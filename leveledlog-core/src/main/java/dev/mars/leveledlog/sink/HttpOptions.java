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
 * Options for an {@link HttpSink}.
 * <table border="1">
 *   <tr><th>Option</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>timeout</td><td>per-request timeout in seconds (0 = default)</td><td>2</td></tr>
 *   <tr><td>insecure</td><td>skip TLS certificate and host name verification</td><td>false</td></tr>
 *   <tr><td>httpGet</td><td>send as GET query parameter instead of POST body</td><td>false</td></tr>
 *   <tr><td>formatted</td><td>send the formatted line instead of JSON record data</td><td>false</td></tr>
 *   <tr><td>async</td><td>deliver in the background</td><td>false</td></tr>
 * </table>
 */
public class HttpOptions {

    public static final int DEFAULT_TIMEOUT_SECONDS = 2;

    private int timeout;
    private boolean insecure;
    private boolean httpGet;
    private boolean formatted;
    private boolean async;

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public HttpOptions timeout(int timeout) {
        this.timeout = timeout;
        return this;
    }

    /** The timeout to apply, substituting the default for unset values. */
    public int effectiveTimeout() {
        return timeout > 0 ? timeout : DEFAULT_TIMEOUT_SECONDS;
    }

    public boolean isInsecure() {
        return insecure;
    }

    public void setInsecure(boolean insecure) {
        this.insecure = insecure;
    }

    public HttpOptions insecure(boolean insecure) {
        this.insecure = insecure;
        return this;
    }

    public boolean isHttpGet() {
        return httpGet;
    }

    public void setHttpGet(boolean httpGet) {
        this.httpGet = httpGet;
    }

    public HttpOptions httpGet(boolean httpGet) {
        this.httpGet = httpGet;
        return this;
    }

    public boolean isFormatted() {
        return formatted;
    }

    public void setFormatted(boolean formatted) {
        this.formatted = formatted;
    }

    public HttpOptions formatted(boolean formatted) {
        this.formatted = formatted;
        return this;
    }

    public boolean isAsync() {
        return async;
    }

    public void setAsync(boolean async) {
        this.async = async;
    }

    public HttpOptions async(boolean async) {
        this.async = async;
        return this;
    }

    @Override
    public String toString() {
        return "HttpOptions{" +
                "timeout=" + timeout +
                ", insecure=" + insecure +
                ", httpGet=" + httpGet +
                ", formatted=" + formatted +
                ", async=" + async +
                '}';
    }
}
