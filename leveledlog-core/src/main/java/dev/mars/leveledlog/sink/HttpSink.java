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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.Messages;
import dev.mars.leveledlog.core.LogRecord;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;

/**
 * Sends log records to an HTTP endpoint.
 * <p>
 * By default each record is POSTed as JSON-encoded {@link dev.mars.leveledlog.core.RecordData}.
 * With {@code formatted} the formatted line is sent instead; with {@code httpGet} the payload
 * travels in the {@code message} query parameter of a GET request.
 * <p>
 * Delivery is synchronous; wrap the sink in a {@link DeliverySink} for background delivery.
 * Any non-2xx response counts as a failed delivery.
 */
public final class HttpSink implements PrintingSink, CloseableSink {

    private static final Logger LOG = LoggerFactory.getLogger(HttpSink.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final HttpUrl url;
    private final HttpOptions options;
    private final OkHttpClient client;
    private final boolean ownsClient;

    /**
     * @param url     the endpoint
     * @param options request options
     * @param client  client to derive from, or null to build a dedicated one
     */
    public HttpSink(HttpUrl url, HttpOptions options, OkHttpClient client) {
        this.url = Objects.requireNonNull(url, "url");
        this.options = options != null ? options : new HttpOptions();
        this.ownsClient = client == null;
        this.client = configure(client != null ? client.newBuilder() : new OkHttpClient.Builder(), this.options);
        LOG.debug("HTTP sink created: url={}, options={}", url, this.options);
    }

    public HttpSink(HttpUrl url, HttpOptions options) {
        this(url, options, null);
    }

    public HttpUrl url() {
        return url;
    }

    public HttpOptions options() {
        return options;
    }

    @Override
    public void log(Level level, int calldepth, LogRecord record) {
        String payload;
        if (options.isFormatted()) {
            payload = record.formatted(calldepth + 1);
        } else {
            try {
                payload = MAPPER.writeValueAsString(record.data());
            } catch (JsonProcessingException e) {
                throw new SinkException("Failed to encode record #" + record.id(), e);
            }
        }

        Request request;
        if (options.isHttpGet()) {
            request = new Request.Builder()
                    .url(url.newBuilder().addQueryParameter("message", payload).build())
                    .get()
                    .build();
        } else {
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(payload, JSON))
                    .build();
        }
        execute(request);
    }

    @Override
    public void print(Object... args) {
        String text = Messages.sprint(args);
        Request request;
        if (options.isHttpGet()) {
            request = new Request.Builder()
                    .url(url.newBuilder().addQueryParameter("string", text).build())
                    .get()
                    .build();
        } else {
            request = new Request.Builder()
                    .url(url.newBuilder().addQueryParameter("string", "true").build())
                    .post(RequestBody.create(text, JSON))
                    .build();
        }
        execute(request);
    }

    private void execute(Request request) {
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SinkException("HTTP " + request.method() + " " + url + " returned " + response.code());
            }
        } catch (IOException e) {
            throw new SinkException("HTTP " + request.method() + " " + url + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Releases connections and threads of a client this sink built itself.
     */
    @Override
    public void close() {
        if (!ownsClient) {
            return;
        }
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
        LOG.debug("HTTP sink closed: url={}", url);
    }

    private static OkHttpClient configure(OkHttpClient.Builder builder, HttpOptions options) {
        Duration timeout = Duration.ofSeconds(options.effectiveTimeout());
        builder.callTimeout(timeout)
                .connectTimeout(timeout);
        if (options.isInsecure()) {
            X509TrustManager trustAll = new TrustAllManager();
            try {
                SSLContext context = SSLContext.getInstance("TLS");
                context.init(null, new TrustManager[]{trustAll}, new SecureRandom());
                builder.sslSocketFactory(context.getSocketFactory(), trustAll)
                        .hostnameVerifier((host, session) -> true);
            } catch (GeneralSecurityException e) {
                throw new SinkException("Failed to configure insecure TLS", e);
            }
            LOG.warn("HTTP sink created with TLS verification DISABLED");
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "HttpSink{" + url + '}';
    }

    private static final class TrustAllManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
