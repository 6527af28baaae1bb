package me.golemcore.gateway.adapter.outbound.http;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.UpstreamProtocolException;
import me.golemcore.gateway.domain.exception.UpstreamTransportException;
import me.golemcore.gateway.domain.model.WireRequest;
import me.golemcore.gateway.port.outbound.UpstreamPort;
import me.golemcore.gateway.port.outbound.UpstreamStream;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link UpstreamPort} over the shared {@link OkHttpClient}.
 *
 * <p>
 * Calls are blocking and run on the bounded-elastic scheduler. Streaming
 * bodies are read one line per downstream demand, so a slow client pauses
 * upstream reads. Cancelling a subscription cancels the OkHttp {@link Call},
 * which unblocks any pending read and releases the connection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OkHttpUpstreamClient implements UpstreamPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY_CHARS = 4000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<UpstreamStream> open(WireRequest request) {
        return Mono.defer(() -> {
            Call call = httpClient.newCall(toHttpRequest(request));
            return Mono.fromCallable(() -> openStream(call, request))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnCancel(call::cancel);
        });
    }

    @Override
    public Mono<JsonNode> exchange(WireRequest request) {
        return Mono.defer(() -> {
            Call call = httpClient.newCall(toHttpRequest(request));
            return Mono.fromCallable(() -> readJson(call, request))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnCancel(call::cancel);
        });
    }

    private UpstreamStream openStream(Call call, WireRequest request) {
        Response response = execute(call, request);
        ensureSuccess(response, request);
        log.debug("[Upstream] Stream opened: {} {}", response.code(), request.url());
        return new OkHttpUpstreamStream(call, response);
    }

    private JsonNode readJson(Call call, WireRequest request) {
        try (Response response = execute(call, request)) {
            ensureSuccess(response, request);
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            try {
                return objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                throw new UpstreamProtocolException(response.code(), "Backend returned invalid JSON");
            }
        } catch (IOException e) {
            throw new UpstreamTransportException("Failed to read backend reply from " + request.url()
                    + ": " + e.getMessage(), e);
        }
    }

    private Request toHttpRequest(WireRequest request) {
        String body;
        try {
            body = objectMapper.writeValueAsString(request.body());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize backend request", e);
        }
        Request.Builder builder = new Request.Builder()
                .url(request.url())
                .post(RequestBody.create(body, JSON));
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (header.getValue() != null) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        return builder.build();
    }

    private Response execute(Call call, WireRequest request) {
        try {
            return call.execute();
        } catch (IOException e) {
            throw new UpstreamTransportException("Failed to reach backend at " + request.url()
                    + ": " + e.getMessage(), e);
        }
    }

    private void ensureSuccess(Response response, WireRequest request) {
        if (response.isSuccessful()) {
            return;
        }
        String message;
        try (response) {
            ResponseBody body = response.body();
            message = errorMessage(response.code(), body != null ? body.string() : "");
        } catch (IOException e) {
            message = "HTTP " + response.code() + " from backend";
        }
        log.warn("[Upstream] {} returned {}: {}", request.url(), response.code(), message);
        throw new UpstreamProtocolException(response.code(), message);
    }

    /**
     * Extracts the backend's own error message from an error envelope
     * ({@code {"error":{"message":...}}}, {@code {"error":"..."}} or
     * {@code {"message":...}}), falling back to the status line.
     */
    String errorMessage(int code, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode json = objectMapper.readTree(body);
                JsonNode error = json.path("error");
                if (error.isTextual()) {
                    return error.asText();
                }
                if (error.path("message").isTextual()) {
                    return error.get("message").asText();
                }
                if (json.path("message").isTextual()) {
                    return json.get("message").asText();
                }
            } catch (JsonProcessingException e) {
                log.trace("[Upstream] Error body is not JSON", e);
            }
            String trimmed = body.trim();
            return "HTTP " + code + " from backend: "
                    + (trimmed.length() > MAX_ERROR_BODY_CHARS ? trimmed.substring(0, MAX_ERROR_BODY_CHARS) : trimmed);
        }
        return "HTTP " + code + " from backend";
    }

    static final class OkHttpUpstreamStream implements UpstreamStream {

        private final Call call;
        private final Response response;
        private final AtomicBoolean subscribed = new AtomicBoolean();

        OkHttpUpstreamStream(Call call, Response response) {
            this.call = call;
            this.response = response;
        }

        @Override
        public Flux<String> lines() {
            if (!subscribed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Upstream stream already consumed"));
            }
            ResponseBody body = response.body();
            if (body == null) {
                response.close();
                return Flux.empty();
            }
            return Flux.<String, BufferedSource>generate(body::source, (source, sink) -> {
                try {
                    String line = source.readUtf8Line();
                    if (line == null) {
                        sink.complete();
                    } else {
                        sink.next(line);
                    }
                } catch (IOException e) {
                    if (call.isCanceled()) {
                        sink.complete();
                    } else {
                        sink.error(new UpstreamTransportException("Backend stream interrupted: " + e.getMessage(), e));
                    }
                }
                return source;
            }, source -> response.close())
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnCancel(call::cancel);
        }

        @Override
        public void close() {
            call.cancel();
            response.close();
        }
    }
}
