package me.golemcore.gateway.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.GatewayException;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.CanonicalEventType;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.RelayOutcome;
import me.golemcore.gateway.domain.model.RelayState;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * One client-facing streaming session.
 *
 * <p>
 * State machine: {@code IDLE -> STREAMING -> COMPLETED | FAILED | CLIENT_CLOSED}.
 * <ul>
 * <li>{@code DONE}, or the end of the upstream stream, completes the session.
 * A missing {@code DONE} is emitted to the client.</li>
 * <li>{@code ERROR}, or an upstream error, fails it with a terminal
 * {@code ERROR} event.</li>
 * <li>Downstream cancellation closes it and cancels the upstream subscription
 * in the same call.</li>
 * </ul>
 * Terminal states accept no further events. The settle hook receives the final
 * {@link RelayOutcome} exactly once; the client stream completes only after
 * it finishes, unless the client is already gone.
 *
 * <p>
 * Instances are single-use and not Spring beans.
 */
@Slf4j
public class StreamRelay {

    private final String correlationId;
    private final GatewayEventSink eventSink;
    private final Function<RelayOutcome, Mono<Void>> settleHook;

    private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.IDLE);
    private final AtomicBoolean settled = new AtomicBoolean();
    private final StringBuilder completion = new StringBuilder();
    private int deltaCount;
    private String errorMessage;

    public StreamRelay(String correlationId, GatewayEventSink eventSink,
            Function<RelayOutcome, Mono<Void>> settleHook) {
        this.correlationId = correlationId;
        this.eventSink = eventSink;
        this.settleHook = settleHook;
    }

    /**
     * Relays {@code upstream} to the client. May be subscribed once.
     */
    public Flux<CanonicalEvent> relay(Flux<CanonicalEvent> upstream) {
        return Flux.defer(() -> {
            if (!transition(RelayState.IDLE, RelayState.STREAMING)) {
                return Flux.error(new IllegalStateException("Relay already started"));
            }
            return upstream
                    .concatWith(Mono.fromSupplier(CanonicalEvent::done))
                    .onErrorResume(error -> Mono.just(CanonicalEvent.error(messageOf(error))))
                    .takeUntil(CanonicalEvent::isTerminal)
                    .filter(event -> state.get() == RelayState.STREAMING)
                    .doOnNext(this::track)
                    .concatWith(Mono.defer(this::settle).then(Mono.empty()))
                    .doOnCancel(this::onClientClosed);
        });
    }

    public RelayState getState() {
        return state.get();
    }

    public synchronized RelayOutcome snapshot() {
        return new RelayOutcome(state.get(), completion.toString(), deltaCount, errorMessage);
    }

    private void track(CanonicalEvent event) {
        CanonicalEventType type = event.type();
        switch (type) {
        case DELTA -> appendDelta(event.text());
        case DONE -> transition(RelayState.STREAMING, RelayState.COMPLETED);
        case ERROR -> {
            recordError(event.message());
            transition(RelayState.STREAMING, RelayState.FAILED);
        }
        default -> throw new IllegalStateException("Unexpected event type: " + type);
        }
    }

    private synchronized void appendDelta(String text) {
        if (text != null) {
            completion.append(text);
        }
        deltaCount++;
    }

    private synchronized void recordError(String message) {
        errorMessage = message;
    }

    private void onClientClosed() {
        if (transition(RelayState.STREAMING, RelayState.CLIENT_CLOSED)) {
            settle().subscribe();
        }
    }

    private Mono<Void> settle() {
        if (!settled.compareAndSet(false, true)) {
            return Mono.empty();
        }
        RelayOutcome outcome = snapshot();
        log.debug("[Relay] {} settled: state={}, deltas={}", correlationId, outcome.state(), outcome.deltaCount());
        Mono<Void> accounting = Mono.defer(() -> settleHook.apply(outcome))
                .onErrorResume(e -> {
                    log.warn("[Relay] {} settle hook failed: {}", correlationId, e.getMessage());
                    return Mono.empty();
                })
                .cache();
        // detached from the client subscription
        accounting.subscribe();
        return accounting;
    }

    private boolean transition(RelayState from, RelayState to) {
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        log.debug("[Relay] {} {} -> {}", correlationId, from, to);
        try {
            eventSink.publish(GatewayEventType.RELAY_TRANSITION, correlationId,
                    Map.of("from", from.name(), "to", to.name()));
        } catch (RuntimeException e) { // NOSONAR
            log.debug("[Relay] Failed to publish transition event: {}", e.getMessage());
        }
        return true;
    }

    private static String messageOf(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException.getMessage();
        }
        String message = error.getMessage();
        return "Upstream stream failed: " + (message != null ? message : error.getClass().getSimpleName());
    }
}
