package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.exception.UpstreamTransportException;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.RelayOutcome;
import me.golemcore.gateway.domain.model.RelayState;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.publisher.TestPublisher;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StreamRelayTest {

    private static final String CID = "cid-relay";

    private GatewayEventSink eventSink;
    private List<RelayOutcome> outcomes;
    private StreamRelay relay;

    @BeforeEach
    void setUp() {
        eventSink = mock(GatewayEventSink.class);
        outcomes = new CopyOnWriteArrayList<>();
        relay = new StreamRelay(CID, eventSink, outcome -> {
            outcomes.add(outcome);
            return Mono.empty();
        });
    }

    @Test
    void shouldRelayDeltasInOrderAndComplete() {
        Flux<CanonicalEvent> upstream = Flux.just(
                CanonicalEvent.delta("Hel"), CanonicalEvent.delta("lo"), CanonicalEvent.done());

        StepVerifier.create(relay.relay(upstream))
                .expectNext(CanonicalEvent.delta("Hel"), CanonicalEvent.delta("lo"), CanonicalEvent.done())
                .verifyComplete();

        assertEquals(RelayState.COMPLETED, relay.getState());
        assertEquals(1, outcomes.size());
        assertEquals(new RelayOutcome(RelayState.COMPLETED, "Hello", 2, null), outcomes.get(0));
    }

    @Test
    void shouldEmitDoneWhenUpstreamEndsWithoutIt() {
        StepVerifier.create(relay.relay(Flux.just(CanonicalEvent.delta("a"))))
                .expectNext(CanonicalEvent.delta("a"), CanonicalEvent.done())
                .verifyComplete();

        assertEquals(RelayState.COMPLETED, relay.getState());
    }

    @Test
    void shouldDropEventsAfterTerminal() {
        Flux<CanonicalEvent> upstream = Flux.just(
                CanonicalEvent.delta("a"), CanonicalEvent.done(), CanonicalEvent.delta("late"));

        StepVerifier.create(relay.relay(upstream))
                .expectNext(CanonicalEvent.delta("a"), CanonicalEvent.done())
                .verifyComplete();

        assertEquals("a", outcomes.get(0).completionText());
        assertEquals(1, outcomes.get(0).deltaCount());
    }

    @Test
    void shouldFailOnErrorEvent() {
        Flux<CanonicalEvent> upstream = Flux.just(
                CanonicalEvent.delta("a"), CanonicalEvent.error("quota exceeded"), CanonicalEvent.delta("b"));

        StepVerifier.create(relay.relay(upstream))
                .expectNext(CanonicalEvent.delta("a"), CanonicalEvent.error("quota exceeded"))
                .verifyComplete();

        assertEquals(RelayState.FAILED, relay.getState());
        assertEquals("quota exceeded", outcomes.get(0).errorMessage());
        assertEquals(RelayState.FAILED, outcomes.get(0).state());
    }

    @Test
    void shouldTurnUpstreamExceptionIntoErrorEvent() {
        Flux<CanonicalEvent> upstream = Flux.just(CanonicalEvent.delta("a"))
                .concatWith(Flux.error(new UpstreamTransportException("Backend stream interrupted: reset",
                        new IOException("reset"))));

        StepVerifier.create(relay.relay(upstream))
                .expectNext(CanonicalEvent.delta("a"))
                .expectNext(CanonicalEvent.error("Backend stream interrupted: reset"))
                .verifyComplete();

        assertEquals(RelayState.FAILED, relay.getState());
    }

    @Test
    void shouldCancelUpstreamAndSettleWhenClientDisconnects() {
        TestPublisher<CanonicalEvent> upstream = TestPublisher.create();

        StepVerifier.create(relay.relay(upstream.flux()))
                .then(() -> upstream.next(CanonicalEvent.delta("partial")))
                .expectNext(CanonicalEvent.delta("partial"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        upstream.assertWasCancelled();
        assertEquals(RelayState.CLIENT_CLOSED, relay.getState());
        assertEquals(1, outcomes.size());
        assertEquals(RelayState.CLIENT_CLOSED, outcomes.get(0).state());
        assertEquals("partial", outcomes.get(0).completionText());
    }

    @Test
    void shouldCompleteOnlyAfterSettleHookFinishes() {
        AtomicBoolean accounted = new AtomicBoolean();
        StreamRelay slowRelay = new StreamRelay(CID, eventSink,
                outcome -> Mono.delay(Duration.ofMillis(50)).doOnNext(tick -> accounted.set(true)).then());

        StepVerifier.create(slowRelay.relay(Flux.just(CanonicalEvent.delta("a"), CanonicalEvent.done())))
                .expectNextCount(2)
                .verifyComplete();

        assertTrue(accounted.get());
    }

    @Test
    void shouldCompleteEvenWhenSettleHookFails() {
        StreamRelay failingRelay = new StreamRelay(CID, eventSink,
                outcome -> Mono.error(new IllegalStateException("disk full")));

        StepVerifier.create(failingRelay.relay(Flux.just(CanonicalEvent.done())))
                .expectNext(CanonicalEvent.done())
                .verifyComplete();
    }

    @Test
    void shouldRejectSecondSubscription() {
        Flux<CanonicalEvent> relayed = relay.relay(Flux.just(CanonicalEvent.done()));

        StepVerifier.create(relayed).expectNext(CanonicalEvent.done()).verifyComplete();
        StepVerifier.create(relayed).expectError(IllegalStateException.class).verify();

        assertEquals(1, outcomes.size());
    }

    @Test
    void shouldPublishStateTransitions() {
        StepVerifier.create(relay.relay(Flux.just(CanonicalEvent.done())))
                .expectNext(CanonicalEvent.done())
                .verifyComplete();

        verify(eventSink, times(2)).publish(eq(GatewayEventType.RELAY_TRANSITION), eq(CID), anyMap());
    }
}
