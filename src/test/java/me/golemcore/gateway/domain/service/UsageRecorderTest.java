package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.UsageOutcome;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import me.golemcore.gateway.port.outbound.UsageStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class UsageRecorderTest {

    private UsageStorePort usageStore;
    private GatewayEventSink eventSink;
    private GatewayProperties properties;
    private UsageRecorder recorder;

    @BeforeEach
    void setUp() {
        usageStore = mock(UsageStorePort.class);
        eventSink = mock(GatewayEventSink.class);
        properties = new GatewayProperties();
        properties.getUsage().setPersistAttempts(3);
        properties.getUsage().setDefaultListLimit(2);
        properties.getUsage().setMaxListLimit(5);
        recorder = new UsageRecorder(usageStore, eventSink, properties);
    }

    @Test
    void shouldPersistAndPublishRecordedEvent() {
        UsageRecord usageRecord = usage("cid-1");

        StepVerifier.create(recorder.record(usageRecord)).expectComplete().verify(Duration.ofSeconds(5));

        verify(usageStore).append(usageRecord);
        verify(eventSink).publish(eq(GatewayEventType.USAGE_RECORDED), eq("cid-1"), anyMap());
        assertEquals(List.of(usageRecord), recorder.recent(null));
    }

    @Test
    void shouldRetryTransientFailures() {
        UsageRecord usageRecord = usage("cid-2");
        doThrow(new UncheckedIOException(new IOException("busy")))
                .doThrow(new UncheckedIOException(new IOException("busy")))
                .doNothing()
                .when(usageStore).append(usageRecord);

        StepVerifier.create(recorder.record(usageRecord)).expectComplete().verify(Duration.ofSeconds(5));

        verify(usageStore, times(3)).append(usageRecord);
        verify(eventSink).publish(eq(GatewayEventType.USAGE_RECORDED), eq("cid-2"),
                argThat(payload -> Integer.valueOf(3).equals(payload.get("attempts"))));
    }

    @Test
    void shouldDropRecordWithoutFailingCallerWhenStoreIsDown() {
        UsageRecord usageRecord = usage("cid-3");
        doThrow(new UncheckedIOException(new IOException("read-only file system")))
                .when(usageStore).append(any());

        StepVerifier.create(recorder.record(usageRecord)).expectComplete().verify(Duration.ofSeconds(5));

        verify(usageStore, times(3)).append(usageRecord);
        verify(eventSink).publish(eq(GatewayEventType.USAGE_PERSIST_FAILED), eq("cid-3"),
                argThat(payload -> payload.containsKey("error")));
        verify(eventSink, never()).publish(eq(GatewayEventType.USAGE_RECORDED), any(), anyMap());
    }

    @Test
    void shouldSkipEverythingWhenDisabled() {
        properties.getUsage().setEnabled(false);
        recorder = new UsageRecorder(usageStore, eventSink, properties);

        StepVerifier.create(recorder.record(usage("cid-4"))).verifyComplete();
        recorder.init();

        verifyNoInteractions(usageStore, eventSink);
    }

    @Test
    void shouldSeedRecentRecordsFromStore() {
        when(usageStore.loadRecent(anyInt())).thenReturn(List.of(usage("old-1"), usage("old-2")));

        recorder.init();

        assertEquals(List.of("old-2", "old-1"),
                recorder.recent(10).stream().map(UsageRecord::getCorrelationId).toList());
    }

    @Test
    void shouldListRecordedUsageNewestFirst() {
        for (String correlationId : List.of("first", "second", "third")) {
            recorder.record(usage(correlationId)).block(Duration.ofSeconds(5));
        }

        assertEquals(List.of("third", "second", "first"),
                recorder.recent(3).stream().map(UsageRecord::getCorrelationId).toList());
        assertEquals(List.of("third", "second"),
                recorder.recent(null).stream().map(UsageRecord::getCorrelationId).toList());
    }

    @Test
    void shouldClampListLimit() {
        when(usageStore.loadRecent(anyInt())).thenReturn(IntStream.range(0, 8)
                .mapToObj(i -> usage("r" + i))
                .toList());
        recorder.init();

        assertEquals(2, recorder.recent(null).size());
        assertEquals(5, recorder.recent(100).size());
        assertEquals(1, recorder.recent(0).size());
        assertEquals("r7", recorder.recent(1).get(0).getCorrelationId());
    }

    private static UsageRecord usage(String correlationId) {
        return UsageRecord.builder()
                .bindingKey("default")
                .modelName("gpt-4o-mini")
                .inputTokens(12)
                .outputTokens(3)
                .outcome(UsageOutcome.COMPLETED)
                .correlationId(correlationId)
                .build();
    }
}
