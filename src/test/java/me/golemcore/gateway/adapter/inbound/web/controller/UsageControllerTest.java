package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.domain.model.UsageOutcome;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.domain.service.UsageRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class UsageControllerTest {

    private UsageRecorder usageRecorder;
    private UsageController controller;

    @BeforeEach
    void setUp() {
        usageRecorder = mock(UsageRecorder.class);
        controller = new UsageController(usageRecorder);
    }

    @Test
    void shouldReturnRecentRecordsWithCount() {
        UsageRecord usageRecord = UsageRecord.builder()
                .bindingKey("default")
                .inputTokens(10)
                .outputTokens(2)
                .outcome(UsageOutcome.COMPLETED)
                .build();
        when(usageRecorder.recent(50)).thenReturn(List.of(usageRecord));

        StepVerifier.create(controller.getRecent(50))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().getCount());
                    assertEquals(12, response.getBody().getItems().get(0).getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void shouldDelegateDefaultLimitToRecorder() {
        when(usageRecorder.recent(null)).thenReturn(List.of());

        StepVerifier.create(controller.getRecent(null))
                .assertNext(response -> assertEquals(0, response.getBody().getCount()))
                .verifyComplete();
        verify(usageRecorder).recent(null);
    }
}
