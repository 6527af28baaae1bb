package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.UsageListResponse;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.domain.service.UsageRecorder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Recent usage records.
 */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final UsageRecorder usageRecorder;

    @GetMapping
    public Mono<ResponseEntity<UsageListResponse>> getRecent(@RequestParam(required = false) Integer limit) {
        List<UsageRecord> items = usageRecorder.recent(limit);
        return Mono.just(ResponseEntity.ok(UsageListResponse.builder()
                .items(items)
                .count(items.size())
                .build()));
    }
}
