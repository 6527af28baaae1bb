package me.golemcore.gateway.adapter.outbound.usage;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import me.golemcore.gateway.port.outbound.UsageStorePort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Usage store backed by JSONL files in workspace storage, one file per UTC day
 * ({@code usage/2026-01-31.jsonl}), one record per line.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlUsageStore implements UsageStorePort {

    private static final String LOG_PREFIX = "[Usage]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void append(UsageRecord usageRecord) {
        Instant timestamp = usageRecord.getTimestamp() != null ? usageRecord.getTimestamp() : clock.instant();
        String file = LocalDate.ofInstant(timestamp, ZoneOffset.UTC) + JSONL_EXTENSION;
        String line;
        try {
            line = objectMapper.writeValueAsString(usageRecord) + NEWLINE;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize usage record", e);
        }
        storagePort.appendText(directory(), file, line).join();
    }

    @Override
    public List<UsageRecord> loadRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> files = storagePort.listObjects(directory(), "").join();
        if (files == null || files.isEmpty()) {
            return List.of();
        }

        List<String> dayFiles = files.stream()
                .filter(name -> name.endsWith(JSONL_EXTENSION))
                .sorted()
                .toList();

        Deque<UsageRecord> newestFirst = new ArrayDeque<>();
        for (int i = dayFiles.size() - 1; i >= 0 && newestFirst.size() < limit; i--) {
            String file = dayFiles.get(i);
            List<UsageRecord> records = parseFile(file);
            for (int j = records.size() - 1; j >= 0 && newestFirst.size() < limit; j--) {
                newestFirst.addLast(records.get(j));
            }
        }

        List<UsageRecord> result = new ArrayList<>(newestFirst.size());
        newestFirst.descendingIterator().forEachRemaining(result::add);
        return result;
    }

    private List<UsageRecord> parseFile(String file) {
        String content;
        try {
            content = storagePort.getText(directory(), file).join();
        } catch (RuntimeException e) {
            log.warn("{} Failed to read file {}: {}", LOG_PREFIX, file, e.getMessage());
            return List.of();
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<UsageRecord> records = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, UsageRecord.class));
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return records;
    }

    private String directory() {
        return properties.getUsage().getDirectory();
    }
}
