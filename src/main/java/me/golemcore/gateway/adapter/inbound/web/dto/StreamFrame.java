package me.golemcore.gateway.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.CanonicalEvent;

/**
 * One SSE {@code data:} frame sent to streaming clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamFrame {

    public static final String TYPE_DELTA = "delta";
    public static final String TYPE_DONE = "done";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_WORKFLOW_DELTA = "llm.delta";

    private String type;
    private String content;
    private String data;
    private String message;

    /**
     * Canonical framing: {@code {type:"delta",content}}, {@code {type:"done"}},
     * {@code {type:"error",message}}.
     */
    public static StreamFrame of(CanonicalEvent event) {
        return switch (event.type()) {
        case DELTA -> StreamFrame.builder().type(TYPE_DELTA).content(event.text()).build();
        case DONE -> StreamFrame.builder().type(TYPE_DONE).build();
        case ERROR -> StreamFrame.builder().type(TYPE_ERROR).message(event.message()).build();
        };
    }

    /**
     * Workflow-engine framing: deltas become {@code {type:"llm.delta",data}}.
     */
    public static StreamFrame forWorkflow(CanonicalEvent event) {
        if (event.isDelta()) {
            return StreamFrame.builder().type(TYPE_WORKFLOW_DELTA).data(event.text()).build();
        }
        return of(event);
    }
}
