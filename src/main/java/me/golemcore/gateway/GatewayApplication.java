package me.golemcore.gateway;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Gateway.
 *
 * <p>
 * GolemCore Gateway puts many large-language-model backends behind one chat
 * contract and accounts for the tokens and cost of every call.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Model bindings</b> - logical model id, key or name resolved to a
 * concrete backend, read from {@code models.json} on every request</li>
 * <li><b>Three wire protocols</b> - chat-completions, responses and local
 * NDJSON (Ollama), normalized to one delta/done/error event stream</li>
 * <li><b>Streaming relay</b> - SSE to clients with back-pressure and upstream
 * cancellation on disconnect</li>
 * <li><b>Usage accounting</b> - jtokkit token estimates, per-million pricing,
 * JSONL usage records</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → ChatController, CompatChatController
 * Domain Layer       → DispatchOrchestrator, StreamRelay, Services
 * Infrastructure     → Backend adapters, OkHttp upstream client, Storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code gateway.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }

}
