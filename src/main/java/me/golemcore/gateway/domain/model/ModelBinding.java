package me.golemcore.gateway.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Resolved, concrete backend configuration for a logical model reference.
 *
 * <p>
 * Bindings are immutable and request-scoped: the resolver reads them from the
 * binding store on every request so they always reflect current configuration.
 * The credential must never be logged; {@link #toString()} masks it.
 */
@Value
@Builder(toBuilder = true)
public class ModelBinding {

    private static final String DEFAULT_CURRENCY = "USD";

    Long id;
    String key;
    String modelName;
    String displayName;
    String providerName;
    BackendKind backendKind;
    String endpointBaseUrl;
    String credential;
    @Singular
    Map<String, String> headers;
    WireMode wireMode;
    boolean supportsReasoning;
    BigDecimal priceInputPerMillion;
    BigDecimal priceOutputPerMillion;
    String currency;

    public boolean hasPricing() {
        return priceInputPerMillion != null || priceOutputPerMillion != null;
    }

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }

    public String getCurrency() {
        return currency != null && !currency.isBlank() ? currency : DEFAULT_CURRENCY;
    }

    public WireMode getWireMode() {
        return wireMode != null ? wireMode : WireMode.AUTO;
    }

    /**
     * Key used in usage records: the logical key when configured, otherwise the
     * backend model name.
     */
    public String getAccountingKey() {
        return key != null && !key.isBlank() ? key : modelName;
    }

    @Override
    public String toString() {
        return "ModelBinding(id=" + id + ", key=" + key + ", modelName=" + modelName
                + ", backendKind=" + backendKind + ", endpointBaseUrl=" + endpointBaseUrl
                + ", credential=" + (hasCredential() ? "***" : "none") + ")";
    }
}
