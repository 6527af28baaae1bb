package me.golemcore.gateway.domain.exception;

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

import me.golemcore.gateway.domain.model.ModelRef;

/**
 * The model reference did not resolve to a binding. No upstream call is made.
 */
public class ModelNotConfiguredException extends GatewayException {

    public static final String CODE = "gateway.model.not_configured";

    private final transient ModelRef ref;

    public ModelNotConfiguredException(ModelRef ref) {
        super(CODE, "Model not configured in gateway: " + (ref != null ? ref.describe() : "<none>"));
        this.ref = ref;
    }

    public ModelRef getRef() {
        return ref;
    }
}
