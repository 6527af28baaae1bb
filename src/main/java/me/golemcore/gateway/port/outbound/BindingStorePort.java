package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.ModelBinding;

import java.util.Optional;

/**
 * Persistent configuration store for model bindings. Implementations are read
 * concurrently without synchronization by the model resolver and must return
 * current configuration on every call.
 */
public interface BindingStorePort {

    Optional<ModelBinding> findById(long id);

    Optional<ModelBinding> findByKey(String key);

    /**
     * Looks a binding up by backend model name. When several bindings share a
     * name the first configured one wins.
     */
    Optional<ModelBinding> findByName(String modelName);
}
