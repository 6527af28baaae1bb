package me.golemcore.gateway.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.ModelNotConfiguredException;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.ModelRef;
import me.golemcore.gateway.port.outbound.BindingStorePort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves a caller's model reference to a concrete binding.
 *
 * <p>
 * Precedence is strict: id, then key, then backend model name. The first
 * identifier present is authoritative. If it does not resolve, lower-precedence
 * identifiers are not tried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelResolver {

    private final BindingStorePort bindingStore;

    public ModelBinding resolve(ModelRef ref) {
        if (ref == null || ref.isEmpty()) {
            throw new ModelNotConfiguredException(ref);
        }

        Optional<ModelBinding> binding;
        if (ref.hasId()) {
            binding = bindingStore.findById(ref.id());
        } else if (ref.hasKey()) {
            binding = bindingStore.findByKey(ref.key());
        } else {
            binding = bindingStore.findByName(ref.name());
        }

        return binding
                .map(resolved -> {
                    log.debug("[Resolver] {} -> {}", ref.describe(), resolved);
                    return resolved;
                })
                .orElseThrow(() -> new ModelNotConfiguredException(ref));
    }
}
