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

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import me.golemcore.gateway.domain.model.ChatMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Subword token counting with jtokkit.
 *
 * <p>
 * Chat counting approximates vendor message framing: a fixed priming cost, a
 * per-message overhead and the encoded role, name and content of every
 * message. The overheads differ per encoding.
 */
@Component
public class TokenCounter {

    private static final Pattern O200K_MODELS = Pattern.compile("^(gpt-5|o\\d)", Pattern.CASE_INSENSITIVE);

    private final EncodingRegistry registry = Encodings.newLazyEncodingRegistry();

    /**
     * Chooses the encoding by model-name convention: {@code gpt-5*} and
     * {@code o<digit>*} models use {@code o200k_base}, everything else
     * {@code cl100k_base}.
     */
    public EncodingType encodingFor(String modelName) {
        if (modelName != null && O200K_MODELS.matcher(modelName).find()) {
            return EncodingType.O200K_BASE;
        }
        return EncodingType.CL100K_BASE;
    }

    /**
     * Parses an encoding name such as {@code cl100k_base}.
     *
     * @throws IllegalArgumentException
     *             for unknown encodings
     */
    public EncodingType parseEncoding(String name) {
        return EncodingType.fromName(name.trim().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new IllegalArgumentException("Unknown encoding: " + name));
    }

    public int countText(String text, EncodingType encodingType) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return registry.getEncoding(encodingType).encodeOrdinary(text).size();
    }

    public int countChat(List<ChatMessage> messages, EncodingType encodingType) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        ChatOverhead overhead = ChatOverhead.of(encodingType);
        Encoding encoding = registry.getEncoding(encodingType);

        int total = overhead.priming();
        for (ChatMessage message : messages) {
            if (message == null) {
                continue;
            }
            total += overhead.perMessage();
            total += count(encoding, message.getRole());
            if (message.getName() != null && !message.getName().isEmpty()) {
                total += overhead.perName() + count(encoding, message.getName());
            }
            total += count(encoding, message.getContent());
        }
        return total;
    }

    private int count(Encoding encoding, String text) {
        return text == null || text.isEmpty() ? 0 : encoding.encodeOrdinary(text).size();
    }

    record ChatOverhead(int perMessage, int perName, int priming) {

        private static final ChatOverhead CL100K = new ChatOverhead(4, -1, 2);
        private static final ChatOverhead O200K = new ChatOverhead(3, 1, 2);

        static ChatOverhead of(EncodingType encodingType) {
            return encodingType == EncodingType.O200K_BASE ? O200K : CL100K;
        }
    }
}
