package me.golemcore.gateway.adapter.inbound.web.controller;

import com.knuddels.jtokkit.api.EncodingType;
import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.TokenCountRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.TokenCountResponse;
import me.golemcore.gateway.domain.service.TokenCounter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Token counting for arbitrary text and chat messages.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TokensController {

    static final String NOTE = "Token counts computed with jtokkit. Chat overhead is an approximation.";

    private final TokenCounter tokenCounter;

    @PostMapping("/tokens")
    public Mono<ResponseEntity<TokenCountResponse>> countTokens(@RequestBody TokenCountRequest request) {
        EncodingType encoding = request.getEncoding() != null && !request.getEncoding().isBlank()
                ? tokenCounter.parseEncoding(request.getEncoding())
                : tokenCounter.encodingFor(request.getModel());

        Integer textTokens = request.getText() != null
                ? tokenCounter.countText(request.getText(), encoding)
                : null;
        Integer messageTokens = request.getMessages() != null
                ? tokenCounter.countChat(request.getMessages(), encoding)
                : null;
        int total = (textTokens != null ? textTokens : 0) + (messageTokens != null ? messageTokens : 0);

        TokenCountResponse response = TokenCountResponse.builder()
                .model(request.getModel())
                .encoding(encoding.getName())
                .textTokens(textTokens)
                .messageTokens(messageTokens)
                .totalTokens(total)
                .note(NOTE)
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
