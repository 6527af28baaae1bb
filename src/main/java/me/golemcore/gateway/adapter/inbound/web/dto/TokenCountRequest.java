package me.golemcore.gateway.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.ChatMessage;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenCountRequest {
    private String model;
    private String encoding;
    private String text;
    private List<ChatMessage> messages;
}
