package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenCountResponse {
    private String model;
    private String encoding;
    @JsonProperty("text_tokens")
    private Integer textTokens;
    @JsonProperty("message_tokens")
    private Integer messageTokens;
    @JsonProperty("total_tokens")
    private int totalTokens;
    private String note;
}
