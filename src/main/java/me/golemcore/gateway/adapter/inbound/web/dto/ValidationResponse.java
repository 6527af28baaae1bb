package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResponse {

    private boolean valid;
    private List<String> errors;
    private List<String> warnings;
    private Structure structure;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Structure {
        @JsonProperty("has_model")
        private boolean hasModel;
        @JsonProperty("has_messages")
        private boolean hasMessages;
        @JsonProperty("message_count")
        private int messageCount;
        @JsonProperty("has_temperature")
        private boolean hasTemperature;
        @JsonProperty("has_max_tokens")
        private boolean hasMaxTokens;
        private boolean stream;
    }
}
