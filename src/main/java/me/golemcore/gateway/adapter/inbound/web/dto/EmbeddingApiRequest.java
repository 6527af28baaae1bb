package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingApiRequest {

    /** A string or an array of strings. */
    private JsonNode input;

    private String model;

    @JsonProperty("model_key")
    @JsonAlias("modelKey")
    private String modelKey;

    @JsonProperty("model_id")
    @JsonAlias("modelId")
    private Long modelId;

    @JsonProperty("encoding_format")
    @JsonAlias("encodingFormat")
    private String encodingFormat;

    private Integer dimensions;

    @JsonProperty("conversation_id")
    @JsonAlias("conversationId")
    private String conversationId;

    private Map<String, Object> metadata;
}
