package me.golemcore.gateway.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Inbound embedding call before model resolution. {@code batch} records
 * whether the caller sent an array, even a single-element one.
 */
@Value
@Builder
public class EmbeddingRequest {

    ModelRef modelRef;
    @Singular("input")
    List<String> inputs;
    boolean batch;
    String encodingFormat;
    Integer dimensions;
    String correlationId;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
