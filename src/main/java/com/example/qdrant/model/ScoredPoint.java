package com.example.qdrant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holds a single search hit.
 *
 * Whether a higher score is better depends on the distance metric of the collection.
 * {@code vector} and {@code payload} are {@code null} unless they were requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoredPoint(PointId id, List<Float> vector, Map<String, Object> payload, float score) {

    public ScoredPoint {
        Objects.requireNonNull(id, "id");
        vector = vector == null ? null : List.copyOf(vector);
        payload = Payloads.normalize(payload);
    }
}
