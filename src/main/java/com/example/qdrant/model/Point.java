package com.example.qdrant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A Qdrant point: id, embedding vector and optional payload (metadata).
 *
 * The vector length must match the dimensionality of the collection the point is
 * written to; the server enforces it.
 *
 * @param id      point id, unique within a collection
 * @param vector  embedding vector
 * @param payload arbitrary JSON metadata, {@code null} when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Point(PointId id, List<Float> vector, Map<String, Object> payload) {

    public Point {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vector, "vector");
        vector = List.copyOf(vector);
        payload = Payloads.normalize(payload);
    }
}
