package com.example.qdrant.client;

/**
 * Distance metric of a collection, fixed at creation time.
 */
public enum Distance {
    COSINE("Cosine"),
    EUCLID("Euclid"),
    DOT("Dot"),
    MANHATTAN("Manhattan");

    private final String wireName;

    Distance(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
