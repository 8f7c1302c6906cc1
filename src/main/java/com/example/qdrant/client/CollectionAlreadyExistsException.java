package com.example.qdrant.client;

/**
 * Thrown by {@link QdrantClient#createCollection} when the collection is already present.
 * No create request is sent in that case.
 */
public class CollectionAlreadyExistsException extends QdrantException {

    private final String collectionName;

    public CollectionAlreadyExistsException(String collectionName) {
        super("Collection '" + collectionName + "' already exists");
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
