package com.example.qdrant.client;

/**
 * Thrown by {@link QdrantClient#deleteCollection} when the collection does not exist.
 */
public class CollectionNotFoundException extends QdrantException {

    private final String collectionName;

    public CollectionNotFoundException(String collectionName) {
        super("Not found collection '" + collectionName + "'");
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
