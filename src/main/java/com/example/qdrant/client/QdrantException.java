package com.example.qdrant.client;

/**
 * Base exception for Qdrant client operations.
 */
public class QdrantException extends RuntimeException {

    public QdrantException(String message) {
        super(message);
    }

    public QdrantException(String message, Throwable cause) {
        super(message, cause);
    }
}
