package com.example.qdrant.client;

/**
 * Thrown when a response body is not valid JSON or lacks a field the operation needs.
 */
public class QdrantDecodeException extends QdrantRequestFailedException {

    public QdrantDecodeException(String message, int statusCode) {
        super(message, statusCode, null);
    }

    public QdrantDecodeException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, null, cause);
    }
}
