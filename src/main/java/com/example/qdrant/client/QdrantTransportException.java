package com.example.qdrant.client;

/**
 * Thrown when the HTTP call itself could not be completed (connect, DNS, TLS, I/O).
 * The underlying {@link java.io.IOException} is kept as the cause.
 */
public class QdrantTransportException extends QdrantException {

    public QdrantTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
