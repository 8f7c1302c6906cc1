package com.example.qdrant.client;

/**
 * Thrown when the calling thread is interrupted while a request is in flight.
 * The interrupt flag of the thread is restored before this is thrown.
 */
public class QdrantCancelledException extends QdrantException {

    public QdrantCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
