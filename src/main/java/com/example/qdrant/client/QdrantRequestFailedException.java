package com.example.qdrant.client;

/**
 * Thrown when the server answered but reported a failure: a non-2xx HTTP status,
 * a {@code status} other than {@code "ok"}, or a {@code false} result.
 */
public class QdrantRequestFailedException extends QdrantException {

    /** Marker for failures that carry no HTTP status. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String serverStatus;

    public QdrantRequestFailedException(String message, int statusCode, String serverStatus) {
        super(message);
        this.statusCode = statusCode;
        this.serverStatus = serverStatus;
    }

    protected QdrantRequestFailedException(String message, int statusCode, String serverStatus, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.serverStatus = serverStatus;
    }

    /**
     * HTTP status of the response, or {@link #NO_STATUS}.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Status reported by the server in the response body ({@code status} string or
     * {@code status.error} message), or {@code null} when the body carried none.
     */
    public String getServerStatus() {
        return serverStatus;
    }
}
