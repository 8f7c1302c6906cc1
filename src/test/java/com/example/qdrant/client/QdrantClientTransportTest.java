package com.example.qdrant.client;

import com.example.qdrant.model.PointId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failures below the HTTP layer: the call never produces a response.
 */
class QdrantClientTransportTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void connectFailureIsTransportError() throws Exception {
        HttpClient http = Mockito.mock(HttpClient.class);
        when(http.send(any(HttpRequest.class), any())).thenThrow(new ConnectException("Connection refused"));
        QdrantClient client = new QdrantClient("http://qdrant.invalid:6333", http);

        QdrantTransportException e = assertThrows(QdrantTransportException.class,
                () -> client.searchPoints("docs", List.of(0.1f, 0.2f), 3));

        assertInstanceOf(ConnectException.class, e.getCause());
        verify(http, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void existsDoesNotHideTransportErrors() throws Exception {
        HttpClient http = Mockito.mock(HttpClient.class);
        when(http.send(any(HttpRequest.class), any())).thenThrow(new ConnectException("Connection refused"));
        QdrantClient client = new QdrantClient("http://qdrant.invalid:6333", http);

        assertThrows(QdrantTransportException.class, () -> client.collectionExists("docs"));
        assertThrows(QdrantTransportException.class, () -> client.createCollection("docs", 4));
        // only the existence checks went out
        verify(http, times(2)).send(any(HttpRequest.class), any());
    }

    @Test
    void interruptionIsCancellationAndKeepsInterruptFlag() throws Exception {
        HttpClient http = Mockito.mock(HttpClient.class);
        when(http.send(any(HttpRequest.class), any())).thenThrow(new InterruptedException());
        QdrantClient client = new QdrantClient("http://qdrant.invalid:6333", http);

        assertThrows(QdrantCancelledException.class,
                () -> client.deletePoints("docs", List.of(PointId.of(1))));

        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void unreachableServerIsTransportError() throws Exception {
        String baseUrl;
        try (FakeQdrantServer server = FakeQdrantServer.start()) {
            baseUrl = server.baseUrl();
        }
        QdrantClient client = new QdrantClient(baseUrl);

        assertThrows(QdrantTransportException.class, () -> client.listCollections());
    }
}
