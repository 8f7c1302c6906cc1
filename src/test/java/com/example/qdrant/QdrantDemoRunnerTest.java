package com.example.qdrant;

import com.example.qdrant.client.FakeQdrantServer;
import com.example.qdrant.client.QdrantClient;
import com.example.qdrant.model.Point;
import com.example.qdrant.model.ScoredPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class QdrantDemoRunnerTest {

    private FakeQdrantServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeQdrantServer.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static List<Object> cities(List<ScoredPoint> hits) {
        return hits.stream().map(h -> h.payload().get("city")).collect(Collectors.toList());
    }

    @Test
    void demoPointsLoadFromClasspath() throws Exception {
        List<Point> points = QdrantDemoRunner.loadPoints(new ObjectMapper());

        assertEquals(6, points.size());
        assertEquals(List.of(0.05f, 0.61f, 0.76f, 0.74f), points.get(0).vector());
        assertEquals("Mumbai", points.get(5).payload().get("city"));
    }

    @Test
    void runsTheWholeScenario() throws Exception {
        QdrantClient client = new QdrantClient(server.baseUrl());

        QdrantDemoRunner.DemoSummary summary = QdrantDemoRunner.run(client, "my_test");

        assertEquals(6, summary.sizeAfterUpsert());
        assertEquals(List.of("New York", "Berlin"), cities(summary.firstSearch()));
        assertEquals(4, summary.sizeAfterDelete());
        assertEquals(List.of("Moscow", "London"), cities(summary.secondSearch()));
    }

    @Test
    void rerunRecreatesTheCollection() throws Exception {
        QdrantClient client = new QdrantClient(server.baseUrl());
        QdrantDemoRunner.run(client, "my_test");

        QdrantDemoRunner.DemoSummary again = QdrantDemoRunner.run(client, "my_test");

        assertEquals(6, again.sizeAfterUpsert());
        assertEquals(1, server.count("DELETE", "/collections/my_test"));
        assertEquals(2, server.count("PUT", "/collections/my_test"));
    }
}
