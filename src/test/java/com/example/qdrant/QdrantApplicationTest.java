package com.example.qdrant;

import com.example.qdrant.client.QdrantClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"qdrant.url=http://qdrant.test:6333", "qdrant.api-key="})
class QdrantApplicationTest {

    @Autowired
    private QdrantClient qdrantClient;

    @Test
    void contextExposesConfiguredClient() {
        assertEquals("http://qdrant.test:6333", qdrantClient.getBaseUrl());
        assertFalse(qdrantClient.hasApiKey());
    }
}
