package com.example.qdrant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point; exposes a configured {@link com.example.qdrant.client.QdrantClient} bean.
 */
@SpringBootApplication
public class QdrantApplication {

    public static void main(String[] args) {
        SpringApplication.run(QdrantApplication.class, args);
    }
}
