package com.example.qdrant.config;

import com.example.qdrant.client.QdrantClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Spring configuration that wires the Qdrant client as a bean.
 */
@Configuration
@EnableConfigurationProperties(QdrantProperties.class)
public class QdrantConfig {

    @Bean
    public HttpClient qdrantHttpClient(QdrantProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    @Bean
    public QdrantClient qdrantClient(QdrantProperties properties, HttpClient qdrantHttpClient) {
        QdrantClient client = new QdrantClient(properties.getUrl(), qdrantHttpClient);
        String apiKey = properties.getApiKey();
        // blank key means an unsecured instance
        if (apiKey == null || apiKey.isBlank()) {
            return client;
        }
        return client.withApiKey(apiKey);
    }
}
