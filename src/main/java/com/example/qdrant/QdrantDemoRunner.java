package com.example.qdrant;

import com.example.qdrant.client.QdrantClient;
import com.example.qdrant.model.Point;
import com.example.qdrant.model.PointId;
import com.example.qdrant.model.ScoredPoint;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Simple CLI runner against a live Qdrant:
 * - recreates a 4-dimensional collection
 * - upserts six city points from demo_points.json
 * - reads them back, searches, deletes two and searches again
 *
 * Usage: QdrantDemoRunner [endpoint]   (api key from QDRANT_API_KEY)
 */
public class QdrantDemoRunner {

    private static final Logger log = LoggerFactory.getLogger(QdrantDemoRunner.class);

    static final String COLLECTION_NAME = "my_test";
    static final String POINTS_RESOURCE = "demo_points.json";
    static final List<Float> QUERY = List.of(0.2f, 0.1f, 0.9f, 0.7f);

    public static void main(String[] args) throws Exception {
        String endpoint = args.length > 0 ? args[0] : QdrantClient.DEFAULT_HOST;

        QdrantClient client = new QdrantClient(endpoint);
        String apiKey = System.getenv("QDRANT_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            client = client.withApiKey(apiKey);
        }

        DemoSummary summary = run(client, COLLECTION_NAME);

        System.out.println("\n--- Demo summary ---");
        System.out.println("Size after upsert: " + summary.sizeAfterUpsert());
        System.out.println("Search: " + describe(summary.firstSearch()));
        System.out.println("Size after delete: " + summary.sizeAfterDelete());
        System.out.println("Search: " + describe(summary.secondSearch()));
        System.out.println("--------------------\n");
    }

    public static DemoSummary run(QdrantClient client, String collectionName) throws IOException {
        // 1. Start from a clean collection
        if (client.collectionExists(collectionName)) {
            log.info("Collection `{}` exists, deleting it", collectionName);
            client.deleteCollection(collectionName);
        }
        client.createCollection(collectionName, 4);

        // 2. Upsert the demo points
        List<Point> points = loadPoints(new ObjectMapper());
        client.upsertPoints(collectionName, points);
        long sizeAfterUpsert = client.collectionInfo(collectionName);
        log.info("The collection size is {}", sizeAfterUpsert);

        // 3. Read back
        Point second = client.getPoint(collectionName, PointId.of(2));
        log.info("The second point is {}", second);
        List<PointId> allIds = LongStream.rangeClosed(1, points.size())
                .mapToObj(PointId::of)
                .collect(Collectors.toList());
        List<Point> fetched = client.getPoints(collectionName, allIds);
        log.info("Fetched {} points", fetched.size());

        // 4. Search, delete, search again
        List<ScoredPoint> firstSearch = client.searchPoints(collectionName, QUERY, 2);
        client.deletePoints(collectionName, List.of(PointId.of(1), PointId.of(4)));
        long sizeAfterDelete = client.collectionInfo(collectionName);
        log.info("The collection size is {}", sizeAfterDelete);
        List<ScoredPoint> secondSearch = client.searchPoints(collectionName, QUERY, 2);

        return new DemoSummary(sizeAfterUpsert, firstSearch, sizeAfterDelete, secondSearch);
    }

    /**
     * Load demo points from classpath resource demo_points.json
     */
    static List<Point> loadPoints(ObjectMapper objectMapper) throws IOException {
        try (InputStream is = QdrantDemoRunner.class
                .getClassLoader()
                .getResourceAsStream(POINTS_RESOURCE)) {

            if (is == null) {
                throw new IllegalStateException("Cannot find " + POINTS_RESOURCE + " on classpath");
            }

            return objectMapper.readValue(is, new TypeReference<List<Point>>() {});
        }
    }

    private static String describe(List<ScoredPoint> hits) {
        return hits.stream()
                .map(hit -> hit.id() + " " + hit.payload() + " score=" + hit.score())
                .collect(Collectors.joining(", ", "[", "]"));
    }

    public record DemoSummary(
            long sizeAfterUpsert,
            List<ScoredPoint> firstSearch,
            long sizeAfterDelete,
            List<ScoredPoint> secondSearch
    ) {}
}
