package com.example.qdrant.client;

import com.example.qdrant.model.Point;
import com.example.qdrant.model.PointId;
import com.example.qdrant.model.ScoredPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Blocking client for the Qdrant REST API. Each operation is one HTTP round trip, no retries.
 * Immutable and safe to share; a search without 'result' is empty, failed searches throw.
 */
public class QdrantClient {

    private static final Logger log = LoggerFactory.getLogger(QdrantClient.class);

    public static final String DEFAULT_HOST = "http://localhost:6333";

    static final String API_KEY_HEADER = "api-key";

    private final String baseUrl;
    private final String apiKey; // null when not configured
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public QdrantClient() {
        this(DEFAULT_HOST);
    }

    public QdrantClient(String baseUrl) {
        this(baseUrl, HttpClient.newHttpClient());
    }

    public QdrantClient(String baseUrl, HttpClient httpClient) {
        this(baseUrl, httpClient, new ObjectMapper(), null);
    }

    private QdrantClient(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper, String apiKey) {
        this.baseUrl = validateBaseUrl(baseUrl);
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    /**
     * Returns a client that sends {@code api-key: <apiKey>} with every request.
     * This client is left unchanged.
     */
    public QdrantClient withApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        return new QdrantClient(baseUrl, httpClient, objectMapper, apiKey);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    /**
     * Check whether a collection exists. A missing collection is {@code false}, not an error.
     */
    public boolean collectionExists(String collectionName) {
        log.info("check collection existence: {}", collectionName);

        Reply reply = send("GET", collectionPath(collectionName) + "/exists", null);
        requireSuccess(reply, "Failed to check collection existence '" + collectionName + "'");

        JsonNode exists = readJson(reply).path("result").path("exists");
        if (!exists.isBoolean()) {
            throw new QdrantDecodeException(
                    "The given key 'result.exists' does not exist or is not a boolean.", reply.statusCode());
        }
        return exists.booleanValue();
    }

    /**
     * Create a collection using the {@link Distance#COSINE} metric, stored on disk.
     *
     * @throws CollectionAlreadyExistsException if the collection is already present
     */
    public void createCollection(String collectionName, int dimensionality) {
        createCollection(collectionName, dimensionality, Distance.COSINE);
    }

    public void createCollection(String collectionName, int dimensionality, Distance distance) {
        if (dimensionality <= 0) {
            throw new IllegalArgumentException("dimensionality must be positive: " + dimensionality);
        }
        Objects.requireNonNull(distance, "distance");
        log.info("create collection '{}'", collectionName);

        if (collectionExists(collectionName)) {
            CollectionAlreadyExistsException e = new CollectionAlreadyExistsException(collectionName);
            log.error(e.getMessage());
            throw e;
        }

        // body: { "vectors": { "size": N, "distance": "Cosine", "on_disk": true } }
        ObjectNode vectorsNode = objectMapper.createObjectNode();
        vectorsNode.put("size", dimensionality);
        vectorsNode.put("distance", distance.wireName());
        vectorsNode.put("on_disk", true);

        ObjectNode root = objectMapper.createObjectNode();
        root.set("vectors", vectorsNode);

        String failure = "Failed to create collection '" + collectionName + "'";
        Reply reply = send("PUT", collectionPath(collectionName), root);
        requireSuccess(reply, failure);
        if (!readBooleanResult(reply)) {
            throw new QdrantRequestFailedException(failure, reply.statusCode(), null);
        }
    }

    /**
     * Delete a collection.
     *
     * @throws CollectionNotFoundException if the collection does not exist
     */
    public void deleteCollection(String collectionName) {
        log.info("delete collection '{}'", collectionName);

        if (!collectionExists(collectionName)) {
            CollectionNotFoundException e = new CollectionNotFoundException(collectionName);
            log.error(e.getMessage());
            throw e;
        }

        String failure = "Failed to delete collection '" + collectionName + "'";
        Reply reply = send("DELETE", collectionPath(collectionName), null);
        requireSuccess(reply, failure);
        if (!readBooleanResult(reply)) {
            throw new QdrantRequestFailedException(failure, reply.statusCode(), null);
        }
    }

    /**
     * Names of all collections; empty when the server has none.
     */
    public List<String> listCollections() {
        log.info("list collections");

        Reply reply = send("GET", "/collections", null);
        requireSuccess(reply, "Failed to list collections");

        JsonNode result = readJson(reply).get("result");
        if (result == null) {
            throw new QdrantDecodeException("The given key 'result' does not exist.", reply.statusCode());
        }
        JsonNode collections = result.get("collections");
        if (collections == null) {
            throw new QdrantDecodeException("The given key 'collections' does not exist.", reply.statusCode());
        }
        if (!collections.isArray()) {
            throw new QdrantDecodeException(
                    "The value corresponding to the 'collections' key is not an array.", reply.statusCode());
        }

        List<String> names = new ArrayList<>();
        for (JsonNode collection : collections) {
            JsonNode name = collection.get("name");
            if (name == null || !name.isTextual()) {
                throw new QdrantDecodeException("Collection entry without a 'name': " + collection,
                        reply.statusCode());
            }
            names.add(name.asText());
        }
        return names;
    }

    /**
     * Number of points in the collection, as reported by the server.
     */
    public long collectionInfo(String collectionName) {
        log.info("get collection info: '{}'", collectionName);

        Reply reply = send("GET", collectionPath(collectionName), null);
        requireSuccess(reply, "Failed to get collection info '" + collectionName + "'");

        JsonNode count = readJson(reply).path("result").path("points_count");
        if (!count.isIntegralNumber()) {
            throw new QdrantDecodeException(
                    "The given key 'result.points_count' does not exist or is not an integer.",
                    reply.statusCode());
        }
        return count.longValue();
    }

    /**
     * Insert or replace points in one request. Returns once the server has applied the write.
     */
    public void upsertPoints(String collectionName, List<Point> points) {
        log.info("upsert {} points to collection '{}'", points.size(), collectionName);

        ObjectNode root = objectMapper.createObjectNode();
        root.set("points", objectMapper.valueToTree(points));

        Reply reply = send("PUT", collectionPath(collectionName) + "/points?wait=true", root);
        requireSuccess(reply, "Failed to upsert points");

        JsonNode status = readJson(reply).get("status");
        if (status == null || !status.isTextual()) {
            throw new QdrantDecodeException("The given key 'status' does not exist or is not a string.",
                    reply.statusCode());
        }
        if (!"ok".equals(status.asText())) {
            throw new QdrantRequestFailedException("Failed to upsert points. Status = " + status.asText(),
                    reply.statusCode(), status.asText());
        }
    }

    public Point getPoint(String collectionName, PointId id) {
        log.info("get point from collection '{}' with id {}", collectionName, id);

        Reply reply = send("GET", collectionPath(collectionName) + "/points/" + encode(id.toString()), null);
        requireSuccess(reply, "Failed to get point " + id);

        JsonNode result = readJson(reply).get("result");
        if (result == null || !result.isObject()) {
            throw new QdrantDecodeException("The given key 'result' does not exist or is not an object.",
                    reply.statusCode());
        }
        return convert(result, Point.class, reply);
    }

    /**
     * Fetch points by id. Ids the server does not know are left out of the result.
     */
    public List<Point> getPoints(String collectionName, Collection<PointId> ids) {
        log.info("get points from collection '{}'", collectionName);

        ObjectNode root = objectMapper.createObjectNode();
        root.set("ids", objectMapper.valueToTree(ids));
        root.put("with_payload", true);
        root.put("with_vector", true);

        Reply reply = send("POST", collectionPath(collectionName) + "/points", root);
        requireSuccess(reply, "Failed to get points");

        JsonNode result = readJson(reply).get("result");
        if (result == null || !result.isArray()) {
            throw new QdrantDecodeException("The given key 'result' does not exist or is not an array.",
                    reply.statusCode());
        }
        List<Point> points = new ArrayList<>();
        for (JsonNode pointNode : result) {
            points.add(convert(pointNode, Point.class, reply));
        }
        return points;
    }

    /**
     * Delete points by id and wait for the server to apply it. Unknown ids are ignored by the server.
     */
    public void deletePoints(String collectionName, Collection<PointId> ids) {
        log.info("delete points from collection '{}'", collectionName);

        ObjectNode root = objectMapper.createObjectNode();
        root.set("points", objectMapper.valueToTree(ids));

        Reply reply = send("POST", collectionPath(collectionName) + "/points/delete?wait=true", root);
        requireSuccess(reply, "Failed to delete points");
    }

    public List<ScoredPoint> searchPoints(String collectionName, List<Float> vector, long limit) {
        return searchPoints(collectionName, vector, limit, 0.0f);
    }

    /**
     * Search the collection by vector. Hits carry vector and payload and keep the server's order.
     *
     * @param scoreThreshold applied by the server; hits are not filtered again here
     */
    public List<ScoredPoint> searchPoints(String collectionName, List<Float> vector, long limit,
                                          float scoreThreshold) {
        log.info("search points in collection '{}'", collectionName);

        ObjectNode root = objectMapper.createObjectNode();
        root.set("vector", objectMapper.valueToTree(vector));
        root.put("limit", limit);
        root.put("with_payload", true);
        root.put("with_vector", true);
        root.put("score_threshold", scoreThreshold);

        Reply reply = send("POST", collectionPath(collectionName) + "/points/search", root);
        requireSuccess(reply, "Failed to search points");

        JsonNode result = readJson(reply).get("result");
        if (result == null) {
            log.warn("The given key 'result' does not exist in the search response of collection '{}'",
                    collectionName);
            return new ArrayList<>();
        }
        if (!result.isArray()) {
            throw new QdrantDecodeException("The value corresponding to the 'result' key is not an array.",
                    reply.statusCode());
        }

        List<ScoredPoint> hits = new ArrayList<>();
        for (JsonNode hitNode : result) {
            if (!hitNode.path("score").isNumber()) {
                throw new QdrantDecodeException("Search hit without a 'score': " + hitNode, reply.statusCode());
            }
            hits.add(convert(hitNode, ScoredPoint.class, reply));
        }
        return hits;
    }

    private record Reply(int statusCode, String body) {

        boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }

    /**
     * Single place where requests are built: JSON content type, optional api-key header.
     */
    private Reply send(String method, String path, JsonNode body) {
        URI uri = URI.create(endpoint() + path);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json");
        if (apiKey != null) {
            builder.header(API_KEY_HEADER, apiKey);
        }
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(writeJson(body));
        HttpRequest request = builder.method(method, publisher).build();

        log.debug("{} {}", method, uri);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return new Reply(response.statusCode(), response.body());
        } catch (IOException e) {
            throw new QdrantTransportException(method + " " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QdrantCancelledException(method + " " + uri + " was interrupted", e);
        }
    }

    private void requireSuccess(Reply reply, String failure) {
        if (!reply.isSuccess()) {
            throw new QdrantRequestFailedException(
                    failure + ": " + reply.statusCode() + " body: " + reply.body(),
                    reply.statusCode(),
                    serverStatusOf(reply.body()));
        }
    }

    private JsonNode readJson(Reply reply) {
        if (reply.body() == null || reply.body().isBlank()) {
            throw new QdrantDecodeException("Empty response body", reply.statusCode());
        }
        try {
            return objectMapper.readTree(reply.body());
        } catch (JsonProcessingException e) {
            throw new QdrantDecodeException("Response body is not valid JSON: " + e.getOriginalMessage(),
                    reply.statusCode(), e);
        }
    }

    private boolean readBooleanResult(Reply reply) {
        JsonNode result = readJson(reply).get("result");
        if (result == null || !result.isBoolean()) {
            throw new QdrantDecodeException("The given key 'result' does not exist or is not a boolean.",
                    reply.statusCode());
        }
        return result.booleanValue();
    }

    private <T> T convert(JsonNode node, Class<T> type, Reply reply) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new QdrantDecodeException("Cannot decode " + type.getSimpleName() + ": " + e.getMessage(),
                    reply.statusCode(), e);
        }
    }

    private String writeJson(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new QdrantException("Failed to encode request body", e);
        }
    }

    /**
     * Qdrant reports failures as {"status": {"error": "..."}} and successes as {"status": "ok"}.
     * Returns null for bodies that are not JSON.
     */
    private String serverStatusOf(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode status;
        try {
            status = objectMapper.readTree(body).path("status");
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
        if (status.isTextual()) {
            return status.asText();
        }
        JsonNode error = status.path("error");
        return error.isTextual() ? error.asText() : null;
    }

    /**
     * Reject base URLs that cannot prefix a request URI, so the error shows at construction.
     */
    private static String validateBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid Qdrant base URL '" + baseUrl + "': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new IllegalArgumentException("Qdrant base URL must be an http(s) URL with a host: " + baseUrl);
        }
        return baseUrl;
    }

    private String endpoint() {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private static String collectionPath(String collectionName) {
        Objects.requireNonNull(collectionName, "collectionName");
        return "/collections/" + encode(collectionName);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
