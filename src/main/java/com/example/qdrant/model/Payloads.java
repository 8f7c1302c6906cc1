package com.example.qdrant.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brings a payload into the form Jackson produces when decoding it: ints as Integer (Long/BigInteger
 * when larger), decimals as Double, nested objects as LinkedHashMap, arrays as ArrayList.
 * Encoding and decoding a point therefore yields an equal point.
 */
final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private Payloads() {
    }

    static Map<String, Object> normalize(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        try {
            // text round trip: convertValue would keep Long and Float as given
            LinkedHashMap<String, Object> decoded = MAPPER.readValue(MAPPER.writeValueAsBytes(payload), PAYLOAD_TYPE);
            return Collections.unmodifiableMap(decoded);
        } catch (IOException e) {
            throw new IllegalArgumentException("Payload is not representable as JSON: " + e.getMessage(), e);
        }
    }
}
