package com.apiplatform.common.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonUtilsTest {

    public static class ApiChange {
        public String name;
        public Instant changedAt;
    }

    @Test
    void testDatesWrittenAsIsoStrings() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("at", Instant.parse("2025-01-01T00:00:00Z"));

        byte[] json = JsonUtils.toJsonBytes(payload);

        assertEquals("{\"at\":\"2025-01-01T00:00:00Z\"}", new String(json, StandardCharsets.UTF_8));
    }

    @Test
    void testUnknownPropertiesIgnored() {
        byte[] json = "{\"name\":\"orders\",\"changedAt\":\"2025-01-01T00:00:00Z\",\"extra\":1}"
                .getBytes(StandardCharsets.UTF_8);

        ApiChange change = JsonUtils.fromJsonBytes(json, ApiChange.class);

        assertEquals("orders", change.name);
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), change.changedAt);
    }

    @Test
    void testMalformedPayload() {
        byte[] json = "not json".getBytes(StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> JsonUtils.fromJsonBytes(json, ApiChange.class));
    }
}
