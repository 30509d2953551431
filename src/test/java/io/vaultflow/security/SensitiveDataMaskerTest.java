package io.vaultflow.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksSecretKeysAtAnyDepth() throws Exception {
        JsonNode input = Jsons.mapper().readTree(
                "{\"to\":\"client@example.com\",\"smtp\":{\"password\":\"pw\",\"host\":\"mail\"},"
                        + "\"headers\":[{\"Authorization\":\"Bearer x\"}],\"api_key\":\"k\"}");

        JsonNode masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("client@example.com", masked.path("to").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.path("smtp").path("password").asText());
        Assertions.assertEquals("mail", masked.path("smtp").path("host").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.path("headers").get(0).path("Authorization").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.path("api_key").asText());
    }

    @Test
    void masksOpaqueTokensButKeepsIds() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("approved_file", "APPROVAL_send_email_20260302_090000_1a2b");
        params.put("note", "ghp_A1b2C3d4E5f6G7h8I9j0K1l2M3n4");

        Map<String, Object> masked = SensitiveDataMasker.maskedParameters(params, 10, 100);

        Assertions.assertEquals("APPROVAL_send_email_20260302_090000_1a2b", masked.get("approved_file"));
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("note"));
    }

    @Test
    void boundsEntryCountAndLength() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("a", "short");
        params.put("b", Map.of("nested", "value-that-is-long"));
        params.put("c", 3);
        params.put("d", true);

        Map<String, Object> masked = SensitiveDataMasker.maskedParameters(params, 2, 10);

        Assertions.assertEquals("short", masked.get("a"));
        Assertions.assertEquals("{\"nested\":...", masked.get("b"));
        Assertions.assertEquals(2, masked.get(SensitiveDataMasker.TRUNCATED_KEY));
        Assertions.assertEquals(3, masked.size());
    }

    @Test
    void emptyParametersStayEmpty() {
        Assertions.assertTrue(SensitiveDataMasker.maskedParameters(null, 5, 5).isEmpty());
        Assertions.assertTrue(SensitiveDataMasker.masked(null).isNull());
    }
}
