package io.auditchain.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.ConfigChangePayload;
import io.auditchain.core.event.LoginPayload;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SensitiveDataMaskerTest {

    private final SensitiveDataMasker masker = SensitiveDataMasker.defaults();

    private static AuditEvent configChange(String key, String oldValue, String newValue) {
        return AuditEvent.of("cfg-" + key, new ConfigChangePayload("broker", key, oldValue, newValue, "ops"), 5_000L);
    }

    @Test
    void matchesKeyNamesLoosely() {
        assertTrue(masker.isSensitive("password"));
        assertTrue(masker.isSensitive("DB_PASSWORD"));
        assertTrue(masker.isSensitive("apiKey"));
        assertTrue(masker.isSensitive("refresh-token"));
        assertFalse(masker.isSensitive("username"));
        assertFalse(masker.isSensitive("max_position"));
        assertFalse(masker.isSensitive(null));
    }

    @Test
    void masksValuesOfSensitiveConfigKeys() {
        AuditEvent event = configChange("broker.api_key", "old-key-123", "new-key-456");

        AuditEvent masked = masker.redact(event);

        ConfigChangePayload payload = (ConfigChangePayload) masked.payload();
        assertEquals(SensitiveDataMasker.MASK, payload.oldValue());
        assertEquals(SensitiveDataMasker.MASK, payload.newValue());
        assertEquals("broker.api_key", payload.key());
        assertEquals(event.id(), masked.id());
        assertEquals(event.createdAt(), masked.createdAt());
        // the original stays intact for hashing
        assertEquals("new-key-456", ((ConfigChangePayload) event.payload()).newValue());
    }

    @Test
    void masksNestedFieldsInsideStructuredValues() throws Exception {
        AuditEvent event = configChange("connection",
                "{\"host\":\"db1\"}",
                "{\"host\":\"db2\",\"auth\":{\"user\":\"svc\",\"password\":\"hunter2\"},\"tokens\":[{\"token\":\"t-1\"}]}");

        ConfigChangePayload payload = (ConfigChangePayload) masker.redact(event).payload();

        assertEquals("{\"host\":\"db1\"}", payload.oldValue());
        JsonNode updated = new ObjectMapper().readTree(payload.newValue());
        assertEquals("db2", updated.get("host").asText());
        assertEquals("svc", updated.get("auth").get("user").asText());
        assertEquals(SensitiveDataMasker.MASK, updated.get("auth").get("password").asText());
        assertEquals(SensitiveDataMasker.MASK, updated.get("tokens").get(0).get("token").asText());
        assertFalse(payload.newValue().contains("hunter2"));
    }

    @Test
    void leavesHarmlessEventsUntouched() {
        AuditEvent limit = configChange("max_position", "100", "{not json");
        AuditEvent login = AuditEvent.of("l-1", new LoginPayload("erin", true, "10.0.0.1", "password"), 5_000L);

        assertSame(limit, masker.redact(limit));
        assertSame(login, masker.redact(login));
        assertEquals(List.of(limit, login), masker.redactAll(List.of(limit, login)));
    }

    @Test
    void emptyKeySetDisablesMasking() {
        SensitiveDataMasker off = new SensitiveDataMasker(Set.of());
        AuditEvent event = configChange("password", "a", "b");

        assertSame(event, off.redact(event));
        assertFalse(off.isSensitive("password"));
    }
}
