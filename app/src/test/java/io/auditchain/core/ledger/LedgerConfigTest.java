package io.auditchain.core.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.query.SensitiveDataMasker;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LedgerConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        LedgerConfig config = LedgerConfig.defaultLocal();
        assertEquals(300L, config.miningIntervalSeconds);
        assertEquals(2, config.difficulty);
        assertEquals(500, config.maxBlockSize);
        assertTrue(config.autoMine);
        assertEquals(EnumSet.allOf(EventKind.class), config.recordTypes);
        assertEquals(SensitiveDataMasker.DEFAULT_KEYS, config.sensitiveKeys);
    }

    @Test
    void loadsFileAndIgnoresUnknownKeys() throws Exception {
        Path file = Path.of(getClass().getResource("/ledger-config-test.json").toURI());
        LedgerConfig config = LedgerConfig.load(file);

        assertEquals(60L, config.miningIntervalSeconds);
        assertEquals(1, config.difficulty);
        assertEquals(50, config.maxBlockSize);
        assertFalse(config.autoMine);
        assertEquals(Duration.ofSeconds(5), config.miningTimeout);
        assertEquals(EnumSet.of(EventKind.TRADE, EventKind.LOGIN), config.recordTypes);
        assertEquals(100L, config.maxChainSize);
        assertEquals(Set.of("passphrase", "secret"), config.sensitiveKeys);
        // untouched keys keep their defaults
        assertTrue(config.verifyOnStart);
    }

    @Test
    void rejectsBadValues() {
        ObjectMapper mapper = new ObjectMapper();
        LedgerConfig base = LedgerConfig.defaultLocal();
        assertThrows(IllegalArgumentException.class,
                () -> LedgerConfig.fromJson(mapper.readTree("{\"difficulty\": 65}"), base));
        assertThrows(IllegalArgumentException.class,
                () -> LedgerConfig.fromJson(mapper.readTree("{\"auto_mine\": \"yes\"}"), base));
        assertThrows(IllegalArgumentException.class,
                () -> LedgerConfig.fromJson(mapper.readTree("{\"record_types\": []}"), base));
        assertThrows(IllegalArgumentException.class,
                () -> LedgerConfig.fromJson(mapper.readTree("{\"max_block_size\": 0}"), base));
        assertThrows(IllegalArgumentException.class,
                () -> LedgerConfig.fromJson(mapper.readTree("{\"sensitive_keys\": \"password\"}"), base));
        assertThrows(IllegalArgumentException.class,
                () -> LedgerConfig.fromJson(mapper.readTree("{\"sensitive_keys\": [\"\"]}"), base));
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.load(Path.of("does-not-exist.json")));
    }
}
