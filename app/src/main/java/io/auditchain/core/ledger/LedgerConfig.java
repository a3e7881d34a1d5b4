package io.auditchain.core.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.query.SensitiveDataMasker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Simple config holder for a ledger.
 *
 * JSON keys (all optional, snake_case): mining_interval (seconds), difficulty, max_block_size,
 * auto_mine, mining_timeout (seconds), max_pow_attempts, record_types (array of kind names),
 * max_chain_size (0 = unlimited), prune_older_than_days (0 = never), mine_on_shutdown,
 * verify_on_start, sensitive_keys (field names masked on read and export; empty disables masking).
 */
public final class LedgerConfig {
    private static final Logger LOG = Logger.getLogger(LedgerConfig.class.getName());

    public static final int MAX_DIFFICULTY = 64;

    public final long miningIntervalSeconds;
    public final int difficulty;
    public final int maxBlockSize;
    public final boolean autoMine;
    public final Duration miningTimeout;
    public final long maxPowAttempts;
    public final Set<EventKind> recordTypes;
    public final long maxChainSize;
    public final int pruneOlderThanDays;
    public final boolean mineOnShutdown;
    public final boolean verifyOnStart;
    public final Set<String> sensitiveKeys;

    public LedgerConfig(long miningIntervalSeconds, int difficulty, int maxBlockSize, boolean autoMine,
                        Duration miningTimeout, long maxPowAttempts, Set<EventKind> recordTypes,
                        long maxChainSize, int pruneOlderThanDays, boolean mineOnShutdown, boolean verifyOnStart,
                        Set<String> sensitiveKeys) {
        if (miningIntervalSeconds <= 0) throw new IllegalArgumentException("mining_interval must be > 0");
        if (difficulty < 0 || difficulty > MAX_DIFFICULTY) {
            throw new IllegalArgumentException("difficulty must be between 0 and " + MAX_DIFFICULTY);
        }
        if (maxBlockSize <= 0) throw new IllegalArgumentException("max_block_size must be > 0");
        if (miningTimeout == null || miningTimeout.isNegative() || miningTimeout.isZero()) {
            throw new IllegalArgumentException("mining_timeout must be > 0");
        }
        if (maxPowAttempts <= 0) throw new IllegalArgumentException("max_pow_attempts must be > 0");
        if (recordTypes == null || recordTypes.isEmpty()) {
            throw new IllegalArgumentException("record_types must name at least one kind");
        }
        if (maxChainSize < 0) throw new IllegalArgumentException("max_chain_size must be >= 0");
        if (pruneOlderThanDays < 0) throw new IllegalArgumentException("prune_older_than_days must be >= 0");
        this.miningIntervalSeconds = miningIntervalSeconds;
        this.difficulty = difficulty;
        this.maxBlockSize = maxBlockSize;
        this.autoMine = autoMine;
        this.miningTimeout = miningTimeout;
        this.maxPowAttempts = maxPowAttempts;
        this.recordTypes = Collections.unmodifiableSet(EnumSet.copyOf(recordTypes));
        this.maxChainSize = maxChainSize;
        this.pruneOlderThanDays = pruneOlderThanDays;
        this.mineOnShutdown = mineOnShutdown;
        this.verifyOnStart = verifyOnStart;
        this.sensitiveKeys = sensitiveKeys == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sensitiveKeys));
    }

    public static LedgerConfig defaultLocal() {
        return new LedgerConfig(
                300L,                       // mine every five minutes
                2,                          // two leading zero hex digits
                500,                        // events per block cap
                true,                       // periodic mining on
                Duration.ofSeconds(30),     // wall-clock budget per PoW search
                50_000_000L,                // nonce attempts per search
                EnumSet.allOf(EventKind.class),
                0L,                         // no block-count retention
                0,                          // no age retention
                true,                       // flush pending events on close
                true,                       // verify the chain when starting
                SensitiveDataMasker.DEFAULT_KEYS
        );
    }

    public LedgerConfig withMiningInterval(long seconds) {
        return new LedgerConfig(seconds, difficulty, maxBlockSize, autoMine, miningTimeout, maxPowAttempts,
                recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withDifficulty(int newDifficulty) {
        return new LedgerConfig(miningIntervalSeconds, newDifficulty, maxBlockSize, autoMine, miningTimeout,
                maxPowAttempts, recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withMaxBlockSize(int size) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, size, autoMine, miningTimeout, maxPowAttempts,
                recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withAutoMine(boolean enabled) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, enabled, miningTimeout,
                maxPowAttempts, recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withMiningLimits(Duration timeout, long attempts) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, autoMine, timeout, attempts,
                recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withRecordTypes(Set<EventKind> kinds) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, autoMine, miningTimeout,
                maxPowAttempts, kinds, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withRetention(long maxBlocks, int olderThanDays) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, autoMine, miningTimeout,
                maxPowAttempts, recordTypes, maxBlocks, olderThanDays, mineOnShutdown, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withMineOnShutdown(boolean enabled) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, autoMine, miningTimeout,
                maxPowAttempts, recordTypes, maxChainSize, pruneOlderThanDays, enabled, verifyOnStart, sensitiveKeys);
    }

    public LedgerConfig withVerifyOnStart(boolean enabled) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, autoMine, miningTimeout,
                maxPowAttempts, recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, enabled, sensitiveKeys);
    }

    public LedgerConfig withSensitiveKeys(Set<String> keys) {
        return new LedgerConfig(miningIntervalSeconds, difficulty, maxBlockSize, autoMine, miningTimeout,
                maxPowAttempts, recordTypes, maxChainSize, pruneOlderThanDays, mineOnShutdown, verifyOnStart, keys);
    }

    /** Load a JSON config file; keys not present keep their defaults. */
    public static LedgerConfig load(Path file) {
        try {
            JsonNode root = new ObjectMapper().readTree(Files.readAllBytes(file));
            return fromJson(root, defaultLocal());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }
    }

    /** Overlay the keys present in {@code root} on top of {@code base}. */
    public static LedgerConfig fromJson(JsonNode root, LedgerConfig base) {
        if (root == null || root.isNull() || root.isMissingNode()) return base;
        if (!root.isObject()) throw new IllegalArgumentException("Config must be a JSON object");

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                LOG.warning(() -> "Ignoring unknown config key '" + name + "'");
            }
        }

        Set<EventKind> kinds = base.recordTypes;
        JsonNode types = root.get("record_types");
        if (types != null) {
            if (!types.isArray()) throw new IllegalArgumentException("record_types must be an array");
            kinds = EnumSet.noneOf(EventKind.class);
            for (JsonNode t : types) {
                kinds.add(EventKind.parse(t.asText()));
            }
        }
        Set<String> sensitive = base.sensitiveKeys;
        JsonNode sensitiveNode = root.get("sensitive_keys");
        if (sensitiveNode != null) {
            if (!sensitiveNode.isArray()) throw new IllegalArgumentException("sensitive_keys must be an array");
            sensitive = new LinkedHashSet<>();
            for (JsonNode k : sensitiveNode) {
                if (!k.isTextual() || k.asText().isBlank()) {
                    throw new IllegalArgumentException("sensitive_keys entries must be non-empty strings");
                }
                sensitive.add(k.asText());
            }
        }
        return new LedgerConfig(
                longValue(root, "mining_interval", base.miningIntervalSeconds),
                (int) longValue(root, "difficulty", base.difficulty),
                (int) longValue(root, "max_block_size", base.maxBlockSize),
                boolValue(root, "auto_mine", base.autoMine),
                Duration.ofSeconds(longValue(root, "mining_timeout", base.miningTimeout.getSeconds())),
                longValue(root, "max_pow_attempts", base.maxPowAttempts),
                kinds,
                longValue(root, "max_chain_size", base.maxChainSize),
                (int) longValue(root, "prune_older_than_days", base.pruneOlderThanDays),
                boolValue(root, "mine_on_shutdown", base.mineOnShutdown),
                boolValue(root, "verify_on_start", base.verifyOnStart),
                sensitive
        );
    }

    private static final Set<String> KNOWN_KEYS = Set.of(
            "mining_interval", "difficulty", "max_block_size", "auto_mine", "mining_timeout",
            "max_pow_attempts", "record_types", "max_chain_size", "prune_older_than_days",
            "mine_on_shutdown", "verify_on_start", "sensitive_keys");

    private static long longValue(JsonNode root, String key, long fallback) {
        JsonNode v = root.get(key);
        if (v == null || v.isNull()) return fallback;
        if (!v.canConvertToLong()) throw new IllegalArgumentException(key + " must be an integer");
        return v.asLong();
    }

    private static boolean boolValue(JsonNode root, String key, boolean fallback) {
        JsonNode v = root.get(key);
        if (v == null || v.isNull()) return fallback;
        if (!v.isBoolean()) throw new IllegalArgumentException(key + " must be true or false");
        return v.booleanValue();
    }

    @Override
    public String toString() {
        return "LedgerConfig{interval=" + miningIntervalSeconds + "s, difficulty=" + difficulty
                + ", maxBlockSize=" + maxBlockSize + ", autoMine=" + autoMine
                + ", timeout=" + miningTimeout.getSeconds() + "s, recordTypes=" + recordTypes + "}";
    }
}
