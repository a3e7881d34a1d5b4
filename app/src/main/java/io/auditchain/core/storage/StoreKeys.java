package io.auditchain.core.storage;

import io.auditchain.core.event.EventKind;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Binary key layouts for {@link RocksDBChainStore}. Numbers are big-endian so RocksDB's bytewise
 * ordering matches numeric ordering (indices are never negative).
 */
final class StoreKeys {
    private StoreKeys() {}

    static final byte[] META_TIP = utf8("tip");
    static final byte[] META_FIRST = utf8("first");
    static final byte[] META_CHECKPOINT = utf8("checkpoint");

    static byte[] longKey(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    static long readLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }

    static byte[] positionKey(long blockIndex, int position) {
        return ByteBuffer.allocate(12).putLong(blockIndex).putInt(position).array();
    }

    static EventPosition readPosition(byte[] key, int offset) {
        ByteBuffer b = ByteBuffer.wrap(key, offset, 12);
        return new EventPosition(b.getLong(), b.getInt());
    }

    static byte[] kindKey(EventKind kind, long blockIndex, int position) {
        return ByteBuffer.allocate(13).put((byte) kind.ordinal()).putLong(blockIndex).putInt(position).array();
    }

    static byte[] countKey(EventKind kind) {
        return utf8("count:" + kind.name());
    }

    static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /** Smallest key strictly greater than {@code key}. */
    static byte[] successor(byte[] key) {
        return Arrays.copyOf(key, key.length + 1);
    }

    /** Unsigned lexicographic compare, same order RocksDB uses by default. */
    static int compare(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }

    /** Per-block created_at range and event count, used to skip blocks during time-bounded scans. */
    record BlockSummary(long index, long minCreatedAt, long maxCreatedAt, int count) {

        byte[] toBytes() {
            return ByteBuffer.allocate(20).putLong(minCreatedAt).putLong(maxCreatedAt).putInt(count).array();
        }

        static BlockSummary read(byte[] key, byte[] value) {
            ByteBuffer b = ByteBuffer.wrap(value);
            return new BlockSummary(readLong(key), b.getLong(), b.getLong(), b.getInt());
        }
    }

    /** events CF value: hash length, block hash, event JSON. */
    static byte[] eventValue(String blockHash, byte[] eventJson) {
        byte[] hash = utf8(blockHash);
        return ByteBuffer.allocate(4 + hash.length + eventJson.length)
                .putInt(hash.length).put(hash).put(eventJson).array();
    }

    static String eventValueHash(byte[] value) {
        int len = ByteBuffer.wrap(value).getInt();
        return new String(value, 4, len, StandardCharsets.UTF_8);
    }

    static byte[] eventValueJson(byte[] value) {
        int len = ByteBuffer.wrap(value).getInt();
        return Arrays.copyOfRange(value, 4 + len, value.length);
    }
}
