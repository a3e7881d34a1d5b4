package io.auditchain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Block hashing.
 *
 * Preimage layout (all integers big-endian):
 * <pre>
 *   index(8) || timestamp(8) || len(4) || utf8(serializedTransactions) || len(4) || utf8(previousHash) || nonce(8)
 * </pre>
 * The nonce goes last so the miner can hash a fixed prefix and only append the nonce per attempt.
 */
public final class Hashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashes() {}

    public static byte[] sha256(byte[] in) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /** Everything in the preimage except the trailing nonce. */
    public static byte[] preimagePrefix(long index, long timestamp, String serializedTransactions, String previousHash) {
        byte[] txs = serializedTransactions.getBytes(StandardCharsets.UTF_8);
        byte[] prev = previousHash.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(8 + 8 + 4 + txs.length + 4 + prev.length);
        buf.putLong(index);
        buf.putLong(timestamp);
        buf.putInt(txs.length);
        buf.put(txs);
        buf.putInt(prev.length);
        buf.put(prev);
        return buf.array();
    }

    public static String blockHash(long index, long timestamp, String serializedTransactions, String previousHash, long nonce) {
        MessageDigest digest = newSha256();
        digest.update(preimagePrefix(index, timestamp, serializedTransactions, previousHash));
        digest.update(longToBytes(nonce));
        return toHex(digest.digest());
    }

    static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    public static String toHex(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    /** True when the hex hash starts with at least {@code difficulty} '0' digits. */
    public static boolean meetsDifficulty(String hexHash, int difficulty) {
        if (difficulty <= 0) return true;
        if (hexHash == null || hexHash.length() < difficulty) return false;
        for (int i = 0; i < difficulty; i++) {
            if (hexHash.charAt(i) != '0') return false;
        }
        return true;
    }
}
