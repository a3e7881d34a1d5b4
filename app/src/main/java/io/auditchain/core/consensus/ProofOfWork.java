package io.auditchain.core.consensus;

import io.auditchain.core.error.MiningTimeoutException;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.Hashes;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.time.Duration;

/**
 * Bounded proof-of-work search.
 *
 * Difficulty is a count of leading zero hex digits, i.e. 4 * difficulty leading zero bits in the
 * raw SHA-256. The nonce is searched upward from 0 until the hash qualifies or the attempt ceiling
 * or wall-clock budget runs out. There is no partial result: a search that runs out throws.
 */
public final class ProofOfWork {

    /** How many nonces to try between deadline checks. */
    private static final int CLOCK_CHECK_INTERVAL = 4096;

    /** Quick check: does this block's stored hash meet the difficulty? */
    public boolean meetsTarget(Block block, int difficulty) {
        return Hashes.meetsDifficulty(block.hash(), difficulty);
    }

    /**
     * Search for a nonce that satisfies {@code difficulty}.
     *
     * @return a NEW block carrying the winning nonce and hash
     * @throws MiningTimeoutException when {@code maxAttempts} or {@code timeout} is exhausted,
     *                                or the calling thread is interrupted
     */
    public Block mine(Block template, int difficulty, long maxAttempts, Duration timeout) {
        if (template == null) throw new IllegalArgumentException("template required");
        int requiredBits = toRequiredBits(difficulty);
        long startNanos = System.nanoTime();
        long deadline = startNanos + timeout.toNanos();

        byte[] prefix = Hashes.preimagePrefix(template.index(), template.timestamp(),
                template.serializedTransactions(), template.previousHash());
        MessageDigest digest = Hashes.newSha256();
        ByteBuffer nonceBuf = ByteBuffer.allocate(8);

        long attempts = 0;
        for (long nonce = 0; attempts < maxAttempts; nonce++) {
            attempts++;
            digest.update(prefix);
            nonceBuf.clear();
            nonceBuf.putLong(nonce);
            digest.update(nonceBuf.array());
            byte[] hash = digest.digest();
            if (hasLeadingZeroBits(hash, requiredBits)) {
                return template.withNonce(nonce, Hashes.toHex(hash));
            }
            if (attempts % CLOCK_CHECK_INTERVAL == 0) {
                if (Thread.currentThread().isInterrupted() || System.nanoTime() - deadline > 0) {
                    break;
                }
            }
        }
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        throw new MiningTimeoutException(template.index(), attempts, elapsedMillis);
    }

    // ---------- helpers ----------

    /** Hex digits to bits, clamped to the SHA-256 width. */
    private static int toRequiredBits(int difficulty) {
        if (difficulty < 0) return 0;
        if (difficulty > 64) return 256;
        return difficulty * 4;
    }

    /**
     * Check for N leading zero bits in the hash.
     * Fast path: count whole zero bytes, then the first non-zero byte's leading zeros.
     */
    static boolean hasLeadingZeroBits(byte[] hash, int requiredBits) {
        if (requiredBits <= 0) return true;
        if (requiredBits > 256) return false;

        int fullBytes = requiredBits / 8;
        int remBits = requiredBits % 8;

        for (int i = 0; i < fullBytes; i++) {
            if (hash[i] != 0) return false;
        }
        if (remBits == 0) return true;

        int next = hash[fullBytes] & 0xff;
        return leadingZeroBitsInByte(next) >= remBits;
    }

    /** Number of leading zero bits in a single byte (0..8). */
    private static int leadingZeroBitsInByte(int b) {
        if (b == 0) return 8;
        int n = 0;
        for (int mask = 0x80; mask != 0; mask >>= 1) {
            if ((b & mask) == 0) n++; else break;
        }
        return n;
    }
}
