package io.auditchain.core.protocol;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.LoginPayload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockTest {

    @Test
    void hashCoversEveryField() {
        AuditEvent login = AuditEvent.of("l-1", new LoginPayload("carol", true, null, null), 42L);
        Block block = Block.candidate(1, 1_000L, List.of(login), Block.GENESIS_PREVIOUS_HASH);
        String base = block.computeHash();

        assertEquals(64, base.length());
        assertEquals(base, base.toLowerCase());
        assertNotEquals(base, block.withNonce(1, "x").computeHash());
        assertNotEquals(base, new Block(2, 1_000L, block.serializedTransactions(), block.previousHash(), 0, "x").computeHash());
        assertNotEquals(base, new Block(1, 1_001L, block.serializedTransactions(), block.previousHash(), 0, "x").computeHash());
        assertNotEquals(base, new Block(1, 1_000L, "[]", block.previousHash(), 0, "x").computeHash());
        assertNotEquals(base, new Block(1, 1_000L, block.serializedTransactions(), "1".repeat(64), 0, "x").computeHash());
    }

    @Test
    void codecKeepsSerializedTransactionsVerbatim() {
        AuditEvent login = AuditEvent.of("l-2", new LoginPayload("dave", false, "192.168.1.7", null), 77L);
        Block candidate = Block.candidate(3, 5_000L, List.of(login), "a".repeat(64));
        Block block = candidate.withNonce(9, candidate.withNonce(9, "").computeHash());

        Block decoded = BlockCodec.fromBytes(BlockCodec.toBytes(block));
        assertEquals(block.serializedTransactions(), decoded.serializedTransactions());
        assertEquals(block.hash(), decoded.hash());
        assertEquals(block.hash(), decoded.computeHash());
        assertEquals(List.of(login), decoded.transactions());
    }

    @Test
    void meetsDifficultyCountsHexZeros() {
        assertTrue(Hashes.meetsDifficulty("00ab", 2));
        assertFalse(Hashes.meetsDifficulty("0ab0", 2));
        assertTrue(Hashes.meetsDifficulty("ffff", 0));
    }

    @Test
    void toStringShowsIndexAndShortHashInAscii() {
        Block block = new Block(7, 1_000L, "[]", Block.GENESIS_PREVIOUS_HASH, 0, "abcdef0123456789" + "0".repeat(48));
        assertEquals("Block{index=7, hash=abcdef012345...}", block.toString());
    }
}
