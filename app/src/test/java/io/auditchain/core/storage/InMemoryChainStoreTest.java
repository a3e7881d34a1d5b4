package io.auditchain.core.storage;

import io.auditchain.core.protocol.Block;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryChainStoreTest extends ChainStoreContract {

    @Override
    protected ChainStore newStore() {
        return new InMemoryChainStore();
    }

    @Test
    void scanStopsAtTipSeenWhenStarted() {
        appendGenesis(store, 1_000L);
        store.append(nextBlock(store, 2_000L, List.of(trade("a", 1))));

        Iterator<CommittedEvent> it = store.eventsAfter(null, EventFilter.ALL);
        store.append(nextBlock(store, 3_000L, List.of(trade("b", 2))));

        assertEquals(List.of("a"), ids(it));
    }

    @Test
    void sizeTracksStoredBlocks() {
        assertEquals(0L, store.approximateSizeBytes());
        Block genesis = appendGenesis(store, 1_000L);
        assertTrue(store.approximateSizeBytes() > 0);
        assertEquals(genesis, store.getBlock(0).orElseThrow());
    }
}
