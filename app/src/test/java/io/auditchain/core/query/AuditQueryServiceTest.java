package io.auditchain.core.query;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.ConfigChangePayload;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.event.LoginPayload;
import io.auditchain.core.event.TradePayload;
import io.auditchain.core.event.TradeSide;
import io.auditchain.core.ledger.GenesisBuilder;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.EventPosition;
import io.auditchain.core.storage.InMemoryChainStore;
import io.auditchain.core.verify.ChainVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditQueryServiceTest {

    // 2024-03-01T00:00:00Z
    private static final long DAY_ONE = 1_709_251_200_000L;
    private static final long DAY = 86_400_000L;

    private InMemoryChainStore store;
    private AuditQueryService queries;

    @BeforeEach
    void setUp() {
        store = new InMemoryChainStore();
        store.append(GenesisBuilder.buildGenesis(DAY_ONE));
        queries = new AuditQueryService(store, new ChainVerifier(store, 0), null);
    }

    private static AuditEvent trade(String id, long createdAt) {
        return AuditEvent.of(id, TradePayload.of("AMZN", TradeSide.BUY, BigDecimal.ONE, new BigDecimal("178")), createdAt);
    }

    private static AuditEvent login(String id, long createdAt) {
        return AuditEvent.of(id, new LoginPayload("grace", true, null, null), createdAt);
    }

    private void commit(AuditEvent... events) {
        Block tip = store.getTip().orElseThrow();
        Block candidate = Block.candidate(tip.index() + 1, tip.timestamp() + 1, List.of(events), tip.hash());
        store.append(candidate.withNonce(0, candidate.computeHash()));
    }

    @Test
    void trailAndReportMaskCredentialValues() {
        commit(AuditEvent.of("c-1", new ConfigChangePayload("gateway", "admin_password", "old-pw", "new-pw", "root"), DAY_ONE + 1));

        AuditEntry entry = queries.getAuditTrail(AuditQuery.all(10)).entries().get(0);
        ConfigChangePayload shown = (ConfigChangePayload) entry.event().payload();
        assertEquals(SensitiveDataMasker.MASK, shown.oldValue());
        assertEquals(SensitiveDataMasker.MASK, shown.newValue());
        assertEquals("root", shown.changedBy());

        AuditReport report = queries.generateReport(null, null, null, true);
        ConfigChangePayload reported = (ConfigChangePayload) report.events().get(0).event().payload();
        assertEquals(SensitiveDataMasker.MASK, reported.newValue());
    }

    @Test
    void pagesThroughTrailInCommitOrder() {
        commit(trade("a", DAY_ONE + 1), login("b", DAY_ONE + 2), trade("c", DAY_ONE + 3));
        commit(trade("d", DAY_ONE + 4), login("e", DAY_ONE + 5));

        AuditPage first = queries.getAuditTrail(AuditQuery.all(2));
        assertEquals(List.of("a", "b"), ids(first));
        assertTrue(first.hasMore());

        AuditPage second = queries.getAuditTrail(AuditQuery.all(2).withCursor(first.nextCursor()));
        assertEquals(List.of("c", "d"), ids(second));
        assertEquals(1L, second.entries().get(1).blockIndex());

        AuditPage last = queries.getAuditTrail(AuditQuery.all(2).withCursor(second.nextCursor()));
        assertEquals(List.of("e"), ids(last));
        assertNull(last.nextCursor());
    }

    @Test
    void exactlyFullLastPageHasNoCursor() {
        commit(trade("a", DAY_ONE + 1), trade("b", DAY_ONE + 2));
        AuditPage page = queries.getAuditTrail(AuditQuery.all(2));
        assertEquals(2, page.entries().size());
        assertFalse(page.hasMore());
    }

    @Test
    void cursorStaysValidWhileBlocksAreAdded() {
        commit(trade("a", DAY_ONE + 1), trade("b", DAY_ONE + 2), trade("c", DAY_ONE + 3));
        AuditPage first = queries.getAuditTrail(AuditQuery.all(2));

        commit(trade("d", DAY_ONE + 4));
        commit(trade("e", DAY_ONE + 5));

        List<String> seen = new ArrayList<>(ids(first));
        String cursor = first.nextCursor();
        while (cursor != null) {
            AuditPage page = queries.getAuditTrail(AuditQuery.all(2).withCursor(cursor));
            seen.addAll(ids(page));
            cursor = page.nextCursor();
        }
        assertEquals(List.of("a", "b", "c", "d", "e"), seen);
    }

    @Test
    void filtersByKindAndTimeRange() {
        commit(trade("a", DAY_ONE + 10), login("b", DAY_ONE + 20), trade("c", DAY_ONE + 30));
        commit(trade("d", DAY_ONE + DAY + 5));

        assertEquals(List.of("a", "c", "d"), ids(queries.getAuditTrail(AuditQuery.ofKind(EventKind.TRADE, 10))));
        AuditPage window = queries.getAuditTrail(new AuditQuery(EventKind.TRADE, DAY_ONE + 15, DAY_ONE + DAY, 10, null));
        assertEquals(List.of("c"), ids(window));
    }

    @Test
    void rejectsMalformedQueries() {
        assertThrows(IllegalArgumentException.class, () -> new AuditQuery(null, 10L, 5L, 10, null));
        assertThrows(IllegalArgumentException.class, () -> queries.getAuditTrail(AuditQuery.all(10).withCursor("%%%")));
        assertThrows(IllegalArgumentException.class, () -> AuditCursor.decode("djI6MTox"));
        assertEquals(AuditQuery.MAX_LIMIT, new AuditQuery(null, null, null, 50_000, null).limit());
    }

    @Test
    void cursorEncodesPosition() {
        EventPosition at = new EventPosition(42, 7);
        assertEquals(at, AuditCursor.decode(AuditCursor.encode(at)));
    }

    @Test
    void reportCountsByKindAndDay() {
        commit(trade("a", DAY_ONE + 10), login("b", DAY_ONE + 20));
        commit(trade("c", DAY_ONE + DAY + 5));

        AuditReport report = queries.generateReport(null, null, null, true);
        assertEquals(3, report.totalEvents());
        assertEquals(2L, report.countsByKind().get("trade"));
        assertEquals(1L, report.countsByKind().get("login"));
        assertEquals(2L, report.dailyCounts().get("2024-03-01"));
        assertEquals(1L, report.dailyCounts().get("2024-03-02"));
        assertEquals(DAY_ONE + 10, report.firstEventAt());
        assertEquals(DAY_ONE + DAY + 5, report.lastEventAt());
        assertEquals(3, report.events().size());

        AuditReport summary = queries.generateReport(EventKind.LOGIN, null, null, false);
        assertEquals("login", summary.kind());
        assertEquals(1, summary.totalEvents());
        assertNull(summary.events());
    }

    @Test
    void statsReflectChain() {
        commit(trade("a", DAY_ONE + 1), login("b", DAY_ONE + 2));
        store.appendPending(trade("p", DAY_ONE + 3));

        LedgerStats stats = queries.getStats();
        assertEquals(2, stats.blockCount());
        assertEquals(1L, stats.tipIndex());
        assertEquals(1, stats.pendingCount());
        assertEquals(2, stats.totalTransactions());
        assertEquals(1.0, stats.avgTransactionsPerBlock());
        assertEquals(DAY_ONE, stats.firstBlockTime());
    }

    private static List<String> ids(AuditPage page) {
        return page.entries().stream().map(e -> e.event().id()).toList();
    }
}
