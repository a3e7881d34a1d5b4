package io.auditchain.core.pool;

import io.auditchain.core.error.InvalidEventException;
import io.auditchain.core.error.QueueWriteException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.event.LoginPayload;
import io.auditchain.core.event.TradePayload;
import io.auditchain.core.event.TradeSide;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.storage.ForwardingChainStore;
import io.auditchain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class PendingPoolTest {

    private static AuditEvent trade(String id) {
        return AuditEvent.of(id, TradePayload.of("NVDA", TradeSide.BUY, BigDecimal.ONE, BigDecimal.TEN), System.currentTimeMillis());
    }

    @Test
    void duplicateIdsAreIgnored() {
        PendingPool pool = new PendingPool(new InMemoryChainStore(), new EventValidator());
        double before = LedgerMetrics.registry().counter("ledger.events.duplicate").count();

        assertTrue(pool.record(trade("dup-1")));
        assertFalse(pool.record(trade("dup-1")));

        assertEquals(1, pool.size());
        assertTrue(pool.contains("dup-1"));
        assertEquals(before + 1, LedgerMetrics.registry().counter("ledger.events.duplicate").count());
    }

    @Test
    void disabledKindIsRejected() {
        PendingPool pool = new PendingPool(new InMemoryChainStore(),
                new EventValidator(EnumSet.of(EventKind.TRADE), EventValidator.DEFAULT_MAX_FUTURE_SKEW_MILLIS));
        AuditEvent login = AuditEvent.of(new LoginPayload("frank", true, null, null));

        InvalidEventException ex = assertThrows(InvalidEventException.class, () -> pool.record(login));
        assertEquals("kind", ex.getField());
        assertTrue(ex.getMessage().contains(EventValidator.KIND_DISABLED));
        assertEquals(0, pool.size());
        assertTrue(pool.record(trade("ok")));
    }

    @Test
    void farFutureTimestampIsRejected() {
        PendingPool pool = new PendingPool(new InMemoryChainStore(), new EventValidator());
        AuditEvent late = AuditEvent.of("f-1", TradePayload.of("NVDA", TradeSide.SELL, BigDecimal.ONE, BigDecimal.ONE),
                System.currentTimeMillis() + EventValidator.DEFAULT_MAX_FUTURE_SKEW_MILLIS * 2);

        InvalidEventException ex = assertThrows(InvalidEventException.class, () -> pool.record(late));
        assertEquals("created_at", ex.getField());
        assertEquals(0, pool.size());
    }

    @Test
    void storageFailureSurfacesAsQueueWriteError() {
        ForwardingChainStore failing = new ForwardingChainStore(new InMemoryChainStore()) {
            @Override
            public boolean appendPending(AuditEvent event) {
                throw new QueueWriteException(event.id(), new IllegalStateException("disk full"));
            }
        };
        PendingPool pool = new PendingPool(failing, new EventValidator());

        assertThrows(QueueWriteException.class, () -> pool.record(trade("w-1")));
        assertEquals(0, pool.size());
    }
}
