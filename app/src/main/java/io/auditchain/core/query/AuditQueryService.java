package io.auditchain.core.query;

import io.auditchain.core.event.EventKind;
import io.auditchain.core.ledger.MinerStatus;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.CommittedEvent;
import io.auditchain.core.storage.EventFilter;
import io.auditchain.core.storage.EventPosition;
import io.auditchain.core.verify.ChainVerifier;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Read side of the ledger. Everything here works on committed blocks only and never takes the
 * mining lock, so queries keep working while a block is being mined. Returned events pass
 * through a {@link SensitiveDataMasker}.
 */
public final class AuditQueryService {

    private final ChainStore store;
    private final ChainVerifier verifier;
    private final Supplier<MinerStatus> minerStatus;
    private final SensitiveDataMasker masker;

    public AuditQueryService(ChainStore store, ChainVerifier verifier, Supplier<MinerStatus> minerStatus) {
        this(store, verifier, minerStatus, SensitiveDataMasker.defaults());
    }

    public AuditQueryService(ChainStore store, ChainVerifier verifier, Supplier<MinerStatus> minerStatus,
                             SensitiveDataMasker masker) {
        if (store == null) throw new IllegalArgumentException("store");
        if (masker == null) throw new IllegalArgumentException("masker");
        this.store = store;
        this.verifier = verifier;
        this.minerStatus = minerStatus;
        this.masker = masker;
    }

    /**
     * Entries in (block index, position) order. Passing back {@code nextCursor} continues exactly
     * after the last entry returned, even if blocks were committed in between.
     */
    public AuditPage getAuditTrail(AuditQuery query) {
        EventPosition after = query.cursor() == null ? null : AuditCursor.decode(query.cursor());
        EventFilter filter = new EventFilter(query.kind(), query.startTime(), query.endTime());
        Iterator<CommittedEvent> it = store.eventsAfter(after, filter);
        List<AuditEntry> entries = new ArrayList<>(Math.min(query.limit(), 64));
        CommittedEvent last = null;
        while (entries.size() < query.limit() && it.hasNext()) {
            last = it.next();
            entries.add(AuditEntry.from(last, masker));
        }
        String next = last != null && entries.size() == query.limit() && it.hasNext()
                ? AuditCursor.encode(last.location())
                : null;
        return new AuditPage(entries, next);
    }

    public LedgerStats getStats() {
        Optional<Block> tip = store.getTip();
        long first = store.firstIndex();
        Map<String, Long> counts = wireCounts(store.kindCounts());
        long total = 0;
        for (long c : counts.values()) total += c;
        long blocks = store.blockCount();
        Long firstTime = store.getBlock(first).map(Block::timestamp).orElse(null);
        return new LedgerStats(
                blocks,
                first,
                tip.map(Block::index).orElse(null),
                tip.map(Block::hash).orElse(null),
                store.pendingCount(),
                counts,
                total,
                store.approximateSizeBytes(),
                firstTime,
                tip.map(Block::timestamp).orElse(null),
                blocks == 0 ? 0.0 : (double) total / blocks,
                minerStatus == null ? null : minerStatus.get(),
                store.getCheckpoint().orElse(null),
                verifier == null ? null : verifier.lastResult()
        );
    }

    /** Streams every matching committed event once; memory is bounded by the sample size. */
    public AuditReport generateReport(EventKind kind, Long startTime, Long endTime, boolean detailed) {
        if (startTime != null && endTime != null && startTime > endTime) {
            throw new IllegalArgumentException("startTime must not be after endTime");
        }
        Map<EventKind, Long> byKind = new TreeMap<>();
        Map<String, Long> daily = new TreeMap<>();
        List<AuditEntry> sample = new ArrayList<>();
        long totalEvents = 0;
        Long firstAt = null;
        Long lastAt = null;

        Iterator<CommittedEvent> it = store.eventsAfter(null, new EventFilter(kind, startTime, endTime));
        while (it.hasNext()) {
            CommittedEvent ce = it.next();
            long createdAt = ce.event().createdAt();
            totalEvents++;
            byKind.merge(ce.event().kind(), 1L, Long::sum);
            firstAt = firstAt == null ? createdAt : Math.min(firstAt, createdAt);
            lastAt = lastAt == null ? createdAt : Math.max(lastAt, createdAt);
            if (detailed) {
                String day = Instant.ofEpochMilli(createdAt).atZone(ZoneOffset.UTC).toLocalDate().toString();
                daily.merge(day, 1L, Long::sum);
                if (sample.size() < AuditReport.DETAILED_EVENT_LIMIT) {
                    sample.add(AuditEntry.from(ce, masker));
                }
            }
        }
        return new AuditReport(
                kind == null ? null : kind.wireName(),
                startTime,
                endTime,
                System.currentTimeMillis(),
                totalEvents,
                wireCounts(byKind),
                firstAt,
                lastAt,
                detailed ? daily : null,
                detailed ? sample : null
        );
    }

    private static Map<String, Long> wireCounts(Map<EventKind, Long> counts) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (EventKind kind : EventKind.values()) {
            Long c = counts.get(kind);
            if (c != null && c > 0) out.put(kind.wireName(), c);
        }
        return out;
    }
}
