package io.auditchain.core.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.EventCodec;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.Checkpoint;
import io.auditchain.core.storage.CommittedEvent;
import io.auditchain.core.storage.EventFilter;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Streams the retained chain out as JSON (one object per block, transactions embedded exactly
 * as they were hashed) or CSV (one row per committed event). The target stream is flushed but
 * left open.
 *
 * Sensitive values are masked in both formats. A JSON block whose transactions had to be masked
 * carries {@code "redacted": true}; its hash can no longer be recomputed from the export.
 */
public final class LedgerExporter {
    private static final Logger LOG = Logger.getLogger(LedgerExporter.class.getName());

    private static final CsvMapper CSV = CsvMapper.builder()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .build();
    private static final CsvSchema ROW_SCHEMA = CSV.schemaFor(CsvRow.class).withHeader();

    private final ChainStore store;
    private final SensitiveDataMasker masker;

    public LedgerExporter(ChainStore store) {
        this(store, SensitiveDataMasker.defaults());
    }

    public LedgerExporter(ChainStore store, SensitiveDataMasker masker) {
        this.store = store;
        this.masker = masker;
    }

    public void export(ExportFormat format, OutputStream out) throws IOException {
        switch (format) {
            case JSON -> exportJson(out);
            case CSV -> exportCsv(out);
        }
    }

    private void exportJson(OutputStream out) throws IOException {
        Optional<Block> tip = store.getTip();
        long first = store.firstIndex();
        long end = tip.map(b -> b.index() + 1).orElse(first);
        long blocks = 0;
        try (JsonGenerator gen = EventCodec.mapper().getFactory().createGenerator(out)) {
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            gen.writeStartObject();
            gen.writeNumberField("exported_at", System.currentTimeMillis());
            gen.writeNumberField("first_index", first);
            if (tip.isPresent()) {
                gen.writeNumberField("tip_index", tip.get().index());
            }
            Optional<Checkpoint> cp = store.getCheckpoint();
            if (cp.isPresent()) {
                gen.writeFieldName("checkpoint");
                EventCodec.mapper().writeValue(gen, cp.get());
            }
            gen.writeArrayFieldStart("blocks");
            for (Block block : store.iterate(first, end)) {
                gen.writeStartObject();
                gen.writeNumberField("index", block.index());
                gen.writeNumberField("timestamp", block.timestamp());
                gen.writeStringField("previous_hash", block.previousHash());
                gen.writeNumberField("nonce", block.nonce());
                gen.writeStringField("hash", block.hash());
                List<AuditEvent> masked = masker.keys().isEmpty() ? null : masked(block);
                if (masked == null) {
                    gen.writeFieldName("transactions");
                    gen.writeRawValue(block.serializedTransactions());
                } else {
                    gen.writeBooleanField("redacted", true);
                    gen.writeFieldName("transactions");
                    EventCodec.mapper().writeValue(gen, masked);
                }
                gen.writeEndObject();
                blocks++;
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
        out.flush();
        final long exported = blocks;
        LOG.info(() -> "Exported " + exported + " blocks as JSON");
    }

    private void exportCsv(OutputStream out) throws IOException {
        long rows = 0;
        Iterator<CommittedEvent> it = store.eventsAfter(null, EventFilter.ALL);
        try (SequenceWriter writer = CSV.writer(ROW_SCHEMA).writeValues(out)) {
            while (it.hasNext()) {
                CommittedEvent ce = it.next();
                writer.write(new CsvRow(
                        ce.blockIndex(),
                        ce.position(),
                        ce.blockHash(),
                        ce.event().id(),
                        ce.event().kind().wireName(),
                        ce.event().createdAt(),
                        EventCodec.mapper().writeValueAsString(masker.redact(ce.event()).payload())));
                rows++;
            }
        }
        out.flush();
        final long exported = rows;
        LOG.info(() -> "Exported " + exported + " events as CSV");
    }

    // null when the block holds nothing sensitive
    private List<AuditEvent> masked(Block block) {
        List<AuditEvent> events = block.transactions();
        List<AuditEvent> redacted = masker.redactAll(events);
        return redacted.equals(events) ? null : redacted;
    }

    @JsonPropertyOrder({"block_index", "position", "block_hash", "event_id", "kind", "created_at", "payload"})
    public record CsvRow(
            @JsonProperty("block_index") long blockIndex,
            @JsonProperty("position") int position,
            @JsonProperty("block_hash") String blockHash,
            @JsonProperty("event_id") String eventId,
            @JsonProperty("kind") String kind,
            @JsonProperty("created_at") long createdAt,
            @JsonProperty("payload") String payload
    ) {
    }
}
