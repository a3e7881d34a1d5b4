package io.auditchain.core.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.auditchain.core.ledger.MinerStatus;
import io.auditchain.core.storage.Checkpoint;
import io.auditchain.core.verify.VerificationResult;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerStats(
        @JsonProperty("block_count") long blockCount,
        @JsonProperty("first_index") long firstIndex,
        @JsonProperty("tip_index") Long tipIndex,
        @JsonProperty("tip_hash") String tipHash,
        @JsonProperty("pending_count") long pendingCount,
        @JsonProperty("counts_by_kind") Map<String, Long> countsByKind,
        @JsonProperty("total_transactions") long totalTransactions,
        @JsonProperty("storage_bytes") long storageBytes,
        @JsonProperty("first_block_time") Long firstBlockTime,
        @JsonProperty("last_block_time") Long lastBlockTime,
        @JsonProperty("avg_transactions_per_block") double avgTransactionsPerBlock,
        @JsonProperty("miner") MinerStatus miner,
        @JsonProperty("checkpoint") Checkpoint checkpoint,
        @JsonProperty("last_verification") VerificationResult lastVerification
) {
}
