package io.auditchain.core.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MinerStatus(
        @JsonProperty("auto_mine") boolean autoMine,
        @JsonProperty("mining") boolean mining,
        @JsonProperty("halted") boolean halted,
        @JsonProperty("halt_reason") String haltReason,
        @JsonProperty("consecutive_failures") int consecutiveFailures,
        @JsonProperty("last_mined_at") Long lastMinedAt,
        @JsonProperty("last_status") MiningResult.Status lastStatus
) {
}
