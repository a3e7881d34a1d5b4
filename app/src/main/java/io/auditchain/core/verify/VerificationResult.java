package io.auditchain.core.verify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one verification run. On failure {@code failedIndex}, {@code failedCheck} and
 * {@code message} say where and why; the counts cover the blocks checked before it stopped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("chain_length") long chainLength,
        @JsonProperty("transaction_count") long transactionCount,
        @JsonProperty("checked_at") long checkedAt,
        @JsonProperty("failed_index") Long failedIndex,
        @JsonProperty("failed_check") VerificationCheck failedCheck,
        @JsonProperty("message") String message
) {
    public static VerificationResult ok(long chainLength, long transactionCount, long checkedAt) {
        return new VerificationResult(true, chainLength, transactionCount, checkedAt, null, null, null);
    }

    public static VerificationResult failure(long chainLength, long transactionCount, long checkedAt,
                                             long failedIndex, VerificationCheck check, String message) {
        return new VerificationResult(false, chainLength, transactionCount, checkedAt, failedIndex, check, message);
    }
}
