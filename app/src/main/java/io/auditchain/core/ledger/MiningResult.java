package io.auditchain.core.ledger;

import io.auditchain.core.protocol.Block;

/** What one mining attempt did. {@code block} is set only for {@link Status#MINED}. */
public record MiningResult(Status status, Block block, String message) {

    public enum Status {
        MINED,
        NOTHING_PENDING,
        TIMED_OUT,
        FAILED,
        HALTED
    }

    public static MiningResult mined(Block block) {
        return new MiningResult(Status.MINED, block, "Mined block " + block.index());
    }

    public static MiningResult nothingPending() {
        return new MiningResult(Status.NOTHING_PENDING, null, "No pending events");
    }

    public static MiningResult timedOut(String message) {
        return new MiningResult(Status.TIMED_OUT, null, message);
    }

    public static MiningResult failed(String message) {
        return new MiningResult(Status.FAILED, null, message);
    }

    public static MiningResult halted(String reason) {
        return new MiningResult(Status.HALTED, null, "Mining halted: " + reason);
    }

    public boolean isMined() {
        return status == Status.MINED;
    }
}
