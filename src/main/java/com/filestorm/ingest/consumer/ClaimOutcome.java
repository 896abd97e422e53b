package com.filestorm.ingest.consumer;

/**
 * Result of one claim step.
 */
public final class ClaimOutcome {

    private static final ClaimOutcome NONE = new ClaimOutcome(0, BatchOutcome.EMPTY, false);

    private final int claimed;
    private final BatchOutcome outcome;
    private final boolean ledgerDrained;

    public ClaimOutcome(int claimed, BatchOutcome outcome, boolean ledgerDrained) {
        this.claimed = claimed;
        this.outcome = outcome;
        this.ledgerDrained = ledgerDrained;
    }

    public static ClaimOutcome none() {
        return NONE;
    }

    public int getClaimed() {
        return claimed;
    }

    public BatchOutcome getOutcome() {
        return outcome;
    }

    /**
     * @return true if entries were claimed and nothing is pending afterwards
     */
    public boolean isLedgerDrained() {
        return ledgerDrained;
    }
}
