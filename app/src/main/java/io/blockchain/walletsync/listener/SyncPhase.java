package io.blockchain.walletsync.listener;

/** Direction of a block listener call. */
public enum SyncPhase {
    APPLY("apply", "Applied"),
    ROLLBACK("rollback", "Rolled back");

    private final String label;
    private final String pastTense;

    SyncPhase(String label, String pastTense) {
        this.label = label;
        this.pastTense = pastTense;
    }

    public String label() { return label; }
    public String pastTense() { return pastTense; }

    @Override public String toString() { return label; }
}
