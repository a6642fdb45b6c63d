package io.blockchain.walletsync.slotting;

import java.time.Duration;

/**
 * Slot duration of one epoch and the offset of its first slot from system start.
 */
public final class EpochSlottingData {
    private final Duration slotDuration;
    private final Duration startOffset;

    public EpochSlottingData(Duration slotDuration, Duration startOffset) {
        if (slotDuration == null || slotDuration.isZero() || slotDuration.isNegative()) {
            throw new IllegalArgumentException("slotDuration must be positive");
        }
        if (startOffset == null || startOffset.isNegative()) {
            throw new IllegalArgumentException("startOffset must be >= 0");
        }
        this.slotDuration = slotDuration;
        this.startOffset = startOffset;
    }

    public Duration slotDuration() { return slotDuration; }
    public Duration startOffset() { return startOffset; }

    @Override public String toString() {
        return "EpochSlottingData{slot=" + slotDuration + ", offset=" + startOffset + "}";
    }
}
