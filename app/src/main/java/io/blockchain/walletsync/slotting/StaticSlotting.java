package io.blockchain.walletsync.slotting;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed slotting parameters. The current epoch can be moved forward by the caller.
 */
public final class StaticSlotting implements Slotting {
    private final Instant systemStart;
    private final SlottingData data;
    private volatile long currentEpoch;

    public StaticSlotting(Instant systemStart, SlottingData data, long currentEpoch) {
        this.systemStart = Objects.requireNonNull(systemStart, "systemStart");
        this.data = Objects.requireNonNull(data, "data");
        this.currentEpoch = currentEpoch;
    }

    public void setCurrentEpoch(long epoch) {
        this.currentEpoch = epoch;
    }

    @Override
    public Instant getSystemStart() {
        return systemStart;
    }

    @Override
    public SlottingData getSlottingData() {
        return data;
    }

    @Override
    public Duration getCurrentEpochSlotDuration() {
        long epoch = currentEpoch;
        return data.epoch(epoch)
                .or(() -> data.epoch(data.lastKnownEpoch()))
                .map(EpochSlottingData::slotDuration)
                .orElseThrow(() -> new IllegalStateException("No slotting data for epoch " + epoch));
    }
}
