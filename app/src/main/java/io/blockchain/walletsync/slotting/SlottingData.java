package io.blockchain.walletsync.slotting;

import io.blockchain.walletsync.protocol.SlotId;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Known slot durations per epoch. Epochs without an entry cannot be mapped to time.
 */
public final class SlottingData {
    private final TreeMap<Long, EpochSlottingData> epochs;

    public SlottingData(Map<Long, EpochSlottingData> epochs) {
        if (epochs == null || epochs.isEmpty()) {
            throw new IllegalArgumentException("slotting data must describe at least one epoch");
        }
        this.epochs = new TreeMap<>(epochs);
    }

    /** Every epoch in [0, epochCount) has the same slot duration and slot count. */
    public static SlottingData uniform(Duration slotDuration, int slotsPerEpoch, int epochCount) {
        if (slotsPerEpoch <= 0) throw new IllegalArgumentException("slotsPerEpoch must be > 0");
        if (epochCount <= 0) throw new IllegalArgumentException("epochCount must be > 0");
        Map<Long, EpochSlottingData> out = new TreeMap<>();
        Duration epochLength = slotDuration.multipliedBy(slotsPerEpoch);
        for (long e = 0; e < epochCount; e++) {
            out.put(e, new EpochSlottingData(slotDuration, epochLength.multipliedBy(e)));
        }
        return new SlottingData(out);
    }

    public Optional<EpochSlottingData> epoch(long epoch) {
        return Optional.ofNullable(epochs.get(epoch));
    }

    public long lastKnownEpoch() {
        return epochs.lastKey();
    }

    public Map<Long, EpochSlottingData> epochs() {
        return Collections.unmodifiableMap(epochs);
    }

    /** Start of the given slot, or empty when its epoch is unknown. */
    public Optional<Instant> slotStart(Instant systemStart, SlotId slot) {
        EpochSlottingData data = epochs.get(slot.epoch());
        if (data == null) {
            return Optional.empty();
        }
        Duration sinceEpoch = data.slotDuration().multipliedBy(slot.localSlot());
        return Optional.of(systemStart.plus(data.startOffset()).plus(sinceEpoch));
    }
}
