package io.blockchain.walletsync.slotting;

import java.time.Duration;
import java.time.Instant;

/** Source of slot timing information. */
public interface Slotting {

    /** Wall-clock time of slot 0 of epoch 0. */
    Instant getSystemStart();

    SlottingData getSlottingData();

    /** Slot duration of the epoch the node is currently in. */
    Duration getCurrentEpochSlotDuration();
}
