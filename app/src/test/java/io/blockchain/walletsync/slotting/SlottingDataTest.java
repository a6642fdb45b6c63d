package io.blockchain.walletsync.slotting;

import io.blockchain.walletsync.protocol.SlotId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SlottingDataTest {
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void slotStartAddsEpochOffsetAndLocalSlots() {
        SlottingData data = SlottingData.uniform(Duration.ofSeconds(20), 10, 3);

        assertEquals(Optional.of(START), data.slotStart(START, new SlotId(0, 0)));
        assertEquals(Optional.of(START.plusSeconds(200 + 60)), data.slotStart(START, new SlotId(1, 3)));
        assertEquals(Optional.empty(), data.slotStart(START, new SlotId(7, 0)));
        assertEquals(2, data.lastKnownEpoch());
    }

    @Test
    void currentSlotDurationFallsBackToLastKnownEpoch() {
        StaticSlotting slotting = new StaticSlotting(START, SlottingData.uniform(Duration.ofSeconds(5), 10, 2), 0);
        assertEquals(Duration.ofSeconds(5), slotting.getCurrentEpochSlotDuration());

        slotting.setCurrentEpoch(40);
        assertEquals(Duration.ofSeconds(5), slotting.getCurrentEpochSlotDuration());
    }

    @Test
    void rejectsEmptyLayouts() {
        assertThrows(IllegalArgumentException.class, () -> SlottingData.uniform(Duration.ofSeconds(1), 0, 1));
        assertThrows(IllegalArgumentException.class, () -> SlottingData.uniform(Duration.ofSeconds(1), 1, 0));
    }
}
