package io.blockchain.walletsync.protocol;

/** Position of a main block: epoch index plus slot index inside that epoch. */
public record SlotId(long epoch, int localSlot) {
    public SlotId {
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0");
        if (localSlot < 0) throw new IllegalArgumentException("localSlot must be >= 0");
    }

    @Override public String toString() {
        return epoch + "." + localSlot;
    }
}
