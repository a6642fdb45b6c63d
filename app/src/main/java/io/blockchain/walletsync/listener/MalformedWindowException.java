package io.blockchain.walletsync.listener;

/** A block window that is not chain-linked or whose undo data does not line up with its blocks. */
public final class MalformedWindowException extends IllegalArgumentException {
    public MalformedWindowException(String message) {
        super(message);
    }
}
