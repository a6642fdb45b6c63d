package io.blockchain.walletsync.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * UTXO-style transaction: spends earlier outputs, creates new ones.
 * The id is SHA-256 over the deterministic encoding.
 */
public final class Transaction {

    private final List<TxIn> inputs;
    private final List<TxOut> outputs;
    private final Hash id;

    private Transaction(List<TxIn> inputs, List<TxOut> outputs) {
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        basicValidate();
        this.id = Hashes.sha256(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<TxIn> inputs = new ArrayList<>();
        private final List<TxOut> outputs = new ArrayList<>();

        public Builder input(Hash txId, int index) { inputs.add(new TxIn(txId, index)); return this; }
        public Builder input(TxIn in) { inputs.add(in); return this; }
        public Builder output(String address, long amountMinor) { outputs.add(new TxOut(address, amountMinor)); return this; }
        public Builder output(TxOut out) { outputs.add(out); return this; }

        public Transaction build() {
            return new Transaction(inputs, outputs);
        }
    }

    public List<TxIn> inputs() { return inputs; }
    public List<TxOut> outputs() { return outputs; }
    public Hash id() { return id; }

    public byte[] serialize() {
        int size = 8;
        for (TxIn in : inputs) size += Hash.LENGTH + 4;
        for (TxOut out : outputs) size += 4 + out.address().getBytes(StandardCharsets.UTF_8).length + 8;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(inputs.size());
        for (TxIn in : inputs) {
            buf.put(in.txId().bytes());
            buf.putInt(in.index());
        }
        buf.putInt(outputs.size());
        for (TxOut out : outputs) {
            byte[] addr = out.address().getBytes(StandardCharsets.UTF_8);
            buf.putInt(addr.length);
            buf.put(addr);
            buf.putLong(out.amountMinor());
        }
        buf.flip();
        byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        return bytes;
    }

    private void basicValidate() {
        if (outputs.isEmpty()) throw new IllegalArgumentException("transaction has no outputs");
    }

    @Override public boolean equals(Object o) {
        return o instanceof Transaction && id.equals(((Transaction) o).id);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Transaction{id=" + id + ", in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}
