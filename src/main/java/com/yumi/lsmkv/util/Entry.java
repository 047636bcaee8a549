package com.yumi.lsmkv.util;

import java.util.Arrays;
import java.util.Objects;

public final class Entry {
    private final byte[] key;
    private final Payload payload;
    private final long sequence;

    public Entry(byte[] key, Payload payload, long sequence) {
        this.key = Objects.requireNonNull(key, "key");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.sequence = sequence;
    }

    public static Entry value(byte[] key, byte[] value, long sequence) {
        return new Entry(key, Payload.value(value), sequence);
    }

    public static Entry tombstone(byte[] key, long sequence) {
        return new Entry(key, Payload.tombstone(), sequence);
    }

    public byte[] getKey() {
        return key;
    }

    public Payload getPayload() {
        return payload;
    }

    public long getSequence() {
        return sequence;
    }

    public boolean isTombstone() {
        return payload.isTombstone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry entry = (Entry) o;
        return sequence == entry.sequence && Arrays.equals(key, entry.key) && payload.equals(entry.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(payload, sequence);
        result = 31 * result + Arrays.hashCode(key);
        return result;
    }

    @Override
    public String toString() {
        return "Entry{key=" + Arrays.toString(key) + ", payload=" + payload + ", sequence=" + sequence + '}';
    }
}
