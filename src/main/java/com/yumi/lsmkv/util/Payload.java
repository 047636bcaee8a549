package com.yumi.lsmkv.util;

import java.util.Arrays;

/**
 * 值或者删除标记，不用 null 表示删除
 */
public final class Payload {
    public enum Type {
        VALUE,
        TOMBSTONE
    }

    private static final Payload TOMBSTONE = new Payload(Type.TOMBSTONE, null);

    private final Type type;
    private final byte[] value;

    private Payload(Type type, byte[] value) {
        this.type = type;
        this.value = value;
    }

    public static Payload value(byte[] value) {
        if (value == null) {
            throw new NullPointerException("value");
        }
        return new Payload(Type.VALUE, value);
    }

    public static Payload tombstone() {
        return TOMBSTONE;
    }

    public Type getType() {
        return type;
    }

    public boolean isTombstone() {
        return type == Type.TOMBSTONE;
    }

    public byte[] getValue() {
        if (isTombstone()) {
            throw new IllegalStateException("tombstone has no value");
        }
        return value;
    }

    //值的字节数，删除标记为0
    public int length() {
        return value == null ? 0 : value.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return type == payload.type && Arrays.equals(value, payload.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return isTombstone() ? "TOMBSTONE" : "VALUE(" + value.length + "B)";
    }
}
