package com.yumi.lsmkv.filter;

public class BitsArray implements Cloneable {
    private final byte[] bytes;
    private final int bitLength;

    public static BitsArray create(int bitLength) {
        return new BitsArray(bitLength);
    }

    public static BitsArray create(byte[] bytes, int bitLength) {
        return new BitsArray(bytes, bitLength);
    }

    private BitsArray(int bitLength) {
        if (bitLength < 1) {
            throw new IllegalArgumentException("Bit is less than 1.");
        }
        this.bitLength = bitLength;
        int temp = bitLength / Byte.SIZE;
        if (bitLength % Byte.SIZE > 0) {
            temp++;
        }
        this.bytes = new byte[temp];
    }

    private BitsArray(byte[] bytes, int bitLength) {
        if (bytes == null || bytes.length < 1) {
            throw new IllegalArgumentException("Bytes is empty!");
        }
        if (bitLength < 1) {
            throw new IllegalArgumentException("Bit is less than 1.");
        }
        if (bitLength > bytes.length * Byte.SIZE) {
            throw new IllegalArgumentException("BitLength is greater than bytes.length * " + Byte.SIZE);
        }
        this.bytes = new byte[bytes.length];
        System.arraycopy(bytes, 0, this.bytes, 0, this.bytes.length);
        this.bitLength = bitLength;
    }

    public int bitLength() {
        return this.bitLength;
    }

    public int byteLength() {
        return this.bytes.length;
    }

    public byte[] bytes() {
        return this.bytes;
    }

    public boolean getBit(int bitPos) {
        checkBitPosition(bitPos);
        return (this.bytes[subscript(bitPos)] & position(bitPos)) != 0;
    }

    public void setBit(int bitPos, boolean set) {
        checkBitPosition(bitPos);
        int sub = subscript(bitPos);
        int pos = position(bitPos);
        if (set) {
            this.bytes[sub] = (byte) (this.bytes[sub] | pos);
        } else {
            this.bytes[sub] = (byte) (this.bytes[sub] & ~pos);
        }
    }

    //置位的 bit 数量
    public int cardinality() {
        int count = 0;
        for (byte b : this.bytes) {
            count += Integer.bitCount(b & 0xFF);
        }
        return count;
    }

    protected int subscript(int bitPos) {
        return bitPos / Byte.SIZE;
    }

    protected int position(int bitPos) {
        return 1 << bitPos % Byte.SIZE;
    }

    protected void checkBitPosition(int bitPos) {
        if (bitPos >= this.bitLength) {
            throw new IllegalArgumentException("BitPos is greater than " + (this.bitLength - 1));
        }
        if (bitPos < 0) {
            throw new IllegalArgumentException("BitPos is less than 0");
        }
    }

    @Override
    public BitsArray clone() {
        return create(this.bytes, this.bitLength);
    }
}
