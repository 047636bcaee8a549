package com.yumi.lsmkv.filter;

import com.yumi.lsmkv.filter.bloom.BloomFilter;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 每个 sst 文件一个的存在性过滤器，构建完成后不可修改
 */
public final class LsmBloomFilter implements Filter {
    private final BloomFilter bloomFilter;
    private final BitsArray bitsArray;

    private LsmBloomFilter(BloomFilter bloomFilter, BitsArray bitsArray) {
        this.bloomFilter = bloomFilter;
        this.bitsArray = bitsArray;
    }

    public static Builder builder(double falsePositiveRate) {
        return new Builder(falsePositiveRate);
    }

    public static LsmBloomFilter readFrom(ByteBuffer buffer) {
        int m = buffer.getInt();
        int k = buffer.getInt();
        if (m < Byte.SIZE || m % Byte.SIZE != 0 || k < 1) {
            throw new IllegalArgumentException("illegal filter header m=" + m + ", k=" + k);
        }
        byte[] bits = new byte[m / Byte.SIZE];
        buffer.get(bits);
        return new LsmBloomFilter(BloomFilter.restore(k, m), BitsArray.create(bits, m));
    }

    @Override
    public boolean mightContain(byte[] key) {
        return this.bloomFilter.isHit(this.bloomFilter.calcBitPositions(key), this.bitsArray);
    }

    @Override
    public int serializedSize() {
        return 4 + 4 + this.bitsArray.byteLength();
    }

    @Override
    public void writeTo(ByteBuffer buffer) {
        buffer.putInt(this.bloomFilter.getM());
        buffer.putInt(this.bloomFilter.getK());
        buffer.put(this.bitsArray.bytes());
    }

    public int bitLength() {
        return this.bloomFilter.getM();
    }

    public int hashCount() {
        return this.bloomFilter.getK();
    }

    /**
     * 先记录每个 key 的 64 位哈希，key 的总数确定后再决定 m 和 k
     */
    public static final class Builder {
        private final double falsePositiveRate;
        private long[] hashes = new long[64];
        private int keyCnt;
        private boolean built;

        private Builder(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
        }

        public Builder add(byte[] key) {
            if (this.built) {
                throw new IllegalStateException("filter already built");
            }
            if (this.keyCnt == this.hashes.length) {
                this.hashes = Arrays.copyOf(this.hashes, this.hashes.length * 2);
            }
            this.hashes[this.keyCnt++] = BloomFilter.hash64(key);
            return this;
        }

        public int keyLen() {
            return this.keyCnt;
        }

        public LsmBloomFilter build() {
            this.built = true;
            BloomFilter bloomFilter = BloomFilter.createByNp(Math.max(1, this.keyCnt), this.falsePositiveRate);
            BitsArray bitsArray = BitsArray.create(bloomFilter.getM());
            for (int i = 0; i < this.keyCnt; i++) {
                bloomFilter.hashTo(bloomFilter.calcBitPositions(this.hashes[i]), bitsArray);
            }
            this.hashes = null;
            return new LsmBloomFilter(bloomFilter, bitsArray);
        }
    }
}
