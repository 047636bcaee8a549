package com.yumi.lsmkv.filter.bloom;

import com.google.common.hash.Hashing;
import com.yumi.lsmkv.filter.BitsArray;

/**
 * 布隆过滤器的参数计算与 bit 位置计算，本身不持有 bit 数组
 */
public class BloomFilter {
    private static final double LN2 = Math.log(2);
    /*计算数据*/
    //hash函数个数
    private final int k;
    //布隆过滤器bit位数
    private final int m;

    /**
     * @param n 预估存放数据量
     * @param p 期望的误判率 (0, 1)
     */
    public static BloomFilter createByNp(int n, double p) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be greater than 0");
        }
        if (!(p > 0 && p < 1)) {
            throw new IllegalArgumentException("p must be in (0, 1)");
        }
        // m = -n * ln(p) / (ln2)^2, k = (m / n) * ln2
        double rawM = Math.ceil(-n * Math.log(p) / (LN2 * LN2));
        //转换为8的整数倍（java中只有byte）
        long m = (long) (Byte.SIZE * Math.ceil(rawM / Byte.SIZE));
        if (m > Integer.MAX_VALUE - Byte.SIZE) {
            throw new IllegalArgumentException("bit array too large for n=" + n + ", p=" + p);
        }
        m = Math.max(m, Byte.SIZE);
        int k = (int) Math.max(1, Math.round((double) m / n * LN2));
        return new BloomFilter(k, (int) m);
    }

    public static BloomFilter restore(int k, int m) {
        if (k < 1 || m < 1) {
            throw new IllegalArgumentException("k and m must be greater than 0");
        }
        return new BloomFilter(k, m);
    }

    private BloomFilter(int k, int m) {
        this.k = k;
        this.m = m;
    }

    public static long hash64(byte[] bytes) {
        return Hashing.murmur3_128().hashBytes(bytes).asLong();
    }

    public int[] calcBitPositions(byte[] bytes) {
        return calcBitPositions(hash64(bytes));
    }

    //双重哈希 h1 + i * h2 派生出 k 个位置
    public int[] calcBitPositions(long hash64) {
        int[] bitPositions = new int[this.k];
        int hash1 = (int) hash64;
        int hash2 = (int) (hash64 >>> 32);

        for (int i = 1; i <= this.k; i++) {
            int combinedHash = hash1 + (i * hash2);
            if (combinedHash < 0) {
                combinedHash = ~combinedHash;
            }
            bitPositions[i - 1] = combinedHash % this.m;
        }
        return bitPositions;
    }

    public void hashTo(int[] bitPositions, BitsArray bits) {
        check(bits);
        for (int i : bitPositions) {
            bits.setBit(i, true);
        }
    }

    public boolean isHit(int[] bitPositions, BitsArray bits) {
        check(bits);
        for (int pos : bitPositions) {
            if (!bits.getBit(pos)) {
                return false;
            }
        }
        return true;
    }

    public int getK() {
        return k;
    }

    public int getM() {
        return m;
    }

    protected void check(BitsArray bits) {
        if (bits.bitLength() != this.m) {
            throw new IllegalArgumentException(
                    String.format("Length(%d) of bits in BitsArray is not equal to %d!", bits.bitLength(), this.m)
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BloomFilter))
            return false;

        BloomFilter that = (BloomFilter) o;
        return k == that.k && m == that.m;
    }

    @Override
    public int hashCode() {
        return 31 * k + m;
    }

    @Override
    public String toString() {
        return String.format("k: %d, m: %d", k, m);
    }
}
