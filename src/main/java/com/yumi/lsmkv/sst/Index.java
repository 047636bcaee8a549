package com.yumi.lsmkv.sst;

import java.util.Arrays;
import java.util.Objects;

/**
 * 稀疏索引项: 某条记录的 key，它所在数据块的文件偏移，以及它在解压后块内的偏移
 */
public final class Index {
    private final byte[] key;
    private final int blockOffset;
    private final int entryOffset;

    public Index(byte[] key, int blockOffset, int entryOffset) {
        this.key = key;
        this.blockOffset = blockOffset;
        this.entryOffset = entryOffset;
    }

    public byte[] getKey() {
        return key;
    }

    public int getBlockOffset() {
        return blockOffset;
    }

    public int getEntryOffset() {
        return entryOffset;
    }

    public int encodedSize() {
        return 4 + key.length + 4 + 4;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Index index = (Index) o;
        return blockOffset == index.blockOffset && entryOffset == index.entryOffset && Arrays.equals(key, index.key);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(blockOffset, entryOffset);
        result = 31 * result + Arrays.hashCode(key);
        return result;
    }
}
