package com.yumi.lsmkv.sst;

import java.nio.ByteBuffer;

/**
 * sst 文件的元数据，写在文件末尾，它的存在就是文件已提交的标志。
 * 其后紧跟 16 字节的 trailer: footerSize(4) metaChecksum(4) MAGIC(8)
 */
public final class Footer {
    public static final int TRAILER_SIZE = 16;
    // "YUMI-SST"
    public static final long MAGIC = 0x59554D492D535354L;

    private final long fileId;
    private final int level;
    private final int entryCount;
    private final int tombstoneCount;
    private final long minSequence;
    private final long maxSequence;
    private final int sparseInterval;
    private final CompressionCodec compression;
    private final byte[] minKey;
    private final byte[] maxKey;
    private final long indexOffset;
    private final int indexSize;
    private final long filterOffset;
    private final int filterSize;
    private final int dataChecksum;

    public Footer(long fileId, int level, int entryCount, int tombstoneCount,
                  long minSequence, long maxSequence, int sparseInterval, CompressionCodec compression,
                  byte[] minKey, byte[] maxKey,
                  long indexOffset, int indexSize, long filterOffset, int filterSize,
                  int dataChecksum) {
        this.fileId = fileId;
        this.level = level;
        this.entryCount = entryCount;
        this.tombstoneCount = tombstoneCount;
        this.minSequence = minSequence;
        this.maxSequence = maxSequence;
        this.sparseInterval = sparseInterval;
        this.compression = compression;
        this.minKey = minKey;
        this.maxKey = maxKey;
        this.indexOffset = indexOffset;
        this.indexSize = indexSize;
        this.filterOffset = filterOffset;
        this.filterSize = filterSize;
        this.dataChecksum = dataChecksum;
    }

    public int encodedSize() {
        return 8 + 4 + 4 + 4 + 8 + 8 + 4 + 1
                + 4 + minKey.length
                + 4 + maxKey.length
                + 8 + 4 + 8 + 4
                + 4;
    }

    public void writeTo(ByteBuffer buffer) {
        buffer.putLong(fileId);
        buffer.putInt(level);
        buffer.putInt(entryCount);
        buffer.putInt(tombstoneCount);
        buffer.putLong(minSequence);
        buffer.putLong(maxSequence);
        buffer.putInt(sparseInterval);
        buffer.put(compression.getId());
        buffer.putInt(minKey.length);
        buffer.put(minKey);
        buffer.putInt(maxKey.length);
        buffer.put(maxKey);
        buffer.putLong(indexOffset);
        buffer.putInt(indexSize);
        buffer.putLong(filterOffset);
        buffer.putInt(filterSize);
        buffer.putInt(dataChecksum);
    }

    public static Footer readFrom(ByteBuffer buffer) {
        long fileId = buffer.getLong();
        int level = buffer.getInt();
        int entryCount = buffer.getInt();
        int tombstoneCount = buffer.getInt();
        long minSequence = buffer.getLong();
        long maxSequence = buffer.getLong();
        int sparseInterval = buffer.getInt();
        CompressionCodec compression = CompressionCodec.fromId(buffer.get());
        byte[] minKey = readKey(buffer);
        byte[] maxKey = readKey(buffer);
        long indexOffset = buffer.getLong();
        int indexSize = buffer.getInt();
        long filterOffset = buffer.getLong();
        int filterSize = buffer.getInt();
        int dataChecksum = buffer.getInt();
        if (entryCount <= 0 || tombstoneCount < 0 || tombstoneCount > entryCount || sparseInterval <= 0) {
            throw new IllegalArgumentException("illegal footer counters");
        }
        return new Footer(fileId, level, entryCount, tombstoneCount, minSequence, maxSequence, sparseInterval,
                compression, minKey, maxKey, indexOffset, indexSize, filterOffset, filterSize, dataChecksum);
    }

    private static byte[] readKey(ByteBuffer buffer) {
        int len = buffer.getInt();
        if (len <= 0 || len > buffer.remaining()) {
            throw new IllegalArgumentException("illegal key length " + len);
        }
        byte[] key = new byte[len];
        buffer.get(key);
        return key;
    }

    public long getFileId() {
        return fileId;
    }

    public int getLevel() {
        return level;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public int getTombstoneCount() {
        return tombstoneCount;
    }

    public long getMinSequence() {
        return minSequence;
    }

    public long getMaxSequence() {
        return maxSequence;
    }

    public int getSparseInterval() {
        return sparseInterval;
    }

    public CompressionCodec getCompression() {
        return compression;
    }

    public byte[] getMinKey() {
        return minKey;
    }

    public byte[] getMaxKey() {
        return maxKey;
    }

    public long getIndexOffset() {
        return indexOffset;
    }

    public int getIndexSize() {
        return indexSize;
    }

    public long getFilterOffset() {
        return filterOffset;
    }

    public int getFilterSize() {
        return filterSize;
    }

    public int getDataChecksum() {
        return dataChecksum;
    }
}
