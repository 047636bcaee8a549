package com.yumi.lsmkv.sst;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.yumi.lsmkv.Config;
import com.yumi.lsmkv.exception.CapacityExceededException;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.filter.LsmBloomFilter;
import com.yumi.lsmkv.util.AllUtils;
import com.yumi.lsmkv.util.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * 按 key 升序写入一个 sst 文件。数据块按配置的方式压缩。
 * 顺序: 数据块 -> 稀疏索引 -> 过滤器 -> footer -> trailer，trailer 最后落盘，
 * 中途失败留下的文件没有合法 trailer，读取方会忽略它。
 */
public class SstWriter implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(SstWriter.class);

    private final Path file;
    private final long fileId;
    private final int level;
    private final int sparseInterval;
    private final CompressionCodec compression;
    private final FileChannel channel;

    private final Block dataBlock;
    private final LsmBloomFilter.Builder filterBuilder;
    private final List<Index> indexArr;
    private final Hasher dataChecksum;

    private byte[] preKey;
    private byte[] minKey;
    //已经刷到 channel 的字节数
    private long position;
    private int entriesCnt;
    private int tombstoneCnt;
    private long minSequence = Long.MAX_VALUE;
    private long maxSequence = Long.MIN_VALUE;
    private boolean closed;

    public SstWriter(Path file, long fileId, int level, Config config) {
        this.file = file;
        this.fileId = fileId;
        this.level = level;
        this.sparseInterval = config.getSparseIndexInterval();
        try {
            this.channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new IOFailureException("创建sst文件失败 " + file, e);
        }
        this.compression = config.getCompression();
        this.dataBlock = new Block(config.getSstBlockSize(), this.compression);
        this.filterBuilder = LsmBloomFilter.builder(config.getFilterFalsePositiveRate());
        this.indexArr = new ArrayList<>();
        this.dataChecksum = Hashing.crc32c().newHasher();
    }

    public void append(Entry entry) {
        checkState(!this.closed, "writer already closed");
        byte[] key = entry.getKey();
        checkArgument(this.preKey == null || AllUtils.compare(this.preKey, key) < 0,
                "keys must be appended in strictly ascending order");
        if (this.size() + EntryCodec.encodedSize(entry) + Block.HEADER_SIZE > Integer.MAX_VALUE) {
            throw new CapacityExceededException("sst数据块超过 " + Integer.MAX_VALUE + " 字节");
        }
        //每 M 条记录建一条索引，第一条一定有索引；数据块只在索引处切分，一组记录不会跨块
        if (this.entriesCnt % this.sparseInterval == 0) {
            if (this.dataBlock.isFull()) {
                try {
                    refreshBlock();
                } catch (IOException e) {
                    throw new IOFailureException("写入sst文件失败 " + this.file, e);
                }
            }
            this.indexArr.add(new Index(key, (int) this.position, this.dataBlock.size()));
        }
        this.dataBlock.append(entry);
        this.filterBuilder.add(key);
        if (this.minKey == null) {
            this.minKey = key;
        }
        this.preKey = key;
        this.entriesCnt++;
        if (entry.isTombstone()) {
            this.tombstoneCnt++;
        }
        this.minSequence = Math.min(this.minSequence, entry.getSequence());
        this.maxSequence = Math.max(this.maxSequence, entry.getSequence());
    }

    //当前文件大小的估算，未刷盘的缓冲按压缩前计算
    public long size() {
        return this.position + this.dataBlock.size();
    }

    public int entriesCnt() {
        return this.entriesCnt;
    }

    public Path getFile() {
        return file;
    }

    public Footer finish() {
        checkState(!this.closed, "writer already closed");
        checkState(this.entriesCnt > 0, "an sst file needs at least one entry");
        try {
            refreshBlock();
            long indexOffset = this.position;
            int indexSize = 4;
            for (Index index : this.indexArr) {
                indexSize += index.encodedSize();
            }
            LsmBloomFilter filter = this.filterBuilder.build();
            int filterSize = filter.serializedSize();
            Footer footer = new Footer(this.fileId, this.level, this.entriesCnt, this.tombstoneCnt,
                    this.minSequence, this.maxSequence, this.sparseInterval, this.compression,
                    this.minKey, this.preKey,
                    indexOffset, indexSize, indexOffset + indexSize, filterSize,
                    this.dataChecksum.hash().asInt());
            int footerSize = footer.encodedSize();

            ByteBuffer meta = ByteBuffer.allocate(indexSize + filterSize + footerSize + Footer.TRAILER_SIZE);
            meta.putInt(this.indexArr.size());
            for (Index index : this.indexArr) {
                meta.putInt(index.getKey().length);
                meta.put(index.getKey());
                meta.putInt(index.getBlockOffset());
                meta.putInt(index.getEntryOffset());
            }
            filter.writeTo(meta);
            footer.writeTo(meta);
            int metaChecksum = Hashing.crc32c()
                    .hashBytes(meta.array(), 0, indexSize + filterSize + footerSize).asInt();
            meta.putInt(footerSize);
            meta.putInt(metaChecksum);
            meta.putLong(Footer.MAGIC);
            meta.flip();
            while (meta.hasRemaining()) {
                this.channel.write(meta);
            }
            this.channel.force(true);
            close();
            LOG.debug("sst {} committed, {} entries, {} bytes", this.file.getFileName(), this.entriesCnt,
                    indexOffset + meta.limit());
            return footer;
        } catch (IOException e) {
            throw new IOFailureException("写入sst文件失败 " + this.file, e);
        }
    }

    //放弃写入，删除未提交的文件
    public void abort() {
        try {
            close();
        } finally {
            try {
                Files.deleteIfExists(this.file);
            } catch (IOException e) {
                LOG.warn("删除未提交的sst文件失败 {}", this.file, e);
            }
        }
    }

    private void refreshBlock() throws IOException {
        if (this.dataBlock.isEmpty()) {
            return;
        }
        this.position += this.dataBlock.flushTo(this.channel, this.dataChecksum);
    }

    @Override
    public void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        try {
            this.channel.close();
        } catch (IOException e) {
            throw new IOFailureException("关闭sst文件失败 " + this.file, e);
        }
    }
}
