package com.yumi.lsmkv.sst;

import com.google.common.hash.Hashing;
import com.yumi.lsmkv.Config;
import com.yumi.lsmkv.exception.CorruptFileException;
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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 一个已提交的 sst 文件。打开时整体只读映射，过滤器和稀疏索引常驻内存，数据块在读取时按需解压。
 * 文件被删除后已经持有它的读者仍可以继续读取映射的内容。
 */
public final class SstFile implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(SstFile.class);
    public static final String SUFFIX = ".sst";

    private final Path path;
    private final FileChannel channel;
    private final ByteBuffer data;
    private final Footer footer;
    private final Index[] indices;
    private final LsmBloomFilter filter;
    private final long size;

    private SstFile(Path path, FileChannel channel, ByteBuffer data, Footer footer,
                    Index[] indices, LsmBloomFilter filter, long size) {
        this.path = path;
        this.channel = channel;
        this.data = data;
        this.footer = footer;
        this.indices = indices;
        this.filter = filter;
        this.size = size;
    }

    public static String fileName(long fileId) {
        return String.format("%012d%s", fileId, SUFFIX);
    }

    public static OptionalLong parseFileId(String fileName) {
        if (!fileName.endsWith(SUFFIX)) {
            return OptionalLong.empty();
        }
        String id = fileName.substring(0, fileName.length() - SUFFIX.length());
        try {
            return OptionalLong.of(Long.parseLong(id));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public static SstFile open(Path path, Config config) {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (IOException e) {
            throw new IOFailureException("打开sst文件失败 " + path, e);
        }
        try {
            return load(path, channel, config.isVerifyChecksums());
        } catch (RuntimeException e) {
            closeQuietly(channel);
            throw e;
        }
    }

    private static SstFile load(Path path, FileChannel channel, boolean verifyData) {
        long length;
        ByteBuffer map;
        try {
            length = channel.size();
            if (length < Footer.TRAILER_SIZE) {
                throw new CorruptFileException(path, "文件过短，没有footer");
            }
            if (length > Integer.MAX_VALUE) {
                throw new CorruptFileException(path, "文件过大 " + length);
            }
            map = channel.map(FileChannel.MapMode.READ_ONLY, 0, length);
        } catch (IOException e) {
            throw new IOFailureException("映射sst文件失败 " + path, e);
        }

        int trailerPos = (int) length - Footer.TRAILER_SIZE;
        int footerSize = map.getInt(trailerPos);
        int metaChecksum = map.getInt(trailerPos + 4);
        long magic = map.getLong(trailerPos + 8);
        if (magic != Footer.MAGIC) {
            throw new CorruptFileException(path, "缺少提交标记，文件未写完");
        }
        int footerPos = trailerPos - footerSize;
        if (footerSize <= 0 || footerPos < 0) {
            throw new CorruptFileException(path, "非法的footer长度 " + footerSize);
        }
        Footer footer;
        try {
            footer = Footer.readFrom(slice(map, footerPos, footerSize));
        } catch (RuntimeException e) {
            throw new CorruptFileException(path, "footer无法解析", e);
        }
        if (footer.getIndexOffset() < 0 || footer.getIndexSize() < 4 || footer.getFilterSize() < 8
                || footer.getIndexOffset() + footer.getIndexSize() != footer.getFilterOffset()
                || footer.getFilterOffset() + footer.getFilterSize() != footerPos) {
            throw new CorruptFileException(path, "footer中的区段偏移不一致");
        }
        int indexOffset = (int) footer.getIndexOffset();
        int metaSize = trailerPos - indexOffset;
        if (Hashing.crc32c().hashBytes(toArray(slice(map, indexOffset, metaSize))).asInt() != metaChecksum) {
            throw new CorruptFileException(path, "元数据校验和不匹配");
        }
        if (verifyData && Hashing.crc32c().newHasher().putBytes(slice(map, 0, indexOffset)).hash().asInt()
                != footer.getDataChecksum()) {
            throw new CorruptFileException(path, "数据块校验和不匹配");
        }

        Index[] indices;
        LsmBloomFilter filter;
        try {
            indices = readIndex(slice(map, indexOffset, footer.getIndexSize()));
            filter = LsmBloomFilter.readFrom(slice(map, (int) footer.getFilterOffset(), footer.getFilterSize()));
        } catch (RuntimeException e) {
            throw new CorruptFileException(path, "索引或过滤器无法解析", e);
        }
        if (indices.length == 0 || indices[0].getBlockOffset() != 0 || indices[0].getEntryOffset() != 0) {
            throw new CorruptFileException(path, "稀疏索引为空");
        }
        return new SstFile(path, channel, slice(map, 0, indexOffset), footer, indices, filter, length);
    }

    private static Index[] readIndex(ByteBuffer buffer) {
        int count = buffer.getInt();
        if (count < 0) {
            throw new IllegalArgumentException("illegal index count " + count);
        }
        Index[] indices = new Index[count];
        for (int i = 0; i < count; i++) {
            int keyLen = buffer.getInt();
            if (keyLen <= 0 || keyLen > buffer.remaining()) {
                throw new IllegalArgumentException("illegal key length " + keyLen);
            }
            byte[] key = new byte[keyLen];
            buffer.get(key);
            indices[i] = new Index(key, buffer.getInt(), buffer.getInt());
        }
        return indices;
    }

    private static ByteBuffer slice(ByteBuffer map, int offset, int length) {
        ByteBuffer dup = map.duplicate();
        dup.position(offset);
        dup.limit(offset + length);
        return dup.slice();
    }

    private static byte[] toArray(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    /**
     * 1.范围判断 2.过滤器 3.二分查找稀疏索引 4.解压索引指向的数据块，在至多 M 条记录内顺序扫描
     * @return 可能是删除标记；empty 表示本文件中没有该 key
     */
    public Optional<Entry> get(byte[] key) {
        if (AllUtils.compare(key, this.footer.getMinKey()) < 0
                || AllUtils.compare(key, this.footer.getMaxKey()) > 0) {
            return Optional.empty();
        }
        if (!this.filter.mightContain(key)) {
            return Optional.empty();
        }
        Index index = floorIndex(key);
        if (index == null) {
            return Optional.empty();
        }
        try {
            ByteBuffer view = readBlock(index.getBlockOffset());
            view.position(index.getEntryOffset());
            for (int i = 0; i < this.footer.getSparseInterval() && view.hasRemaining(); i++) {
                Entry entry = EntryCodec.decode(view);
                int cmp = AllUtils.compare(entry.getKey(), key);
                if (cmp == 0) {
                    return Optional.of(entry);
                }
                if (cmp > 0) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            if (e instanceof CorruptFileException) {
                throw e;
            }
            throw new CorruptFileException(this.path, "记录无法解析", e);
        }
        return Optional.empty();
    }

    /**
     * 解压 offset 处的数据块
     * @return 解压后的块内容，position 为 0
     */
    private ByteBuffer readBlock(int offset) {
        if (offset < 0 || offset + Block.HEADER_SIZE > this.data.limit()) {
            throw new CorruptFileException(this.path, "非法的数据块偏移 " + offset);
        }
        int rawLength = this.data.getInt(offset);
        int storedLength = this.data.getInt(offset + 4);
        if (rawLength < 0 || storedLength < 0 || storedLength > this.data.limit() - offset - Block.HEADER_SIZE) {
            throw new CorruptFileException(this.path, "非法的数据块长度 " + offset);
        }
        try {
            byte[] raw = this.footer.getCompression().decompress(
                    slice(this.data, offset + Block.HEADER_SIZE, storedLength), rawLength);
            if (raw.length != rawLength) {
                throw new CorruptFileException(this.path, "数据块解压后长度不匹配 " + offset);
            }
            return ByteBuffer.wrap(raw);
        } catch (IOException e) {
            throw new CorruptFileException(this.path, "数据块解压失败 " + offset, e);
        }
    }

    //下一个数据块的偏移
    private int nextBlockOffset(int offset) {
        return offset + Block.HEADER_SIZE + this.data.getInt(offset + 4);
    }

    //最后一个 key <= 目标 key 的索引项
    private Index floorIndex(byte[] key) {
        int l = 0;
        int h = this.indices.length - 1;
        Index ans = null;
        while (l <= h) {
            int mid = l + ((h - l) >> 1);
            if (AllUtils.compare(this.indices[mid].getKey(), key) <= 0) {
                ans = this.indices[mid];
                l = mid + 1;
            } else {
                h = mid - 1;
            }
        }
        return ans;
    }

    /**
     * 按 key 升序顺序读取全部记录，合并时使用
     */
    public Iterator<Entry> iterator() {
        return new Iterator<>() {
            private int nextBlock = 0;
            private ByteBuffer block = ByteBuffer.allocate(0);

            @Override
            public boolean hasNext() {
                while (!this.block.hasRemaining() && this.nextBlock < data.limit()) {
                    this.block = readBlock(this.nextBlock);
                    this.nextBlock = nextBlockOffset(this.nextBlock);
                }
                return this.block.hasRemaining();
            }

            @Override
            public Entry next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                try {
                    return EntryCodec.decode(this.block);
                } catch (RuntimeException e) {
                    throw new CorruptFileException(path, "记录无法解析", e);
                }
            }
        };
    }

    public CompressionCodec getCompression() {
        return footer.getCompression();
    }

    public Path getPath() {
        return path;
    }

    public long getFileId() {
        return footer.getFileId();
    }

    public int getLevel() {
        return footer.getLevel();
    }

    public byte[] getMinKey() {
        return footer.getMinKey();
    }

    public byte[] getMaxKey() {
        return footer.getMaxKey();
    }

    public int getEntryCount() {
        return footer.getEntryCount();
    }

    public int getTombstoneCount() {
        return footer.getTombstoneCount();
    }

    public long getMinSequence() {
        return footer.getMinSequence();
    }

    public long getMaxSequence() {
        return footer.getMaxSequence();
    }

    public long size() {
        return size;
    }

    Index[] indices() {
        return indices;
    }

    LsmBloomFilter filter() {
        return filter;
    }

    //关闭读流，映射的内容由 GC 回收
    @Override
    public void close() {
        try {
            this.channel.close();
        } catch (IOException e) {
            throw new IOFailureException("关闭sst文件失败 " + this.path, e);
        }
    }

    //销毁，要删除对应的文件
    public void destroy() {
        close();
        try {
            Files.deleteIfExists(this.path);
        } catch (IOException e) {
            throw new IOFailureException("删除sst文件失败 " + this.path, e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("关闭文件失败", e);
        }
    }

    @Override
    public String toString() {
        return "SstFile{" + path.getFileName() + ", level=" + getLevel() + ", entries=" + getEntryCount() + '}';
    }
}
