package com.yumi.lsmkv.wal;

import com.google.common.hash.Hashing;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.memtable.MemTable;
import com.yumi.lsmkv.sst.EntryCodec;
import com.yumi.lsmkv.util.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class WalReader {
    private static final Logger LOG = LoggerFactory.getLogger(WalReader.class);

    private final Path file;

    public WalReader(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("文件不存在: " + file);
        }
        this.file = file;
    }

    /**
     * 把 wal 中的记录按顺序写回 mem table，sequence 不大于 persistedSequence 的记录已经在 sst 中，跳过
     * @return 读到的最大 sequence，没有记录时为 0
     */
    public long restoreMemTable(MemTable memTable, long persistedSequence) {
        long maxSequence = 0;
        for (Entry entry : readAll()) {
            if (entry.getSequence() > persistedSequence) {
                memTable.apply(entry);
            }
            maxSequence = Math.max(maxSequence, entry.getSequence());
        }
        return maxSequence;
    }

    //遇到不完整或校验失败的记录就停止，它之后的内容视为崩溃时未写完
    public List<Entry> readAll() {
        ByteBuffer view;
        try {
            view = ByteBuffer.wrap(Files.readAllBytes(this.file));
        } catch (IOException e) {
            throw new IOFailureException("读取wal失败 " + this.file, e);
        }
        List<Entry> res = new ArrayList<>();
        while (view.hasRemaining()) {
            int start = view.position();
            if (view.remaining() < 4) {
                LOG.warn("wal {} 尾部有 {} 字节不完整的数据，已忽略", this.file, view.remaining());
                break;
            }
            int entrySize = view.getInt();
            if (entrySize <= 0 || entrySize + 4 > view.remaining()) {
                LOG.warn("wal {} 在偏移 {} 处记录不完整，已忽略", this.file, start);
                break;
            }
            int checksum = view.getInt(view.position() + entrySize);
            if (Hashing.crc32c().hashBytes(view.array(), view.position(), entrySize).asInt() != checksum) {
                LOG.warn("wal {} 在偏移 {} 处校验失败，已忽略", this.file, start);
                break;
            }
            ByteBuffer record = view.slice();
            record.limit(entrySize);
            res.add(EntryCodec.decode(record));
            view.position(view.position() + entrySize + 4);
        }
        return res;
    }

    public Path getFile() {
        return file;
    }
}
