package com.yumi.lsmkv.wal;

import com.google.common.hash.Hashing;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.sst.EntryCodec;
import com.yumi.lsmkv.util.Entry;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static com.yumi.lsmkv.wal.WalConstants.RECORD_OVERHEAD;

/**
 * 一个 mem table 对应一个 wal 文件，记录格式: length entry crc32c
 */
public class WalWriter {

    private final Path file;
    private final FileChannel channel;
    private final boolean sync;
    private long size;

    public WalWriter(Path file, boolean sync) {
        this.file = file;
        this.sync = sync;
        try {
            this.channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new IOFailureException("创建wal文件失败 " + file, e);
        }
    }

    public void write(Entry entry) {
        int entrySize = EntryCodec.encodedSize(entry);
        ByteBuffer buffer = ByteBuffer.allocate(entrySize + RECORD_OVERHEAD);
        buffer.putInt(entrySize);
        EntryCodec.encode(entry, buffer);
        buffer.putInt(Hashing.crc32c().hashBytes(buffer.array(), 4, entrySize).asInt());
        buffer.flip();
        try {
            while (buffer.hasRemaining()) {
                this.channel.write(buffer);
            }
            //每次都刷，不会丢数据，但是性能受影响
            if (this.sync) {
                this.channel.force(false);
            }
        } catch (IOException e) {
            throw new IOFailureException("写入wal失败 " + this.file, e);
        }
        this.size += entrySize + RECORD_OVERHEAD;
    }

    public long size() {
        return size;
    }

    public boolean isOpen() {
        return this.channel.isOpen();
    }

    public Path getFile() {
        return file;
    }

    public void close() {
        try {
            if (this.channel.isOpen()) {
                this.channel.force(false);
                this.channel.close();
            }
        } catch (IOException e) {
            throw new IOFailureException("关闭wal失败 " + this.file, e);
        }
    }
}
