package com.yumi.lsmkv.sst;

import com.google.common.hash.Hasher;
import com.yumi.lsmkv.util.Entry;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * 写 sst 数据块时使用的缓冲，放不下时自动扩容，刷盘后循环使用。
 * 落盘格式: rawLength(4) storedLength(4) 压缩后的字节
 */
public class Block {
    public static final int HEADER_SIZE = 4 + 4;

    private final int blockSize;
    private final CompressionCodec codec;
    private ByteBuffer buffer;
    private int entriesCnt;

    public Block(int blockSize, CompressionCodec codec) {
        this.blockSize = blockSize;
        this.codec = codec;
        this.buffer = ByteBuffer.allocate(blockSize);
    }

    /**
     * @return 该记录在块内（未压缩）的偏移
     */
    public int append(Entry entry) {
        int willWriteBytes = EntryCodec.encodedSize(entry);
        if (willWriteBytes > this.buffer.remaining()) {
            int newCapacity = Math.max(this.buffer.capacity() * 2, this.buffer.position() + willWriteBytes);
            ByteBuffer newBuffer = ByteBuffer.allocate(newCapacity);
            this.buffer.flip();
            newBuffer.put(this.buffer);
            this.buffer = newBuffer;
        }
        int offset = this.buffer.position();
        EntryCodec.encode(entry, this.buffer);
        this.entriesCnt++;
        return offset;
    }

    //未压缩的字节数
    public int size() {
        return this.buffer.position();
    }

    public boolean isFull() {
        return this.buffer.position() >= this.blockSize;
    }

    public int getEntriesCnt() {
        return entriesCnt;
    }

    public boolean isEmpty() {
        return this.entriesCnt == 0;
    }

    /**
     * 压缩后写到 channel 当前位置，同时把写出的字节喂给校验和
     * @return 写出的字节数，含块头
     */
    public int flushTo(FileChannel fileChannel, Hasher checksum) throws IOException {
        int rawLength = this.size();
        byte[] stored = this.codec.compress(this.buffer.array(), rawLength);
        ByteBuffer out = ByteBuffer.allocate(HEADER_SIZE + stored.length);
        out.putInt(rawLength);
        out.putInt(stored.length);
        out.put(stored);
        out.flip();
        checksum.putBytes(out.duplicate());
        while (out.hasRemaining()) {
            fileChannel.write(out);
        }
        clear();
        return HEADER_SIZE + stored.length;
    }

    public void clear() {
        this.entriesCnt = 0;
        if (this.buffer.capacity() != this.blockSize) {
            this.buffer = ByteBuffer.allocate(this.blockSize);
        } else {
            this.buffer.clear();
        }
    }
}
