package com.yumi.lsmkv.sst;

import com.yumi.lsmkv.util.Entry;
import com.yumi.lsmkv.util.Payload;

import java.nio.ByteBuffer;

/**
 * 单条记录的编码: keyLen key valueLen|TOMBSTONE value? sequence
 * sst 的数据块和 wal 共用这一格式
 */
public final class EntryCodec {
    public static final int TOMBSTONE = -1;

    private EntryCodec() {}

    public static int encodedSize(Entry entry) {
        return 4 //keyLen
                + entry.getKey().length
                + 4 //valueLen 或者删除标记
                + entry.getPayload().length()
                + 8; //sequence
    }

    public static void encode(Entry entry, ByteBuffer buffer) {
        byte[] key = entry.getKey();
        buffer.putInt(key.length);
        buffer.put(key);
        Payload payload = entry.getPayload();
        if (payload.isTombstone()) {
            buffer.putInt(TOMBSTONE);
        } else {
            byte[] value = payload.getValue();
            buffer.putInt(value.length);
            buffer.put(value);
        }
        buffer.putLong(entry.getSequence());
    }

    public static Entry decode(ByteBuffer buffer) {
        int keyLen = buffer.getInt();
        if (keyLen <= 0 || keyLen > buffer.remaining()) {
            throw new IllegalArgumentException("illegal key length " + keyLen);
        }
        byte[] key = new byte[keyLen];
        buffer.get(key);
        int valueLen = buffer.getInt();
        Payload payload;
        if (valueLen == TOMBSTONE) {
            payload = Payload.tombstone();
        } else {
            if (valueLen < 0 || valueLen > buffer.remaining()) {
                throw new IllegalArgumentException("illegal value length " + valueLen);
            }
            byte[] value = new byte[valueLen];
            buffer.get(value);
            payload = Payload.value(value);
        }
        long sequence = buffer.getLong();
        return new Entry(key, payload, sequence);
    }
}
