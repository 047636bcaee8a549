package com.yumi.lsmkv.sst;

import org.xerial.snappy.Snappy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * sst 数据块的压缩方式，编号写在 footer 中，同一个文件内所有数据块使用同一种
 */
public enum CompressionCodec {
    NONE((byte) 0) {
        @Override
        public byte[] compress(byte[] raw, int length) {
            byte[] res = new byte[length];
            System.arraycopy(raw, 0, res, 0, length);
            return res;
        }

        @Override
        public byte[] decompress(ByteBuffer stored, int rawLength) {
            byte[] res = new byte[stored.remaining()];
            stored.get(res);
            return res;
        }
    },
    GZIP((byte) 1) {
        @Override
        public byte[] compress(byte[] raw, int length) throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, length / 2));
            try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                gzip.write(raw, 0, length);
            }
            return out.toByteArray();
        }

        @Override
        public byte[] decompress(ByteBuffer stored, int rawLength) throws IOException {
            byte[] input = new byte[stored.remaining()];
            stored.get(input);
            byte[] res = new byte[rawLength];
            try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(input))) {
                int read = gzip.readNBytes(res, 0, rawLength);
                if (read != rawLength || gzip.read() != -1) {
                    throw new IOException("解压后的长度与记录的不一致，期望 " + rawLength);
                }
            }
            return res;
        }
    },
    SNAPPY((byte) 2) {
        @Override
        public byte[] compress(byte[] raw, int length) throws IOException {
            byte[] res = new byte[Snappy.maxCompressedLength(length)];
            int size = Snappy.compress(raw, 0, length, res, 0);
            byte[] trimmed = new byte[size];
            System.arraycopy(res, 0, trimmed, 0, size);
            return trimmed;
        }

        @Override
        public byte[] decompress(ByteBuffer stored, int rawLength) throws IOException {
            byte[] input = new byte[stored.remaining()];
            stored.get(input);
            if (Snappy.uncompressedLength(input) != rawLength) {
                throw new IOException("解压后的长度与记录的不一致，期望 " + rawLength);
            }
            return Snappy.uncompress(input);
        }
    };

    private final byte id;

    CompressionCodec(byte id) {
        this.id = id;
    }

    public byte getId() {
        return id;
    }

    //压缩 raw 的前 length 个字节
    public abstract byte[] compress(byte[] raw, int length) throws IOException;

    public abstract byte[] decompress(ByteBuffer stored, int rawLength) throws IOException;

    public static CompressionCodec fromId(byte id) {
        for (CompressionCodec codec : values()) {
            if (codec.id == id) {
                return codec;
            }
        }
        throw new IllegalArgumentException("unknown compression codec " + id);
    }
}
