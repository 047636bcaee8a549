package com.yumi.lsmkv.sst;

import com.yumi.lsmkv.Config;
import com.yumi.lsmkv.StoreTestHelper;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.util.AllUtils;
import com.yumi.lsmkv.util.Entry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.yumi.lsmkv.StoreTestHelper.bytes;
import static com.yumi.lsmkv.StoreTestHelper.str;

public class SstWriterTest {
    @TempDir
    Path dir;

    @Test
    public void testWriteSuccess() throws IOException {
        Config config = Config.newConfig(dir.toString(), c -> {
            c.setSstBlockSize(29);
            c.setSparseIndexInterval(3);
            c.setCompression(CompressionCodec.NONE);
        });
        Path file = dir.resolve(SstFile.fileName(7));
        SstWriter sstWriter = new SstWriter(file, 7, 0, config);
        sstWriter.append(Entry.value(new byte[]{1}, new byte[]{1}, 3));
        sstWriter.append(Entry.value(new byte[]{1, 2}, new byte[]{1, 2}, 1));
        sstWriter.append(Entry.tombstone(new byte[]{3}, 5));
        sstWriter.append(Entry.value(new byte[]{3, 4}, new byte[]{3, 4}, 2));
        Assertions.assertEquals(4, sstWriter.entriesCnt());
        Footer footer = sstWriter.finish();

        // 4 4 1 1 8 = 18 | 4 4 2 2 8 = 20 | 4 1 4 8 = 17 | 4 4 2 2 8 = 20
        // 块只在索引处切分: [块头8 + 18 20 17] [块头8 + 20]
        Assertions.assertEquals(8 + 55 + 8 + 20, footer.getIndexOffset());
        Assertions.assertEquals(7, footer.getFileId());
        Assertions.assertEquals(0, footer.getLevel());
        Assertions.assertEquals(4, footer.getEntryCount());
        Assertions.assertEquals(1, footer.getTombstoneCount());
        Assertions.assertEquals(1, footer.getMinSequence());
        Assertions.assertEquals(5, footer.getMaxSequence());
        Assertions.assertEquals(3, footer.getSparseInterval());
        Assertions.assertEquals(CompressionCodec.NONE, footer.getCompression());
        Assertions.assertEquals(0, AllUtils.compare(new byte[]{1}, footer.getMinKey()));
        Assertions.assertEquals(0, AllUtils.compare(new byte[]{3, 4}, footer.getMaxKey()));
        // 第0条和第3条建索引: 4 + (4 1 4 4) + (4 2 4 4)
        Assertions.assertEquals(4 + 13 + 14, footer.getIndexSize());

        byte[] bytes = Files.readAllBytes(file);
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        //第一个块头
        Assertions.assertEquals(55, buffer.getInt(0));
        Assertions.assertEquals(55, buffer.getInt(4));
        //第一条记录
        Assertions.assertEquals(1, buffer.getInt(8));
        Assertions.assertEquals(1, buffer.get(12));
        Assertions.assertEquals(1, buffer.getInt(13));
        Assertions.assertEquals(3L, buffer.getLong(18));
        //删除标记的 value 长度为 -1
        Assertions.assertEquals(EntryCodec.TOMBSTONE, buffer.getInt(8 + 18 + 20 + 5));
        //第二个块头
        Assertions.assertEquals(20, buffer.getInt(63));
        Assertions.assertEquals(20, buffer.getInt(67));
        //索引区
        int indexOffset = (int) footer.getIndexOffset();
        Assertions.assertEquals(2, buffer.getInt(indexOffset));
        Assertions.assertEquals(1, buffer.getInt(indexOffset + 4));
        Assertions.assertEquals(0, buffer.getInt(indexOffset + 9));
        Assertions.assertEquals(0, buffer.getInt(indexOffset + 13));
        Assertions.assertEquals(2, buffer.getInt(indexOffset + 17));
        Assertions.assertEquals(63, buffer.getInt(indexOffset + 23));
        Assertions.assertEquals(0, buffer.getInt(indexOffset + 27));
        //提交标记在文件最后
        Assertions.assertEquals(Footer.MAGIC, buffer.getLong(bytes.length - 8));
    }

    @Test
    public void testAppendOutOfOrder() {
        Config config = Config.newConfig(dir.toString());
        try (SstWriter sstWriter = new SstWriter(dir.resolve(SstFile.fileName(1)), 1, 0, config)) {
            sstWriter.append(Entry.value(bytes("b"), bytes("1"), 1));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> sstWriter.append(Entry.value(bytes("a"), bytes("1"), 2)));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> sstWriter.append(Entry.value(bytes("b"), bytes("2"), 3)));
        }
    }

    @Test
    public void testFinishEmpty() {
        Config config = Config.newConfig(dir.toString());
        SstWriter sstWriter = new SstWriter(dir.resolve(SstFile.fileName(1)), 1, 0, config);
        Assertions.assertThrows(IllegalStateException.class, sstWriter::finish);
        sstWriter.abort();
        Assertions.assertFalse(Files.exists(dir.resolve(SstFile.fileName(1))));
    }

    @Test
    public void testFileExists() throws IOException {
        Config config = Config.newConfig(dir.toString());
        Files.write(dir.resolve(SstFile.fileName(1)), new byte[]{1});
        Assertions.assertThrows(IOFailureException.class,
                () -> new SstWriter(dir.resolve(SstFile.fileName(1)), 1, 0, config));
    }

    @Test
    public void testEntryLargerThanBlock() {
        Config config = Config.newConfig(dir.toString(), c -> {
            c.setSstBlockSize(16);
            c.setCompression(CompressionCodec.NONE);
        });
        Path file = dir.resolve(SstFile.fileName(2));
        try (SstWriter sstWriter = new SstWriter(file, 2, 0, config)) {
            sstWriter.append(Entry.value(bytes("a"), new byte[100], 1));
            sstWriter.append(Entry.value(bytes("b"), new byte[]{1}, 2));
            //同一组记录留在同一个块里，块自动扩容
            Assertions.assertEquals(4 + 1 + 4 + 100 + 8 + 4 + 1 + 4 + 1 + 8, sstWriter.size());
            sstWriter.finish();
        }
        SstFile sstFile = SstFile.open(file, config);
        Assertions.assertEquals(100, sstFile.get(bytes("a")).orElseThrow().getPayload().length());
        Assertions.assertArrayEquals(new byte[]{1}, sstFile.get(bytes("b")).orElseThrow().getPayload().getValue());
        sstFile.close();
    }

    @Test
    public void testDataSpansManyBlocks() {
        Config config = Config.newConfig(dir.toString(), c -> {
            c.setSstBlockSize(32);
            c.setSparseIndexInterval(2);
        });
        Path file = dir.resolve(SstFile.fileName(3));
        try (SstWriter sstWriter = new SstWriter(file, 3, 0, config)) {
            for (int i = 0; i < 200; i++) {
                sstWriter.append(Entry.value(bytes(String.format("k%04d", i)), bytes("value-value-" + i), i + 1));
            }
            sstWriter.finish();
        }
        SstFile sstFile = SstFile.open(file, config);
        Assertions.assertEquals(CompressionCodec.GZIP, sstFile.getCompression());
        //每两条一个块，索引指向各自的块首
        Index[] indices = sstFile.indices();
        Assertions.assertEquals(100, indices.length);
        for (int i = 0; i < indices.length; i++) {
            Assertions.assertEquals(0, indices[i].getEntryOffset());
            if (i > 0) {
                Assertions.assertTrue(indices[i].getBlockOffset() > indices[i - 1].getBlockOffset());
            }
        }
        for (int i = 0; i < 200; i++) {
            Assertions.assertEquals("value-value-" + i,
                    str(sstFile.get(bytes(String.format("k%04d", i))).orElseThrow().getPayload().getValue()));
        }
        Assertions.assertEquals(200, StoreTestHelper.readAll(sstFile).size());
        sstFile.close();
    }
}
