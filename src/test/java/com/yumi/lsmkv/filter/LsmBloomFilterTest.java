package com.yumi.lsmkv.filter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public class LsmBloomFilterTest {

    private static byte[] key(int i) {
        return ("key-" + i).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testAddSuccess() {
        LsmBloomFilter.Builder builder = LsmBloomFilter.builder(0.01);
        builder.add(new byte[] {1, 2, 3});
        Assertions.assertEquals(1, builder.keyLen());
        LsmBloomFilter filter = builder.build();
        Assertions.assertTrue(filter.mightContain(new byte[] {1, 2, 3}));
        Assertions.assertThrows(IllegalStateException.class, () -> builder.add(new byte[] {4}));
    }

    @Test
    public void testNoFalseNegative() {
        LsmBloomFilter.Builder builder = LsmBloomFilter.builder(0.01);
        for (int i = 0; i < 10000; i++) {
            builder.add(key(i));
        }
        LsmBloomFilter filter = builder.build();
        for (int i = 0; i < 10000; i++) {
            Assertions.assertTrue(filter.mightContain(key(i)));
        }
    }

    @Test
    public void testFalsePositiveRate() {
        LsmBloomFilter.Builder builder = LsmBloomFilter.builder(0.01);
        for (int i = 0; i < 10000; i++) {
            builder.add(key(i));
        }
        LsmBloomFilter filter = builder.build();
        int hits = 0;
        for (int i = 10000; i < 30000; i++) {
            if (filter.mightContain(key(i))) {
                hits++;
            }
        }
        //期望 1%，给足余量
        Assertions.assertTrue(hits < 20000 * 0.03, "false positives: " + hits);
    }

    @Test
    public void testEmptyFilter() {
        LsmBloomFilter filter = LsmBloomFilter.builder(0.01).build();
        Assertions.assertTrue(filter.bitLength() >= 8);
        Assertions.assertFalse(filter.mightContain(key(1)));
    }

    @Test
    public void testSerialize() {
        LsmBloomFilter.Builder builder = LsmBloomFilter.builder(0.05);
        for (int i = 0; i < 100; i++) {
            builder.add(key(i));
        }
        LsmBloomFilter filter = builder.build();
        ByteBuffer buffer = ByteBuffer.allocate(filter.serializedSize());
        filter.writeTo(buffer);
        Assertions.assertFalse(buffer.hasRemaining());
        buffer.flip();

        LsmBloomFilter restored = LsmBloomFilter.readFrom(buffer);
        Assertions.assertEquals(filter.bitLength(), restored.bitLength());
        Assertions.assertEquals(filter.hashCount(), restored.hashCount());
        for (int i = 0; i < 200; i++) {
            Assertions.assertEquals(filter.mightContain(key(i)), restored.mightContain(key(i)));
        }
    }

    @Test
    public void testReadIllegalHeader() {
        ByteBuffer buffer = ByteBuffer.allocate(8);
        buffer.putInt(7).putInt(1).flip();
        Assertions.assertThrows(IllegalArgumentException.class, () -> LsmBloomFilter.readFrom(buffer));
    }
}
