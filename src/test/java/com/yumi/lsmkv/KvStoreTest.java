package com.yumi.lsmkv;

import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.exception.InvalidKeyException;
import com.yumi.lsmkv.sst.SstFile;
import com.yumi.lsmkv.util.Entry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.yumi.lsmkv.StoreTestHelper.bytes;
import static com.yumi.lsmkv.StoreTestHelper.str;

public class KvStoreTest {
    @TempDir
    Path dir;

    KvStore store;

    private KvStore open(int compactionTrigger) {
        store = new KvStore(Config.newConfig(dir.toString(), c -> {
            c.setMemoryThreshold(5);
            c.setSparseIndexInterval(3);
            c.setCompactionTrigger(compactionTrigger);
            c.setSyncWrites(false);
        }));
        return store;
    }

    @AfterEach
    public void cleanup() {
        if (store != null) {
            store.close();
        }
    }

    private String get(String key) {
        return store.get(bytes(key)).map(StoreTestHelper::str).orElse(null);
    }

    @Test
    public void testFlushAtThreshold() {
        open(0);
        for (int i = 1; i <= 6; i++) {
            store.put(bytes("k" + i), bytes("v" + i));
        }
        store.awaitBackgroundTasks();
        Assertions.assertEquals(1, store.registry().size());
        Assertions.assertEquals(5, store.registry().files().get(0).getEntryCount());
        Assertions.assertEquals(0, store.registry().files().get(0).getLevel());
        Assertions.assertEquals(1, store.memTableEntries());
        Assertions.assertEquals(0, store.pendingFlushes());
        for (int i = 1; i <= 6; i++) {
            Assertions.assertEquals("v" + i, get("k" + i));
        }
        Assertions.assertEquals(KvStore.State.IDLE, store.state());
    }

    @Test
    public void testOverwrite() {
        open(0);
        store.put(bytes("k1"), bytes("v1"));
        store.put(bytes("k1"), bytes("v2"));
        Assertions.assertEquals("v2", get("k1"));
        store.flush();
        Assertions.assertEquals("v2", get("k1"));
        Assertions.assertEquals(1, store.registry().files().get(0).getEntryCount());
    }

    @Test
    public void testDelete() {
        open(0);
        store.put(bytes("k1"), bytes("v1"));
        store.delete(bytes("k1"));
        Assertions.assertNull(get("k1"));
        store.flush();
        Assertions.assertNull(get("k1"));
        //从没写过的 key 也可以删除
        store.delete(bytes("never"));
        Assertions.assertNull(get("never"));
        Assertions.assertEquals(Optional.empty(), store.get(bytes("missing")));
    }

    @Test
    public void testRecencyAcrossFlush() {
        open(0);
        store.put(bytes("k1"), bytes("v1"));
        store.flush();
        store.put(bytes("k1"), bytes("v2"));
        Assertions.assertEquals("v2", get("k1"));
        store.flush();
        Assertions.assertEquals(2, store.registry().size());
        Assertions.assertEquals("v2", get("k1"));
    }

    @Test
    public void testTombstoneShadowsOlderFile() {
        open(0);
        store.put(bytes("k1"), bytes("v1"));
        store.put(bytes("k2"), bytes("v2"));
        store.flush();
        store.delete(bytes("k1"));
        store.flush();
        Assertions.assertEquals(2, store.registry().size());
        Assertions.assertEquals(1, store.registry().files().get(0).getTombstoneCount());
        Assertions.assertNull(get("k1"));

        store.compact();
        Assertions.assertEquals(1, store.registry().size());
        SstFile merged = store.registry().files().get(0);
        Assertions.assertEquals(1, merged.getEntryCount());
        Assertions.assertEquals(0, merged.getTombstoneCount());
        Assertions.assertNull(get("k1"));
        Assertions.assertEquals("v2", get("k2"));
    }

    @Test
    public void testCompactKeepsNewestVersion() {
        open(0);
        store.put(bytes("k1"), bytes("a"));
        store.put(bytes("k2"), bytes("b"));
        store.flush();
        store.put(bytes("k2"), bytes("c"));
        store.flush();
        long k2Sequence = store.lastSequence();
        Assertions.assertEquals(2, store.registry().size());

        store.compact();
        Assertions.assertEquals(1, store.registry().size());
        SstFile merged = store.registry().files().get(0);
        Assertions.assertEquals(2, merged.getEntryCount());
        Entry k2 = merged.get(bytes("k2")).orElseThrow();
        Assertions.assertEquals("c", str(k2.getPayload().getValue()));
        Assertions.assertEquals(k2Sequence, k2.getSequence());
        Assertions.assertEquals("a", get("k1"));
        Assertions.assertEquals("c", get("k2"));
    }

    @Test
    public void testCompactAllDeleted() {
        open(0);
        store.put(bytes("k1"), bytes("v1"));
        store.flush();
        store.delete(bytes("k1"));
        store.flush();
        store.compact();
        Assertions.assertTrue(store.registry().isEmpty());
        Assertions.assertNull(get("k1"));
        //没有文件时合并什么都不做
        store.compact();
        Assertions.assertTrue(store.registry().isEmpty());
    }

    @Test
    public void testCompactionConservation() {
        open(0);
        Map<String, String> model = new HashMap<>();
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            String key = "key" + random.nextInt(100);
            if (random.nextInt(4) == 0) {
                store.delete(bytes(key));
                model.remove(key);
            } else {
                String value = "value" + i;
                store.put(bytes(key), bytes(value));
                model.put(key, value);
            }
        }
        store.flush();
        Assertions.assertTrue(store.registry().size() > 1);
        for (int i = 0; i < 100; i++) {
            Assertions.assertEquals(model.get("key" + i), get("key" + i));
        }

        store.compact();
        int entries = 0;
        for (SstFile file : store.registry()) {
            Assertions.assertEquals(0, file.getTombstoneCount());
            entries += file.getEntryCount();
        }
        Assertions.assertEquals(model.size(), entries);
        for (int i = 0; i < 100; i++) {
            Assertions.assertEquals(model.get("key" + i), get("key" + i));
        }
    }

    @Test
    public void testAutoCompaction() {
        open(2);
        for (int i = 0; i < 200; i++) {
            store.put(bytes(String.format("key%04d", i)), bytes("v" + i));
        }
        store.flush();
        Registry registry = store.registry();
        //每一层连续的文件数都小于阈值
        for (int level = 0; level <= registry.maxLevel(); level++) {
            Assertions.assertTrue(registry.levelRun(level).size() < 2, "level " + level + ": " + registry);
        }
        //越新的文件层号越小
        int preLevel = -1;
        for (SstFile file : registry) {
            Assertions.assertTrue(file.getLevel() >= preLevel);
            preLevel = file.getLevel();
        }
        for (int i = 0; i < 200; i++) {
            Assertions.assertEquals("v" + i, get(String.format("key%04d", i)));
        }
    }

    @Test
    public void testInvalidKey() {
        open(0);
        Assertions.assertThrows(InvalidKeyException.class, () -> store.put(null, bytes("v")));
        Assertions.assertThrows(InvalidKeyException.class, () -> store.put(new byte[0], bytes("v")));
        Assertions.assertThrows(InvalidKeyException.class, () -> store.delete(new byte[64 * 1024 + 1]));
        Assertions.assertThrows(InvalidKeyException.class, () -> store.get(null));
        Assertions.assertThrows(NullPointerException.class, () -> store.put(bytes("k"), null));
        Assertions.assertEquals(0, store.lastSequence());
        Assertions.assertEquals(0, store.memTableEntries());
    }

    @Test
    public void testEmptyValue() {
        open(0);
        store.put(bytes("k"), new byte[0]);
        Assertions.assertEquals("", get("k"));
        store.flush();
        Assertions.assertEquals("", get("k"));
    }

    @Test
    public void testClosed() {
        open(0);
        store.put(bytes("k"), bytes("v"));
        store.close();
        Assertions.assertThrows(IllegalStateException.class, () -> store.put(bytes("k"), bytes("v")));
        Assertions.assertThrows(IllegalStateException.class, () -> store.get(bytes("k")));
        //重复关闭没有影响
        store.close();
    }

    @Test
    public void testReadWhileWriting() throws InterruptedException {
        open(2);
        AtomicInteger written = new AtomicInteger(0);
        AtomicBoolean done = new AtomicBoolean(false);
        List<String> errors = new CopyOnWriteArrayList<>();
        List<Thread> readers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            Thread reader = new Thread(() -> {
                while (!done.get()) {
                    int bound = written.get();
                    if (bound == 0) {
                        continue;
                    }
                    int i = ThreadLocalRandom.current().nextInt(bound);
                    Optional<byte[]> value = store.get(bytes("key" + i));
                    if (!value.isPresent() || !("v" + i).equals(str(value.get()))) {
                        errors.add("key" + i);
                    }
                }
            });
            reader.start();
            readers.add(reader);
        }
        for (int i = 0; i < 2000; i++) {
            store.put(bytes("key" + i), bytes("v" + i));
            written.set(i + 1);
        }
        store.flush();
        done.set(true);
        for (Thread reader : readers) {
            reader.join();
        }
        Assertions.assertTrue(errors.isEmpty(), "lost reads: " + errors.size());
    }

    @Test
    public void testRegistryIsSnapshot() {
        open(0);
        store.put(bytes("k1"), bytes("v1"));
        store.flush();
        Registry before = store.registry();
        store.put(bytes("k2"), bytes("v2"));
        store.flush();
        Assertions.assertEquals(1, before.size());
        Assertions.assertEquals(2, store.registry().size());
        Iterator<SstFile> it = store.registry().iterator();
        Assertions.assertTrue(it.next().getFileId() > it.next().getFileId());
    }

    @Test
    public void testCallerArraysAreCopied() {
        open(0);
        byte[] key = bytes("b");
        byte[] value = bytes("v1");
        store.put(key, value);
        key[0] = 'z';
        value[0] = 'X';
        Assertions.assertEquals("v1", get("b"));
        Assertions.assertNull(get("z"));

        //修改返回的数组不影响存储的数据
        byte[] read = store.get(bytes("b")).orElseThrow();
        read[0] = 'X';
        Assertions.assertEquals("v1", get("b"));

        byte[] deleted = bytes("b");
        store.delete(deleted);
        deleted[0] = 'c';
        Assertions.assertNull(get("b"));

        //写入顺序和 mem table 中的顺序一致，刷盘不会因为乱序失败
        store.put(bytes("a"), bytes("1"));
        store.flush();
        Assertions.assertEquals(2, store.registry().files().get(0).getEntryCount());
        Assertions.assertEquals("1", get("a"));
        Assertions.assertNull(get("b"));
    }

    @Test
    public void testFlushFailureKeepsDataAndRetries() {
        AtomicBoolean failFlush = new AtomicBoolean(true);
        store = new KvStore(Config.newConfig(dir.toString(), c -> {
            c.setMemoryThreshold(5);
            c.setCompactionTrigger(0);
            c.setSyncWrites(false);
            c.setMemTableConstructor(maxKeySize -> new FailingMemTable(maxKeySize, failFlush));
        }));
        for (int i = 0; i < 6; i++) {
            store.put(bytes("k" + i), bytes("v" + i));
        }
        store.awaitBackgroundTasks();
        //刷盘失败，只读表留在内存中，仍然可以读到
        Assertions.assertTrue(store.registry().isEmpty());
        Assertions.assertEquals(1, store.pendingFlushes());
        Assertions.assertEquals(1, store.memTableEntries());
        for (int i = 0; i < 6; i++) {
            Assertions.assertEquals("v" + i, get("k" + i));
        }
        //只读表的 wal 和活跃表的 wal 都保留
        Assertions.assertEquals(2, walFiles().size());

        Assertions.assertThrows(IOFailureException.class, () -> store.put(bytes("k6"), bytes("v6")));
        Assertions.assertThrows(IOFailureException.class, () -> store.delete(bytes("k0")));
        Assertions.assertThrows(IOFailureException.class, () -> store.flush());
        store.awaitBackgroundTasks();
        //重试仍然失败
        Assertions.assertThrows(IOFailureException.class, () -> store.put(bytes("k6"), bytes("v6")));
        Assertions.assertNull(get("k6"));
        Assertions.assertEquals("v0", get("k0"));
        Assertions.assertEquals(6, store.lastSequence());

        //磁盘恢复，被拒绝的写入触发重试
        failFlush.set(false);
        Assertions.assertThrows(IOFailureException.class, () -> store.put(bytes("k6"), bytes("v6")));
        store.awaitBackgroundTasks();
        Assertions.assertEquals(1, store.registry().size());
        Assertions.assertEquals(5, store.registry().files().get(0).getEntryCount());
        Assertions.assertEquals(0, store.pendingFlushes());

        store.put(bytes("k6"), bytes("v6"));
        store.delete(bytes("k0"));
        store.flush();
        Assertions.assertEquals(2, store.registry().size());
        Assertions.assertNull(get("k0"));
        for (int i = 1; i < 7; i++) {
            Assertions.assertEquals("v" + i, get("k" + i));
        }
        Assertions.assertEquals(KvStore.State.IDLE, store.state());
    }

    @Test
    public void testCompactFailureBeforeCommit() throws IOException {
        open(0);
        for (int i = 0; i < 12; i++) {
            store.put(bytes("k" + (i % 8)), bytes("v" + i));
        }
        store.delete(bytes("k1"));
        store.flush();
        Registry before = store.registry();
        Assertions.assertEquals(3, before.size());
        List<Path> filesBefore = sstFiles();

        //manifest 的临时文件无法写入，合并在提交点之前失败
        Path tmp = dir.resolve(Manifest.FILE_NAME + ".tmp");
        Files.createDirectory(tmp);
        Assertions.assertThrows(IOFailureException.class, () -> store.compact());
        Assertions.assertSame(before, store.registry());
        //已经写出的合并结果被删除，输入文件保持不动
        Assertions.assertEquals(filesBefore, sstFiles());
        Assertions.assertEquals(KvStore.State.IDLE, store.state());
        Assertions.assertNull(get("k1"));
        Assertions.assertEquals("v11", get("k3"));

        Files.delete(tmp);
        store.compact();
        Assertions.assertEquals(1, store.registry().size());
        Assertions.assertEquals(1, sstFiles().size());
        Assertions.assertEquals(0, store.registry().files().get(0).getTombstoneCount());
        Assertions.assertEquals(7, store.registry().files().get(0).getEntryCount());
        Assertions.assertNull(get("k1"));
        Assertions.assertEquals("v11", get("k3"));
        Assertions.assertEquals("v8", get("k0"));
    }

    private List<Path> sstFiles() throws IOException {
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(p -> p.getFileName().toString().endsWith(SstFile.SUFFIX))
                    .sorted().collect(Collectors.toList());
        }
    }

    private List<Path> walFiles() {
        try (Stream<Path> paths = Files.list(store.getConfig().getWalDirPath())) {
            return paths.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
