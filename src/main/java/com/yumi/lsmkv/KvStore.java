package com.yumi.lsmkv;

import com.yumi.lsmkv.compaction.Compactor;
import com.yumi.lsmkv.exception.CorruptFileException;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.exception.KvStoreException;
import com.yumi.lsmkv.memtable.MemTable;
import com.yumi.lsmkv.sst.SstFile;
import com.yumi.lsmkv.sst.SstWriter;
import com.yumi.lsmkv.util.AllUtils;
import com.yumi.lsmkv.util.Entry;
import com.yumi.lsmkv.util.Payload;
import com.yumi.lsmkv.wal.WalConstants;
import com.yumi.lsmkv.wal.WalReader;
import com.yumi.lsmkv.wal.WalWriter;
import org.jctools.queues.SpscArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 写入先进 wal 再进活跃 mem table，写满后转为只读表交给后台线程刷盘。
 * 读取顺序: 活跃表 -> 只读表(从新到旧) -> sst 文件(从新到旧)，第一个命中的版本即为结果。
 * 刷盘和合并都在同一个后台线程中串行执行。
 */
public class KvStore implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(KvStore.class);

    public enum State {
        IDLE,
        FLUSHING,
        COMPACTING
    }

    private final ExecutorService poolService = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "lsm-kv-background");
        thread.setDaemon(true);
        return thread;
    });
    private final Config config;
    private final ReentrantReadWriteLock dataLock = new ReentrantReadWriteLock();
    //只替换 readOnlyMemTableList 时使用，不和 dataLock 嵌套等待
    private final Object readOnlyLock = new Object();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicLong nextFileId = new AtomicLong(1);
    private final Manifest manifest;
    private final Compactor compactor;
    private final SpscArrayQueue<MemTableCompactItem> memCompactQueue;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicReference<Throwable> backgroundFailure = new AtomicReference<>();
    private final AtomicBoolean stop = new AtomicBoolean(false);

    private long walIndex = 0;
    private WalWriter walWriter;
    private MemTable memTable;
    //从旧到新，写时复制
    private volatile List<MemTableCompactItem> readOnlyMemTableList = Collections.emptyList();
    private volatile Registry registry = Registry.empty();

    public KvStore(Config config) {
        this.config = checkNotNull(config, "config");
        this.manifest = new Manifest(config.getDirPath());
        this.compactor = new Compactor(config);
        this.memCompactQueue = new SpscArrayQueue<>(config.getPendingFlushCapacity());
        try {
            constructTree(); //加载sst文件
            constructMemTable(); //恢复mem table
        } catch (RuntimeException e) {
            this.poolService.shutdownNow();
            for (SstFile file : this.registry) {
                file.close();
            }
            throw e;
        }
        LOG.info("store opened at {}: {} sst files, {} pending flushes, sequence {}",
                config.getDir(), this.registry.size(), this.readOnlyMemTableList.size(), this.sequence.get());
    }

    private void constructTree() {
        NavigableMap<Long, Path> onDisk = listSstFiles();
        if (!onDisk.isEmpty()) {
            this.nextFileId.set(onDisk.lastKey() + 1);
        }
        Optional<Manifest.Snapshot> registered = this.manifest.load();
        List<SstFile> files = new ArrayList<>();
        if (registered.isPresent()) {
            //manifest 是唯一可信的文件列表
            for (long fileId : registered.get().getFileIds()) {
                Path path = onDisk.get(fileId);
                if (null == path) {
                    LOG.error("registered sst file {} is missing", SstFile.fileName(fileId));
                    continue;
                }
                tryOpen(path).ifPresent(files::add);
            }
            Set<Long> keep = new HashSet<>(registered.get().getFileIds());
            for (Map.Entry<Long, Path> item : onDisk.entrySet()) {
                if (!keep.contains(item.getKey())) {
                    LOG.warn("deleting orphan sst file {}", item.getValue());
                    deleteQuietly(item.getValue());
                }
            }
            this.registry = Registry.of(files, registered.get().getPersistedSequence());
        } else {
            //没有 manifest，编号越大越新
            for (Path path : onDisk.descendingMap().values()) {
                tryOpen(path).ifPresent(files::add);
            }
            this.registry = Registry.of(files);
            this.manifest.persist(this.registry);
        }
        this.sequence.set(this.registry.persistedSequence());
    }

    private Optional<SstFile> tryOpen(Path path) {
        try {
            return Optional.of(SstFile.open(path, this.config));
        } catch (CorruptFileException e) {
            LOG.error("excluding corrupt sst file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private NavigableMap<Long, Path> listSstFiles() {
        NavigableMap<Long, Path> res = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(this.config.getDirPath(), "*" + SstFile.SUFFIX)) {
            for (Path path : stream) {
                OptionalLong fileId = SstFile.parseFileId(path.getFileName().toString());
                if (fileId.isPresent() && Files.isRegularFile(path)) {
                    res.put(fileId.getAsLong(), path);
                }
            }
        } catch (IOException e) {
            throw new IOFailureException("列出sst文件失败 " + this.config.getDir(), e);
        }
        return res;
    }

    private void constructMemTable() {
        NavigableMap<Long, Path> wals = listWalFiles();
        long persistedSequence = this.registry.persistedSequence();
        for (Map.Entry<Long, Path> item : wals.entrySet()) {
            Path wal = item.getValue();
            MemTable restored = this.config.getMemTableConstructor().create(this.config.getMaxKeySize());
            long maxSequence = new WalReader(wal).restoreMemTable(restored, persistedSequence);
            this.sequence.accumulateAndGet(maxSequence, Math::max);
            if (restored.entriesCnt() == 0) {
                deleteQuietly(wal);
                continue;
            }
            LOG.info("recovered {} entries from {}", restored.entriesCnt(), wal);
            restored.freeze();
            addToReadonlyAndFireCompact(wal, restored);
        }
        this.walIndex = wals.isEmpty() ? 0 : wals.lastKey() + 1;
        newMemTable();
    }

    private NavigableMap<Long, Path> listWalFiles() {
        NavigableMap<Long, Path> res = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(this.config.getWalDirPath(), "*" + WalConstants.WAL_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                try {
                    res.put(Long.parseLong(name.substring(0, name.length() - WalConstants.WAL_SUFFIX.length())), path);
                } catch (NumberFormatException e) {
                    LOG.warn("ignoring unexpected file {} in wal directory", path);
                }
            }
        } catch (IOException e) {
            throw new IOFailureException("列出wal文件失败 " + this.config.getWalDirPath(), e);
        }
        return res;
    }

    public void put(byte[] key, byte[] value) {
        checkOpen();
        AllUtils.checkKey(key, this.config.getMaxKeySize());
        checkNotNull(value, "value");
        //复制一份，调用方之后修改数组不影响已经写入的数据
        write(key.clone(), Payload.value(value.clone()));
    }

    public void delete(byte[] key) {
        checkOpen();
        AllUtils.checkKey(key, this.config.getMaxKeySize());
        write(key.clone(), Payload.tombstone());
    }

    private void write(byte[] key, Payload payload) {
        ReentrantReadWriteLock.WriteLock lock = this.dataLock.writeLock();
        lock.lock();
        try {
            checkBackgroundFailure();
            // --写满了要重建，上次重建失败时 wal 已经关闭，也要重建
            if (this.memTable.entriesCnt() >= this.config.getMemoryThreshold() || !this.walWriter.isOpen()) {
                refreshMemTable();
            }
            Entry entry = new Entry(key, payload, this.sequence.incrementAndGet());
            //1.写入wal file
            this.walWriter.write(entry);
            //2.写入mem table中
            if (payload.isTombstone()) {
                this.memTable.delete(key, entry.getSequence());
            } else {
                this.memTable.put(key, payload.getValue(), entry.getSequence());
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<byte[]> get(byte[] key) {
        checkOpen();
        AllUtils.checkKey(key, this.config.getMaxKeySize());
        List<MemTableCompactItem> readOnly;
        ReentrantReadWriteLock.ReadLock lock = this.dataLock.readLock();
        lock.lock();
        try {
            //mem table找
            Optional<Entry> entry = this.memTable.get(key);
            if (entry.isPresent()) {
                return toValue(entry.get());
            }
            readOnly = this.readOnlyMemTableList;
        } finally {
            lock.unlock();
        }
        //从新到旧冷表找
        for (int i = readOnly.size() - 1; i >= 0; i--) {
            Optional<Entry> entry = readOnly.get(i).getMemTable().get(key);
            if (entry.isPresent()) {
                return toValue(entry.get());
            }
        }
        //冷表之后再取 registry，刷盘时先登记文件再移除冷表，中间状态也不会漏读
        for (SstFile file : this.registry) {
            Optional<Entry> entry = file.get(key);
            if (entry.isPresent()) {
                return toValue(entry.get());
            }
        }
        return Optional.empty();
    }

    private static Optional<byte[]> toValue(Entry entry) {
        if (entry.isTombstone()) {
            return Optional.empty();
        }
        return Optional.of(entry.getPayload().getValue().clone());
    }

    /**
     * 把活跃表转为只读表并等待所有只读表落盘
     */
    public void flush() {
        checkOpen();
        ReentrantReadWriteLock.WriteLock lock = this.dataLock.writeLock();
        lock.lock();
        try {
            checkBackgroundFailure();
            if (this.memTable.entriesCnt() > 0) {
                refreshMemTable();
            }
        } finally {
            lock.unlock();
        }
        await(this.poolService.submit(this::drainFlushQueue));
        Throwable failure = this.backgroundFailure.get();
        if (null != failure) {
            throw new IOFailureException("刷盘失败", failure);
        }
    }

    /**
     * 全量合并所有 sst 文件，删除标记和被覆盖的旧版本都会被丢弃
     */
    public void compact() {
        checkOpen();
        await(this.poolService.submit(() -> {
            Registry current = this.registry;
            if (current.isEmpty()) {
                return;
            }
            if (current.size() == 1 && current.files().get(0).getTombstoneCount() == 0) {
                //只有一个文件且没有删除标记，合并不会有任何变化
                return;
            }
            compactFiles(current, current.files(), Math.max(1, current.maxLevel()));
        }));
    }

    /**
     * 等待已经提交的刷盘和合并任务执行完，不会封存活跃表
     */
    public void awaitBackgroundTasks() {
        checkOpen();
        await(this.poolService.submit(() -> { }));
    }

    private void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new KvStoreException("等待后台任务时被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof KvStoreException) {
                throw (KvStoreException) cause;
            }
            throw new KvStoreException("后台任务失败", cause);
        }
    }

    private void checkOpen() {
        if (this.stop.get()) {
            throw new IllegalStateException("store已关闭");
        }
    }

    //上一次刷盘失败时拒绝写入，同时触发一次重试
    private void checkBackgroundFailure() {
        Throwable failure = this.backgroundFailure.get();
        if (null != failure) {
            submitBackground(this::drainFlushQueue);
            throw new IOFailureException("后台刷盘失败，稍后重试", failure);
        }
    }

    private void refreshMemTable() {
        //先建好新的 wal，失败时活跃表保持不变
        this.walWriter.close();
        WalWriter next = new WalWriter(walFile(this.walIndex + 1), this.config.isSyncWrites());
        //热表转冷表
        MemTable old = this.memTable;
        old.freeze();
        Path oldWal = this.walWriter.getFile();
        this.walIndex++;
        this.walWriter = next;
        this.memTable = this.config.getMemTableConstructor().create(this.config.getMaxKeySize());
        addToReadonlyAndFireCompact(oldWal, old);
    }

    private void addToReadonlyAndFireCompact(Path walFile, MemTable memTable) {
        MemTableCompactItem item = new MemTableCompactItem(walFile, memTable);
        synchronized (this.readOnlyLock) {
            List<MemTableCompactItem> list = new ArrayList<>(this.readOnlyMemTableList);
            list.add(item);
            this.readOnlyMemTableList = Collections.unmodifiableList(list);
        }
        //放到冷表队列中，队列满了就等后台线程消费
        int spins = 0;
        while (!this.memCompactQueue.offer(item)) {
            if (spins++ % 1024 == 0) {
                submitBackground(this::drainFlushQueue);
            }
            Thread.yield();
        }
        submitBackground(this::drainFlushQueue);
    }

    private void submitBackground(Runnable task) {
        try {
            this.poolService.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.warn("background executor rejected task, store is shutting down");
        }
    }

    //后台线程: 按顺序刷盘，失败的只读表留在队首等待重试
    private void drainFlushQueue() {
        MemTableCompactItem item;
        while (null != (item = this.memCompactQueue.peek())) {
            try {
                compactMemTable(item);
            } catch (RuntimeException e) {
                LOG.error("flushing {} failed, will retry", item.getWalFile(), e);
                this.backgroundFailure.set(e);
                return;
            }
            this.memCompactQueue.poll();
            this.backgroundFailure.set(null);
        }
        tryCompactSst();
    }

    private void compactMemTable(MemTableCompactItem item) {
        this.state.set(State.FLUSHING);
        try {
            Optional<SstFile> flushed = flushMemTable(item.getMemTable());
            if (flushed.isPresent()) {
                Registry next = this.registry.append(flushed.get());
                try {
                    this.manifest.persist(next);
                } catch (RuntimeException e) {
                    destroyQuietly(flushed.get());
                    throw e;
                }
                this.registry = next;
            }
            synchronized (this.readOnlyLock) {
                List<MemTableCompactItem> list = new ArrayList<>(this.readOnlyMemTableList);
                list.remove(item);
                this.readOnlyMemTableList = Collections.unmodifiableList(list);
            }
            deleteQuietly(item.getWalFile());
        } finally {
            this.state.set(State.IDLE);
        }
    }

    private Optional<SstFile> flushMemTable(MemTable memTable) {
        Iterator<Entry> entries = memTable.drain();
        if (!entries.hasNext()) {
            return Optional.empty();
        }
        long fileId = this.nextFileId.getAndIncrement();
        Path path = this.config.getDirPath().resolve(SstFile.fileName(fileId));
        SstWriter sstWriter = new SstWriter(path, fileId, 0, this.config);
        try {
            while (entries.hasNext()) {
                sstWriter.append(entries.next());
            }
            sstWriter.finish();
        } catch (RuntimeException e) {
            sstWriter.abort();
            throw e;
        }
        SstFile file = SstFile.open(path, this.config);
        LOG.info("flushed {} entries to {}", file.getEntryCount(), path.getFileName());
        return Optional.of(file);
    }

    /**
     * 某一层连续的文件数达到阈值时合并成下一层，逐层检查
     */
    private void tryCompactSst() {
        int trigger = this.config.getCompactionTrigger();
        if (trigger == 0) {
            return;
        }
        Registry current = this.registry;
        for (int level = 0; level <= current.maxLevel(); level++) {
            List<SstFile> run = current.levelRun(level);
            if (run.size() < trigger) {
                continue;
            }
            try {
                compactFiles(current, run, level + 1);
            } catch (RuntimeException e) {
                LOG.error("compacting level {} failed", level, e);
                return;
            }
            current = this.registry;
        }
    }

    private void compactFiles(Registry current, List<SstFile> inputs, int outputLevel) {
        this.state.set(State.COMPACTING);
        try {
            //输入包含了所有文件，没有更老的版本需要删除标记去遮挡
            boolean dropTombstones = inputs.size() == current.size();
            List<SstFile> outputs = this.compactor.compact(inputs, dropTombstones, outputLevel,
                    this.nextFileId::getAndIncrement);
            Registry next = current.replace(inputs, outputs);
            try {
                this.manifest.persist(next);
            } catch (RuntimeException e) {
                for (SstFile output : outputs) {
                    destroyQuietly(output);
                }
                throw e;
            }
            //提交点之后
            this.registry = next;
            for (SstFile input : inputs) {
                destroyQuietly(input);
            }
        } finally {
            this.state.set(State.IDLE);
        }
    }

    private void newMemTable() {
        this.walWriter = new WalWriter(walFile(this.walIndex), this.config.isSyncWrites());
        this.memTable = this.config.getMemTableConstructor().create(this.config.getMaxKeySize());
    }

    private Path walFile(long index) {
        return this.config.getWalDirPath().resolve(index + WalConstants.WAL_SUFFIX);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("failed to delete {}", path, e);
        }
    }

    //旧文件已经不在 manifest 中，删除失败只会在下次打开时作为孤儿文件清理
    private static void destroyQuietly(SstFile file) {
        try {
            file.destroy();
        } catch (IOFailureException e) {
            LOG.warn("failed to destroy {}", file.getPath(), e);
        }
    }

    public State state() {
        return this.state.get();
    }

    public Registry registry() {
        return this.registry;
    }

    public int memTableEntries() {
        ReentrantReadWriteLock.ReadLock lock = this.dataLock.readLock();
        lock.lock();
        try {
            return this.memTable.entriesCnt();
        } finally {
            lock.unlock();
        }
    }

    public int pendingFlushes() {
        return this.readOnlyMemTableList.size();
    }

    public long lastSequence() {
        return this.sequence.get();
    }

    public Config getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (!this.stop.compareAndSet(false, true)) {
            return;
        }
        ReentrantReadWriteLock.WriteLock lock = this.dataLock.writeLock();
        lock.lock();
        try {
            if (this.memTable.entriesCnt() > 0 && null == this.backgroundFailure.get()) {
                refreshMemTable();
            }
        } catch (KvStoreException e) {
            //数据仍在 wal 中，下次打开时恢复
            LOG.error("sealing the active mem table on close failed", e);
        } finally {
            lock.unlock();
        }
        ExecutorService poolToShutdown = this.poolService;
        poolToShutdown.shutdown();
        boolean shutdown = false;
        for (int i = 0; i < 3; i++) {
            LOG.info("waiting for background tasks...");
            try {
                shutdown = poolToShutdown.awaitTermination(30, TimeUnit.SECONDS);
                if (shutdown) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!shutdown) {
            LOG.warn("force shutdown");
            poolToShutdown.shutdownNow();
        }
        try {
            this.walWriter.close();
        } catch (IOFailureException e) {
            LOG.error("closing wal failed", e);
        }
        for (SstFile file : this.registry) {
            file.close();
        }
        LOG.info("store at {} closed", this.config.getDir());
    }

    public static class MemTableCompactItem {
        private final Path walFile;
        private final MemTable memTable;

        public MemTableCompactItem(Path walFile, MemTable memTable) {
            this.walFile = walFile;
            this.memTable = memTable;
        }

        public Path getWalFile() {
            return walFile;
        }

        public MemTable getMemTable() {
            return memTable;
        }
    }
}
