package com.yumi.lsmkv;

import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.memtable.AvlMemTable;
import com.yumi.lsmkv.memtable.MemTable;
import com.yumi.lsmkv.util.Entry;

import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * failFlush 为 true 时 drain 抛出 IO 异常，模拟刷盘时磁盘写满
 */
public class FailingMemTable implements MemTable {
    private final MemTable delegate;
    private final AtomicBoolean failFlush;

    public FailingMemTable(int maxKeySize, AtomicBoolean failFlush) {
        this.delegate = new AvlMemTable(maxKeySize);
        this.failFlush = failFlush;
    }

    @Override
    public void put(byte[] key, byte[] value, long sequence) {
        delegate.put(key, value, sequence);
    }

    @Override
    public void delete(byte[] key, long sequence) {
        delegate.delete(key, sequence);
    }

    @Override
    public void apply(Entry entry) {
        delegate.apply(entry);
    }

    @Override
    public Optional<Entry> get(byte[] key) {
        return delegate.get(key);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public int entriesCnt() {
        return delegate.entriesCnt();
    }

    @Override
    public void freeze() {
        delegate.freeze();
    }

    @Override
    public boolean isFrozen() {
        return delegate.isFrozen();
    }

    @Override
    public Iterator<Entry> drain() {
        if (failFlush.get()) {
            throw new IOFailureException("写入sst文件失败", new IOException("No space left on device"));
        }
        return delegate.drain();
    }
}
