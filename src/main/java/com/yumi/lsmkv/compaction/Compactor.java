package com.yumi.lsmkv.compaction;

import com.yumi.lsmkv.Config;
import com.yumi.lsmkv.sst.SstFile;
import com.yumi.lsmkv.sst.SstWriter;
import com.yumi.lsmkv.util.AllUtils;
import com.yumi.lsmkv.util.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.function.LongSupplier;

/**
 * 多路归并若干 sst 文件，每个 key 只保留 sequence 最大的版本。
 * 只有输入覆盖了所有可能持有旧版本的文件时，删除标记才可以丢弃，
 * 否则未参与合并的更老文件中的值会重新可见。
 */
public class Compactor {
    private static final Logger LOG = LoggerFactory.getLogger(Compactor.class);
    //每处理这么多个 key 检查一次中断
    private static final int CANCEL_CHECK_INTERVAL = 1024;

    private final Config config;

    public Compactor(Config config) {
        this.config = config;
    }

    /**
     * @param inputs 从新到旧排列的输入文件
     * @param dropTombstones 是否为全量合并
     * @param outputLevel 输出文件所在的层
     * @param fileIds 新文件编号的分配器
     * @return 已提交的输出文件，按 key 升序；全部被删除时为空
     */
    public List<SstFile> compact(List<SstFile> inputs, boolean dropTombstones, int outputLevel, LongSupplier fileIds) {
        //文件会很大~不能把输入全部读取进来，逐条归并
        PriorityQueue<Cursor> pq = new PriorityQueue<>((c1, c2) -> {
            int cmp = AllUtils.compare(c1.current.getKey(), c2.current.getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = Long.compare(c2.current.getSequence(), c1.current.getSequence());
            if (cmp != 0) {
                return cmp;
            }
            return Integer.compare(c1.order, c2.order);
        });
        for (int i = 0; i < inputs.size(); i++) {
            Cursor cursor = new Cursor(inputs.get(i).iterator(), i);
            if (cursor.advance()) {
                pq.add(cursor);
            }
        }

        List<SstFile> outputs = new ArrayList<>();
        SstWriter sstWriter = null;
        byte[] lastKey = null;
        long keys = 0;
        long dropped = 0;
        try {
            while (!pq.isEmpty()) {
                Cursor cursor = pq.poll();
                Entry entry = cursor.current;
                if (cursor.advance()) {
                    pq.add(cursor);
                }
                //同一个 key 第一个出队的就是最新版本，其余全部丢弃
                if (lastKey != null && AllUtils.compare(lastKey, entry.getKey()) == 0) {
                    dropped++;
                    continue;
                }
                lastKey = entry.getKey();
                if (++keys % CANCEL_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("compaction interrupted");
                }
                if (entry.isTombstone() && dropTombstones) {
                    dropped++;
                    continue;
                }
                // 倘若当前输出文件大小已经超限，提交它并开始一个新文件
                if (sstWriter != null && sstWriter.size() >= this.config.getMaxSstFileSize()) {
                    outputs.add(commit(sstWriter));
                    sstWriter = null;
                }
                if (sstWriter == null) {
                    long fileId = fileIds.getAsLong();
                    Path file = this.config.getDirPath().resolve(SstFile.fileName(fileId));
                    sstWriter = new SstWriter(file, fileId, outputLevel, this.config);
                }
                sstWriter.append(entry);
            }
            if (sstWriter != null) {
                outputs.add(commit(sstWriter));
                sstWriter = null;
            }
        } catch (RuntimeException e) {
            if (sstWriter != null) {
                sstWriter.abort();
            }
            for (SstFile output : outputs) {
                destroyQuietly(output);
            }
            throw e;
        }
        LOG.info("compacted {} files into {} (level {}), {} keys, {} entries dropped, tombstones {}",
                inputs.size(), outputs.size(), outputLevel, keys, dropped, dropTombstones ? "purged" : "kept");
        return outputs;
    }

    private SstFile commit(SstWriter sstWriter) {
        try {
            sstWriter.finish();
        } catch (RuntimeException e) {
            sstWriter.abort();
            throw e;
        }
        return SstFile.open(sstWriter.getFile(), this.config);
    }

    private void destroyQuietly(SstFile file) {
        try {
            file.destroy();
        } catch (RuntimeException e) {
            LOG.warn("清理合并输出失败 {}", file.getPath(), e);
        }
    }

    private static final class Cursor {
        private final Iterator<Entry> iterator;
        //输入中的位置，越小越新
        private final int order;
        private Entry current;

        private Cursor(Iterator<Entry> iterator, int order) {
            this.iterator = iterator;
            this.order = order;
        }

        private boolean advance() {
            if (this.iterator.hasNext()) {
                this.current = this.iterator.next();
                return true;
            }
            this.current = null;
            return false;
        }
    }
}
