package com.yumi.lsmkv;

import com.yumi.lsmkv.exception.CapacityExceededException;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.memtable.AvlMemTable;
import com.yumi.lsmkv.memtable.MemTableConstructor;
import com.yumi.lsmkv.sst.CompressionCodec;
import com.yumi.lsmkv.wal.WalConstants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Consumer;

public class Config {
    //工作目录
    private String dir;
    //mem table 中的 key 数量达到该值后刷盘
    private int memoryThreshold = 4096;
    //稀疏索引间隔，每 M 条记录建一条索引
    private int sparseIndexInterval = 16;
    //过滤器误判率
    private double filterFalsePositiveRate = 0.01;
    //key 的最大字节数
    private int maxKeySize = 64 * 1024;
    //写 sst 时的缓冲块大小，默认值32KB
    private int sstBlockSize = 32 * 1024;
    //sst 数据块的压缩方式
    private CompressionCodec compression = CompressionCodec.GZIP;
    //合并输出的单个 sst 文件大小上限，默认值2MB
    private long maxSstFileSize = 2 * 1024 * 1024;
    //同一层连续的文件数达到该值触发自动合并，0表示关闭
    private int compactionTrigger = 4;
    //等待刷盘的 mem table 队列容量
    private int pendingFlushCapacity = 16;
    //每次写 wal 都刷盘
    private boolean syncWrites = true;
    //打开 sst 时校验数据块
    private boolean verifyChecksums = true;
    //memTable构造器
    private MemTableConstructor memTableConstructor = AvlMemTable::new;

    private Config() {}

    public static Config newConfig(String dir, ConfigOption...options) {
        if (dir == null || dir.isEmpty()) {
            throw new IllegalArgumentException("dir不能为空");
        }
        Config config = new Config();
        config.dir = dir;
        for (ConfigOption option : options) {
            option.accept(config);
        }
        config.initAndCheck();
        return config;
    }

    private void initAndCheck() {
        try {
            Files.createDirectories(getDirPath());
            Files.createDirectories(getWalDirPath());
        } catch (IOException e) {
            throw new IOFailureException("创建 " + this.dir + " 失败", e);
        }
    }

    public String getDir() {
        return dir;
    }

    public Path getDirPath() {
        return Paths.get(dir);
    }

    public Path getWalDirPath() {
        return getDirPath().resolve(WalConstants.WAL_DIR);
    }

    public int getMemoryThreshold() {
        return memoryThreshold;
    }

    public int getSparseIndexInterval() {
        return sparseIndexInterval;
    }

    public double getFilterFalsePositiveRate() {
        return filterFalsePositiveRate;
    }

    public int getMaxKeySize() {
        return maxKeySize;
    }

    public int getSstBlockSize() {
        return sstBlockSize;
    }

    public CompressionCodec getCompression() {
        return compression;
    }

    public long getMaxSstFileSize() {
        return maxSstFileSize;
    }

    public int getCompactionTrigger() {
        return compactionTrigger;
    }

    public int getPendingFlushCapacity() {
        return pendingFlushCapacity;
    }

    public boolean isSyncWrites() {
        return syncWrites;
    }

    public boolean isVerifyChecksums() {
        return verifyChecksums;
    }

    public MemTableConstructor getMemTableConstructor() {
        return memTableConstructor;
    }

    public void setMemoryThreshold(int memoryThreshold) {
        if (memoryThreshold <= 0) {
            throw new CapacityExceededException("非法的memoryThreshold: " + memoryThreshold);
        }
        this.memoryThreshold = memoryThreshold;
    }

    public void setSparseIndexInterval(int sparseIndexInterval) {
        if (sparseIndexInterval <= 0) {
            throw new CapacityExceededException("非法的sparseIndexInterval: " + sparseIndexInterval);
        }
        this.sparseIndexInterval = sparseIndexInterval;
    }

    public void setFilterFalsePositiveRate(double filterFalsePositiveRate) {
        if (!(filterFalsePositiveRate > 0 && filterFalsePositiveRate < 1)) {
            throw new CapacityExceededException("非法的filterFalsePositiveRate: " + filterFalsePositiveRate);
        }
        this.filterFalsePositiveRate = filterFalsePositiveRate;
    }

    public void setMaxKeySize(int maxKeySize) {
        if (maxKeySize <= 0) {
            throw new CapacityExceededException("非法的maxKeySize: " + maxKeySize);
        }
        this.maxKeySize = maxKeySize;
    }

    public void setSstBlockSize(int sstBlockSize) {
        if (sstBlockSize <= 0) {
            throw new CapacityExceededException("非法的sstBlockSize: " + sstBlockSize);
        }
        this.sstBlockSize = sstBlockSize;
    }

    public void setCompression(CompressionCodec compression) {
        if (compression == null) {
            throw new IllegalArgumentException("compression不能为空");
        }
        this.compression = compression;
    }

    public void setMaxSstFileSize(long maxSstFileSize) {
        if (maxSstFileSize <= 0 || maxSstFileSize > Integer.MAX_VALUE) {
            throw new CapacityExceededException("非法的maxSstFileSize: " + maxSstFileSize);
        }
        this.maxSstFileSize = maxSstFileSize;
    }

    public void setCompactionTrigger(int compactionTrigger) {
        if (compactionTrigger < 0 || compactionTrigger == 1) {
            throw new CapacityExceededException("非法的compactionTrigger: " + compactionTrigger);
        }
        this.compactionTrigger = compactionTrigger;
    }

    public void setPendingFlushCapacity(int pendingFlushCapacity) {
        if (pendingFlushCapacity <= 0) {
            throw new CapacityExceededException("非法的pendingFlushCapacity: " + pendingFlushCapacity);
        }
        this.pendingFlushCapacity = pendingFlushCapacity;
    }

    public void setSyncWrites(boolean syncWrites) {
        this.syncWrites = syncWrites;
    }

    public void setVerifyChecksums(boolean verifyChecksums) {
        this.verifyChecksums = verifyChecksums;
    }

    public void setMemTableConstructor(MemTableConstructor memTableConstructor) {
        if (memTableConstructor == null) {
            throw new IllegalArgumentException("memTableConstructor不能为空");
        }
        this.memTableConstructor = memTableConstructor;
    }

    @FunctionalInterface
    public interface ConfigOption extends Consumer<Config> {}
}
