package com.yumi.lsmkv;

import com.google.common.collect.ImmutableList;
import com.yumi.lsmkv.sst.SstFile;

import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 当前可见的 sst 文件，从新到旧排列。
 * 不可变，刷盘和合并都会生成一个新的 Registry 整体替换旧的。
 */
public final class Registry implements Iterable<SstFile> {
    private static final Registry EMPTY = new Registry(ImmutableList.of(), 0);

    private final ImmutableList<SstFile> files;
    //曾经写入 sst 的最大序号，合并丢弃记录后也不会变小
    private final long persistedSequence;

    private Registry(ImmutableList<SstFile> files, long persistedSequence) {
        this.files = files;
        this.persistedSequence = persistedSequence;
    }

    public static Registry empty() {
        return EMPTY;
    }

    public static Registry of(List<SstFile> newestFirst) {
        return of(newestFirst, 0);
    }

    /**
     * @param persistedSequence manifest 中记录的序号，和文件中的最大序号取较大者
     */
    public static Registry of(List<SstFile> newestFirst, long persistedSequence) {
        long max = persistedSequence;
        for (SstFile file : newestFirst) {
            max = Math.max(max, file.getMaxSequence());
        }
        return new Registry(ImmutableList.copyOf(newestFirst), max);
    }

    //刷盘: 新文件放在最前面
    public Registry append(SstFile file) {
        return new Registry(ImmutableList.<SstFile>builder().add(file).addAll(this.files).build(),
                Math.max(this.persistedSequence, file.getMaxSequence()));
    }

    /**
     * 合并: 把连续的一段 removed 替换为 added，其它文件的先后顺序不变
     */
    public Registry replace(List<SstFile> removed, List<SstFile> added) {
        checkArgument(!removed.isEmpty(), "nothing to replace");
        int start = this.files.indexOf(removed.get(0));
        checkArgument(start >= 0, "file %s is not registered", removed.get(0));
        checkArgument(start + removed.size() <= this.files.size()
                        && this.files.subList(start, start + removed.size()).equals(removed),
                "replaced files must be a contiguous run of the registry");
        return new Registry(ImmutableList.<SstFile>builder()
                .addAll(this.files.subList(0, start))
                .addAll(added)
                .addAll(this.files.subList(start + removed.size(), this.files.size()))
                .build(), this.persistedSequence);
    }

    /**
     * 第一段连续的、层号为 level 的文件。
     * 合并输出总是放在输入原来的位置，所以越新的文件层号越小，同层文件总是相邻。
     */
    public List<SstFile> levelRun(int level) {
        int start = 0;
        while (start < this.files.size() && this.files.get(start).getLevel() != level) {
            start++;
        }
        int end = start;
        while (end < this.files.size() && this.files.get(end).getLevel() == level) {
            end++;
        }
        return this.files.subList(start, end);
    }

    public int maxLevel() {
        int max = 0;
        for (SstFile file : files) {
            max = Math.max(max, file.getLevel());
        }
        return max;
    }

    public List<SstFile> files() {
        return files;
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    //序号不超过该值的记录都已经落盘，恢复 wal 时跳过
    public long persistedSequence() {
        return persistedSequence;
    }

    @Override
    public Iterator<SstFile> iterator() {
        return files.iterator();
    }

    @Override
    public String toString() {
        return "Registry" + files;
    }
}
