package com.yumi.lsmkv.memtable;

import com.yumi.lsmkv.util.Entry;

import java.util.Iterator;
import java.util.Optional;

public interface MemTable {
    //写入或覆盖，sequence 更大的版本生效
    void put(byte[] key, byte[] value, long sequence);
    //逻辑删除，写入删除标记
    void delete(byte[] key, long sequence);
    //wal 恢复时按原样写回
    void apply(Entry entry);
    //结果可能是删除标记
    Optional<Entry> get(byte[] key);
    //table 中所有数据的大小 单位是byte
    int size();
    //key 数量
    int entriesCnt();
    //冻结，之后只读
    void freeze();
    boolean isFrozen();
    //按 key 升序的一次性迭代器，调用后 table 被冻结
    Iterator<Entry> drain();
}
