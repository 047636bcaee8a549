package com.yumi.lsmkv.memtable;

@FunctionalInterface
public interface MemTableConstructor {
    MemTable create(int maxKeySize);
}
