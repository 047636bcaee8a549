package com.yumi.lsmkv.wal;

public final class WalConstants {
    public static final String WAL_DIR = "walfile";
    public static final String WAL_SUFFIX = ".wal";
    //记录头的长度字段 + 记录尾的校验和
    public static final int RECORD_OVERHEAD = 4 + 4;

    private WalConstants() {}
}
