package com.yumi.lsmkv.filter;

import java.nio.ByteBuffer;

public interface Filter {
    //false 表示 key 一定不存在，true 表示可能存在
    boolean mightContain(byte[] key);
    //写入文件时占用的字节数
    int serializedSize();
    //序列化到 buffer 的当前位置
    void writeTo(ByteBuffer buffer);
}
