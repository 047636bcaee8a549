package com.yumi.lsmkv.util;

import com.yumi.lsmkv.exception.InvalidKeyException;

public class AllUtils {
    private AllUtils() {}

    /**
     * 按无符号字节做字典序比较
     */
    public static int compare(byte[] key1, byte[] key2) {
        if (key1 == key2) {
            return 0;
        }
        if (key1 == null || key2 == null) {
            return key1 == null ? -1 : 1;
        }
        int i = mismatch(key1, key2, Math.min(key1.length, key2.length));
        if (i >= 0) {
            return Integer.compare(Byte.toUnsignedInt(key1[i]), Byte.toUnsignedInt(key2[i]));
        }
        return Integer.compare(key1.length, key2.length);
    }

    private static int mismatch(byte[] key1, byte[] key2, int min) {
        for (int i = 0; i < min; i++) {
            if (key1[i] != key2[i]) {
                return i;
            }
        }
        return -1;
    }

    public static void checkKey(byte[] key, int maxKeySize) {
        if (key == null || key.length == 0) {
            throw new InvalidKeyException("key不能为空");
        }
        if (key.length > maxKeySize) {
            throw new InvalidKeyException("key长度 " + key.length + " 超过上限 " + maxKeySize);
        }
    }
}
