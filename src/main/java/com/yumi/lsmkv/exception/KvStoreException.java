package com.yumi.lsmkv.exception;

/**
 * 存储引擎所有错误的基类，均为非受检异常
 */
public class KvStoreException extends RuntimeException {

    public KvStoreException(String message) {
        super(message);
    }

    public KvStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
