package com.yumi.lsmkv.exception;

/**
 * 配置项越界，或者文件大小超出可映射的范围
 */
public class CapacityExceededException extends KvStoreException {

    public CapacityExceededException(String message) {
        super(message);
    }
}
