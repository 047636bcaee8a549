package com.yumi.lsmkv.exception;

/**
 * key 为空或超长，在任何修改发生之前抛出
 */
public class InvalidKeyException extends KvStoreException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
