package com.yumi.lsmkv.exception;

import java.io.IOException;

public class IOFailureException extends KvStoreException {

    public IOFailureException(String message, IOException cause) {
        super(message, cause);
    }

    public IOFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
