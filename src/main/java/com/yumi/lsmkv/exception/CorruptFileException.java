package com.yumi.lsmkv.exception;

import java.nio.file.Path;

/**
 * 文件的 footer 或校验和不合法，该文件不参与读取
 */
public class CorruptFileException extends KvStoreException {
    private final Path file;

    public CorruptFileException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public CorruptFileException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
