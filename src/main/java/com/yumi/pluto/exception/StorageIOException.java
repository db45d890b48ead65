package com.yumi.pluto.exception;

import java.io.IOException;

/**
 * 文件打开、读取、写入、截断失败。不重试，直接抛给触发它的调用方。
 */
public class StorageIOException extends PlutoException {

    public StorageIOException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
