package com.yumi.pluto.exception;

/**
 * 存储引擎所有异常的父类
 */
public class PlutoException extends RuntimeException {

    public PlutoException(String message) {
        super(message);
    }

    public PlutoException(String message, Throwable cause) {
        super(message, cause);
    }
}
