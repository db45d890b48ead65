package com.yumi.pluto.exception;

/**
 * wal 文件内容无法解析。启动时遇到这个异常说明日志已经损坏，不做部分恢复。
 */
public class CorruptedLogException extends PlutoException {
    private final int offset;
    private final String field;

    public CorruptedLogException(String message, int offset, String field) {
        super(message + " (offset=" + offset + ", field=" + field + ")");
        this.offset = offset;
        this.field = field;
    }

    //出错字段在缓冲区中的字节偏移
    public int getOffset() {
        return offset;
    }

    public String getField() {
        return field;
    }
}
