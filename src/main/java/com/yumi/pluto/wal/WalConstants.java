package com.yumi.pluto.wal;

public final class WalConstants {
    private WalConstants() {}

    //key 和 value 之间的分隔符，key 中不允许出现
    public static final byte SEPARATOR = '|';
    //action 标记 + 分隔符 占用的字节数
    public static final int FIXED_BYTES = 2;
    public static final String DEFAULT_WAL_FILE = "pluto.wal";
}
