package com.yumi.pluto.wal;

import com.google.common.base.Preconditions;
import com.yumi.pluto.util.AllUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import static com.yumi.pluto.wal.WalConstants.FIXED_BYTES;
import static com.yumi.pluto.wal.WalConstants.SEPARATOR;

/**
 * wal 中的一条变更记录。length 恒等于 key.length + value.length + 2。
 */
public final class Record {
    private static final byte[] EMPTY = new byte[0];

    private final int length;
    private final byte[] key;
    private final byte[] value;
    private final Action action;

    public Record(int length, byte[] key, byte[] value, Action action) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        Preconditions.checkNotNull(action, "action");
        Preconditions.checkArgument(!AllUtils.contains(key, SEPARATOR),
                "key 中不能包含分隔符 '%s'", (char) SEPARATOR);
        Preconditions.checkArgument(length == key.length + value.length + FIXED_BYTES,
                "length %s 与 key/value 长度不一致", length);
        this.length = length;
        this.key = key;
        this.value = value;
        this.action = action;
    }

    /**
     * 复制调用方传入的数组，之后调用方再修改数组不会影响已写入的记录
     */
    public static Record put(byte[] key, byte[] value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        return new Record(key.length + value.length + FIXED_BYTES, key.clone(), value.clone(), Action.PUT);
    }

    public static Record delete(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        return new Record(key.length + FIXED_BYTES, key.clone(), EMPTY, Action.DELETE);
    }

    public int getLength() {
        return length;
    }

    public byte[] getKey() {
        return key;
    }

    public byte[] getValue() {
        return value;
    }

    public Action getAction() {
        return action;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        return length == record.length && action == record.action
                && Arrays.equals(key, record.key) && Arrays.equals(value, record.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(length, action);
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return length + String.valueOf((char) action.tag())
                + new String(key, StandardCharsets.UTF_8) + (char) SEPARATOR
                + new String(value, StandardCharsets.UTF_8);
    }
}
