package com.yumi.pluto.wal;

import com.yumi.pluto.exception.CorruptedLogException;
import com.yumi.pluto.util.AllUtils;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.yumi.pluto.wal.WalConstants.FIXED_BYTES;
import static com.yumi.pluto.wal.WalConstants.SEPARATOR;

/**
 * 单条记录的编解码。
 * <p>
 * 格式: 十进制 ASCII 的 length | 1 字节 action | key | 分隔符 | value，记录之间没有分隔，
 * 下一条紧跟在上一条的 value 之后。
 * <p>
 * value 按长度读取，可以包含分隔符；key 按分隔符切分，不能包含分隔符。
 */
public final class RecordCodec {

    /** 解码时所处的字段 */
    public enum Field {
        LENGTH, ACTION, KEY, VALUE
    }

    private RecordCodec() {}

    public static byte[] encode(Record record) {
        int length = record.getLength();
        ByteBuffer buffer = ByteBuffer.allocate(AllUtils.decimalDigits(length) + length);
        putDecimal(buffer, length);
        buffer.put(record.getAction().tag());
        buffer.put(record.getKey());
        buffer.put(SEPARATOR);
        buffer.put(record.getValue());
        return buffer.array();
    }

    public static List<Record> decode(byte[] data) {
        return decode(ByteBuffer.wrap(data));
    }

    /**
     * 解析 view 中 position 到 limit 之间的全部记录。任何一条不完整或非法都会抛出
     * {@link CorruptedLogException}，不会返回部分结果。
     */
    public static List<Record> decode(ByteBuffer view) {
        List<Record> records = new ArrayList<>();
        int pos = view.position();
        int limit = view.limit();
        while (pos < limit) {
            Field field = Field.LENGTH;
            int length = 0;
            Action action = null;
            byte[] key = null;
            byte[] value = null;
            while (value == null) {
                switch (field) {
                    case LENGTH: {
                        int start = pos;
                        while (pos < limit && isDigit(view.get(pos))) {
                            int digit = view.get(pos) - '0';
                            if (length > (Integer.MAX_VALUE - digit) / 10) {
                                throw new CorruptedLogException("长度溢出", start, field.name());
                            }
                            length = length * 10 + digit;
                            pos++;
                        }
                        if (pos == start) {
                            throw new CorruptedLogException(pos == limit ? "记录被截断" : "期望数字",
                                    pos, field.name());
                        }
                        if (length < FIXED_BYTES) {
                            throw new CorruptedLogException("非法的长度 " + length, start, field.name());
                        }
                        field = Field.ACTION;
                        break;
                    }
                    case ACTION: {
                        if (pos >= limit) {
                            throw new CorruptedLogException("记录被截断", pos, field.name());
                        }
                        Optional<Action> actionOpt = Action.fromTag(view.get(pos));
                        if (!actionOpt.isPresent()) {
                            throw new CorruptedLogException("未知的 action 标记 " + view.get(pos),
                                    pos, field.name());
                        }
                        action = actionOpt.get();
                        pos++;
                        field = Field.KEY;
                        break;
                    }
                    case KEY: {
                        int start = pos;
                        //key 最多 length - 2 个字节，超过仍未遇到分隔符就是坏数据
                        int keyLimit = (int) Math.min(limit, (long) start + length - FIXED_BYTES);
                        while (pos < keyLimit && view.get(pos) != SEPARATOR) {
                            pos++;
                        }
                        if (pos >= limit) {
                            throw new CorruptedLogException("缺少分隔符", start, field.name());
                        }
                        if (view.get(pos) != SEPARATOR) {
                            throw new CorruptedLogException("key 超出记录长度", start, field.name());
                        }
                        key = copy(view, start, pos);
                        pos++;
                        field = Field.VALUE;
                        break;
                    }
                    case VALUE: {
                        int valueLen = length - key.length - FIXED_BYTES;
                        if (limit - pos < valueLen) {
                            throw new CorruptedLogException("记录被截断", pos, field.name());
                        }
                        value = copy(view, pos, pos + valueLen);
                        pos += valueLen;
                        break;
                    }
                    default:
                        throw new IllegalStateException("bug");
                }
            }
            records.add(new Record(length, key, value, action));
        }
        return records;
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private static byte[] copy(ByteBuffer view, int from, int to) {
        byte[] out = new byte[to - from];
        for (int i = from; i < to; i++) {
            out[i - from] = view.get(i);
        }
        return out;
    }

    private static void putDecimal(ByteBuffer buffer, int value) {
        byte[] digits = new byte[AllUtils.decimalDigits(value)];
        for (int i = digits.length - 1; i >= 0; i--) {
            digits[i] = (byte) ('0' + value % 10);
            value /= 10;
        }
        buffer.put(digits);
    }
}
