package com.yumi.pluto.util;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.UnsignedBytes;

public class AllUtils {
    private AllUtils() {}

    /**
     * 按无符号字节的字典序比较，与 key 写入 sst 时的顺序一致
     */
    public static int compare(byte[] key1, byte[] key2) {
        if (key1 == key2) {
            return 0;
        }
        if (key1 == null || key2 == null) {
            return key1 == null ? -1 : 1;
        }
        int i = mismatch(key1, key2, Math.min(key1.length, key2.length));
        if (i >= 0) {
            return UnsignedBytes.compare(key1[i], key2[i]);
        }
        return key1.length - key2.length;
    }

    private static int mismatch(byte[] key1, byte[] key2, int min) {
        for (int i = 0; i < min; i++) {
            if (key1[i] != key2[i]) {
                return i;
            }
        }
        return -1;
    }

    public static boolean contains(byte[] bytes, byte target) {
        return Bytes.indexOf(bytes, target) >= 0;
    }

    public static int decimalDigits(int value) {
        int digits = 1;
        while (value >= 10) {
            value /= 10;
            digits++;
        }
        return digits;
    }
}
