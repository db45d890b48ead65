package com.yumi.pluto.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public class Kv {
    private final byte[] key;
    private final byte[] value;

    public Kv(byte[] key, byte[] value) {
        this.key = key;
        this.value = value;
    }

    public byte[] getKey() {
        return key;
    }

    public byte[] getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Kv kv = (Kv) o;
        return Arrays.equals(key, kv.key) && Arrays.equals(value, kv.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return new String(key, StandardCharsets.UTF_8) + "=" + new String(value, StandardCharsets.UTF_8);
    }
}
