package com.yumi.pluto.exception;

import java.nio.charset.StandardCharsets;

/**
 * active 表和 immutable 表中都不存在该 key
 */
public class KeyNotFoundException extends PlutoException {
    private final byte[] key;

    public KeyNotFoundException(byte[] key) {
        super("key not found: " + new String(key, StandardCharsets.UTF_8));
        this.key = key.clone();
    }

    public byte[] getKey() {
        return key.clone();
    }
}
