package com.yumi.pluto.wal;

import java.util.Optional;

/**
 * 日志记录的操作类型。GET 只是为了对称存在，读操作不会写日志。
 */
public enum Action {
    PUT('p'),
    GET('g'),
    DELETE('d');

    private final byte tag;

    Action(char tag) {
        this.tag = (byte) tag;
    }

    public byte tag() {
        return tag;
    }

    public static Optional<Action> fromTag(byte tag) {
        for (Action action : values()) {
            if (action.tag == tag) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
