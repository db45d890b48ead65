package com.yumi.pluto.memtable;

@FunctionalInterface
public interface MemTableConstructor {
    MemTable create();
}
