package com.yumi.pluto.memtable;

import com.yumi.pluto.util.Kv;

import java.util.List;
import java.util.Optional;

public interface MemTable {
    void put(byte[] key, byte[] value);
    Optional<byte[]> get(byte[] key);
    //返回 key 是否存在
    boolean delete(byte[] key);
    //key-value 数量
    int entriesCnt();
    //按 key 升序排列
    List<Kv> all();
}
