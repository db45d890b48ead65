package com.yumi.pluto.memtable;

import com.yumi.pluto.util.AllUtils;
import com.yumi.pluto.util.Kv;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * 跳表实现，key 按无符号字节序排列
 */
public class SkipListMemTable implements MemTable {
    private final ConcurrentSkipListMap<byte[], byte[]> map = new ConcurrentSkipListMap<>(AllUtils::compare);

    @Override
    public void put(byte[] key, byte[] value) {
        this.map.put(key, value);
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        return Optional.ofNullable(this.map.get(key));
    }

    @Override
    public boolean delete(byte[] key) {
        return null != this.map.remove(key);
    }

    @Override
    public int entriesCnt() {
        return this.map.size();
    }

    @Override
    public List<Kv> all() {
        return map.entrySet()
                .stream()
                .map((entry) -> new Kv(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}
