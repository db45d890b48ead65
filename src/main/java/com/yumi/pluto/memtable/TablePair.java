package com.yumi.pluto.memtable;

import com.yumi.pluto.sst.SstWriter;
import com.yumi.pluto.util.AllUtils;
import com.yumi.pluto.util.Kv;
import com.yumi.pluto.wal.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 热表(active) + 冷表(immutable)。
 * <p>
 * 任一时刻最多只有一张冷表；rotate 之前必须先把已有的冷表刷成 sst。
 * delete 只作用于热表，不会在冷表里留下删除标记，所以 rotate 之后删除一个只存在于冷表中的 key，
 * get 仍然能读到冷表里的旧值。
 */
public class TablePair {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final MemTableConstructor memTableConstructor;
    private MemTable active;
    private MemTable immutable;
    //冷表是否已经写成 sst
    private boolean immutableFlushed;

    public TablePair(MemTableConstructor memTableConstructor) {
        this.memTableConstructor = memTableConstructor;
        this.active = memTableConstructor.create();
        this.immutable = memTableConstructor.create();
    }

    public void put(byte[] key, byte[] value) {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            this.active.put(key, value);
        } finally {
            writeLock.unlock();
        }
    }

    public void delete(byte[] key) {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            this.active.delete(key);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 把一条日志记录的变更应用到热表，GET 记录忽略
     */
    public void apply(Record record) {
        switch (record.getAction()) {
            case PUT:
                put(record.getKey(), record.getValue());
                break;
            case DELETE:
                delete(record.getKey());
                break;
            default:
                break;
        }
    }

    public Optional<byte[]> get(byte[] key) {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            Optional<byte[]> valOpt = this.active.get(key);
            if (valOpt.isPresent()) {
                return valOpt;
            }
            return this.immutable.get(key);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 冷表非空且还没有刷成 sst
     */
    public boolean hasUnflushedImmutable() {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return !this.immutableFlushed && this.immutable.entriesCnt() > 0;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 冷表按 key 排好序交给 sstWriter 写成第 level 代 sst 文件，返回写入的条数。
     * 成功后冷表仍然可读，但被标记为已刷盘，直到下一次 rotate；写失败时冷表保持原样。
     */
    public int flushImmutableTo(SstWriter sstWriter, int level) {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            //MemTable 实现不一定有序，这里排序保证 sst 中 key 升序
            List<Kv> sorted = new ArrayList<>(this.immutable.all());
            sorted.sort((kv1, kv2) -> AllUtils.compare(kv1.getKey(), kv2.getKey()));
            sstWriter.write(level, sorted);
            this.immutableFlushed = true;
            return sorted.size();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 热表转冷表，换上一张新的空热表。调用方需保证原冷表已经落盘。
     */
    public void rotate() {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            this.immutable = this.active;
            this.immutableFlushed = false;
            this.active = this.memTableConstructor.create();
        } finally {
            writeLock.unlock();
        }
    }

    public int activeEntries() {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return this.active.entriesCnt();
        } finally {
            readLock.unlock();
        }
    }

    public int immutableEntries() {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return this.immutable.entriesCnt();
        } finally {
            readLock.unlock();
        }
    }
}
