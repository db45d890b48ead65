package com.yumi.pluto;

import com.google.common.base.Preconditions;
import com.yumi.pluto.exception.KeyNotFoundException;
import com.yumi.pluto.exception.PlutoException;
import com.yumi.pluto.memtable.TablePair;
import com.yumi.pluto.sst.SstWriter;
import com.yumi.pluto.wal.Record;
import com.yumi.pluto.wal.Wal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 存储引擎入口：wal + 热表/冷表 + sst。
 * <p>
 * 写入顺序：compaction 检查 -> 追加 wal（持久化点）-> 应用到热表（可见点）。
 * 三步在 dataLock 的写锁内完成，读操作持有读锁，所以读不到已落盘但未应用的记录，
 * 也读不到 wal 已截断但热表冷表还没有交换的中间状态。
 */
public class Engine implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(Engine.class);

    private final Config config;
    private final ReentrantReadWriteLock dataLock = new ReentrantReadWriteLock();
    private final Wal wal;
    private final TablePair tables;
    private final SstWriter sstWriter;
    //下一个 sst 文件的代数
    private int level;
    private boolean closed;

    private Engine(Config config, Wal wal) {
        this.config = config;
        this.wal = wal;
        try {
            Path dir = Paths.get(config.getDir());
            this.level = nextLevel(dir.toFile());
            this.sstWriter = new SstWriter(dir);
            this.tables = new TablePair(config.getMemTableConstructor());
            replay();
        } catch (RuntimeException e) {
            wal.close();
            throw e;
        }
    }

    public static Engine open(Config config) {
        Preconditions.checkNotNull(config, "config");
        Path walFile = Paths.get(config.getDir()).resolve(config.getWalFileName());
        return open(config, Wal.open(walFile, config.isSyncOnAppend()));
    }

    //wal 由调用方打开，engine 接管它的关闭
    static Engine open(Config config, Wal wal) {
        Engine engine = new Engine(config, wal);
        LOG.info("Opened engine at {}: replayed={}, nextLevel={}",
                config.getDir(), wal.length(), engine.level);
        return engine;
    }

    //wal 中的记录按原顺序重新应用到热表
    private void replay() {
        List<Record> records = this.wal.records();
        for (Record record : records) {
            this.tables.apply(record);
        }
    }

    private int nextLevel(File dir) {
        File[] sstFiles = dir.listFiles(f -> f.isFile() && SstWriter.levelOf(f.getName()) >= 0);
        if (null == sstFiles || sstFiles.length == 0) {
            return 0;
        }
        int max = -1;
        for (File sstFile : sstFiles) {
            max = Math.max(max, SstWriter.levelOf(sstFile.getName()));
        }
        if (max == Integer.MAX_VALUE) {
            throw new IllegalStateException("sst 代数已用尽");
        }
        return max + 1;
    }

    public void put(byte[] key, byte[] value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        write(Record.put(key, value));
    }

    public void delete(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        write(Record.delete(key));
    }

    private void write(Record record) {
        ReentrantReadWriteLock.WriteLock lock = dataLock.writeLock();
        lock.lock();
        try {
            ensureOpen();
            if (this.wal.length() > this.config.getLogLimit()) {
                compact();
            }
            //1.写入wal file，失败则不会应用到内存表
            this.wal.append(record);
            //2.把刚写入的记录应用到热表
            this.tables.apply(this.wal.last());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws KeyNotFoundException 热表和冷表中都没有该 key
     */
    public byte[] get(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        ReentrantReadWriteLock.ReadLock lock = dataLock.readLock();
        lock.lock();
        try {
            ensureOpen();
            //返回副本，调用方修改返回值不会影响表中的数据
            return this.tables.get(key)
                    .map(byte[]::clone)
                    .orElseThrow(() -> new KeyNotFoundException(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 1.冷表非空且未刷过盘时先刷成新一代 sst；2.截断 wal；3.热表转冷表，换上新的热表。
     * 任一步失败都会中止，内存表保持原样，引擎仍然可用。
     * 第 1 步成功而第 2 步失败时，冷表被标记为已刷盘，重试时不会再写出一份重复的 sst。
     */
    void compact() {
        ReentrantReadWriteLock.WriteLock lock = dataLock.writeLock();
        lock.lock();
        try {
            LOG.info("Compaction started: walRecords={}, active={}, immutable={}",
                    this.wal.length(), this.tables.activeEntries(), this.tables.immutableEntries());
            flushImmutable();
            this.wal.compact();
            this.tables.rotate();
            LOG.info("Compaction finished, nextLevel={}", this.level);
        } catch (PlutoException e) {
            LOG.error("Compaction aborted at {}", config.getDir(), e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    //冷表已经刷过盘(上一次 compaction 在截断 wal 时失败)就不再重复写
    private void flushImmutable() {
        if (!this.tables.hasUnflushedImmutable()) {
            return;
        }
        int flushed = this.tables.flushImmutableTo(this.sstWriter, this.level);
        LOG.info("Flushed {} entries to {}", flushed, SstWriter.sstFile(this.level));
        this.level++;
    }

    /**
     * 冷表非空时刷成 sst 后关闭 wal。热表不刷盘，它的记录还在 wal 中，下次打开时重放。
     */
    @Override
    public void close() {
        ReentrantReadWriteLock.WriteLock lock = dataLock.writeLock();
        lock.lock();
        try {
            if (this.closed) {
                return;
            }
            this.closed = true;
            try {
                flushImmutable();
            } finally {
                this.wal.close();
            }
            LOG.info("Closed engine at {}", config.getDir());
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (this.closed) {
            throw new IllegalStateException("engine 已关闭");
        }
    }

    int walLength() {
        return this.wal.length();
    }

    int nextLevel() {
        ReentrantReadWriteLock.ReadLock lock = dataLock.readLock();
        lock.lock();
        try {
            return this.level;
        } finally {
            lock.unlock();
        }
    }

    TablePair tables() {
        return this.tables;
    }
}
