package com.yumi.pluto.wal;

import com.yumi.pluto.exception.StorageIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单文件的预写日志。
 * <p>
 * 内存中的记录列表始终和文件中已写入的字节一一对应：append 只有在字节落盘后才把记录加入列表，
 * compact 同时清空文件和列表。所有修改操作由同一把锁串行化。
 */
public class Wal implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(Wal.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Path file;
    private final WalWriter walWriter;
    private final List<Record> records;
    private boolean closed;

    private Wal(Path file, WalWriter walWriter, List<Record> records) {
        this.file = file;
        this.walWriter = walWriter;
        this.records = records;
    }

    /**
     * 打开（不存在则创建）wal 文件，解析已有内容，写位置放在文件末尾。
     * 解析失败直接抛出，不尝试修复。
     */
    public static Wal open(Path file, boolean sync) {
        return open(file, new WalWriter(file, sync));
    }

    /**
     * 用已经打开的 walWriter 加载 file，失败时关闭 walWriter
     */
    public static Wal open(Path file, WalWriter walWriter) {
        List<Record> records;
        try (WalReader walReader = new WalReader(file)) {
            records = walReader.readAll();
        } catch (RuntimeException e) {
            LOG.error("Failed to load wal {}", file, e);
            walWriter.close();
            throw e;
        }
        LOG.debug("Opened wal {}: records={}, bytes={}", file, records.size(), walWriter.size());
        return new Wal(file, walWriter, new ArrayList<>(records));
    }

    public void append(Record record) {
        byte[] bytes = RecordCodec.encode(record);
        lock.lock();
        try {
            ensureOpen();
            this.walWriter.write(bytes);
            this.records.add(record);
        } catch (StorageIOException e) {
            LOG.error("Failed to append to wal {}, records={}", file, this.records.size(), e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    //记录条数，只用来判断是否需要 compaction
    public int length() {
        lock.lock();
        try {
            return this.records.size();
        } finally {
            lock.unlock();
        }
    }

    public Record last() {
        lock.lock();
        try {
            if (this.records.isEmpty()) {
                throw new IllegalStateException("wal 为空");
            }
            return this.records.get(this.records.size() - 1);
        } finally {
            lock.unlock();
        }
    }

    public List<Record> records() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(this.records));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 截断文件并清空内存中的记录，这是丢弃记录的唯一途径
     */
    public void compact() {
        lock.lock();
        try {
            ensureOpen();
            this.walWriter.truncate();
            int dropped = this.records.size();
            this.records.clear();
            LOG.debug("Truncated wal {}, dropped {} records", file, dropped);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (this.closed) {
                return;
            }
            this.closed = true;
            this.walWriter.close();
            LOG.debug("Closed wal {}", file);
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (this.closed) {
            throw new IllegalStateException("wal 已关闭: " + file);
        }
    }
}
