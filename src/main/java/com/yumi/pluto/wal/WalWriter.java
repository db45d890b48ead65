package com.yumi.pluto.wal;

import com.yumi.pluto.exception.StorageIOException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 追加写 wal 文件。文件不存在时创建，打开后写位置在文件末尾。
 */
public class WalWriter implements Closeable {

    private final Path file;
    private final FileChannel dest;
    private final boolean sync;
    private long curPosition;

    public WalWriter(Path file, boolean sync) {
        this(file, openChannel(file), sync);
    }

    /**
     * dest 必须是 file 的可写 channel，walWriter 接管它的关闭
     */
    public WalWriter(Path file, FileChannel dest, boolean sync) {
        this.file = file;
        this.dest = dest;
        this.sync = sync;
        try {
            this.curPosition = this.dest.size();
            this.dest.position(this.curPosition);
        } catch (IOException e) {
            StorageIOException ex = new StorageIOException("定位 wal 文件末尾失败: " + file, e);
            try {
                this.dest.close();
            } catch (IOException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw ex;
        }
    }

    private static FileChannel openChannel(Path file) {
        try {
            return FileChannel.open(file, StandardOpenOption.CREATE,
                    StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageIOException("打开 wal 文件失败: " + file, e);
        }
    }

    /**
     * 写入一条编码后的记录。失败时把文件截回写入前的长度，保证文件里没有半条记录。
     */
    public void write(byte[] bytes) {
        long before = this.curPosition;
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                this.dest.write(buffer);
            }
            //每次都刷，不会丢数据，但是性能受影响
            if (this.sync) {
                this.dest.force(false);
            }
            this.curPosition = before + bytes.length;
        } catch (IOException e) {
            StorageIOException ex = new StorageIOException("写入 wal 文件失败: " + file, e);
            try {
                this.dest.truncate(before);
                this.dest.position(before);
            } catch (IOException rollback) {
                ex.addSuppressed(rollback);
            }
            throw ex;
        }
    }

    public void truncate() {
        try {
            this.dest.truncate(0);
            this.dest.position(0);
            this.dest.force(true);
            this.curPosition = 0;
        } catch (IOException e) {
            throw new StorageIOException("截断 wal 文件失败: " + file, e);
        }
    }

    public long size() {
        return curPosition;
    }

    @Override
    public void close() {
        try {
            this.dest.close();
        } catch (IOException e) {
            throw new StorageIOException("关闭 wal 文件失败: " + file, e);
        }
    }
}
