package com.yumi.pluto.wal;

import com.yumi.pluto.exception.StorageIOException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 启动时一次性读取整个 wal 文件并解码
 */
public class WalReader implements Closeable {

    private final Path file;
    private final FileChannel src;

    public WalReader(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalStateException("文件不存在: " + file);
        }
        this.file = file;
        try {
            this.src = FileChannel.open(file, StandardOpenOption.READ);
        } catch (IOException e) {
            throw new StorageIOException("打开 wal 文件失败: " + file, e);
        }
    }

    public List<Record> readAll() {
        try {
            long size = this.src.size();
            if (size > Integer.MAX_VALUE) {
                throw new IllegalStateException("wal 文件过大: " + file);
            }
            ByteBuffer view = ByteBuffer.allocate((int) size);
            long position = 0;
            while (view.hasRemaining()) {
                int read = this.src.read(view, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            view.flip();
            return RecordCodec.decode(view);
        } catch (IOException e) {
            throw new StorageIOException("读取 wal 文件失败: " + file, e);
        }
    }

    @Override
    public void close() {
        try {
            this.src.close();
        } catch (IOException e) {
            throw new StorageIOException("关闭 wal 文件失败: " + file, e);
        }
    }
}
