package com.yumi.pluto;

import com.yumi.pluto.memtable.MemTableConstructor;
import com.yumi.pluto.memtable.SkipListMemTable;
import com.yumi.pluto.wal.WalConstants;

import java.io.File;
import java.util.function.Consumer;

public class Config {
    public static final String DEFAULT_DIR = ".";
    public static final int DEFAULT_LOG_LIMIT = 4 * 1024;

    //工作目录，wal 文件和 sst 文件都放在这里
    private String dir;
    //wal 中的记录条数超过该值时，下一次写入前触发 compaction
    private int logLimit = DEFAULT_LOG_LIMIT;
    private String walFileName = WalConstants.DEFAULT_WAL_FILE;
    //每次追加后是否刷盘，关闭后写入返回时不保证持久化
    private boolean syncOnAppend = true;
    //memTable构造器
    private MemTableConstructor memTableConstructor = SkipListMemTable::new;
    //newConfig 返回后不允许再修改
    private boolean frozen;

    private Config() {}

    public static Config defaultConfig() {
        return newConfig(DEFAULT_DIR);
    }

    public static Config newConfig(String dir, ConfigOption...options) {
        Config config = new Config();
        config.dir = null == dir ? DEFAULT_DIR : dir;
        for (ConfigOption option : options) {
            option.accept(config);
        }
        config.initAndCheck();
        config.frozen = true;
        return config;
    }

    private void initAndCheck() {
        File dirFile = new File(this.dir);
        if (!dirFile.exists()) {
            boolean makeDirRes = dirFile.mkdirs();
            if (!makeDirRes) {
                throw new IllegalStateException("创建 " + this.dir + " 失败");
            }
        }
        if (!dirFile.isDirectory()) {
            throw new IllegalStateException(this.dir + " 不是文件夹");
        }
    }

    public String getDir() {
        return dir;
    }

    public int getLogLimit() {
        return logLimit;
    }

    public String getWalFileName() {
        return walFileName;
    }

    public boolean isSyncOnAppend() {
        return syncOnAppend;
    }

    public MemTableConstructor getMemTableConstructor() {
        return memTableConstructor;
    }

    public void setLogLimit(int logLimit) {
        checkMutable();
        if (logLimit <= 0) {
            throw new IllegalStateException("非法的logLimit");
        }
        this.logLimit = logLimit;
    }

    public void setWalFileName(String walFileName) {
        checkMutable();
        if (null == walFileName || walFileName.isEmpty()
                || walFileName.contains("/") || walFileName.contains(File.separator)) {
            throw new IllegalStateException("非法的walFileName");
        }
        this.walFileName = walFileName;
    }

    public void setSyncOnAppend(boolean syncOnAppend) {
        checkMutable();
        this.syncOnAppend = syncOnAppend;
    }

    public void setMemTableConstructor(MemTableConstructor memTableConstructor) {
        checkMutable();
        if (null == memTableConstructor) {
            throw new IllegalStateException("非法的memTableConstructor");
        }
        this.memTableConstructor = memTableConstructor;
    }

    private void checkMutable() {
        if (this.frozen) {
            throw new IllegalStateException("config 创建后不能修改");
        }
    }

    @FunctionalInterface
    public interface ConfigOption extends Consumer<Config> {}
}
