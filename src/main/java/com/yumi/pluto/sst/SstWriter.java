package com.yumi.pluto.sst;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.yumi.pluto.exception.StorageIOException;
import com.yumi.pluto.util.AllUtils;
import com.yumi.pluto.util.Kv;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把一代冷表写成 {@code <level>.sst}。
 * <p>
 * 文件内容是一个 JSON 数组，元素为 {"key": ..., "value": ...}，顺序即 key 的升序，读取方可以依赖这个顺序。
 * 先写到 {@code <level>.sst.tmp}，刷盘后原子地重命名，不会留下写了一半的 sst 文件。
 */
public class SstWriter {
    public static final String SST_SUFFIX = ".sst";
    private static final String TMP_SUFFIX = ".tmp";
    private static final Pattern SST_NAME = Pattern.compile("(\\d+)\\.sst");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path dir;

    public SstWriter(Path dir) {
        this.dir = dir;
    }

    public Path write(int level, List<Kv> sortedEntries) {
        Preconditions.checkArgument(level >= 0, "非法的level: %s", level);
        List<SstEntry> entries = new ArrayList<>(sortedEntries.size());
        byte[] preKey = null;
        for (Kv kv : sortedEntries) {
            if (preKey != null) {
                Preconditions.checkArgument(AllUtils.compare(preKey, kv.getKey()) < 0,
                        "sst 中的 key 必须严格升序");
            }
            preKey = kv.getKey();
            entries.add(SstEntry.of(kv));
        }

        Path dest = this.dir.resolve(sstFile(level));
        Path tmp = this.dir.resolve(sstFile(level) + TMP_SUFFIX);
        try {
            try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                this.mapper.writeValue(out, entries);
            }
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            Files.move(tmp, dest, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            StorageIOException ex = new StorageIOException("写入 sst 文件失败: " + dest, e);
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
        return dest;
    }

    public static String sstFile(int level) {
        return level + SST_SUFFIX;
    }

    /**
     * 从文件名中解析代数，不是 {@code <非负整数>.sst} 的返回 -1
     */
    public static int levelOf(String fileName) {
        Matcher matcher = SST_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
