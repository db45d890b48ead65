package com.yumi.pluto.wal;

import com.yumi.pluto.exception.CorruptedLogException;
import com.yumi.pluto.exception.StorageIOException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class WalTest {

    @TempDir
    Path dir;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testAppendAndReopen() throws IOException {
        Path file = dir.resolve(WalConstants.DEFAULT_WAL_FILE);
        Record record1 = Record.put(bytes("hello"), bytes("world"));
        Record record2 = Record.delete(bytes("hello"));

        Wal wal = Wal.open(file, true);
        Assertions.assertEquals(0, wal.length());
        wal.append(record1);
        wal.append(record2);
        Assertions.assertEquals(2, wal.length());
        Assertions.assertEquals(record2, wal.last());
        wal.close();

        Assertions.assertEquals("12phello|world7dhello|", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));

        wal = Wal.open(file, true);
        Assertions.assertEquals(Arrays.asList(record1, record2), wal.records());
        Record record3 = Record.put(bytes("k"), bytes("v"));
        wal.append(record3);
        wal.close();

        Assertions.assertEquals(Arrays.asList(record1, record2, record3),
                RecordCodec.decode(Files.readAllBytes(file)));
    }

    @Test
    public void testCompact() throws IOException {
        Path file = dir.resolve(WalConstants.DEFAULT_WAL_FILE);
        Wal wal = Wal.open(file, true);
        wal.append(Record.put(bytes("hello"), bytes("world")));
        wal.compact();
        Assertions.assertEquals(0, wal.length());
        Assertions.assertEquals(0, Files.size(file));

        wal.append(Record.put(bytes("a"), bytes("b")));
        wal.close();
        Assertions.assertEquals("4pa|b", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    public void testLastOnEmpty() {
        Wal wal = Wal.open(dir.resolve(WalConstants.DEFAULT_WAL_FILE), true);
        Assertions.assertThrows(IllegalStateException.class, wal::last);
        wal.close();
    }

    @Test
    public void testOpenCorrupted() throws IOException {
        Path file = dir.resolve(WalConstants.DEFAULT_WAL_FILE);
        Files.write(file, bytes("12phello|world12phello|wo"));
        Assertions.assertThrows(CorruptedLogException.class, () -> Wal.open(file, true));
    }

    @Test
    public void testClosed() {
        Wal wal = Wal.open(dir.resolve(WalConstants.DEFAULT_WAL_FILE), true);
        wal.close();
        wal.close();
        Assertions.assertThrows(IllegalStateException.class,
                () -> wal.append(Record.put(bytes("k"), bytes("v"))));
        Assertions.assertThrows(IllegalStateException.class, wal::compact);
    }

    @Test
    public void testFailedAppendLeavesNoTrace() throws IOException {
        Path file = dir.resolve(WalConstants.DEFAULT_WAL_FILE);
        FaultyFileChannel channel = FaultyFileChannel.open(file);
        Wal wal = Wal.open(file, new WalWriter(file, channel, true));
        Record record1 = Record.put(bytes("a"), bytes("1"));
        wal.append(record1);
        long sizeBefore = Files.size(file);

        channel.setFailWrites(true);
        PrintStream stderr = System.err;
        ByteArrayOutputStream logged = new ByteArrayOutputStream();
        System.setErr(new PrintStream(logged, true, "UTF-8"));
        try {
            Assertions.assertThrows(StorageIOException.class, () -> wal.append(Record.put(bytes("b"), bytes("2"))));
        } finally {
            System.setErr(stderr);
        }
        String log = logged.toString("UTF-8");
        Assertions.assertTrue(log.contains("ERROR"), log);
        Assertions.assertTrue(log.contains("Failed to append to wal"), log);
        //写了一半的字节被截掉，记录也没有进入列表
        Assertions.assertEquals(sizeBefore, Files.size(file));
        Assertions.assertEquals(1, wal.length());
        Assertions.assertEquals(record1, wal.last());

        channel.setFailWrites(false);
        Record record3 = Record.put(bytes("c"), bytes("3"));
        wal.append(record3);
        wal.close();

        Wal reopened = Wal.open(file, true);
        Assertions.assertEquals(Arrays.asList(record1, record3), reopened.records());
        reopened.close();
    }

    @Test
    public void testFailedCompactKeepsRecords() throws IOException {
        Path file = dir.resolve(WalConstants.DEFAULT_WAL_FILE);
        FaultyFileChannel channel = FaultyFileChannel.open(file);
        Wal wal = Wal.open(file, new WalWriter(file, channel, false));
        wal.append(Record.put(bytes("a"), bytes("1")));
        long sizeBefore = Files.size(file);

        channel.setFailTruncateToZero(true);
        Assertions.assertThrows(StorageIOException.class, wal::compact);
        Assertions.assertEquals(1, wal.length());
        Assertions.assertEquals(sizeBefore, Files.size(file));
        wal.close();
    }

    @Test
    public void testConcurrentAppend() throws Exception {
        Path file = dir.resolve(WalConstants.DEFAULT_WAL_FILE);
        Wal wal = Wal.open(file, false);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            final int thread = t;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    wal.append(Record.put(bytes("t" + thread + "-" + i), bytes("value|" + i)));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();
        wal.close();

        //字节层面没有交错，文件可以完整解析，且顺序与内存中一致
        List<Record> decoded = RecordCodec.decode(Files.readAllBytes(file));
        Assertions.assertEquals(800, decoded.size());
        Wal reopened = Wal.open(file, false);
        Assertions.assertEquals(decoded, reopened.records());
        reopened.close();
    }
}
