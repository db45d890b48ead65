package com.yumi.pluto.wal;

import com.yumi.pluto.exception.StorageIOException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class WalWriterTest {

    @TempDir
    Path dir;

    @Test
    public void testCreateWhenAbsent() {
        Path file = dir.resolve("test.wal");
        WalWriter walWriter = new WalWriter(file, true);
        Assertions.assertTrue(Files.exists(file));
        Assertions.assertEquals(0, walWriter.size());
        walWriter.close();
    }

    @Test
    public void testAppendAtEnd() throws IOException {
        Path file = dir.resolve("test.wal");
        Files.write(file, "3pk|".getBytes(StandardCharsets.UTF_8));
        WalWriter walWriter = new WalWriter(file, true);
        Assertions.assertEquals(4, walWriter.size());
        walWriter.write("4pk|v".getBytes(StandardCharsets.UTF_8));
        walWriter.close();
        Assertions.assertEquals("3pk|4pk|v", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    public void testTruncate() throws IOException {
        Path file = dir.resolve("test.wal");
        WalWriter walWriter = new WalWriter(file, false);
        walWriter.write("4pk|v".getBytes(StandardCharsets.UTF_8));
        walWriter.truncate();
        Assertions.assertEquals(0, Files.size(file));
        walWriter.write("3pa|".getBytes(StandardCharsets.UTF_8));
        walWriter.close();
        Assertions.assertEquals("3pa|", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    public void testFailedWriteRollsBack() throws IOException {
        Path file = dir.resolve("test.wal");
        FaultyFileChannel channel = FaultyFileChannel.open(file);
        WalWriter walWriter = new WalWriter(file, channel, true);
        walWriter.write("3pk|".getBytes(StandardCharsets.UTF_8));

        channel.setFailWrites(true);
        Assertions.assertThrows(StorageIOException.class,
                () -> walWriter.write("12phello|world".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(4, walWriter.size());
        Assertions.assertEquals(4, Files.size(file));

        //回滚后从原来的末尾继续写
        channel.setFailWrites(false);
        walWriter.write("4pk|v".getBytes(StandardCharsets.UTF_8));
        walWriter.close();
        Assertions.assertEquals("3pk|4pk|v", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }
}
