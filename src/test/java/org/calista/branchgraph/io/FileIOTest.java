package org.calista.branchgraph.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileIOTest {

    @TempDir
    Path dir;

    private FileIO locking(long timeoutMs) {
        return new FileIO(dir, FileIO.Options.builder()
                .lockWrites(true)
                .lockTimeout(Duration.ofMillis(timeoutMs))
                .fsyncOnCommit(true)
                .build());
    }

    private static List<String> lines(FileIO io, Path file) throws IOException {
        try (Stream<String> s = io.jsonlStream(file)) {
            return s.collect(Collectors.toList());
        }
    }

    @Test
    void lockedAppendWaitsForHolderThenTimesOut() throws Exception {
        FileIO io = locking(50);
        Path file = io.resolve("events.jsonl");
        io.appendJsonl(file, "{\"index\":0}");

        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE);
             FileLock held = ch.lock()) {
            assertTrue(held.isValid());
            IOException e = assertThrows(IOException.class, () -> io.appendJsonl(file, "{\"index\":1}"));
            assertTrue(e.getMessage().startsWith("Write lock timeout"), e.getMessage());
        }

        io.appendJsonl(file, "{\"index\":1}");
        assertEquals(List.of("{\"index\":0}", "{\"index\":1}"), lines(io, file));
    }

    @Test
    void lockedAtomicWriteReplacesContent() throws Exception {
        FileIO io = locking(1000);
        Path file = io.resolve("conf/engine.json");

        io.writeString(file, "{\"a\":1}");
        io.writeString(file, "{\"a\":2}");

        assertEquals("{\"a\":2}", io.readString(file));
        assertFalse(Files.exists(file.resolveSibling("engine.json.tmp")));
    }

    @Test
    void jsonlRejectsMultiLineRecordsAndSkipsBlankOnes() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("log.jsonl");

        assertThrows(IllegalArgumentException.class, () -> io.appendJsonl(file, "{}\n{}"));
        io.appendJsonl(file, "   ");
        io.appendJsonl(file, " {\"x\":1} ");
        assertEquals(List.of("{\"x\":1}"), lines(io, file));
    }

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(dir);
        assertEquals(dir.toAbsolutePath().normalize().resolve("a/b.json"), io.resolve("a/../a/b.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../outside.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.resolve("x").toAbsolutePath().toString()));
    }
}
