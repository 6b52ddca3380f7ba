package org.calista.canary.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path dir;

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(dir);
        assertEquals(dir.toAbsolutePath().normalize().resolve("a/b.jsonl"), io.resolve("a/b.jsonl"));
        assertEquals(dir.toAbsolutePath().normalize().resolve("b.jsonl"), io.resolve("a/../b.jsonl"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.jsonl"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.resolve("x").toAbsolutePath().toString()));
    }

    @Test
    void writeStringReplacesAtomically() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("nested/config.json");

        io.writeString(file, "one");
        io.writeString(file, "two");

        assertEquals("two", io.readString(file));
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void nonAtomicModeWritesDirectly() throws Exception {
        FileIO io = new FileIO(dir, StandardCharsets.UTF_8, false);
        Path file = io.resolve("plain.txt");
        io.writeString(file, "hello");
        assertEquals("hello", io.readString(file));
    }

    @Test
    void jsonlAppendSkipsBlankAndReadSkipsEmptyLines() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("events.jsonl");

        io.appendJsonl(file, "{\"a\":1}");
        io.appendJsonl(file, "   ");
        io.appendLine(file, "");
        io.appendJsonl(file, "  {\"b\":2}  ");

        assertEquals(List.of("{\"a\":1}", "{\"b\":2}"), io.readJsonl(file));
    }

    @Test
    void rollbackLeavesTargetUntouched() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("snap.jsonl");
        io.writeString(file, "original");

        FileIO.WriterHandle h = io.openWriter(file);
        h.writer.write("partial");
        io.rollback(h);

        assertEquals("original", io.readString(file));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void commitPublishesWriterContent() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("snap.jsonl");

        FileIO.WriterHandle h = io.openWriter(file);
        h.writer.write("line");
        h.writer.newLine();
        io.commit(h);

        assertEquals(List.of("line"), io.readJsonl(file));
        assertTrue(io.exists(file));
    }
}
