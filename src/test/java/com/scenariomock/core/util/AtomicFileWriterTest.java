package com.scenariomock.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteAtomically_Success_ContentWrittenCorrectly() throws IOException {
        Path target = tempDir.resolve("store.json");

        AtomicFileWriter.writeAtomically(target, tempPath -> Files.writeString(tempPath, "{\"scenarios\":[]}"));

        assertTrue(Files.exists(target));
        assertEquals("{\"scenarios\":[]}", Files.readString(target));
    }

    @Test
    void testWriteString_Overwrite_ReplacesContent() throws IOException {
        Path target = tempDir.resolve("store.json");

        AtomicFileWriter.writeString(target, "first");
        assertEquals("first", Files.readString(target));

        AtomicFileWriter.writeString(target, "second");
        assertEquals("second", Files.readString(target));
    }

    @Test
    void testWriteAtomically_WriterThrows_TempFileRemovedAndTargetKept() throws IOException {
        Path target = tempDir.resolve("store.json");
        AtomicFileWriter.writeString(target, "original");

        assertThrows(IOException.class, () ->
                AtomicFileWriter.writeAtomically(target, tempPath -> {
                    throw new IOException("writer failed");
                }));

        assertEquals("original", Files.readString(target));
        try (Stream<Path> list = Files.list(tempDir)) {
            long tempCount = list
                    .filter(p -> p.getFileName().toString().startsWith("scenariomock-"))
                    .count();
            assertEquals(0, tempCount, "Temp file should be cleaned up when writer throws");
        }
    }

    @Test
    void testWriteAtomically_ParentDirMissing_CreatesAndWrites() throws IOException {
        Path target = tempDir.resolve("a").resolve("b").resolve("c").resolve("report.json");

        AtomicFileWriter.writeString(target, "nested content");

        assertEquals("nested content", Files.readString(target));
    }

    @Test
    void testWriteAtomically_ParentIsFile_ThrowsIOException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThrows(IOException.class, () -> AtomicFileWriter.writeString(blocker.resolve("out.json"), "x"));
    }
}
