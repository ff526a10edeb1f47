package com.subreq.io;

import com.subreq.exception.MalformedTableException;
import com.subreq.exception.SubReqException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CsvTable.
 */
class CsvTableTest {

    @Test
    @DisplayName("Values are looked up by trimmed header name")
    void lookupByHeader() {
        CsvTable table = CsvTable.parse("id , name\n1,ENG 101\n2\n", "test");

        assertEquals(List.of("id ", " name"), table.header());
        assertTrue(table.hasColumn("name"));
        assertEquals(2, table.size());
        assertEquals("ENG 101", table.value(0, "name"));
        assertNull(table.value(1, "name"));
        assertNull(table.value(0, "missing"));
    }

    @Test
    @DisplayName("Required column must exist")
    void requiredColumn() {
        CsvTable table = CsvTable.parse("id\n1\n", "test");

        assertEquals("1", table.required(0, "id"));
        assertThrows(MalformedTableException.class, () -> table.required(0, "full_crse"));
    }

    @Test
    @DisplayName("Empty content has no header")
    void emptyContent() {
        assertThrows(MalformedTableException.class, () -> CsvTable.parse("", "empty.csv"));
    }

    @Test
    @DisplayName("Tables are read from the classpath")
    void readClasspath() {
        CsvTable table = CsvTable.read("classpath:fixtures/offered-courses.csv");

        assertEquals(5, table.size());
        assertEquals("ENG 101", table.value(0, "full_crse"));
    }

    @Test
    @DisplayName("Gzip tables are decompressed")
    void readGzip(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("table.csv.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("crse_id,full_crse\n1,ENG 101\n".getBytes(StandardCharsets.UTF_8));
        }

        CsvTable table = CsvTable.read(file.toString());

        assertEquals("ENG 101", table.value(0, "full_crse"));
    }

    @Test
    @DisplayName("Missing file is reported with its path")
    void missingFile(@TempDir Path dir) {
        String path = dir.resolve("nope.csv").toString();

        SubReqException e = assertThrows(SubReqException.class, () -> CsvTable.read(path));
        assertTrue(e.getMessage().contains(path));
    }
}
