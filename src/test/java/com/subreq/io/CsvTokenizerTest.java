package com.subreq.io;

import com.subreq.exception.MalformedTableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CsvTokenizer.
 */
class CsvTokenizerTest {

    @Test
    @DisplayName("Plain fields split on commas, records on line ends")
    void plainFields() {
        List<List<String>> records = tokenize("a,b,c\n1,2,3\n");

        assertEquals(List.of(List.of("a", "b", "c"), List.of("1", "2", "3")), records);
    }

    @Test
    @DisplayName("Quoted fields keep commas, doubled quotes and line breaks")
    void quotedFields() {
        List<List<String>> records = tokenize("x,\"a, \"\"b\"\"\nc\",y");

        assertEquals(List.of(List.of("x", "a, \"b\"\nc", "y")), records);
    }

    @Test
    @DisplayName("CRLF line ends and a trailing record without newline")
    void crlf() {
        assertEquals(List.of(List.of("a", "b"), List.of("c", "")), tokenize("a,b\r\nc,"));
    }

    @Test
    @DisplayName("Byte order mark and blank lines are skipped")
    void bomAndBlankLines() {
        assertEquals(List.of(List.of("h"), List.of("v")), tokenize("\uFEFFh\n\n\r\nv\n"));
    }

    @Test
    @DisplayName("Non-ASCII code symbols pass through")
    void unicode() {
        assertEquals(List.of(List.of("¿", "Æ")), tokenize("¿,Æ"));
    }

    @Test
    @DisplayName("Unterminated quote fails with the source name")
    void unterminatedQuote() {
        MalformedTableException e = assertThrows(MalformedTableException.class,
                () -> new CsvTokenizer("a\n\"open,b", "courses.csv").tokenize());

        assertTrue(e.getMessage().contains("line 2"));
        assertTrue(e.getMessage().contains("courses.csv"));
    }

    private static List<List<String>> tokenize(String input) {
        return new CsvTokenizer(input, "test").tokenize();
    }
}
