package com.subreq.io;

import com.subreq.exception.MalformedTableException;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for comma separated tables.
 * <p>
 * Fields may be quoted with double quotes; a doubled quote inside a quoted field is
 * a literal quote. Records end at CR, LF or CRLF outside quotes. A leading byte
 * order mark is skipped and blank lines are ignored.
 */
public final class CsvTokenizer {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';
    private static final char CR = '\r';
    private static final char LF = '\n';
    private static final char BOM = '\uFEFF';

    private final String input;
    private final String source;
    private final int length;
    private int pos;
    private int line;

    public CsvTokenizer(String input, String source) {
        this.input = input;
        this.source = source;
        this.length = input.length();
        this.pos = !input.isEmpty() && input.charAt(0) == BOM ? 1 : 0;
        this.line = 1;
    }

    /**
     * Tokenize the input into records.
     *
     * @return Records, each a list of field values
     */
    public List<List<String>> tokenize() {
        List<List<String>> records = new ArrayList<>();

        while (!isAtEnd()) {
            List<String> record = readRecord();
            if (!(record.size() == 1 && record.get(0).isEmpty())) {
                records.add(record);
            }
        }
        return records;
    }

    private List<String> readRecord() {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();

        while (!isAtEnd()) {
            char c = peek();

            if (c == QUOTE && field.length() == 0) {
                readQuoted(field);
                continue;
            }

            advance();
            switch (c) {
                case SEPARATOR -> {
                    fields.add(field.toString());
                    field.setLength(0);
                }
                case CR -> {
                    match(LF);
                    line++;
                    fields.add(field.toString());
                    return fields;
                }
                case LF -> {
                    line++;
                    fields.add(field.toString());
                    return fields;
                }
                default -> field.append(c);
            }
        }

        fields.add(field.toString());
        return fields;
    }

    private void readQuoted(StringBuilder field) {
        int startLine = line;
        advance(); // opening quote

        while (!isAtEnd()) {
            char c = advance();
            if (c == QUOTE) {
                if (match(QUOTE)) {
                    field.append(QUOTE);
                    continue;
                }
                return;
            }
            if (c == LF) {
                line++;
            }
            field.append(c);
        }

        throw new MalformedTableException("Unterminated quoted field starting on line " + startLine
                + " of " + source);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
