package com.subreq.io;

import com.subreq.exception.MalformedTableException;
import com.subreq.exception.SubReqException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * A header row plus data rows read from a CSV file.
 */
public final class CsvTable {

    private static final Logger log = LoggerFactory.getLogger(CsvTable.class);

    private final List<String> header;
    private final Map<String, Integer> columnIndex;
    private final List<List<String>> rows;

    private CsvTable(List<String> header, List<List<String>> rows) {
        this.header = List.copyOf(header);
        this.rows = Collections.unmodifiableList(rows);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            index.putIfAbsent(header.get(i).trim(), i);
        }
        this.columnIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Read a table from a path. Supports classpath: prefix and gzip files ending in ".gz".
     *
     * @param path Table location
     * @return Parsed table
     */
    public static CsvTable read(String path) {
        log.info("Reading table from: {}", path);
        Resource resource = ResourceLocator.getResource(path);
        try (InputStream raw = resource.getInputStream();
             InputStream in = path.endsWith(".gz") ? new GZIPInputStream(raw) : raw) {
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), path);
        } catch (IOException e) {
            throw new SubReqException("Failed to read table from: " + path, e);
        }
    }

    public static CsvTable parse(String content, String source) {
        List<List<String>> records = new CsvTokenizer(content, source).tokenize();
        if (records.isEmpty()) {
            throw new MalformedTableException("Table " + source + " has no header row");
        }
        return new CsvTable(records.get(0), records.subList(1, records.size()));
    }

    public List<String> header() {
        return header;
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public int size() {
        return rows.size();
    }

    /**
     * Value of a column in a row. Missing columns and short rows read as null.
     */
    public String value(int row, String column) {
        Integer index = columnIndex.get(column);
        if (index == null) {
            return null;
        }
        List<String> values = rows.get(row);
        return index < values.size() ? values.get(index) : null;
    }

    /**
     * Like {@link #value(int, String)}, but fails when the column is absent.
     */
    public String required(int row, String column) {
        if (!columnIndex.containsKey(column)) {
            throw new MalformedTableException("Missing required column '" + column + "', header is " + header);
        }
        return value(row, column);
    }
}
