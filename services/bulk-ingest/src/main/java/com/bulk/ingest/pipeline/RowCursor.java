package com.bulk.ingest.pipeline;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Lazy, single-pass sequence of validated rows. To start over, reopen the source.
 */
public class RowCursor implements Iterator<RowResult>, Closeable {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> headerNames;
    private final Map<InvoiceColumn, Integer> positions;
    private final RowValidator validator;
    private long rowNumber;

    RowCursor(CSVParser parser, List<String> headerNames, Map<InvoiceColumn, Integer> positions,
            RowValidator validator) {
        this.parser = parser;
        this.records = parser.iterator();
        this.headerNames = headerNames;
        this.positions = positions;
        this.validator = validator;
    }

    @Override
    public boolean hasNext() {
        try {
            return records.hasNext();
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new SourceReadException("Read failed after row " + rowNumber + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RowResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        CSVRecord record;
        try {
            record = records.next();
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new SourceReadException("Read failed after row " + rowNumber + ": " + e.getMessage(), e);
        }
        rowNumber++;

        Map<InvoiceColumn, String> values = new EnumMap<>(InvoiceColumn.class);
        positions.forEach((column, position) -> {
            if (position < record.size()) {
                values.put(column, record.get(position));
            }
        });
        return validator.validate(rowNumber, values, rawFields(record));
    }

    /** Data rows handed out so far. */
    public long getRowNumber() {
        return rowNumber;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private Map<String, String> rawFields(CSVRecord record) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (int i = 0; i < record.size(); i++) {
            String name = i < headerNames.size() ? headerNames.get(i) : "column" + (i + 1);
            raw.putIfAbsent(name, record.get(i));
        }
        return Collections.unmodifiableMap(raw);
    }
}
