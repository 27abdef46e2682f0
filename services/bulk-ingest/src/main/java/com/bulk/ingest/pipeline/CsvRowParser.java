package com.bulk.ingest.pipeline;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

import lombok.extern.slf4j.Slf4j;

/**
 * Streaming reader for invoice-line files. The first record is the header; every following
 * non-empty record becomes one {@link RowResult}. Memory use does not depend on file size.
 */
@Slf4j
public class CsvRowParser {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    private final RowValidator validator;

    public CsvRowParser(RowValidator validator) {
        this.validator = validator;
    }

    /**
     * Reads the header and returns a lazy cursor over the data rows.
     * The cursor owns the reader and closes it.
     *
     * @throws SchemaException if a required column is absent from the header
     * @throws SourceReadException if the header cannot be read
     */
    public RowCursor open(Reader reader) {
        CSVParser parser;
        try {
            parser = FORMAT.parse(reader);
        } catch (IOException | UncheckedIOException e) {
            throw new SourceReadException("Unable to read header: " + e.getMessage(), e);
        }
        List<String> headerNames = parser.getHeaderNames();
        Map<InvoiceColumn, Integer> positions = resolveColumns(headerNames);

        List<String> missing = new ArrayList<>();
        for (InvoiceColumn column : InvoiceColumn.values()) {
            if (column.isRequired() && !positions.containsKey(column)) {
                missing.add(column.header());
            }
        }
        if (!missing.isEmpty()) {
            closeQuietly(parser);
            throw new SchemaException(missing);
        }
        log.debug("Resolved columns {} from header {}", positions, headerNames);
        return new RowCursor(parser, headerNames, positions, validator);
    }

    /**
     * Counts data rows the same way {@link #open(Reader)} would iterate them.
     */
    public long countRows(Reader reader) {
        try (CSVParser parser = FORMAT.parse(reader)) {
            long rows = 0;
            for (CSVRecord ignored : parser) {
                rows++;
            }
            return rows;
        } catch (IOException | UncheckedIOException e) {
            throw new SourceReadException("Unable to count rows: " + e.getMessage(), e);
        }
    }

    private static Map<InvoiceColumn, Integer> resolveColumns(List<String> headerNames) {
        Map<InvoiceColumn, Integer> positions = new EnumMap<>(InvoiceColumn.class);
        for (int i = 0; i < headerNames.size(); i++) {
            int position = i;
            InvoiceColumn.match(headerNames.get(i)).ifPresent(column -> positions.putIfAbsent(column, position));
        }
        return positions;
    }

    private static void closeQuietly(CSVParser parser) {
        try {
            parser.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure after schema error: {}", e.getMessage());
        }
    }
}
