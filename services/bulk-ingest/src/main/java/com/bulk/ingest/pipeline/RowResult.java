package com.bulk.ingest.pipeline;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of parsing and validating one data row: either an accepted line (possibly carrying
 * warnings) or a rejection with its reasons.
 */
@Data
@Builder
public class RowResult {

    private long rowNumber;
    private InvoiceLine line;
    private Map<String, String> rawFields;
    private List<String> rejections;
    private List<String> warnings;

    public boolean isAccepted() {
        return line != null;
    }

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }

    public String rejectionMessage() {
        return rejections == null ? null : String.join("; ", rejections);
    }

    public static RowResult accepted(InvoiceLine line, List<String> warnings) {
        return RowResult.builder()
                .rowNumber(line.getRowNumber())
                .line(line)
                .rawFields(line.getRawFields())
                .rejections(List.of())
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static RowResult rejected(long rowNumber, Map<String, String> rawFields, List<String> reasons) {
        return RowResult.builder()
                .rowNumber(rowNumber)
                .rawFields(rawFields)
                .rejections(List.copyOf(reasons))
                .warnings(List.of())
                .build();
    }
}
