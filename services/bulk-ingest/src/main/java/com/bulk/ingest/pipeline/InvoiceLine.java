package com.bulk.ingest.pipeline;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A validated, normalized invoice line ready for the sink table.
 * Optional text fields are normalized to "" so they can take part in the natural key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceLine {

    private long rowNumber;

    private String invoiceNo;

    private LocalDate invoiceDate;

    private String storeName;

    @Builder.Default
    private String storeCode = "";

    private String itemName;

    @Builder.Default
    private String batchNo = "";

    private BigDecimal quantity;

    private BigDecimal rate;

    private BigDecimal mrp;

    private BigDecimal discount;

    private BigDecimal amount;

    private String contentHash;

    /** Raw cells as read from the file, kept for error snapshots. */
    private Map<String, String> rawFields;
}
