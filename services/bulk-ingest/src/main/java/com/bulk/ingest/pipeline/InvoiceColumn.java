package com.bulk.ingest.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Columns of the invoice-line file. Header cells are matched after normalization
 * (lower case, non-alphanumerics removed), so "Invoice No" and "InvoiceNo" are the same column.
 */
public enum InvoiceColumn {
    INVOICE_NO("InvoiceNo", true, "InvoiceNumber"),
    INVOICE_DATE("InvoiceDate", true, "Date"),
    STORE_NAME("StoreName", true, "CustomerName", "Customer"),
    ITEM_NAME("ItemName", true, "Item"),
    QUANTITY("Quantity", true, "Qty"),
    RATE("Rate", true, "UnitPrice"),
    AMOUNT("Amount", true, "LineAmount"),
    STORE_CODE("StoreCode", false, "CustomerCode"),
    BATCH_NO("BatchNo", false, "Batch"),
    MRP("MRP", false),
    DISCOUNT("Discount", false, "Dis");

    private final String header;
    private final boolean required;
    private final List<String> keys;

    InvoiceColumn(String header, boolean required, String... aliases) {
        this.header = header;
        this.required = required;
        this.keys = Stream.concat(Stream.of(header), Stream.of(aliases))
                .map(InvoiceColumn::normalize)
                .toList();
    }

    public String header() {
        return header;
    }

    public boolean isRequired() {
        return required;
    }

    public static Optional<InvoiceColumn> match(String headerCell) {
        String key = normalize(headerCell);
        for (InvoiceColumn column : values()) {
            if (column.keys.contains(key)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    static String normalize(String headerCell) {
        if (headerCell == null) {
            return "";
        }
        return headerCell.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
