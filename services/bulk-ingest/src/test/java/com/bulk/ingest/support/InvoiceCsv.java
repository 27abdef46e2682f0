package com.bulk.ingest.support;

import java.util.Set;

/**
 * Builds invoice-line CSV content for tests. Every generated row has a distinct natural key.
 */
public final class InvoiceCsv {

    public static final String HEADER = "InvoiceNo,InvoiceDate,StoreName,StoreCode,ItemName,BatchNo,Quantity,Rate,MRP,Amount";

    private InvoiceCsv() {
    }

    public static String rows(String prefix, int count) {
        return rows(prefix, count, Set.of());
    }

    /**
     * @param negativeRows 1-based row numbers that get a negative quantity
     */
    public static String rows(String prefix, int count, Set<Integer> negativeRows) {
        StringBuilder csv = new StringBuilder(HEADER).append('\n');
        for (int i = 1; i <= count; i++) {
            String quantity = negativeRows.contains(i) ? "-2" : "2";
            csv.append(line(invoiceNo(prefix, i), "15/03/2024", "Store " + prefix, "S1", "Item " + i, "B1",
                    quantity, "10.50", "12", "21.00")).append('\n');
        }
        return csv.toString();
    }

    public static String invoiceNo(String prefix, int row) {
        return "INV-" + prefix + "-" + row;
    }

    public static String line(String... cells) {
        return String.join(",", cells);
    }
}
