package com.bulk.ingest.pipeline;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.StringJoiner;

/**
 * SHA-256 over the business content of an invoice line.
 *
 * <p>Fields are joined with the ASCII unit separator so that adjacent values cannot run together.
 * Decimals are reduced to their plain canonical form, so "10", "10.0" and "10.00" hash alike.
 * The row number is not part of the content.
 */
public class ContentHasher {

    private static final String SEPARATOR = "\u001F";
    private static final HexFormat HEX = HexFormat.of();

    public String hash(InvoiceLine line) {
        StringJoiner content = new StringJoiner(SEPARATOR)
                .add(text(line.getInvoiceNo()))
                .add(line.getInvoiceDate() == null ? "" : line.getInvoiceDate().toString())
                .add(text(line.getStoreName()))
                .add(text(line.getStoreCode()))
                .add(text(line.getItemName()))
                .add(text(line.getBatchNo()))
                .add(decimal(line.getQuantity()))
                .add(decimal(line.getRate()))
                .add(decimal(line.getAmount()));
        return HEX.formatHex(sha256().digest(content.toString().getBytes(StandardCharsets.UTF_8)));
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    private static String decimal(BigDecimal value) {
        return value == null ? "" : value.stripTrailingZeros().toPlainString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
