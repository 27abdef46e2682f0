package com.bulk.ingest.pipeline;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.bulk.ingest.config.IngestProperties;
import com.bulk.ingest.config.IngestProperties.AmountMismatchPolicy;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-row schema, type and business-rule validation.
 * Pure validation - no database access, no shared state.
 */
@Slf4j
public class RowValidator {

    // invoice_lines stores every amount as NUMERIC(18, 4).
    private static final int MAX_INTEGER_DIGITS = 14;
    private static final int MAX_SCALE = 4;

    private final DateNormalizer dateNormalizer;
    private final AmountMismatchPolicy amountMismatchPolicy;
    private final BigDecimal amountTolerance;

    public RowValidator(DateNormalizer dateNormalizer, IngestProperties.Validation properties) {
        this.dateNormalizer = dateNormalizer;
        this.amountMismatchPolicy = properties.getAmountMismatchPolicy();
        this.amountTolerance = BigDecimal.valueOf(properties.getAmountTolerance());
    }

    /**
     * @param values cells keyed by column; a column absent from the record maps to null
     * @param rawFields the record as read, for error snapshots
     */
    public RowResult validate(long rowNumber, Map<InvoiceColumn, String> values, Map<String, String> rawFields) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String invoiceNo = requiredText(values, InvoiceColumn.INVOICE_NO, errors);
        String storeName = requiredText(values, InvoiceColumn.STORE_NAME, errors);
        String itemName = requiredText(values, InvoiceColumn.ITEM_NAME, errors);
        LocalDate invoiceDate = requiredDate(values, errors);
        BigDecimal quantity = requiredNumber(values, InvoiceColumn.QUANTITY, true, errors);
        BigDecimal rate = requiredNumber(values, InvoiceColumn.RATE, true, errors);
        BigDecimal amount = requiredNumber(values, InvoiceColumn.AMOUNT, false, errors);
        BigDecimal mrp = optionalNumber(values, InvoiceColumn.MRP, errors);
        BigDecimal discount = optionalNumber(values, InvoiceColumn.DISCOUNT, errors);

        if (errors.isEmpty()) {
            checkAmount(quantity, rate, amount).ifPresent(mismatch -> {
                if (amountMismatchPolicy == AmountMismatchPolicy.REJECT) {
                    errors.add(mismatch);
                } else {
                    warnings.add(mismatch);
                }
            });
        }

        if (!errors.isEmpty()) {
            log.debug("Row {} rejected: {}", rowNumber, errors);
            return RowResult.rejected(rowNumber, rawFields, errors);
        }

        InvoiceLine line = InvoiceLine.builder()
                .rowNumber(rowNumber)
                .invoiceNo(invoiceNo)
                .invoiceDate(invoiceDate)
                .storeName(storeName)
                .storeCode(optionalText(values, InvoiceColumn.STORE_CODE))
                .itemName(itemName)
                .batchNo(optionalText(values, InvoiceColumn.BATCH_NO))
                .quantity(quantity)
                .rate(rate)
                .amount(amount)
                .mrp(mrp)
                .discount(discount)
                .rawFields(rawFields)
                .build();
        return RowResult.accepted(line, warnings);
    }

    private Optional<String> checkAmount(BigDecimal quantity, BigDecimal rate, BigDecimal amount) {
        BigDecimal expected;
        try {
            expected = quantity.multiply(rate);
            if (expected.subtract(amount).abs().compareTo(amountTolerance) <= 0) {
                return Optional.empty();
            }
        } catch (ArithmeticException e) {
            return Optional.of("Amount check failed for " + quantity.toPlainString() + " x " + rate.toPlainString()
                    + ": " + e.getMessage());
        }
        return Optional.of("Amount mismatch: expected " + expected.stripTrailingZeros().toPlainString()
                + ", got " + amount.toPlainString());
    }

    private static String requiredText(Map<InvoiceColumn, String> values, InvoiceColumn column, List<String> errors) {
        String value = values.get(column);
        if (value == null || value.isBlank()) {
            errors.add("Missing required field: " + column.header());
            return null;
        }
        return collapseWhitespace(value);
    }

    private static String optionalText(Map<InvoiceColumn, String> values, InvoiceColumn column) {
        String value = values.get(column);
        return value == null ? "" : collapseWhitespace(value);
    }

    private LocalDate requiredDate(Map<InvoiceColumn, String> values, List<String> errors) {
        String value = values.get(InvoiceColumn.INVOICE_DATE);
        if (value == null || value.isBlank()) {
            errors.add("Missing required field: " + InvoiceColumn.INVOICE_DATE.header());
            return null;
        }
        Optional<LocalDate> date = dateNormalizer.parse(value);
        if (date.isEmpty()) {
            errors.add("Invalid date format: " + value);
            return null;
        }
        return date.get();
    }

    private static BigDecimal requiredNumber(Map<InvoiceColumn, String> values, InvoiceColumn column,
            boolean nonNegative, List<String> errors) {
        String value = values.get(column);
        if (value == null || value.isBlank()) {
            errors.add("Missing required field: " + column.header());
            return null;
        }
        return parseNumber(column, value, nonNegative, errors);
    }

    private static BigDecimal optionalNumber(Map<InvoiceColumn, String> values, InvoiceColumn column,
            List<String> errors) {
        String value = values.get(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return parseNumber(column, value, true, errors);
    }

    private static BigDecimal parseNumber(InvoiceColumn column, String value, boolean nonNegative,
            List<String> errors) {
        BigDecimal number;
        try {
            number = new BigDecimal(value.replace(",", "").trim());
            long integerDigits = (long) number.precision() - number.scale();
            if (integerDigits > MAX_INTEGER_DIGITS) {
                errors.add("Numeric value out of range for " + column.header() + ": " + value);
                return null;
            }
            if (integerDigits < -MAX_SCALE) {
                // below 0.00001, rounds to zero
                number = BigDecimal.ZERO.setScale(MAX_SCALE);
            } else if (number.scale() > MAX_SCALE) {
                number = number.setScale(MAX_SCALE, RoundingMode.HALF_UP);
            }
        } catch (NumberFormatException | ArithmeticException e) {
            errors.add("Invalid numeric value for " + column.header() + ": " + value);
            return null;
        }
        if (nonNegative && number.signum() < 0) {
            errors.add(column.header() + " cannot be negative: " + value);
            return null;
        }
        return number;
    }

    private static String collapseWhitespace(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }
}
