package com.bulk.ingest.pipeline;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.UUID;

/**
 * Batched upsert into invoice_lines. Each line is its own statement in the batch, so two lines
 * with the same natural key in one chunk update in order instead of conflicting.
 */
public class JdbcInvoiceLineStore implements InvoiceLineStore {

    static final String UPSERT_SQL = "INSERT INTO invoice_lines (invoice_no, invoice_date, store_name, store_code, "
            + "item_name, batch_no, quantity, rate, mrp, discount, amount, content_hash, upload_id, "
            + "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) "
            + "ON CONFLICT (invoice_no, store_name, item_name, batch_no) DO UPDATE SET "
            + "invoice_date = EXCLUDED.invoice_date, store_code = EXCLUDED.store_code, "
            + "quantity = EXCLUDED.quantity, rate = EXCLUDED.rate, mrp = EXCLUDED.mrp, "
            + "discount = EXCLUDED.discount, amount = EXCLUDED.amount, content_hash = EXCLUDED.content_hash, "
            + "upload_id = EXCLUDED.upload_id, updated_at = CURRENT_TIMESTAMP";

    @Override
    public int upsert(Connection connection, List<InvoiceLine> lines, UUID uploadId) throws SQLException {
        if (lines.isEmpty()) {
            return 0;
        }
        try (PreparedStatement statement = connection.prepareStatement(UPSERT_SQL)) {
            for (InvoiceLine line : lines) {
                statement.setString(1, line.getInvoiceNo());
                statement.setDate(2, Date.valueOf(line.getInvoiceDate()));
                statement.setString(3, line.getStoreName());
                statement.setString(4, line.getStoreCode());
                statement.setString(5, line.getItemName());
                statement.setString(6, line.getBatchNo());
                statement.setBigDecimal(7, line.getQuantity());
                statement.setBigDecimal(8, line.getRate());
                setNullableDecimal(statement, 9, line.getMrp());
                setNullableDecimal(statement, 10, line.getDiscount());
                statement.setBigDecimal(11, line.getAmount());
                statement.setString(12, line.getContentHash());
                statement.setObject(13, uploadId);
                statement.addBatch();
            }
            statement.executeBatch();
        }
        return lines.size();
    }

    private static void setNullableDecimal(PreparedStatement statement, int index, BigDecimal value)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.NUMERIC);
        } else {
            statement.setBigDecimal(index, value);
        }
    }
}
