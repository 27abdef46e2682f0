package com.bulk.ingest.resilience;

import java.sql.SQLException;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

/**
 * Maps JDBC failures onto Spring's {@link DataAccessException} hierarchy and decides whether
 * they are worth retrying.
 *
 * <p>Transient: connection loss, timeouts, lock and serialization failures, open circuits.
 * Everything else (integrity violations, malformed values, bad SQL) is fatal for the statement.
 */
public class FailureClassifier {

    private final SQLExceptionTranslator translator = new SQLExceptionSubclassTranslator();

    public DataAccessException translate(String task, SQLException ex) {
        DataAccessException translated = translator.translate(task, null, ex);
        return translated != null ? translated : new UncategorizedSQLException(task, null, ex);
    }

    public boolean isTransient(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof CircuitOpenException
                    || current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException) {
                return true;
            }
            if (current instanceof SQLException sql) {
                return isTransient(translate("classify", sql));
            }
            if (current instanceof DataAccessException) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
