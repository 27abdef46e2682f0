package com.bulk.ingest.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    @DisplayName("connection loss and lock failures are transient")
    void transientFailures() {
        assertThat(classifier.isTransient(new SQLTransientConnectionException("connection reset"))).isTrue();
        assertThat(classifier.isTransient(new SQLTransactionRollbackException("deadlock detected"))).isTrue();
        assertThat(classifier.translate("write", new SQLTransientConnectionException("reset")))
                .isInstanceOf(TransientDataAccessException.class);
    }

    @Test
    @DisplayName("integrity violations are fatal")
    void integrityViolationIsFatal() {
        var translated = classifier.translate("write", new SQLIntegrityConstraintViolationException("too long", "22001"));

        assertThat(translated).isInstanceOf(DataIntegrityViolationException.class);
        assertThat(classifier.isTransient(translated)).isFalse();
    }

    @Test
    @DisplayName("an open circuit anywhere in the cause chain is transient")
    void circuitOpenIsTransient() {
        RuntimeException wrapped = new RuntimeException("outer",
                new CircuitOpenException("database", Duration.ofSeconds(5)));

        assertThat(classifier.isTransient(wrapped)).isTrue();
    }

    @Test
    @DisplayName("unrelated exceptions are not transient")
    void otherExceptions() {
        assertThat(classifier.isTransient(new IllegalStateException("bug"))).isFalse();
        assertThat(classifier.isTransient(null)).isFalse();
    }
}
