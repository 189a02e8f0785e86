package com.apptrace.service.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class StorageFailureTest {

    @Test
    void wrapsCauseMessage() {
        StorageFailure failure = StorageFailure.of("Failed to insert 2 log records", new SQLException("connection refused"));

        assertThat(failure).hasMessage("Failed to insert 2 log records: connection refused");
        assertThat(failure.getCause()).isInstanceOf(SQLException.class);
    }

    @Test
    void existingFailureIsNotWrappedTwice() {
        StorageFailure first = new StorageFailure("boom", null);

        assertThat(StorageFailure.of("again", first)).isSameAs(first);
    }

    @Test
    void messageLessCauseReportsItsType() {
        assertThat(StorageFailure.of("read", new IllegalStateException())).hasMessage("read: IllegalStateException");
    }

    @Test
    void pageDefaultsAndValidation() {
        RecordPage page = RecordPage.of((Integer) null, null);

        assertThat(page).isEqualTo(new RecordPage(100, 0));
        assertThat(RecordPage.of(0, 3).isEmpty()).isTrue();
        assertThatThrownBy(() -> RecordPage.of(-5, 0)).hasMessageContaining("limit");
    }
}
