package com.casesentinel.core.alert;

import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertStatus;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.store.RecordingAlertStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertWriter}.
 */
class AlertWriterTest {

    private static final Instant NOW = Instant.parse("2025-06-02T12:00:00Z");

    private RecordingAlertStore store;
    private AlertWriter writer;

    @BeforeEach
    void setUp() {
        store = new RecordingAlertStore();
        writer = new AlertWriter(store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Assigns fresh ids, active status and clock timestamps")
    void populatesFields() {
        List<Alert> written = writer.write(List.of(draft("Billing"), draft("Retail")));

        assertThat(written).hasSize(2);
        assertThat(written).extracting(Alert::getId).doesNotContainNull().doesNotHaveDuplicates();
        assertThat(written).allSatisfy(a -> {
            assertThat(a.getStatus()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(a.getCreatedAt()).isEqualTo(NOW);
            assertThat(a.getUpdatedAt()).isEqualTo(NOW);
        });
        assertThat(store.getAlertBatches()).containsExactly(written);
    }

    @Test
    @DisplayName("Empty batch makes no store call")
    void emptyBatch() {
        assertThat(writer.write(List.of())).isEmpty();
        assertThat(store.getAlertBatches()).isEmpty();
    }

    @Test
    @DisplayName("Writing the same drafts twice appends duplicates")
    void appendsDuplicates() {
        writer.write(List.of(draft("Billing")));
        writer.write(List.of(draft("Billing")));

        assertThat(store.getAlerts()).hasSize(2);
        assertThat(store.getAlerts()).extracting(Alert::getTitle).containsOnly("High volume: 150 cases in Billing");
    }

    private static Alert draft(String bu) {
        return Alert.builder()
                .type(AlertType.THRESHOLD)
                .severity(Severity.MEDIUM)
                .title("High volume: 150 cases in " + bu)
                .description("Case volume in " + bu + " has exceeded the threshold.")
                .businessUnit(bu)
                .currentValue(150)
                .baselineValue(100)
                .percentageChange(50.0)
                .build();
    }
}
