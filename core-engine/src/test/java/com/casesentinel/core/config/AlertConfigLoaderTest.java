package com.casesentinel.core.config;

import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertConfigLoader}.
 */
class AlertConfigLoaderTest {

    @Test
    @DisplayName("Should load overrides from classpath and keep defaults for omitted sections")
    void shouldLoadFromClasspath() {
        AlertConfig config = AlertConfigLoader.fromClasspath("test-alert-config.yml");

        assertThat(config.getSpikeFactor()).isEqualTo(2.0);
        assertThat(config.getMinBaseline()).isEqualTo(10);
        assertThat(config.getDefaultThresholds().valueFor(TimeWindow.DAILY)).hasValue(50);
        assertThat(config.thresholdOverride("Billing")).isPresent();
        assertThat(config.thresholdOverride("Billing").get().valueFor(TimeWindow.DAILY)).hasValue(40);
        assertThat(config.thresholdOverride("Customer Service")).isEmpty();

        assertThat(config.getUrgency().getKeywords()).containsExactly("lawsuit", "injury");
        assertThat(config.getUrgency().getMinCaseCount()).isEqualTo(2);
        assertThat(config.getMisclassification()).isEqualTo(AlertConfig.defaultMisclassificationRules());
    }

    @Test
    @DisplayName("Empty document falls back to built-in defaults")
    void emptyDocumentGivesDefaults() {
        AlertConfig config = AlertConfigLoader.fromClasspath("empty.yml");

        assertThat(config.getSpikeFactor()).isEqualTo(AlertConfig.DEFAULT_SPIKE_FACTOR);
        assertThat(config.getDefaultThresholds().valueFor(TimeWindow.HOURLY)).hasValue(20);
        assertThat(config.thresholdOverride("Technical Support").get().valueFor(TimeWindow.WEEKLY))
                .hasValue(600);
        assertThat(config.getUrgency().getQualifyingSeverities())
                .containsExactlyInAnyOrder(Severity.HIGH, Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("alerts.yml");
        Files.writeString(file, "spike:\n  minBaseline: 3\n");

        AlertConfig config = AlertConfigLoader.fromFile(file.toString());

        assertThat(config.getMinBaseline()).isEqualTo(3);
        assertThat(config.getSpikeFactor()).isEqualTo(AlertConfig.DEFAULT_SPIKE_FACTOR);
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AlertConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AlertConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> AlertConfigLoader.fromClasspath("duplicate-keys.yml"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject unknown time windows")
    void shouldRejectUnknownWindow() {
        assertThatThrownBy(() -> AlertConfigLoader.fromClasspath("unknown-window.yml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("monthly");
    }

    @Test
    @DisplayName("Should reject a non-positive spike factor")
    void shouldRejectInvalidSpikeFactor() {
        assertThatThrownBy(() -> AlertConfigLoader.fromClasspath("invalid-spike.yml"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should read prediction settings and keep defaults for omitted keys")
    void shouldLoadPredictionSection(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("alerts.yml");
        Files.writeString(file, "prediction:\n  consecutiveDays: 4\n  alertThreshold: 250\n");

        PredictionRules rules = AlertConfigLoader.fromFile(file.toString()).getPrediction();

        assertThat(rules.getConsecutiveDays()).isEqualTo(4);
        assertThat(rules.getAlertThreshold()).isEqualTo(250);
        assertThat(rules.getApproachPercent()).isEqualTo(80.0);
        assertThat(rules.getGrowthMultiplier()).isEqualTo(1.5);
        assertThat(rules.getMinCases()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should reject an approach percentage of 100 or more")
    void shouldRejectInvalidApproachPercent(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("alerts.yml");
        Files.writeString(file, "prediction:\n  approachPercent: 100.0\n");

        assertThatThrownBy(() -> AlertConfigLoader.fromFile(file.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("approachPercent");
    }
}
