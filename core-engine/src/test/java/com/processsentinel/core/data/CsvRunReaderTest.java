package com.processsentinel.core.data;

import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.FeatureSchema;
import com.processsentinel.core.model.Run;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CsvRunReader}.
 */
class CsvRunReaderTest {

    private CsvRunReader reader;

    @BeforeEach
    void setUp() {
        reader = new CsvRunReader(FeatureSchema.of(List.of("Mixer/Level", "Mixer/Temperature")),
                "Run id", "Timestamp", "Anomaly");
    }

    @Test
    @DisplayName("Should group rows into runs and ignore extra columns")
    void shouldReadRuns(@TempDir Path dir) throws IOException {
        Path csv = dir.resolve("runs.csv");
        Files.writeString(csv, String.join("\n",
                "number,Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly,Parameter for Anomaly",
                "0,b,1,0.5,275.1,0,",
                "1,a,1,0.6,275.2,0,",
                "2,a,2,0.7,275.3,2,Mixer/Temperature",
                "3,b,2,0.8,275.4,1,Mixer/Level"));

        RunStore store = reader.read(csv);

        assertThat(store.runIds()).containsExactly("a", "b");
        Run a = store.get("a");
        assertThat(a.length()).isEqualTo(2);
        assertThat(a.featureRow(1)).containsExactly(0.7, 275.3);
        assertThat(a.code(1)).isEqualTo(AnomalyCode.STEP);
        assertThat(store.get("b").code(1)).isEqualTo(AnomalyCode.FREEZE);
    }

    @Test
    @DisplayName("Should accept ISO-8601 timestamps")
    void shouldParseIsoTimestamps() throws IOException {
        RunStore store = read(
                "Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly",
                "r,2024-03-01T10:00:00Z,1,2,0",
                "r,2024-03-01 10:00:01,1,2,0");

        Run run = store.get("r");
        assertThat(run.timestamp(1) - run.timestamp(0)).isEqualTo(1000.0);
    }

    @Test
    @DisplayName("Should fail fast when a feature column is missing")
    void shouldRejectMissingColumn() {
        assertThatThrownBy(() -> read(
                "Run id,Timestamp,Mixer/Level,Anomaly",
                "r,1,1,0"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Mixer/Temperature");
    }

    @Test
    @DisplayName("Should fail fast on unknown anomaly codes")
    void shouldRejectUnknownCode() {
        assertThatThrownBy(() -> read(
                "Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly",
                "r,1,1,2,7"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("7");
    }

    @Test
    @DisplayName("Should fail fast on non-numeric feature values")
    void shouldRejectNonNumericFeature() {
        assertThatThrownBy(() -> read(
                "Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly",
                "r,1,full,2,0"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Mixer/Level");
    }

    @Test
    @DisplayName("Should reject NaN feature values with line and column")
    void shouldRejectNanFeature() {
        assertThatThrownBy(() -> read(
                "Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly",
                "r,1,1,NaN,0"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Line 2")
                .hasMessageContaining("Mixer/Temperature")
                .hasMessageContaining("not finite");
    }

    @Test
    @DisplayName("Should reject infinite feature values with line and column")
    void shouldRejectInfiniteFeature() {
        assertThatThrownBy(() -> read(
                "Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly",
                "r,1,1,2,0",
                "r,2,-Infinity,2,0"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Line 3")
                .hasMessageContaining("Mixer/Level")
                .hasMessageContaining("not finite");
    }

    @Test
    @DisplayName("Should reject timestamps that do not increase within a run")
    void shouldRejectNonIncreasingTimestamps() {
        assertThatThrownBy(() -> read(
                "Run id,Timestamp,Mixer/Level,Mixer/Temperature,Anomaly",
                "r,5,1,2,0",
                "r,5,1,2,0"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("does not increase");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("missing.csv")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    private RunStore read(String... lines) throws IOException {
        byte[] bytes = String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
        return reader.read(new ByteArrayInputStream(bytes));
    }
}
