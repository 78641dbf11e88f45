package com.processsentinel.core.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.processsentinel.core.config.PipelineConfig;
import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.FeatureSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads labeled process runs from a CSV file with a header row.
 *
 * <p>
 * Required columns: the run id, the timestamp, the integer anomaly code, and
 * every column of the {@link FeatureSchema}. Other columns are ignored.
 * Timestamps may be numeric or ISO-8601 ({@code Instant} or
 * {@code LocalDateTime}, the latter read as UTC).
 * </p>
 *
 * @since 1.0.0
 */
public final class CsvRunReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRunReader.class);

    private final FeatureSchema schema;
    private final String runIdColumn;
    private final String timestampColumn;
    private final String labelColumn;
    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final CsvMapper mapper = new CsvMapper();

    public CsvRunReader(FeatureSchema schema, String runIdColumn, String timestampColumn,
            String labelColumn) {
        this.schema = Objects.requireNonNull(schema, "Feature schema must not be null");
        this.runIdColumn = Objects.requireNonNull(runIdColumn, "Run id column must not be null");
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "Timestamp column must not be null");
        this.labelColumn = Objects.requireNonNull(labelColumn, "Label column must not be null");
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public static CsvRunReader fromConfig(PipelineConfig config) {
        return new CsvRunReader(config.featureSchema(), config.getRunIdColumn(),
                config.getTimestampColumn(), config.getLabelColumn());
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws DataIntegrityException   if the content violates the schema
     * @throws IllegalStateException    if reading fails
     */
    public RunStore read(Path path) {
        Objects.requireNonNull(path, "CSV path must not be null");
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("CSV file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            RunStore store = read(is);
            LOG.info("Loaded {} from {}", store, path);
            return store;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read CSV file: " + path, e);
        }
    }

    /**
     * Read runs from a CSV stream. The stream is not closed.
     */
    public RunStore read(InputStream in) throws IOException {
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        RunStore.Builder builder = RunStore.builder(schema.size());

        try (MappingIterator<Map<String, String>> it = mapper
                .readerForMapOf(String.class)
                .with(headerSchema)
                .readValues(in)) {

            boolean headerChecked = false;
            long line = 1;
            while (it.hasNext()) {
                Map<String, String> row = it.next();
                line++;
                if (!headerChecked) {
                    requireHeader(row.keySet());
                    headerChecked = true;
                }
                builder.append(
                        requireValue(row, runIdColumn, line),
                        parseTimestamp(requireValue(row, timestampColumn, line), line),
                        parseFeatures(row, line),
                        parseCode(requireValue(row, labelColumn, line), line));
            }
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Parsing helpers
    // ---------------------------------------------------------------

    private void requireHeader(Set<String> header) {
        List<String> required = new ArrayList<>(List.of(runIdColumn, timestampColumn, labelColumn));
        List<String> missing = required.stream().filter(c -> !header.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new DataIntegrityException("Required column(s) absent: " + missing);
        }
        schema.requireColumns(header);
    }

    private static String requireValue(Map<String, String> row, String column, long line) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new DataIntegrityException("Line " + line + ": column '" + column + "' is empty");
        }
        return value;
    }

    private double[] parseFeatures(Map<String, String> row, long line) {
        double[] features = new double[schema.size()];
        for (int i = 0; i < features.length; i++) {
            String column = schema.columnAt(i);
            String raw = requireValue(row, column, line);
            try {
                features[i] = Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw new DataIntegrityException("Line " + line + ": feature '" + column
                        + "' is not numeric: '" + raw + "'", e);
            }
            if (!Double.isFinite(features[i])) {
                throw new DataIntegrityException("Line " + line + ": feature '" + column
                        + "' is not finite: '" + raw + "'");
            }
        }
        return features;
    }

    private static AnomalyCode parseCode(String raw, long line) {
        try {
            double value = Double.parseDouble(raw);
            if (value != Math.rint(value)) {
                throw new DataIntegrityException("Line " + line + ": anomaly code is not an integer: " + raw);
            }
            return AnomalyCode.fromCode((int) value);
        } catch (NumberFormatException e) {
            throw new DataIntegrityException("Line " + line + ": anomaly code is not numeric: '" + raw + "'", e);
        }
    }

    static double parseTimestamp(String raw, long line) {
        if (NUMERIC.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        try {
            return Instant.parse(raw).toEpochMilli();
        } catch (DateTimeParseException instantFailure) {
            try {
                return LocalDateTime.parse(raw.replace(' ', 'T')).toInstant(ZoneOffset.UTC).toEpochMilli();
            } catch (DateTimeParseException e) {
                e.addSuppressed(instantFailure);
                throw new DataIntegrityException("Line " + line + ": unparseable timestamp: '" + raw + "'", e);
            }
        }
    }
}
