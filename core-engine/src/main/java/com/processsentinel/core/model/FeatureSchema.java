package com.processsentinel.core.model;

import com.processsentinel.core.error.DataIntegrityException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed, ordered list of named numeric features.
 *
 * <p>
 * The column order defines the layout of every feature vector in the system,
 * so it must be identical for training and inference. The schema is stored in
 * the model artifact for that reason.
 * </p>
 *
 * <h3>Missing fields</h3>
 * <p>
 * At the ingestion boundary ({@link #requireColumns(Collection)}) a missing
 * column is a {@link DataIntegrityException}. At the scoring boundary
 * ({@link #toVector(Map)}) a missing or {@code null} field defaults to
 * {@value #MISSING_VALUE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Value used for a feature that is absent from a scoring request. */
    public static final double MISSING_VALUE = 0.0;

    /** The 54 sensor/actuator columns of the six plant modules. */
    public static final FeatureSchema DEFAULT = FeatureSchema.of(List.of(
            // Mixer
            "Mixer/OpenDumpValve", "Mixer/Level", "Mixer/Temperature", "Mixer/OpenOutlet",
            "Mixer/Fill1On", "Mixer/Fill2On", "Mixer/Fill3On", "Mixer/Fill4On", "Mixer/Fill5On",
            "Mixer/TurnMixerOn", "Mixer/MixerIsOn", "Mixer/InFlowMix", "Mixer/OutFlowMix",
            // Pasteurizer
            "Pasteurizer/OpenDumpValve", "Pasteurizer/Level", "Pasteurizer/OpenOutlet",
            "Pasteurizer/HeaterOn", "Pasteurizer/Temperature", "Pasteurizer/CoolerOn",
            "Pasteurizer/InFlowMix", "Pasteurizer/OutFlowMix",
            // Homogenizer
            "Homogenizer/ParticleSize", "Homogenizer/HomogenizerOn",
            "Homogenizer/Valve1/InFlowMix", "Homogenizer/Valve2/OutFlowMix",
            // AgeingCooling
            "AgeingCooling/OpenDumpValve", "AgeingCooling/Level", "AgeingCooling/Temperature",
            "AgeingCooling/InFlowMix", "AgeingCooling/OpenOutlet", "AgeingCooling/AgeingCoolingOn",
            "AgeingCooling/OutFlowMix",
            // DynamicFreezer
            "DynamicFreezer/OpenDumpValve", "DynamicFreezer/Level", "DynamicFreezer/OpenOutlet",
            "DynamicFreezer/HeaterOn", "DynamicFreezer/Temperature", "DynamicFreezer/SolidFlavoringOn",
            "DynamicFreezer/LiquidFlavoringOn", "DynamicFreezer/FreezerOn", "DynamicFreezer/DasherOn",
            "DynamicFreezer/Overrun", "DynamicFreezer/SendTestValues", "DynamicFreezer/ParticleSize",
            "DynamicFreezer/BarrelRotationSpeed", "DynamicFreezer/PasteurizationUnits",
            "DynamicFreezer/InFlowMix", "DynamicFreezer/OutFlowMix",
            // Hardening
            "Hardening/Packages", "Hardening/OpenDumpValve", "Hardening/Temperature",
            "Hardening/HardeningOn", "Hardening/FinishBatchOn", "Hardening/InFlowMix"));

    private final List<String> columns;
    private final Map<String, Integer> indexByName;

    private FeatureSchema(List<String> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            index.put(columns.get(i), i);
        }
        this.indexByName = Collections.unmodifiableMap(index);
    }

    /**
     * Create a schema from an ordered column list.
     *
     * @param columns column names; must be non-empty, non-blank and unique
     * @return the schema
     * @throws IllegalArgumentException if the list is empty or contains blank
     *                                  or duplicate names
     */
    public static FeatureSchema of(List<String> columns) {
        Objects.requireNonNull(columns, "Feature columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Feature schema must contain at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("Feature column names must not be blank");
            }
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate feature column: '" + column + "'");
            }
        }
        return new FeatureSchema(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public String columnAt(int index) {
        return columns.get(index);
    }

    /**
     * @return the position of {@code column}, or {@code -1} if unknown
     */
    public int indexOf(String column) {
        Integer index = indexByName.get(column);
        return index != null ? index : -1;
    }

    /**
     * Verify that a tabular header contains every schema column.
     *
     * @param header the column names present in the source
     * @throws DataIntegrityException naming every absent column
     */
    public void requireColumns(Collection<String> header) {
        Objects.requireNonNull(header, "Header must not be null");
        Set<String> present = new HashSet<>(header);
        List<String> missing = columns.stream()
                .filter(c -> !present.contains(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new DataIntegrityException("Required feature column(s) absent: " + missing);
        }
    }

    /**
     * Convert a named row into a feature vector in schema order.
     *
     * <p>
     * Keys that are not part of the schema are ignored. Missing keys and
     * {@code null} values become {@value #MISSING_VALUE}. Numbers are used as
     * is and numeric strings are parsed.
     * </p>
     *
     * @param row field name to value
     * @return a new vector of length {@link #size()}
     * @throws DataIntegrityException if a present value is not a finite number
     */
    public double[] toVector(Map<String, ?> row) {
        Objects.requireNonNull(row, "Row must not be null");
        double[] vector = new double[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            Object raw = row.get(column);
            vector[i] = raw == null ? MISSING_VALUE : toDouble(column, raw);
        }
        return vector;
    }

    /**
     * @return the names of schema columns absent from {@code row}
     */
    public List<String> missingFrom(Map<String, ?> row) {
        return columns.stream().filter(c -> row.get(c) == null).toList();
    }

    private static double toDouble(String column, Object raw) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof Boolean b) {
            value = b ? 1.0 : 0.0;
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new DataIntegrityException(
                        "Feature '" + column + "' is not numeric: '" + s + "'", e);
            }
        } else {
            throw new DataIntegrityException(
                    "Feature '" + column + "' has unsupported type " + raw.getClass().getSimpleName());
        }
        if (!Double.isFinite(value)) {
            throw new DataIntegrityException("Feature '" + column + "' is not finite: '" + raw + "'");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureSchema that))
            return false;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSchema{" + columns.size() + " columns}";
    }
}
