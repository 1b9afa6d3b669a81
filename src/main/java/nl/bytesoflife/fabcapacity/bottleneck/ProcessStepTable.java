package nl.bytesoflife.fabcapacity.bottleneck;

import nl.bytesoflife.fabcapacity.DataException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * How many times a wafer visits each tool type on its way through the line.
 * <p>
 * Visits per wafer are {@code steps / normalizationDivisor}. Tool types missing
 * from the table get {@link #getDefaultSteps()} when one is configured; a strict
 * table (no default) rejects them.
 */
public class ProcessStepTable {

    public static final double DEFAULT_NORMALIZATION_DIVISOR = 10.0;

    private final Map<String, Integer> steps;
    private final Integer defaultSteps;
    private final double normalizationDivisor;
    private final int totalSteps;

    public ProcessStepTable(Map<String, Integer> steps, Integer defaultSteps, double normalizationDivisor) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Process step table must have at least one tool type");
        }
        if (!(normalizationDivisor > 0)) {
            throw new IllegalArgumentException("Normalization divisor must be > 0");
        }
        if (defaultSteps != null && defaultSteps <= 0) {
            throw new IllegalArgumentException("Default step count must be > 0");
        }
        int total = 0;
        for (Map.Entry<String, Integer> entry : steps.entrySet()) {
            if (entry.getValue() == null || entry.getValue() <= 0) {
                throw new IllegalArgumentException("Step count for " + entry.getKey() + " must be > 0");
            }
            total += entry.getValue();
        }
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        this.defaultSteps = defaultSteps;
        this.normalizationDivisor = normalizationDivisor;
        this.totalSteps = total;
    }

    public static ProcessStepTable strict(Map<String, Integer> steps) {
        return new ProcessStepTable(steps, null, DEFAULT_NORMALIZATION_DIVISOR);
    }

    public ProcessStepTable withDefaultSteps(int defaultSteps) {
        return new ProcessStepTable(steps, defaultSteps, normalizationDivisor);
    }

    public ProcessStepTable withNormalizationDivisor(double divisor) {
        return new ProcessStepTable(steps, defaultSteps, divisor);
    }

    public Map<String, Integer> getSteps() {
        return steps;
    }

    public Integer getDefaultSteps() {
        return defaultSteps;
    }

    public double getNormalizationDivisor() {
        return normalizationDivisor;
    }

    /**
     * Sum of the declared step counts. Defaulted tool types are not part of it.
     */
    public int getTotalSteps() {
        return totalSteps;
    }

    public boolean contains(String toolType) {
        return steps.containsKey(toolType);
    }

    public OptionalInt lookup(String toolType) {
        Integer declared = steps.get(toolType);
        return declared != null ? OptionalInt.of(declared) : OptionalInt.empty();
    }

    /**
     * Step count for a tool type, falling back to the default.
     *
     * @throws DataException if the type is unknown and the table is strict
     */
    public int stepsFor(String toolType) {
        Integer declared = steps.get(toolType);
        if (declared != null) return declared;
        if (defaultSteps != null) return defaultSteps;
        throw new DataException("Tool type '" + toolType + "' has no process step count");
    }

    public double visitsPerWafer(String toolType) {
        return stepsFor(toolType) / normalizationDivisor;
    }

    @Override
    public String toString() {
        return "ProcessStepTable{types=" + steps.size() + ", totalSteps=" + totalSteps
                + ", defaultSteps=" + defaultSteps + ", divisor=" + normalizationDivisor + "}";
    }
}
