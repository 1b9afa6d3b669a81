package nl.bytesoflife.fabcapacity.bottleneck;

import nl.bytesoflife.fabcapacity.DataException;
import nl.bytesoflife.fabcapacity.NumericException;
import nl.bytesoflife.fabcapacity.capacity.CapacityRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Theory-of-Constraints ranking of tool types. For a target weekly output each
 * tool type must serve {@code target x visitsPerWafer} visits; dividing by its
 * effective capacity gives its utilization at target. The first row of the result
 * is the binding constraint.
 *
 * <pre>
 * List&lt;BottleneckRow&gt; rows = new BottleneckAnalyzer()
 *     .withProcessSteps(BuiltinProcessSteps.semiconductorFab())
 *     .analyze(capacityRows, 18_000);
 * </pre>
 */
public class BottleneckAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BottleneckAnalyzer.class);

    public static final double BOTTLENECK_THRESHOLD = 0.90;

    private static final Comparator<BottleneckRow> BINDING_FIRST =
            Comparator.comparingDouble(BottleneckRow::utilizationAtTarget)
                    .thenComparingDouble(BottleneckRow::rawUtilization)
                    .reversed();

    private ProcessStepTable processSteps = BuiltinProcessSteps.semiconductorFab();

    public BottleneckAnalyzer withProcessSteps(ProcessStepTable processSteps) {
        if (processSteps == null) {
            throw new IllegalArgumentException("Process step table must not be null");
        }
        this.processSteps = processSteps;
        return this;
    }

    public ProcessStepTable getProcessSteps() {
        return processSteps;
    }

    public List<BottleneckRow> analyze(List<CapacityRow> capacity, double targetOutputWpw) {
        if (!(targetOutputWpw > 0)) {
            throw new IllegalArgumentException("Target output must be > 0 wafers/week but was " + targetOutputWpw);
        }
        if (capacity == null || capacity.isEmpty()) {
            throw new DataException("No capacity rows to analyze; equipment table is empty");
        }

        List<BottleneckRow> rows = new ArrayList<>(capacity.size());
        for (CapacityRow row : capacity) {
            rows.add(analyzeType(row, targetOutputWpw));
        }
        rows.sort(BINDING_FIRST);

        BottleneckRow binding = rows.get(0);
        log.info("Bottleneck analysis at {} WPW: binding constraint {} at {} utilization ({} bottleneck types)",
                targetOutputWpw, binding.toolType(), binding.rawUtilization(),
                rows.stream().filter(BottleneckRow::bottleneck).count());
        return rows;
    }

    private BottleneckRow analyzeType(CapacityRow row, double targetOutputWpw) {
        String toolType = row.toolType();
        boolean defaulted = !processSteps.contains(toolType);
        int steps = processSteps.stepsFor(toolType);
        if (defaulted) {
            log.warn("Tool type {} is not in the process step table, using default of {} steps", toolType, steps);
        }

        double capacityWpw = row.effectiveCapacityWpw();
        NumericException.requirePositive(capacityWpw, "Effective capacity of " + toolType);

        double visitsPerWafer = steps / processSteps.getNormalizationDivisor();
        double requiredVisits = targetOutputWpw * visitsPerWafer;
        double rawUtilization = requiredVisits / capacityWpw;
        boolean bottleneck = rawUtilization > BOTTLENECK_THRESHOLD;

        log.debug("{}: {} steps, {} visits needed, {} capacity, raw utilization {}",
                toolType, steps, requiredVisits, capacityWpw, rawUtilization);

        return new BottleneckRow(
                toolType,
                row.toolCount(),
                row.totalThroughputWph(),
                steps,
                (double) steps / processSteps.getTotalSteps(),
                capacityWpw,
                requiredVisits,
                Math.min(rawUtilization, 1.0),
                rawUtilization,
                capacityWpw / visitsPerWafer,
                bottleneck,
                bottleneck ? rawUtilization : 0.0,
                Math.max(0.0, requiredVisits - capacityWpw),
                defaulted);
    }
}
