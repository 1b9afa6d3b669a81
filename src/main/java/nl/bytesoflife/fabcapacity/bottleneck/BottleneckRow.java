package nl.bytesoflife.fabcapacity.bottleneck;

/**
 * Constraint analysis of one tool type at a target weekly output.
 *
 * @param toolType                 tool type
 * @param toolCount                number of tools of this type
 * @param totalThroughputWph       summed throughput, wafers per hour
 * @param processSteps             step count used for this type
 * @param processFraction          share of the declared total step count
 * @param effectiveCapacityWpw     effective weekly capacity
 * @param requiredVisitsWpw        weekly visits needed to support the target
 * @param utilizationAtTarget      required / capacity, capped at 1.0
 * @param rawUtilization           required / capacity, uncapped
 * @param maxSupportableOutputWpw  highest weekly output this type alone can sustain
 * @param bottleneck               whether raw utilization exceeds the bottleneck threshold
 * @param constraintSeverity       raw utilization when a bottleneck, otherwise 0
 * @param capacityGapWpw           visits the type cannot serve, never negative
 * @param defaultedSteps           whether the step count came from the table default
 */
public record BottleneckRow(
        String toolType,
        int toolCount,
        double totalThroughputWph,
        int processSteps,
        double processFraction,
        double effectiveCapacityWpw,
        double requiredVisitsWpw,
        double utilizationAtTarget,
        double rawUtilization,
        double maxSupportableOutputWpw,
        boolean bottleneck,
        double constraintSeverity,
        double capacityGapWpw,
        boolean defaultedSteps
) {
}
