package nl.bytesoflife.fabcapacity.capacity;

/**
 * Installed capacity of one tool type.
 *
 * @param toolType                   tool type
 * @param toolCount                  number of tools of this type
 * @param totalThroughputWph         summed throughput of all tools, wafers per hour
 * @param meanUtilizationTarget      mean utilization target of the tools
 * @param effectiveCapacityWpw       throughput x 168 h x mean utilization target
 */
public record CapacityRow(
        String toolType,
        int toolCount,
        double totalThroughputWph,
        double meanUtilizationTarget,
        double effectiveCapacityWpw
) {
}
