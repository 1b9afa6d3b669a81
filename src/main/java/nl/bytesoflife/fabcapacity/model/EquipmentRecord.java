package nl.bytesoflife.fabcapacity.model;

/**
 * One physical tool in the fleet.
 *
 * @param toolId            unique tool identifier (e.g. "LIT1000")
 * @param toolType          tool type, the aggregation key of every analysis
 * @param throughputWph     installed throughput in wafers per hour
 * @param utilizationTarget planned utilization, 0..1
 * @param mtbfHours         vendor-specified mean time between failures
 * @param status            operational status
 * @param critical          whether the tool is on the critical path
 * @param costUsd           purchase cost
 * @param ageYears          age since installation
 */
public record EquipmentRecord(
        String toolId,
        String toolType,
        double throughputWph,
        double utilizationTarget,
        double mtbfHours,
        EquipmentStatus status,
        boolean critical,
        double costUsd,
        double ageYears
) {
    public EquipmentRecord {
        if (toolId == null || toolId.isBlank()) {
            throw new IllegalArgumentException("Tool id must not be blank");
        }
        if (toolType == null || toolType.isBlank()) {
            throw new IllegalArgumentException("Tool type must not be blank for " + toolId);
        }
        if (throughputWph < 0) {
            throw new IllegalArgumentException("Throughput must be >= 0 for " + toolId);
        }
        if (utilizationTarget < 0 || utilizationTarget > 1) {
            throw new IllegalArgumentException("Utilization target must be within [0, 1] for " + toolId);
        }
        if (status == null) {
            throw new IllegalArgumentException("Status must be set for " + toolId);
        }
    }

    public boolean isActive() {
        return status == EquipmentStatus.ACTIVE;
    }
}
