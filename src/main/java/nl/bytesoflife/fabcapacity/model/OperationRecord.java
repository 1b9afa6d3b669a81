package nl.bytesoflife.fabcapacity.model;

import java.time.LocalDate;

/**
 * Daily operating telemetry of a single tool.
 *
 * @param date                   reporting day
 * @param toolId                 tool identifier
 * @param toolType               tool type
 * @param utilizationRate        achieved utilization, 0..1
 * @param availability           OEE availability component
 * @param performanceEfficiency  OEE performance component
 * @param qualityRate            OEE quality component
 * @param oee                    availability x performance x quality
 * @param outputWafers           wafers processed that day
 * @param operatingHours         hours the tool ran that day
 * @param unplannedDowntimeHours unplanned downtime, 0 when the tool did not fail
 * @param cycleTimeHours         average cycle time of the day's lots
 */
public record OperationRecord(
        LocalDate date,
        String toolId,
        String toolType,
        double utilizationRate,
        double availability,
        double performanceEfficiency,
        double qualityRate,
        double oee,
        double outputWafers,
        double operatingHours,
        double unplannedDowntimeHours,
        double cycleTimeHours
) {
    public OperationRecord {
        if (date == null) {
            throw new IllegalArgumentException("Operation date must be set");
        }
        if (toolType == null || toolType.isBlank()) {
            throw new IllegalArgumentException("Tool type must not be blank for " + toolId + " on " + date);
        }
        if (outputWafers < 0 || operatingHours < 0 || unplannedDowntimeHours < 0) {
            throw new IllegalArgumentException("Output, operating hours and downtime must be >= 0 for "
                    + toolId + " on " + date);
        }
    }

    public boolean hasUnplannedDowntime() {
        return unplannedDowntimeHours > 0;
    }
}
