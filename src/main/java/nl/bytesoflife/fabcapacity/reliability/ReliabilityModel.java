package nl.bytesoflife.fabcapacity.reliability;

import nl.bytesoflife.fabcapacity.NumericException;
import nl.bytesoflife.fabcapacity.model.EquipmentRecord;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import nl.bytesoflife.fabcapacity.model.OperationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * MTBF and availability impact per tool type.
 * <p>
 * Tool types without any recorded unplanned downtime are left out of the result:
 * no recorded failures is not evidence of perfect reliability.
 */
public class ReliabilityModel {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityModel.class);

    private final FabDataset dataset;

    public ReliabilityModel(FabDataset dataset) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset must not be null");
        }
        this.dataset = dataset;
    }

    /**
     * @return one row per tool type with failures, worst availability impact first
     */
    public List<ReliabilityRow> computeReliability() {
        dataset.requireEquipment();

        List<ReliabilityRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<EquipmentRecord>> entry : dataset.getEquipmentByType().entrySet()) {
            String toolType = entry.getKey();
            List<OperationRecord> operations = dataset.getOperations().stream()
                    .filter(op -> op.toolType().equals(toolType))
                    .toList();
            List<OperationRecord> failures = operations.stream()
                    .filter(OperationRecord::hasUnplannedDowntime)
                    .toList();
            if (failures.isEmpty()) {
                log.debug("No unplanned downtime recorded for {}, omitted", toolType);
                continue;
            }
            rows.add(analyzeType(toolType, entry.getValue().get(0), operations, failures));
        }

        rows.sort(Comparator.comparingDouble(ReliabilityRow::availabilityImpactPct).reversed());
        log.info("Reliability analysis covered {} of {} tool types", rows.size(), dataset.getEquipmentByType().size());
        return rows;
    }

    private ReliabilityRow analyzeType(String toolType, EquipmentRecord firstTool,
                                       List<OperationRecord> operations, List<OperationRecord> failures) {
        int failureCount = failures.size();
        double totalDowntime = failures.stream().mapToDouble(OperationRecord::unplannedDowntimeHours).sum();
        double operatingHours = operations.stream().mapToDouble(OperationRecord::operatingHours).sum();
        double theoreticalMtbf = firstTool.mtbfHours();

        NumericException.requirePositive(operatingHours, "Operating hours of " + toolType);
        NumericException.requirePositive(theoreticalMtbf, "Theoretical MTBF of " + toolType);

        double actualMtbf = operatingHours / failureCount;
        return new ReliabilityRow(
                toolType,
                failureCount,
                totalDowntime,
                totalDowntime / failureCount,
                actualMtbf,
                theoreticalMtbf,
                actualMtbf / theoreticalMtbf * 100,
                totalDowntime / operatingHours * 100);
    }
}
