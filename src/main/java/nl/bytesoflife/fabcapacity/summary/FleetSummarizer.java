package nl.bytesoflife.fabcapacity.summary;

import nl.bytesoflife.fabcapacity.model.CapExProject;
import nl.bytesoflife.fabcapacity.model.EquipmentRecord;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import nl.bytesoflife.fabcapacity.model.OperationRecord;

import java.time.LocalDate;
import java.util.List;

public class FleetSummarizer {

    public FleetSummary summarize(FabDataset dataset) {
        dataset.requireEquipment();
        List<EquipmentRecord> equipment = dataset.getEquipment();
        LocalDate reportDate = dataset.getLatestOperationDate();
        List<OperationRecord> latest = dataset.getOperationsOn(reportDate);
        List<CapExProject> projects = dataset.getProjects();

        return new FleetSummary(
                equipment.size(),
                (int) equipment.stream().filter(EquipmentRecord::isActive).count(),
                equipment.stream().mapToDouble(EquipmentRecord::ageYears).average().orElse(0),
                equipment.stream().mapToDouble(EquipmentRecord::costUsd).sum(),
                reportDate,
                latest.stream().mapToDouble(OperationRecord::oee).average().orElse(0),
                latest.stream().mapToDouble(OperationRecord::utilizationRate).average().orElse(0),
                latest.stream().mapToDouble(OperationRecord::outputWafers).sum(),
                latest.stream().mapToDouble(OperationRecord::cycleTimeHours).average().orElse(0),
                projects.stream().mapToDouble(CapExProject::investmentUsd).sum(),
                projects.stream().mapToDouble(CapExProject::npvUsd).sum(),
                projects.isEmpty() ? null
                        : projects.stream().mapToDouble(CapExProject::irrPercent).average().getAsDouble(),
                (int) projects.stream().filter(CapExProject::isInProgress).count());
    }
}
