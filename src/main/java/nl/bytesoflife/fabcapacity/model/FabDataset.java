package nl.bytesoflife.fabcapacity.model;

import nl.bytesoflife.fabcapacity.DataException;

import java.time.LocalDate;
import java.util.*;

/**
 * The tables of a single planning run. Filled once by the loader and only read
 * by the analyses.
 */
public class FabDataset {

    private final List<EquipmentRecord> equipment = new ArrayList<>();
    private final List<OperationRecord> operations = new ArrayList<>();
    private final List<ForecastRecord> forecast = new ArrayList<>();
    private final List<CapExProject> projects = new ArrayList<>();

    public FabDataset addEquipment(EquipmentRecord record) {
        equipment.add(Objects.requireNonNull(record));
        return this;
    }

    public FabDataset addEquipment(Collection<EquipmentRecord> records) {
        records.forEach(this::addEquipment);
        return this;
    }

    public FabDataset addOperation(OperationRecord record) {
        operations.add(Objects.requireNonNull(record));
        return this;
    }

    public FabDataset addOperations(Collection<OperationRecord> records) {
        records.forEach(this::addOperation);
        return this;
    }

    public FabDataset addForecast(ForecastRecord record) {
        forecast.add(Objects.requireNonNull(record));
        return this;
    }

    public FabDataset addForecasts(Collection<ForecastRecord> records) {
        records.forEach(this::addForecast);
        return this;
    }

    public FabDataset addProject(CapExProject project) {
        projects.add(Objects.requireNonNull(project));
        return this;
    }

    public FabDataset addProjects(Collection<CapExProject> records) {
        records.forEach(this::addProject);
        return this;
    }

    public List<EquipmentRecord> getEquipment() {
        return Collections.unmodifiableList(equipment);
    }

    public List<OperationRecord> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public List<ForecastRecord> getForecast() {
        return Collections.unmodifiableList(forecast);
    }

    public List<CapExProject> getProjects() {
        return Collections.unmodifiableList(projects);
    }

    /**
     * Equipment grouped by tool type, in the order each type first appears.
     */
    public Map<String, List<EquipmentRecord>> getEquipmentByType() {
        Map<String, List<EquipmentRecord>> byType = new LinkedHashMap<>();
        for (EquipmentRecord record : equipment) {
            byType.computeIfAbsent(record.toolType(), k -> new ArrayList<>()).add(record);
        }
        return byType;
    }

    public LocalDate getLatestOperationDate() {
        return operations.stream()
                .map(OperationRecord::date)
                .max(Comparator.naturalOrder())
                .orElseThrow(() -> new DataException("Operations table is empty"));
    }

    public List<OperationRecord> getOperationsOn(LocalDate date) {
        return operations.stream()
                .filter(op -> op.date().equals(date))
                .toList();
    }

    public LocalDate getLatestForecastQuarter() {
        return forecast.stream()
                .map(ForecastRecord::quarter)
                .max(Comparator.naturalOrder())
                .orElseThrow(() -> new DataException("Forecast table is empty"));
    }

    public List<ForecastRecord> getForecastFor(LocalDate quarter) {
        return forecast.stream()
                .filter(f -> f.quarter().equals(quarter))
                .toList();
    }

    public void requireEquipment() {
        if (equipment.isEmpty()) {
            throw new DataException("Equipment table is empty");
        }
    }

    @Override
    public String toString() {
        return "FabDataset{equipment=" + equipment.size()
                + ", operations=" + operations.size()
                + ", forecast=" + forecast.size()
                + ", projects=" + projects.size() + "}";
    }
}
