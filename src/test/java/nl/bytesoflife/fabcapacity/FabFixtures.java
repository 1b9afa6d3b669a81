package nl.bytesoflife.fabcapacity;

import nl.bytesoflife.fabcapacity.model.*;

import java.time.LocalDate;

/**
 * Compact constructors for test records.
 */
public final class FabFixtures {

    public static final LocalDate DAY_1 = LocalDate.of(2024, 6, 14);
    public static final LocalDate DAY_2 = LocalDate.of(2024, 6, 15);
    public static final LocalDate Q1 = LocalDate.of(2024, 3, 31);
    public static final LocalDate Q2 = LocalDate.of(2024, 6, 30);

    private FabFixtures() {
    }

    public static EquipmentRecord tool(String id, String type, double throughputWph, double utilizationTarget) {
        return tool(id, type, throughputWph, utilizationTarget, 500);
    }

    public static EquipmentRecord tool(String id, String type, double throughputWph, double utilizationTarget,
                                       double mtbfHours) {
        return new EquipmentRecord(id, type, throughputWph, utilizationTarget, mtbfHours,
                EquipmentStatus.ACTIVE, false, 1_000_000, 1.0);
    }

    public static OperationRecord op(LocalDate date, String toolId, String type,
                                     double outputWafers, double operatingHours, double downtimeHours) {
        return new OperationRecord(date, toolId, type, 0.8, 0.95, 0.95, 0.97, 0.95 * 0.95 * 0.97,
                outputWafers, operatingHours, downtimeHours, 6.0);
    }

    public static CapExProject project(String name, double investment, double npv, RiskLevel risk) {
        return new CapExProject("CPX-" + name, name, investment, npv, npv / investment * 100, risk, "Planning");
    }

    /**
     * Two tools on each of two days (latest day: 2 x 1,000 wafers, 14,000 WPW) and
     * two quarters of forecast (latest: 130,000 wafers, 10,000 WPW).
     */
    public static FabDataset riskDataset() {
        return new FabDataset()
                .addEquipment(tool("LIT1", "Lithography_EUV", 120, 0.8))
                .addEquipment(tool("ETC1", "Etch_Plasma", 60, 0.82))
                .addOperation(op(DAY_1, "LIT1", "Lithography_EUV", 1500, 24, 0))
                .addOperation(op(DAY_1, "ETC1", "Etch_Plasma", 1500, 24, 0))
                .addOperation(op(DAY_2, "LIT1", "Lithography_EUV", 1000, 24, 0))
                .addOperation(op(DAY_2, "ETC1", "Etch_Plasma", 1000, 24, 0))
                .addForecast(new ForecastRecord(Q1, "Mobile_SoC_3nm", 10_000))
                .addForecast(new ForecastRecord(Q2, "Mobile_SoC_3nm", 65_000))
                .addForecast(new ForecastRecord(Q2, "HPC_GPU_5nm", 65_000));
    }
}
