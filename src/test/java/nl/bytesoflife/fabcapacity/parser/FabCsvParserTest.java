package nl.bytesoflife.fabcapacity.parser;

import nl.bytesoflife.fabcapacity.DataException;
import nl.bytesoflife.fabcapacity.model.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FabCsvParserTest {

    private static final Path FIXTURES = Path.of("src/test/resources/fixtures");

    private final FabCsvParser parser = new FabCsvParser();

    @Test
    void loadsAllExportsFromDirectory() throws IOException {
        FabDataset dataset = parser.loadDirectory(FIXTURES);

        assertEquals(5, dataset.getEquipment().size());
        assertEquals(10, dataset.getOperations().size());
        assertEquals(4, dataset.getForecast().size());
        assertEquals(4, dataset.getProjects().size());
        assertEquals(LocalDate.of(2024, 6, 15), dataset.getLatestOperationDate());
        assertEquals(LocalDate.of(2024, 6, 30), dataset.getLatestForecastQuarter());
    }

    @Test
    void readsEquipmentColumnsByHeader() throws IOException {
        List<EquipmentRecord> equipment = parser.parseEquipment(FIXTURES.resolve(FabCsvParser.EQUIPMENT_FILE));

        EquipmentRecord second = equipment.get(1);
        assertEquals("LIT1001", second.toolId());
        assertEquals("Lithography_EUV", second.toolType());
        assertEquals(120, second.throughputWph());
        assertEquals(0.8, second.utilizationTarget());
        assertEquals(500, second.mtbfHours());
        assertEquals(EquipmentStatus.MAINTENANCE, second.status());
        assertTrue(second.critical());
        assertEquals(180_000_000, second.costUsd());
        assertEquals(1.8, second.ageYears());

        assertFalse(equipment.get(4).critical());
    }

    @Test
    void readsOperationsWithDateTimeStamps() throws IOException {
        List<OperationRecord> operations = parser.parseOperations(FIXTURES.resolve(FabCsvParser.OPERATIONS_FILE));

        OperationRecord failure = operations.get(1);
        assertEquals(LocalDate.of(2024, 6, 14), failure.date());
        assertEquals(1_500, failure.outputWafers());
        assertEquals(4.0, failure.unplannedDowntimeHours());
        assertEquals(20.0, failure.operatingHours());
        assertEquals(20.0, failure.cycleTimeHours());
        assertTrue(failure.hasUnplannedDowntime());
    }

    @Test
    void readsProjectsWithRiskLevels() throws IOException {
        List<CapExProject> projects = parser.parseProjects(FIXTURES.resolve(FabCsvParser.CAPEX_FILE));

        assertEquals(RiskLevel.MEDIUM, projects.get(0).riskLevel());
        assertEquals(RiskLevel.HIGH, projects.get(3).riskLevel());
        assertTrue(projects.get(0).isInProgress());
        assertEquals(-35_000_000.5, projects.get(1).npvUsd());
    }

    @Test
    void plainIsoDatesAreAccepted() throws IOException {
        List<ForecastRecord> forecast = parser.parseForecast(new StringReader("""
                quarter,product,demand_wafers
                2025-03-31,IoT_7nm,15000
                """), "inline");

        assertEquals(1, forecast.size());
        assertEquals(LocalDate.of(2025, 3, 31), forecast.get(0).quarter());
        assertEquals(15_000, forecast.get(0).demandWafers());
    }

    @Test
    void missingColumnNamesSourceAndLine() {
        DataException e = assertThrows(DataException.class, () -> parser.parseForecast(new StringReader("""
                quarter,product
                2025-03-31,IoT_7nm
                """), "demand_forecast.csv"));

        assertTrue(e.getMessage().contains("demand_forecast.csv"));
        assertTrue(e.getMessage().contains("demand_wafers"));
    }

    @Test
    void unparseableNumberIsADataError() {
        assertThrows(DataException.class, () -> parser.parseForecast(new StringReader("""
                quarter,product,demand_wafers
                2025-03-31,IoT_7nm,lots
                """), "inline"));
    }

    @Test
    void unknownRiskLevelIsADataError() {
        assertThrows(DataException.class, () -> parser.parseProjects(new StringReader("""
                project_id,project_name,investment_usd,npv_usd,irr_percent,risk_level,status
                CPX1,Mystery,100,10,10,Extreme,Planning
                """), "inline"));
    }

    @Test
    void invalidDateIsADataError() {
        assertThrows(DataException.class, () -> parser.parseForecast(new StringReader("""
                quarter,product,demand_wafers
                Q1-2025,IoT_7nm,15000
                """), "inline"));
    }
}
