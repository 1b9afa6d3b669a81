package nl.bytesoflife.fabcapacity.parser;

import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import nl.bytesoflife.fabcapacity.DataException;
import nl.bytesoflife.fabcapacity.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads the fab's CSV exports into a {@link FabDataset}. Columns are matched by
 * header name; unknown columns are ignored.
 */
public class FabCsvParser {

    private static final Logger log = LoggerFactory.getLogger(FabCsvParser.class);

    public static final String EQUIPMENT_FILE = "equipment_master.csv";
    public static final String OPERATIONS_FILE = "fab_operations.csv";
    public static final String FORECAST_FILE = "demand_forecast.csv";
    public static final String CAPEX_FILE = "capex_projects.csv";

    /**
     * Loads the four standard exports from a directory. The CapEx file is optional.
     */
    public FabDataset loadDirectory(Path directory) throws IOException {
        FabDataset dataset = new FabDataset()
                .addEquipment(parseEquipment(directory.resolve(EQUIPMENT_FILE)))
                .addOperations(parseOperations(directory.resolve(OPERATIONS_FILE)))
                .addForecasts(parseForecast(directory.resolve(FORECAST_FILE)));
        Path capex = directory.resolve(CAPEX_FILE);
        if (Files.exists(capex)) {
            dataset.addProjects(parseProjects(capex));
        }
        log.info("Loaded {} from {}", dataset, directory);
        return dataset;
    }

    public List<EquipmentRecord> parseEquipment(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseEquipment(reader, file.getFileName().toString());
        }
    }

    public List<EquipmentRecord> parseEquipment(Reader reader, String source) throws IOException {
        return read(reader, source, row -> new EquipmentRecord(
                row.text("tool_id"),
                row.text("tool_type"),
                row.number("throughput_wph"),
                row.number("utilization_target"),
                row.number("mtbf_hours"),
                EquipmentStatus.fromName(row.text("status")),
                row.bool("is_critical"),
                row.optionalNumber("cost_usd"),
                row.optionalNumber("age_years")));
    }

    public List<OperationRecord> parseOperations(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseOperations(reader, file.getFileName().toString());
        }
    }

    public List<OperationRecord> parseOperations(Reader reader, String source) throws IOException {
        return read(reader, source, row -> new OperationRecord(
                row.date("date"),
                row.text("tool_id"),
                row.text("tool_type"),
                row.number("utilization_rate"),
                row.number("availability"),
                row.number("performance_efficiency"),
                row.number("quality_rate"),
                row.number("oee"),
                row.number("output_wafers"),
                row.number("operating_hours"),
                row.number("unplanned_downtime_hours"),
                row.optionalNumber("cycle_time_hours")));
    }

    public List<ForecastRecord> parseForecast(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseForecast(reader, file.getFileName().toString());
        }
    }

    public List<ForecastRecord> parseForecast(Reader reader, String source) throws IOException {
        return read(reader, source, row -> new ForecastRecord(
                row.date("quarter"),
                row.text("product"),
                row.number("demand_wafers")));
    }

    public List<CapExProject> parseProjects(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseProjects(reader, file.getFileName().toString());
        }
    }

    public List<CapExProject> parseProjects(Reader reader, String source) throws IOException {
        return read(reader, source, row -> new CapExProject(
                row.text("project_id"),
                row.text("project_name"),
                row.number("investment_usd"),
                row.number("npv_usd"),
                row.number("irr_percent"),
                RiskLevel.fromName(row.text("risk_level")),
                row.text("status")));
    }

    private <T> List<T> read(Reader reader, String source, Function<CsvRow, T> mapper) throws IOException {
        List<T> records = new ArrayList<>();
        try (CSVReaderHeaderAware csv = new CSVReaderHeaderAware(reader)) {
            Map<String, String> values;
            while ((values = csv.readMap()) != null) {
                CsvRow row = new CsvRow(values);
                try {
                    records.add(mapper.apply(row));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    throw new DataException(source + " line " + csv.getLinesRead() + ": " + e.getMessage(), e);
                }
            }
        } catch (CsvValidationException e) {
            throw new DataException(source + ": malformed CSV: " + e.getMessage(), e);
        }
        log.debug("Read {} records from {}", records.size(), source);
        return records;
    }

    /**
     * One CSV row, keyed by header.
     */
    private static class CsvRow {
        private final Map<String, String> values;

        CsvRow(Map<String, String> values) {
            this.values = values;
        }

        String text(String column) {
            String value = values.get(column);
            if (value == null) {
                throw new IllegalArgumentException("missing column '" + column + "'");
            }
            return value.trim();
        }

        double number(String column) {
            String value = text(column);
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("column '" + column + "' is not a number: '" + value + "'");
            }
        }

        double optionalNumber(String column) {
            String value = values.get(column);
            return value == null || value.isBlank() ? 0.0 : number(column);
        }

        boolean bool(String column) {
            String value = text(column).toLowerCase();
            return value.equals("true") || value.equals("1") || value.equals("yes");
        }

        // "2024-06-30" or "2024-06-30 00:00:00"
        LocalDate date(String column) {
            String value = text(column);
            if (value.length() > 10 && (value.charAt(10) == ' ' || value.charAt(10) == 'T')) {
                value = value.substring(0, 10);
            }
            return LocalDate.parse(value);
        }
    }
}
