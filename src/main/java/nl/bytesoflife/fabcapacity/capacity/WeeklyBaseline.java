package nl.bytesoflife.fabcapacity.capacity;

import nl.bytesoflife.fabcapacity.NumericException;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import nl.bytesoflife.fabcapacity.model.ForecastRecord;
import nl.bytesoflife.fabcapacity.model.OperationRecord;

import java.time.LocalDate;

/**
 * Current weekly output and demand of the fab: the latest reported day's output
 * scaled to a week, and the latest forecast quarter spread over its weeks.
 *
 * @param capacityWpw   latest day's total output x 7
 * @param demandWpw     latest quarter's total demand / weeks per quarter
 * @param capacityDate  the operations day the capacity is taken from
 * @param demandQuarter the forecast quarter the demand is taken from
 */
public record WeeklyBaseline(double capacityWpw, double demandWpw,
                             LocalDate capacityDate, LocalDate demandQuarter) {

    public static final int DAYS_PER_WEEK = 7;
    public static final int WEEKS_PER_QUARTER = 13;

    public static WeeklyBaseline from(FabDataset dataset) {
        return from(dataset, WEEKS_PER_QUARTER);
    }

    public static WeeklyBaseline from(FabDataset dataset, int weeksPerQuarter) {
        if (weeksPerQuarter <= 0) {
            throw new IllegalArgumentException("Weeks per quarter must be > 0");
        }
        LocalDate latestDay = dataset.getLatestOperationDate();
        double dailyOutput = dataset.getOperationsOn(latestDay).stream()
                .mapToDouble(OperationRecord::outputWafers)
                .sum();
        double capacity = dailyOutput * DAYS_PER_WEEK;
        NumericException.requirePositive(capacity, "Weekly output on " + latestDay);

        LocalDate latestQuarter = dataset.getLatestForecastQuarter();
        double quarterDemand = dataset.getForecastFor(latestQuarter).stream()
                .mapToDouble(ForecastRecord::demandWafers)
                .sum();

        return new WeeklyBaseline(capacity, quarterDemand / weeksPerQuarter, latestDay, latestQuarter);
    }
}
