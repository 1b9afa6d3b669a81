package nl.bytesoflife.fabcapacity.model;

import java.time.LocalDate;

/**
 * Forecast demand of one product for one quarter.
 *
 * @param quarter       quarter end date
 * @param product       product name
 * @param demandWafers  demand in wafers for the whole quarter
 */
public record ForecastRecord(LocalDate quarter, String product, double demandWafers) {

    public ForecastRecord {
        if (quarter == null) {
            throw new IllegalArgumentException("Forecast quarter must be set");
        }
        if (demandWafers < 0) {
            throw new IllegalArgumentException("Demand must be >= 0 for " + product + " in " + quarter);
        }
    }
}
