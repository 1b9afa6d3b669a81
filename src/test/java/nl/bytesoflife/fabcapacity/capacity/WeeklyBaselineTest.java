package nl.bytesoflife.fabcapacity.capacity;

import nl.bytesoflife.fabcapacity.DataException;
import nl.bytesoflife.fabcapacity.FabFixtures;
import nl.bytesoflife.fabcapacity.NumericException;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import nl.bytesoflife.fabcapacity.model.ForecastRecord;
import org.junit.jupiter.api.Test;

import static nl.bytesoflife.fabcapacity.FabFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class WeeklyBaselineTest {

    @Test
    void usesLatestDayAndLatestQuarter() {
        WeeklyBaseline baseline = WeeklyBaseline.from(FabFixtures.riskDataset());

        assertEquals(DAY_2, baseline.capacityDate());
        assertEquals(Q2, baseline.demandQuarter());
        assertEquals(14_000, baseline.capacityWpw(), 1e-9);
        assertEquals(10_000, baseline.demandWpw(), 1e-9);
    }

    @Test
    void missingOperationsIsADataError() {
        FabDataset dataset = new FabDataset()
                .addForecast(new ForecastRecord(Q2, "IoT_7nm", 13_000));
        assertThrows(DataException.class, () -> WeeklyBaseline.from(dataset));
    }

    @Test
    void missingForecastIsADataError() {
        FabDataset dataset = new FabDataset()
                .addOperation(op(DAY_2, "CMP1", "CMP", 500, 24, 0));
        assertThrows(DataException.class, () -> WeeklyBaseline.from(dataset));
    }

    @Test
    void zeroOutputIsANumericError() {
        FabDataset dataset = new FabDataset()
                .addOperation(op(DAY_1, "CMP1", "CMP", 500, 24, 0))
                .addOperation(op(DAY_2, "CMP1", "CMP", 0, 0, 24))
                .addForecast(new ForecastRecord(Q2, "IoT_7nm", 13_000));
        assertThrows(NumericException.class, () -> WeeklyBaseline.from(dataset));
    }
}
