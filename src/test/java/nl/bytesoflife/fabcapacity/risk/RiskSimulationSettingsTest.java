package nl.bytesoflife.fabcapacity.risk;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskSimulationSettingsTest {

    @Test
    void defaultsMatchTheStandardRiskModel() {
        RiskSimulationSettings settings = RiskSimulationSettings.defaults();

        assertEquals(0.15, settings.demandVolatility());
        assertEquals(0.92, settings.yieldMean());
        assertEquals(0.05, settings.yieldStdDev());
        assertEquals(9, settings.availabilityAlpha());
        assertEquals(1, settings.availabilityBeta());
        assertEquals(0.15, settings.cycleTimeSigma());
        assertEquals(13, settings.weeksPerQuarter());
    }

    @Test
    void yieldIsClamped() {
        RiskSimulationSettings settings = RiskSimulationSettings.defaults();

        assertEquals(0.75, settings.clampYield(0.5));
        assertEquals(0.98, settings.clampYield(1.2));
        assertEquals(0.9, settings.clampYield(0.9));
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> RiskSimulationSettings.defaults().withDemandVolatility(0));
        assertThrows(IllegalArgumentException.class,
                () -> new RiskSimulationSettings(0.15, 0.92, 0.05, 0.99, 0.75, 9, 1, 0.15, 13));
        assertThrows(IllegalArgumentException.class,
                () -> new RiskSimulationSettings(0.15, 0.92, 0.05, 0.75, 0.98, 0, 1, 0.15, 13));
    }
}
