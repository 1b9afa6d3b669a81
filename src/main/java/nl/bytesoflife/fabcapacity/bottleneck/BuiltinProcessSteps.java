package nl.bytesoflife.fabcapacity.bottleneck;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for built-in process step tables.
 */
public class BuiltinProcessSteps {

    public static final int DEFAULT_STEPS = 50;

    private static volatile ProcessStepTable cachedSemiconductorFab;

    /**
     * Step counts of a leading-edge logic flow, ten tool types, 390 steps in
     * total. Unknown tool types count as {@value #DEFAULT_STEPS} steps.
     */
    public static ProcessStepTable semiconductorFab() {
        if (cachedSemiconductorFab == null) {
            synchronized (BuiltinProcessSteps.class) {
                if (cachedSemiconductorFab == null) {
                    cachedSemiconductorFab = createSemiconductorFab();
                }
            }
        }
        return cachedSemiconductorFab;
    }

    private static ProcessStepTable createSemiconductorFab() {
        Map<String, Integer> steps = new LinkedHashMap<>();
        steps.put("Lithography_EUV", 25);
        steps.put("Lithography_DUV", 40);
        steps.put("Etch_Plasma", 65);
        steps.put("Deposition_CVD", 45);
        steps.put("Deposition_PVD", 20);
        steps.put("CMP", 25);
        steps.put("Metrology_SEM", 80);
        steps.put("Metrology_Optical", 40);
        steps.put("Ion_Implant", 15);
        steps.put("Wet_Process", 35);
        return new ProcessStepTable(steps, DEFAULT_STEPS, ProcessStepTable.DEFAULT_NORMALIZATION_DIVISOR);
    }
}
