package nl.bytesoflife.fabcapacity;

/**
 * A calculation would divide by a zero denominator (effective capacity,
 * theoretical MTBF, operating hours).
 */
public class NumericException extends CapacityPlanningException {

    public NumericException(String message) {
        super(message);
    }

    public static void requirePositive(double value, String what) {
        if (!(value > 0)) {
            throw new NumericException(what + " must be positive but was " + value);
        }
    }
}
