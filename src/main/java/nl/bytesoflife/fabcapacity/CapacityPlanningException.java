package nl.bytesoflife.fabcapacity;

/**
 * Base class for failures raised by the planning analyses. These are never
 * coerced into zero or NaN results.
 */
public class CapacityPlanningException extends RuntimeException {

    public CapacityPlanningException(String message) {
        super(message);
    }

    public CapacityPlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
