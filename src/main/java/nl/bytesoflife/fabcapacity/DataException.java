package nl.bytesoflife.fabcapacity;

/**
 * A required table is missing or empty, a value cannot be read, or a tool type
 * is absent from a lookup that does not allow defaults.
 */
public class DataException extends CapacityPlanningException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
