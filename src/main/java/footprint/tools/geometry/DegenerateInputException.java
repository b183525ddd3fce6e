package footprint.tools.geometry;

/**
 * Raised when two great-circle anchors do not define a unique circle: identical, antipodal or on the
 * same meridian when a latitude is requested.
 **/
public class DegenerateInputException extends FootprintException {

    public DegenerateInputException(String message) {
        super(message);
    }

}
