package footprint.tools.geometry;

/**
 * Base class of the failures raised while projecting footprints. Undefined projected points are
 * reported as NaN values, never with this hierarchy.
 **/
public class FootprintException extends RuntimeException {

    public FootprintException(String message) {
        super(message);
    }

    public FootprintException(String message, Throwable cause) {
        super(message, cause);
    }

}
