package footprint.tools.projections;

import footprint.tools.geometry.FootprintException;

/**
 * Raised when an iterative solver exhausts its iteration cap
 **/
public class ConvergenceException extends FootprintException {

    public ConvergenceException(String message) {
        super(message);
    }

}
