package footprint.tools.geometry;

/**
 * Raised when a projected path jumps across the map discontinuity more than twice
 **/
public class TopologyException extends FootprintException {

    private final int crossings;

    public TopologyException(int crossings) {
        super("Path crosses the map discontinuity " + crossings + " times, at most 2 are supported");
        this.crossings = crossings;
    }

    public int getCrossings() {
        return crossings;
    }

}
