package footprint.tools.geometry;

public class DegenerateSplitException extends FootprintException {

    public DegenerateSplitException(String side, int vertices) {
        super("The " + side + " part of the antimeridian split has only " + vertices + " vertices");
    }

}
