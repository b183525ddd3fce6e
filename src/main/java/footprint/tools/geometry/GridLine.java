package footprint.tools.geometry;

/**
 * One projected graticule line: a meridian (fixed west longitude) or a parallel (fixed latitude).
 * Points the projection cannot resolve are NaN.
 **/
public record GridLine(boolean meridian, double value, double[] x, double[] y) {

    public int size() {
        return x.length;
    }

}
