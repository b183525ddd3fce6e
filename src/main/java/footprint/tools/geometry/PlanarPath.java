package footprint.tools.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable sequence of projected vertices with their drawing codes. Every polygon of the path is
 * closed. Vertices that the projection could not resolve hold NaN coordinates.
 **/
public class PlanarPath {

    private final double[] x;
    private final double[] y;
    private final PathCode[] codes;

    public PlanarPath(double[] x, double[] y, PathCode[] codes) {

        if (x.length != y.length || x.length != codes.length) {
            throw new IllegalArgumentException("Coordinates and codes must have the same size: "
                    + x.length + ", " + y.length + ", " + codes.length);
        }

        this.x = x.clone();
        this.y = y.clone();
        this.codes = codes.clone();

    }

    /**
     * Builds a single closed polygon from a list of {x, y} vertices
     **/
    public static PlanarPath polygon(List<double[]> vertices) {

        double[] x = new double[vertices.size()];
        double[] y = new double[vertices.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = vertices.get(i)[0];
            y[i] = vertices.get(i)[1];
        }
        return new PlanarPath(x, y, PathCode.polygon(x.length));

    }

    /**
     * Joins several paths in a single multi-polygon path
     **/
    public static PlanarPath concat(List<PlanarPath> paths) {

        if (paths.size() == 1) {
            return paths.get(0);
        }

        int size = 0;
        for (PlanarPath path : paths) {
            size += path.size();
        }

        double[] x = new double[size];
        double[] y = new double[size];
        PathCode[] codes = new PathCode[size];

        int offset = 0;
        for (PlanarPath path : paths) {
            System.arraycopy(path.x, 0, x, offset, path.size());
            System.arraycopy(path.y, 0, y, offset, path.size());
            System.arraycopy(path.codes, 0, codes, offset, path.size());
            offset += path.size();
        }

        return new PlanarPath(x, y, codes);

    }

    /**
     * @return one path per polygon
     **/
    public List<PlanarPath> polygons() {

        List<PlanarPath> polygons = new ArrayList<>();
        for (int[] run : PathCode.runs(codes)) {
            polygons.add(new PlanarPath(
                    Arrays.copyOfRange(x, run[0], run[1]),
                    Arrays.copyOfRange(y, run[0], run[1]),
                    Arrays.copyOfRange(codes, run[0], run[1])));
        }
        return polygons;

    }

    /**
     * Planar area enclosed by the path, summed over its polygons (shoelace formula)
     *
     * @return the area in squared planar units
     **/
    public double area() {

        double area = 0;
        for (int[] run : PathCode.runs(codes)) {
            double sum = 0;
            for (int i = run[0]; i < run[1] - 1; i++) {
                sum += x[i] * y[i + 1] - x[i + 1] * y[i];
            }
            area += Math.abs(sum) / 2;
        }
        return area;

    }

    /**
     * Checks whether a point lies inside any polygon of the path, even-odd rule
     *
     * @param px the point x coordinate
     * @param py the point y coordinate
     * @return true if the point is inside
     **/
    public boolean contains(double px, double py) {

        for (int[] run : PathCode.runs(codes)) {

            boolean odd = false;

            // Closing vertex repeats the first one, the edge from the last to the first is implicit
            for (int i = run[0], j = run[1] - 2; i < run[1] - 1; i++) {
                if (((y[i] > py) != (y[j] > py))
                        && (px < (x[j] - x[i]) * (py - y[i]) / (y[j] - y[i]) + x[i])) {
                    odd = !odd;
                }
                j = i;
            }

            if (odd) {
                return true;
            }

        }
        return false;

    }

    /**
     * @return true if no vertex holds a NaN coordinate
     **/
    public boolean isDefined() {
        for (int i = 0; i < x.length; i++) {
            if (Double.isNaN(x[i]) || Double.isNaN(y[i])) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return x.length;
    }

    public double getX(int i) {
        return x[i];
    }

    public double getY(int i) {
        return y[i];
    }

    public PathCode getCode(int i) {
        return codes[i];
    }

    public double[] getX() {
        return x.clone();
    }

    public double[] getY() {
        return y.clone();
    }

    public PathCode[] getCodes() {
        return codes.clone();
    }

    public List<double[]> getVertices() {
        List<double[]> vertices = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            vertices.add(new double[]{x[i], y[i]});
        }
        return vertices;
    }

    @Override
    public String toString() {
        return "PlanarPath{vertices=" + x.length + ", polygons=" + PathCode.runs(codes).size() + "}";
    }

}
