package footprint.tools.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable sequence of geographic vertices (west longitude, latitude, in degrees) with their
 * drawing codes and an optional altitude above the surface, in km. A path may hold several polygons
 * back to back, each one starting with a {@link PathCode#MOVE} code.
 **/
public class GeoPath {

    private final double[] lonW;
    private final double[] lat;
    private final double[] alt;
    private final PathCode[] codes;

    /**
     * Builds a path from {lonW, lat} or {lonW, lat, alt} vertices, codes default to MOVE, LINE...
     *
     * @param vertices the list of vertices
     **/
    public GeoPath(List<double[]> vertices) {
        this(vertices, null);
    }

    public GeoPath(List<double[]> vertices, List<PathCode> codes) {
        this(column(vertices, 0), column(vertices, 1), altitudes(vertices),
                codes == null ? null : codes.toArray(new PathCode[0]));
    }

    /**
     * @param lonW  west longitudes in degrees
     * @param lat   latitudes in degrees
     * @param alt   altitudes in km, may be null
     * @param codes drawing codes, may be null
     **/
    public GeoPath(double[] lonW, double[] lat, double[] alt, PathCode[] codes) {

        if (lonW.length != lat.length) {
            throw new IllegalArgumentException("Longitude and latitude arrays must have the same size: "
                    + lonW.length + " != " + lat.length);
        }
        if (lonW.length < 3) {
            throw new IllegalArgumentException("A path needs at least 3 vertices, got " + lonW.length);
        }
        if (alt != null && alt.length != lonW.length) {
            throw new IllegalArgumentException("Altitude array must match the vertices: "
                    + alt.length + " != " + lonW.length);
        }

        PathCode[] c = codes == null ? defaultCodes(lonW.length) : codes.clone();
        if (c.length != lonW.length) {
            throw new IllegalArgumentException("Codes must match the vertices: " + c.length + " != " + lonW.length);
        }
        if (c[0] != PathCode.MOVE) {
            throw new IllegalArgumentException("A path must start with a MOVE code");
        }

        this.lonW = lonW.clone();
        this.lat = lat.clone();
        this.alt = alt == null ? null : alt.clone();
        this.codes = c;

    }

    private static PathCode[] defaultCodes(int size) {
        PathCode[] codes = new PathCode[size];
        Arrays.fill(codes, PathCode.LINE);
        codes[0] = PathCode.MOVE;
        return codes;
    }

    private static double[] column(List<double[]> vertices, int index) {
        double[] values = new double[vertices.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vertices.get(i)[index];
        }
        return values;
    }

    private static double[] altitudes(List<double[]> vertices) {

        if (vertices.isEmpty() || vertices.get(0).length < 3) {
            return null;
        }
        for (double[] vertex : vertices) {
            if (vertex.length < 3) {
                throw new IllegalArgumentException("Either all or none of the vertices must carry an altitude");
            }
        }
        return column(vertices, 2);

    }

    /**
     * Closes every polygon of the path: the first vertex is repeated at the end of each run when
     * missing, and the last code of each run becomes {@link PathCode#CLOSE}.
     *
     * @return the closed path
     **/
    public GeoPath closed() {

        List<Double> lons = new ArrayList<>();
        List<Double> lats = new ArrayList<>();
        List<Double> alts = new ArrayList<>();
        List<PathCode> c = new ArrayList<>();

        for (int[] run : PathCode.runs(codes)) {

            int first = run[0];
            int last = run[1] - 1;
            int start = c.size();

            for (int i = first; i <= last; i++) {
                lons.add(lonW[i]);
                lats.add(lat[i]);
                alts.add(getAlt(i));
                c.add(codes[i]);
            }

            if (sameVertex(first, last) && last > first) {
                c.set(c.size() - 1, PathCode.CLOSE);
            } else {
                if (c.get(c.size() - 1) == PathCode.CLOSE) {
                    c.set(c.size() - 1, PathCode.LINE);
                }
                lons.add(lonW[first]);
                lats.add(lat[first]);
                alts.add(getAlt(first));
                c.add(PathCode.CLOSE);
            }

            if (c.size() - start < 4) {
                throw new IllegalArgumentException("A closed polygon needs at least 4 vertices, got " + (c.size() - start));
            }

        }

        return new GeoPath(unbox(lons), unbox(lats), alt == null ? null : unbox(alts), c.toArray(new PathCode[0]));

    }

    private boolean sameVertex(int i, int j) {
        return lat[i] == lat[j] && (Math.abs(lat[i]) == 90 || ((lonW[i] - lonW[j]) % 360) == 0);
    }

    private static double[] unbox(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    /**
     * @return one path per polygon of this path
     **/
    public List<GeoPath> runs() {

        List<GeoPath> paths = new ArrayList<>();
        for (int[] run : PathCode.runs(codes)) {
            paths.add(new GeoPath(
                    Arrays.copyOfRange(lonW, run[0], run[1]),
                    Arrays.copyOfRange(lat, run[0], run[1]),
                    alt == null ? null : Arrays.copyOfRange(alt, run[0], run[1]),
                    Arrays.copyOfRange(codes, run[0], run[1])));
        }
        return paths;

    }

    /**
     * Spherical area enclosed by the path
     *
     * @param radiusMeters the sphere radius in meters
     * @return the area in meters squared
     **/
    public double area(double radiusMeters) {
        return GeographicTools.sphericalArea(this, radiusMeters);
    }

    public int size() {
        return lonW.length;
    }

    public double getLonW(int i) {
        return lonW[i];
    }

    public double getLat(int i) {
        return lat[i];
    }

    /**
     * @return the altitude of the vertex in km, 0 when the path carries no altitude
     **/
    public double getAlt(int i) {
        return alt == null ? 0 : alt[i];
    }

    public PathCode getCode(int i) {
        return codes[i];
    }

    public boolean hasAltitude() {
        return alt != null;
    }

    public double[] getLonW() {
        return lonW.clone();
    }

    public double[] getLat() {
        return lat.clone();
    }

    /**
     * @return a copy of the altitudes, or null when the path carries none
     **/
    public double[] getAlt() {
        return alt == null ? null : alt.clone();
    }

    public PathCode[] getCodes() {
        return codes.clone();
    }

    public List<double[]> getVertices() {
        List<double[]> vertices = new ArrayList<>();
        for (int i = 0; i < lonW.length; i++) {
            vertices.add(alt == null ? new double[]{lonW[i], lat[i]} : new double[]{lonW[i], lat[i], alt[i]});
        }
        return vertices;
    }

    @Override
    public String toString() {
        return "GeoPath{vertices=" + lonW.length + ", altitude=" + hasAltitude() + "}";
    }

}
