package footprint.tools.projections;

import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.GreatCircle;
import footprint.tools.geometry.PlanarPath;
import footprint.tools.math.Vectors;
import footprint.tools.utilities.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Orthographic projection: the body as seen from an infinite distance above the center. Points on the
 * far side have no image, polygons crossing the limb are clipped on it.
 **/
public class Orthographic extends GroundProjection {

    private static final Logger LOG = LoggerFactory.getLogger(Orthographic.class);

    public static final double DEFAULT_RADIUS_KM = 1e-3;
    public static final double DEFAULT_DTHETA = 5;

    private final double dtheta;

    public Orthographic() {
        this(0, 0, null, DEFAULT_RADIUS_KM);
    }

    public Orthographic(double lonW0, double lat0, Body body) {
        this(lonW0, lat0, body.name(), body.radius(), DEFAULT_DTHETA);
    }

    public Orthographic(double lonW0, double lat0, String target, double radiusKm) {
        this(lonW0, lat0, target, radiusKm, DEFAULT_DTHETA);
    }

    /**
     * @param dtheta the angular step used to walk along the limb, in degrees
     **/
    public Orthographic(double lonW0, double lat0, String target, double radiusKm, double dtheta) {
        super(lonW0, lat0, target, radiusKm);
        if (!(dtheta > 0)) {
            throw new IllegalArgumentException("Limb step must be positive: " + dtheta);
        }
        this.dtheta = dtheta;
    }

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.ORTHOGRAPHIC;
    }

    @Override
    public Orthographic withCenter(double lonW0, double lat0) {
        return new Orthographic(lonW0, lat0, targetName(), getRadius(), dtheta);
    }

    public double getDtheta() {
        return dtheta;
    }

    @Override
    protected double[] forward(double lonW, double lat) {
        return forward(lonW, lat, 0);
    }

    /**
     * @param alt the altitude above the surface, in km
     **/
    protected double[] forward(double lonW, double lat, double alt) {

        double[] csLat = Vectors.cs(lat);
        double[] csDelta = Vectors.cs(getLonW0() - lonW);

        double g = getSlat0() * csLat[1] + getClat0() * csLat[0] * csDelta[0];
        if (g < -EPSILON) {
            return undefined();
        }

        double k = getR() + alt * 1e3;
        double x = k * csLat[0] * csDelta[1];
        double y = k * (getClat0() * csLat[1] - getSlat0() * csLat[0] * csDelta[0]);

        return new double[]{x, y};

    }

    public double[] transformPoint(double lonW, double lat, double alt) {
        return forward(lonW, lat, alt);
    }

    /**
     * Bulk transform of points above the surface
     *
     * @param alt the altitudes in km
     * @return {xs, ys}
     **/
    public double[][] transform(double[] lonW, double[] lat, double[] alt) {

        checkSizes(lonW, lat);
        checkSizes(lonW, alt);

        double[] x = new double[lonW.length];
        double[] y = new double[lonW.length];
        for (int i = 0; i < lonW.length; i++) {
            double[] xy = forward(lonW[i], lat[i], alt[i]);
            x[i] = xy[0];
            y[i] = xy[1];
        }
        return new double[][]{x, y};

    }

    @Override
    protected double[] backward(double x, double y) {
        double[] lonLatAlt = inversePoint(x, y, false);
        return new double[]{lonLatAlt[0], lonLatAlt[1]};
    }

    /**
     * Inverse transform. Points outside the limb are undefined, unless the altitude is requested: they
     * are then located above the limb point at the same polar angle.
     *
     * @param withAltitude whether points outside the limb are resolved with an altitude
     * @return {lonW, lat, alt}, the altitude in km
     **/
    public double[] inversePoint(double x, double y, boolean withAltitude) {

        double rh = Math.hypot(x, y);
        if (rh <= EPSILON) {
            return new double[]{Vectors.deg360(getLonW0()), getLat0(), 0};
        }

        double alt = 0;
        if (rh > getR()) {
            if (!withAltitude) {
                return new double[]{Double.NaN, Double.NaN, Double.NaN};
            }
            alt = (rh - getR()) / 1e3;
            x *= getR() / rh;
            y *= getR() / rh;
            rh = getR();
        }

        double sinc = Math.min(1, rh / getR());
        double cosc = Math.sqrt(1 - sinc * sinc);

        double lat = Math.asin(Math.max(-1, Math.min(1, cosc * getSlat0() + y * sinc * getClat0() / rh)));

        double lon;
        if (isPolar()) {
            lon = getLat0() > 0 ? Math.atan2(x, -y) : Math.atan2(x, y);
        } else {
            lon = Math.atan2(x * sinc, rh * getClat0() * cosc - y * getSlat0() * sinc);
        }

        return new double[]{Vectors.deg360(getLonW0() - Math.toDegrees(lon)), Math.toDegrees(lat), alt};

    }

    @Override
    public double crossingThreshold() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public double[] polePlanePoint(boolean north) {
        return forward(0, north ? 90 : -90);
    }

    /**
     * Projects a closed polygon, clipping the hidden parts on the limb
     **/
    @Override
    protected PlanarPath transformPolygon(GeoPath polygon) {

        double[] alt = polygon.hasAltitude() ? polygon.getAlt() : new double[polygon.size()];
        double[][] xy = transform(polygon.getLonW(), polygon.getLat(), alt);
        double[] x = xy[0];
        double[] y = xy[1];

        int visible = 0;
        for (double v : x) {
            if (!Double.isNaN(v)) {
                visible++;
            }
        }

        if (visible == x.length) {
            return new PlanarPath(x, y, polygon.getCodes());
        }

        if (visible == 0) {
            LOG.warn("Polygon of {} vertices is entirely on the far side of {}", x.length, getTarget());
            double[] nan = new double[x.length];
            Arrays.fill(nan, Double.NaN);
            return new PlanarPath(nan, nan, polygon.getCodes());
        }

        return clipOnLimb(polygon, x, y);

    }

    private PlanarPath clipOnLimb(GeoPath polygon, double[] x, double[] y) {

        List<double[]> vertices = new ArrayList<>();
        boolean startsVisible = !Double.isNaN(x[0]);
        if (startsVisible) {
            vertices.add(new double[]{x[0], y[0]});
        }

        double[] firstIntersection = null;
        Double limbStart = null;

        for (int i = 0; i < x.length - 1; i++) {

            boolean near = !Double.isNaN(x[i]);
            boolean nextNear = !Double.isNaN(x[i + 1]);

            if (near && nextNear) {
                vertices.add(new double[]{x[i + 1], y[i + 1]});
            } else if (near) {
                double[] intersection = intersection(polygon, i, i + 1);
                vertices.add(intersection);
                limbStart = polarAngle(intersection);
            } else if (nextNear) {
                double[] intersection = intersection(polygon, i + 1, i);
                if (limbStart != null) {
                    walkLimb(vertices, limbStart, polarAngle(intersection));
                } else {
                    firstIntersection = intersection;
                }
                vertices.add(intersection);
                vertices.add(new double[]{x[i + 1], y[i + 1]});
                limbStart = null;
            }

        }

        if (!startsVisible && limbStart != null && firstIntersection != null) {
            walkLimb(vertices, limbStart, polarAngle(firstIntersection));
            vertices.add(firstIntersection);
        }

        LOG.debug("Polygon clipped on the limb, {} vertices become {}", x.length, vertices.size());

        return PlanarPath.polygon(vertices);

    }

    /**
     * Projected intersection of an edge with the limb, on the side of its visible vertex
     **/
    private double[] intersection(GeoPath polygon, int near, int far) {

        double[] lonLat = GreatCircle.limbIntersection(getLonW0(), getLat0(),
                polygon.getLonW(near), polygon.getLat(near), polygon.getLonW(far), polygon.getLat(far));

        double[] csLat = Vectors.cs(lonLat[1]);
        double[] csDelta = Vectors.cs(getLonW0() - lonLat[0]);

        return new double[]{
                getR() * csLat[0] * csDelta[1],
                getR() * (getClat0() * csLat[1] - getSlat0() * csLat[0] * csDelta[0])
        };

    }

    private static double polarAngle(double[] xy) {
        return Math.toDegrees(Math.atan2(xy[1], xy[0]));
    }

    /**
     * Adds the limb points between two polar angles (both excluded), along the shorter direction
     **/
    private void walkLimb(List<double[]> vertices, double start, double end) {

        double delta = end - start;
        if (delta > 180) {
            end -= 360;
        } else if (delta < -180) {
            end += 360;
        }

        double step = end >= start ? dtheta : -dtheta;
        for (double theta = start + step; step > 0 ? theta < end : theta > end; theta += step) {
            double rad = Math.toRadians(theta);
            vertices.add(new double[]{getR() * Math.cos(rad), getR() * Math.sin(rad)});
        }

    }

}
