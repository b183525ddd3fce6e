package footprint.tools.projections;

import footprint.tools.math.Vectors;
import footprint.tools.utilities.Body;

/**
 * Stereographic projection, centered on the North Pole by default. The antipode of the center has no
 * image.
 **/
public class Stereographic extends GroundProjection {

    public static final double DEFAULT_RADIUS_KM = 1e-3;

    public Stereographic() {
        this(0, 90, null, DEFAULT_RADIUS_KM);
    }

    public Stereographic(double lonW0, double lat0, Body body) {
        super(lonW0, lat0, body);
    }

    public Stereographic(double lonW0, double lat0, String target, double radiusKm) {
        super(lonW0, lat0, target, radiusKm);
    }

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.STEREOGRAPHIC;
    }

    @Override
    public Stereographic withCenter(double lonW0, double lat0) {
        return new Stereographic(lonW0, lat0, targetName(), getRadius());
    }

    @Override
    protected double[] forward(double lonW, double lat) {

        double[] csLat = Vectors.cs(lat);
        double[] csDelta = Vectors.cs(getLonW0() - lonW);

        double denominator = 1 + getSlat0() * csLat[1] + getClat0() * csLat[0] * csDelta[0];
        if (denominator <= EPSILON) {
            return undefined();
        }

        double k = 2 * getR() / denominator;
        double x = k * csLat[0] * csDelta[1];
        double y = k * (getClat0() * csLat[1] - getSlat0() * csLat[0] * csDelta[0]);

        return new double[]{x, y};

    }

    @Override
    protected double[] backward(double x, double y) {

        double rh = Math.hypot(x, y);
        if (rh <= EPSILON) {
            return new double[]{Vectors.deg360(getLonW0()), getLat0()};
        }

        double c = 2 * Math.atan(rh / (2 * getR()));
        double sinc = Math.sin(c);
        double cosc = Math.cos(c);

        double lat = Math.asin(Math.max(-1, Math.min(1, cosc * getSlat0() + y * sinc * getClat0() / rh)));

        double lon;
        if (isPolar()) {
            lon = getLat0() > 0 ? Math.atan2(x, -y) : Math.atan2(x, y);
        } else {
            lon = Math.atan2(x * sinc, rh * getClat0() * cosc - y * getSlat0() * sinc);
        }

        return new double[]{Vectors.deg360(getLonW0() - Math.toDegrees(lon)), Math.toDegrees(lat)};

    }

    @Override
    public double crossingThreshold() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public double[] polePlanePoint(boolean north) {
        return forward(0, north ? 90 : -90);
    }

}
