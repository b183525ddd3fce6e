package footprint.tools.projections;

import footprint.tools.math.Vectors;
import footprint.tools.utilities.Body;

/**
 * Equirectangular (plate carrée) projection. With the default radius the planar units are degrees,
 * the map spans [-180, 180] x [-90, 90].
 **/
public class Equirectangular extends GroundProjection {

    public static final double DEFAULT_RADIUS_KM = 180e-3 / Math.PI;
    public static final double DEFAULT_LON_W_0 = 180;

    private static final double WRAP_TOLERANCE = 1e-5;

    private final double latTs;
    private final double rc;

    public Equirectangular() {
        this(DEFAULT_LON_W_0, 0, 0, null, DEFAULT_RADIUS_KM);
    }

    public Equirectangular(double lonW0, double lat0, double latTs, Body body) {
        this(lonW0, lat0, latTs, body.name(), body.radius());
    }

    /**
     * @param lonW0    the central west longitude in degrees
     * @param lat0     the latitude of origin in degrees
     * @param latTs    the latitude of true scale in degrees
     * @param target   the target body name, may be null
     * @param radiusKm the body radius in km
     **/
    public Equirectangular(double lonW0, double lat0, double latTs, String target, double radiusKm) {
        super(lonW0, lat0, target, radiusKm);
        this.latTs = latTs;
        this.rc = Vectors.cs(latTs)[0];
    }

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.EQUIRECTANGULAR;
    }

    @Override
    public Equirectangular withCenter(double lonW0, double lat0) {
        return new Equirectangular(lonW0, lat0, latTs, targetName(), getRadius());
    }

    public double getLatTs() {
        return latTs;
    }

    /**
     * @return the x of the boundary, half the map width
     **/
    public double getXc() {
        return Math.PI * getR() * rc;
    }

    /**
     * @return half the map height for a latitude of origin at the equator
     **/
    public double getYc() {
        return Math.PI / 2 * getR();
    }

    /**
     * @return {xmin, xmax, ymin, ymax}
     **/
    public double[] getExtent() {
        return new double[]{-getXc(), getXc(), -getYc(), getYc()};
    }

    @Override
    protected double[] forward(double lonW, double lat) {

        double dlon = Vectors.deg180(getLonW0() - lonW);

        double x = getR() * rc * Math.toRadians(dlon);
        double y = getR() * Math.toRadians(lat - getLat0());

        return new double[]{x, y};

    }

    @Override
    protected double[] backward(double x, double y) {

        double lonW = Vectors.mod(getLonW0() - Math.toDegrees(x / (getR() * rc)), 360);
        if (Math.abs(lonW - 360) < WRAP_TOLERANCE) {
            lonW = 0;
        }

        double lat = getLat0() + Math.toDegrees(y / getR());

        return new double[]{lonW, Math.max(-90, Math.min(90, lat))};

    }

    @Override
    public double crossingThreshold() {
        return getXc();
    }

    @Override
    public double[] polePlanePoint(boolean north) {
        return new double[]{0, getR() * Math.toRadians((north ? 90 : -90) - getLat0())};
    }

    @Override
    protected String proj4Scale() {
        return " +lat_ts=" + format(latTs);
    }

    @Override
    protected String wktParameters() {
        return parameter("standard_parallel_1", latTs)
                + parameter("central_meridian", getLon0())
                + parameter("latitude_of_origin", getLat0());
    }

}
