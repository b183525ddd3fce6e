package footprint.tools.projections;

import footprint.tools.math.Vectors;
import footprint.tools.utilities.Body;

/**
 * Base class of the projections of a body surface. Holds the projection center, the target body and
 * its radius, and builds the PROJ4 and WKT descriptions shared by the concrete projections.
 **/
public abstract class GroundProjection extends AbstractProjection {

    public static final String UNDEFINED_TARGET = "Undefined";

    private static final String WKT = "PROJCS[\"PROJCS_%1$s_%2$s\","
            + "GEOGCS[\"GCS_%1$s\","
            + "DATUM[\"D_%1$s\","
            + "SPHEROID[\"%1$s_Mean_Sphere\", %3$d, 0]],"
            + "PRIMEM[\"Greenwich\",0],"
            + "UNIT[\"Degree\",0.017453292519943295]],"
            + "PROJECTION[\"%2$s\"],"
            + "PARAMETER[\"false_easting\", 0],"
            + "PARAMETER[\"false_northing\", 0],"
            + "%4$s"
            + "UNIT[\"Meter\", 1]]";

    private final double lonW0;
    private final double lat0;
    private final String target;
    private final double radiusKm;
    private final double r;

    private final double clon0;
    private final double slon0;
    private final double clat0;
    private final double slat0;

    /**
     * @param lonW0    the center west longitude in degrees
     * @param lat0     the center latitude in degrees
     * @param target   the target body name, may be null
     * @param radiusKm the body radius in km
     **/
    protected GroundProjection(double lonW0, double lat0, String target, double radiusKm) {

        if (lat0 < -90 || lat0 > 90) {
            throw new IllegalArgumentException("Center latitude must be in [-90, 90]: " + lat0);
        }
        if (!(radiusKm > 0)) {
            throw new IllegalArgumentException("Radius must be positive: " + radiusKm);
        }

        this.lonW0 = lonW0;
        this.lat0 = lat0;
        this.target = target;
        this.radiusKm = radiusKm;
        this.r = radiusKm * 1e3;

        double[] csLon = Vectors.cs(lonW0);
        double[] csLat = Vectors.cs(lat0);
        this.clon0 = csLon[0];
        this.slon0 = csLon[1];
        this.clat0 = csLat[0];
        this.slat0 = csLat[1];

    }

    protected GroundProjection(double lonW0, double lat0, Body body) {
        this(lonW0, lat0, body.name(), body.radius());
    }

    /**
     * @return a copy of this projection centered on another point
     **/
    public abstract GroundProjection withCenter(double lonW0, double lat0);

    public double getLonW0() {
        return lonW0;
    }

    public double getLat0() {
        return lat0;
    }

    /**
     * @return the east longitude of the central meridian, in [-180, 180]
     **/
    public double getLon0() {
        if (Math.abs(lonW0) == 180) {
            return 180;
        }
        return Vectors.mod(-lonW0 + 180, 360) - 180;
    }

    public String getTarget() {
        return target == null ? UNDEFINED_TARGET : target;
    }

    /**
     * @return the target name as given, null when undefined
     **/
    protected String targetName() {
        return target;
    }

    /**
     * @return the body radius in meters
     **/
    public double getR() {
        return r;
    }

    /**
     * @return the body radius in km
     **/
    public double getRadius() {
        return radiusKm;
    }

    public double getClon0() {
        return clon0;
    }

    public double getSlon0() {
        return slon0;
    }

    public double getClat0() {
        return clat0;
    }

    public double getSlat0() {
        return slat0;
    }

    protected boolean isPolar() {
        return Math.abs(Math.abs(lat0) - 90) < EPSILON;
    }

    public String proj4() {
        return "+proj=" + kind().getProj4Key()
                + " +lat_0=" + format(lat0)
                + " +lon_0=" + format(getLon0())
                + proj4Scale()
                + " +x_0=0 +y_0=0"
                + " +a=" + formatRadius(r)
                + " +b=" + formatRadius(r)
                + " +units=m +no_defs";
    }

    /**
     * PROJ4 scale term, between the center and the false origin
     **/
    protected String proj4Scale() {
        return " +k=1";
    }

    public String wkt() {
        return String.format(WKT, getTarget(), kind().getWktName(), (long) r, wktParameters());
    }

    /**
     * WKT parameters following the false origin
     **/
    protected String wktParameters() {
        return parameter("scale_factor", 1)
                + parameter("central_meridian", getLon0())
                + parameter("latitude_of_origin", lat0);
    }

    protected static String parameter(String name, double value) {
        return "PARAMETER[\"" + name + "\", " + format(value) + "],";
    }

    /**
     * Integral values are printed without decimals
     **/
    protected static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    protected static String formatRadius(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return (long) value + ".0";
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + "> " + getTarget() + " | (" + format(lonW0) + "°W, "
                + format(lat0) + "°) | r=" + getRadius() + " km";
    }

}
