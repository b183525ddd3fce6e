package footprint.tools.projections;

import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.PlanarPath;
import footprint.tools.math.Vectors;
import footprint.tools.utilities.Body;

/**
 * Mollweide equal-area projection. The latitude of origin is always the equator. With the default
 * radius the map spans [-2, 2] x [-1, 1].
 **/
public class Mollweide extends GroundProjection {

    public static final double DEFAULT_RADIUS_KM = 1e-3 / Math.sqrt(2);
    public static final int MAX_ITER = 1_000_000;

    private final double rx;
    private final double ry;

    public Mollweide() {
        this(0, null, DEFAULT_RADIUS_KM);
    }

    public Mollweide(double lonW0, Body body) {
        this(lonW0, body.name(), body.radius());
    }

    public Mollweide(double lonW0, String target, double radiusKm) {
        super(lonW0, 0, target, radiusKm);
        this.ry = getR() * Math.sqrt(2);
        this.rx = 2 * ry / Math.PI;
    }

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.MOLLWEIDE;
    }

    /**
     * @throws IllegalArgumentException if the latitude is not 0
     **/
    @Override
    public Mollweide withCenter(double lonW0, double lat0) {
        if (lat0 != 0) {
            throw new IllegalArgumentException("Mollweide projection is always centered on the equator, got " + lat0);
        }
        return new Mollweide(lonW0, targetName(), getRadius());
    }

    public double getRx() {
        return rx;
    }

    public double getRy() {
        return ry;
    }

    /**
     * @return {xmin, xmax, ymin, ymax}
     **/
    public double[] getExtent() {
        return new double[]{-2 * ry, 2 * ry, -ry, ry};
    }

    /**
     * Solves {@code 2θ + sin 2θ = π sin(lat)} with a Newton-Raphson iteration on the latitudes that
     * have not converged yet
     *
     * @param lat the latitudes in degrees
     * @return the auxiliary angles θ in radians
     * @throws ConvergenceException if the iteration cap is reached
     **/
    public static double[] auxiliaryAngles(double[] lat) {

        int n = lat.length;
        double[] theta = new double[n];
        double[] twoTheta = new double[n];
        double[] target = new double[n];

        int[] working = new int[n];
        int size = 0;

        for (int i = 0; i < n; i++) {
            if (Math.abs(lat[i]) == 90) {
                theta[i] = Math.copySign(Math.PI / 2, lat[i]);
            } else {
                twoTheta[i] = Math.toRadians(lat[i]);
                target[i] = Math.PI * Math.sin(Math.toRadians(lat[i]));
                working[size++] = i;
            }
        }

        int iter = 0;
        while (size > 0) {

            if (iter++ >= MAX_ITER) {
                throw new ConvergenceException("Mollweide auxiliary angle did not converge after " + MAX_ITER
                        + " iterations for " + size + " latitudes");
            }

            int kept = 0;
            for (int k = 0; k < size; k++) {

                int i = working[k];
                double next = newtonStep(twoTheta[i], target[i]);
                double step = twoTheta[i] - next;
                twoTheta[i] = next;

                if (Math.abs(step) > EPSILON) {
                    working[kept++] = i;
                }

            }
            size = kept;

        }

        for (int i = 0; i < n; i++) {
            if (Math.abs(lat[i]) != 90) {
                theta[i] = twoTheta[i] / 2;
            }
        }
        return theta;

    }

    /**
     * One Newton-Raphson iteration on {@code 2θ + sin 2θ = target}
     *
     * @param twoTheta the current estimate of 2θ
     * @return the next estimate
     **/
    static double newtonStep(double twoTheta, double target) {

        double denominator = 1 + Math.cos(twoTheta);
        if (denominator == 0) {
            // Stationary point, only reached at the poles where 2θ = ±π
            return Math.copySign(Math.PI, target);
        }
        return twoTheta - (twoTheta + Math.sin(twoTheta) - target) / denominator;

    }

    @Override
    public double[][] transform(double[] lonW, double[] lat) {

        checkSizes(lonW, lat);

        double[] theta = auxiliaryAngles(lat);
        double[] x = new double[lonW.length];
        double[] y = new double[lonW.length];

        for (int i = 0; i < lonW.length; i++) {
            double dlon = Math.toRadians(Vectors.deg180(getLonW0() - lonW[i]));
            x[i] = rx * dlon * Math.cos(theta[i]);
            y[i] = ry * Math.sin(theta[i]);
        }

        return new double[][]{x, y};

    }

    @Override
    protected double[] forward(double lonW, double lat) {
        return transformPoint(lonW, lat);
    }

    @Override
    protected double[] backward(double x, double y) {

        double s = y / ry;
        if (Math.abs(s) > 1) {
            return undefined();
        }

        double theta = Math.asin(s);
        double c = Math.cos(theta);

        if (Math.abs(x) > rx * Math.PI * c + EPSILON) {
            return undefined();
        }

        double lon = c > 0 ? Math.max(-Math.PI, Math.min(Math.PI, x / (rx * c))) : 0;
        double lat = Math.asin(Math.max(-1, Math.min(1, (2 * theta + Math.sin(2 * theta)) / Math.PI)));

        return new double[]{Vectors.deg360(getLonW0() - Math.toDegrees(lon)), Math.toDegrees(lat)};

    }

    @Override
    public double crossingThreshold() {
        return rx * Math.PI;
    }

    @Override
    public double[] polePlanePoint(boolean north) {
        return new double[]{0, north ? ry : -ry};
    }

    /**
     * @throws UnsupportedOperationException always, paths are not supported by this projection
     **/
    @Override
    public PlanarPath transformPath(GeoPath path) {
        throw new UnsupportedOperationException("Path projection is not available for the Mollweide projection");
    }

    @Override
    public String proj4() {
        return "+proj=moll"
                + " +lon_0=" + format(getLon0())
                + " +x_0=0 +y_0=0"
                + " +R=" + formatRadius(getR())
                + " +units=m +no_defs";
    }

    @Override
    protected String wktParameters() {
        return parameter("central_meridian", getLon0());
    }

}
