package footprint.tools.math;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * This class holds the conversions between geographic coordinates and unit vectors, plus the angle
 * wrapping helpers shared by the projections. Longitudes are west-positive.
 **/
public class Vectors {

    public static final double EPSILON = 1e-10;

    private Vectors() {
    }

    /**
     * Cosine and sine of an angle in degrees, exact on multiples of 90 degrees
     *
     * @param angle the angle in degrees
     * @return a {cos, sin} pair
     **/
    public static double[] cs(double angle) {

        double a = angle % 360;
        if (a < 0) {
            a += 360;
        }

        if (a == 0) {
            return new double[]{1, 0};
        } else if (a == 90) {
            return new double[]{0, 1};
        } else if (a == 180) {
            return new double[]{-1, 0};
        } else if (a == 270) {
            return new double[]{0, -1};
        }

        double rad = Math.toRadians(angle);
        return new double[]{Math.cos(rad), Math.sin(rad)};

    }

    /**
     * Takes a pair of geographic coordinates and transforms them into a unit vector
     *
     * @param lonW west longitude in degrees
     * @param lat  latitude in degrees
     * @return the cartesian unit vector
     **/
    public static Vector3D xyz(double lonW, double lat) {

        double[] csLon = cs(-lonW);
        double[] csLat = cs(lat);

        return new Vector3D(csLat[0] * csLon[0], csLat[0] * csLon[1], csLat[1]);

    }

    /**
     * Takes a cartesian vector (not necessarily unitary) and returns its geographic direction
     *
     * @param v the vector
     * @return a {lonW, lat} pair, west longitude in [0, 360)
     **/
    public static double[] lonlat(Vector3D v) {

        double norm = v.getNorm();
        double lonW = deg360(-Math.toDegrees(Math.atan2(v.getY(), v.getX())));
        double lat = Math.toDegrees(Math.asin(Math.max(-1, Math.min(1, v.getZ() / norm))));

        return new double[]{lonW, lat};

    }

    /**
     * Normalized vector, the zero vector is returned untouched
     **/
    public static Vector3D hat(Vector3D v) {
        double norm = v.getNorm();
        return norm == 0 ? v : v.scalarMultiply(1 / norm);
    }

    /**
     * Wraps an angle to [0, 360)
     **/
    public static double deg360(double angle) {
        double a = angle % 360;
        if (a < 0) {
            a += 360;
        }
        return a == 360 ? 0 : a;
    }

    /**
     * Wraps an angle to [-180, 180), with a raw value of exactly 180 kept at 180
     **/
    public static double deg180(double angle) {
        if (angle == 180) {
            return 180;
        }
        return deg360(angle + 180) - 180;
    }

    /**
     * Positive modulo for doubles
     **/
    public static double mod(double value, double period) {
        double m = value % period;
        return m < 0 ? m + period : m;
    }

}
