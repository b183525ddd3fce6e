package footprint.tools.geometry;

import footprint.tools.math.Vectors;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.List;

/**
 * Great circle operations on the unit sphere. Longitudes are west-positive, all angles in degrees.
 **/
public class GreatCircle {

    private static final double SEPARATION_EPSILON = 1e-8;

    private GreatCircle() {
    }

    /**
     * Samples the shortest great circle arc between two points (spherical linear interpolation)
     *
     * @param lon1 the first west longitude
     * @param lat1 the first latitude
     * @param lon2 the second west longitude
     * @param lat2 the second latitude
     * @param n    the number of points, endpoints included
     * @return a list of {lonW, lat} pairs, the first and last ones equal to the inputs
     * @throws DegenerateInputException if the points are identical or antipodal
     **/
    public static List<double[]> arc(double lon1, double lat1, double lon2, double lat2, int n) {

        if (n < 2) {
            throw new IllegalArgumentException("An arc needs at least 2 points, got " + n);
        }

        double separation = GeographicTools.angularDistance(lon1, lat1, lon2, lat2);
        if (separation < SEPARATION_EPSILON || separation > 180 - SEPARATION_EPSILON) {
            throw new DegenerateInputException("No unique great circle arc between (" + lon1 + ", " + lat1
                    + ") and (" + lon2 + ", " + lat2 + "), separation " + separation);
        }

        Vector3D p0 = Vectors.xyz(lon1, lat1);
        Vector3D p1 = Vectors.xyz(lon2, lat2);
        double omega = Vector3D.angle(p0, p1);
        double sinOmega = Math.sin(omega);

        List<double[]> points = new ArrayList<>();
        points.add(new double[]{lon1, lat1});

        for (int k = 1; k < n - 1; k++) {
            double t = (double) k / (n - 1);
            Vector3D v = new Vector3D(Math.sin((1 - t) * omega) / sinOmega, p0,
                    Math.sin(t * omega) / sinOmega, p1);
            points.add(Vectors.lonlat(v));
        }

        points.add(new double[]{lon2, lat2});
        return points;

    }

    /**
     * Computes the latitude of the great circle through two points at a given west longitude
     *
     * @param lon  the west longitude where the latitude is evaluated
     * @param lon1 the first point west longitude
     * @param lat1 the first point latitude
     * @param lon2 the second point west longitude
     * @param lat2 the second point latitude
     * @return the latitude in degrees
     * @throws DegenerateInputException if the points do not define a unique circle or lie on a meridian
     **/
    public static double latitudeOnCircle(double lon, double lon1, double lat1, double lon2, double lat2) {
        return latitudeOnCircle(new double[]{lon}, lon1, lat1, lon2, lat2)[0];
    }

    public static double[] latitudeOnCircle(double[] lons, double lon1, double lat1, double lon2, double lat2) {

        Vector3D normal = normal(lon1, lat1, lon2, lat2);

        if (Math.abs(normal.getZ()) < Vectors.EPSILON) {
            throw new DegenerateInputException("Points (" + lon1 + ", " + lat1 + ") and (" + lon2 + ", " + lat2
                    + ") lie on the same meridian");
        }

        double[] lats = new double[lons.length];
        for (int i = 0; i < lons.length; i++) {
            double[] cs = Vectors.cs(-lons[i]);
            double tan = -(normal.getX() * cs[0] + normal.getY() * cs[1]) / normal.getZ();
            lats[i] = Math.toDegrees(Math.atan(tan));
        }
        return lats;

    }

    private static Vector3D normal(double lon1, double lat1, double lon2, double lat2) {

        Vector3D normal = Vector3D.crossProduct(Vectors.xyz(lon1, lat1), Vectors.xyz(lon2, lat2));
        if (normal.getNorm() < Vectors.EPSILON) {
            throw new DegenerateInputException("Points (" + lon1 + ", " + lat1 + ") and (" + lon2 + ", " + lat2
                    + ") do not define a unique great circle");
        }
        return normal;

    }

    /**
     * Two points lying on the great circle whose pole is given
     *
     * @param lonP the pole west longitude
     * @param latP the pole latitude
     * @return {lon1, lat1, lon2, lat2}
     **/
    public static double[] poleAxis(double lonP, double latP) {

        double lat1 = latP >= 0 ? latP - 90 : latP + 90;
        double lon2 = Vectors.deg360(lonP + 90);

        return new double[]{lonP, lat1, lon2, 0};

    }

    /**
     * Latitude at a given west longitude of the great circle defined by its pole
     **/
    public static double poleLatitude(double lon, double lonP, double latP) {
        double[] axis = poleAxis(lonP, latP);
        return latitudeOnCircle(lon, axis[0], axis[1], axis[2], axis[3]);
    }

    /**
     * Samples the full great circle through two points on regularly spaced west longitudes
     *
     * @param npt the number of samples between 0 and 360 degrees, both included
     * @return a list of {lonW, lat} pairs
     **/
    public static List<double[]> circle(double lon1, double lat1, double lon2, double lat2, int npt) {

        if (npt < 2) {
            throw new IllegalArgumentException("A circle needs at least 2 samples, got " + npt);
        }

        double[] lons = new double[npt];
        for (int i = 0; i < npt; i++) {
            lons[i] = 360.0 * i / (npt - 1);
        }

        double[] lats = latitudeOnCircle(lons, lon1, lat1, lon2, lat2);

        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < npt; i++) {
            points.add(new double[]{lons[i], lats[i]});
        }
        return points;

    }

    /**
     * Intersection of the great circle through two points with the great circle whose pole is the
     * given center (the limb seen from above the center). The intersection on the side of the first
     * point is returned.
     *
     * @return a {lonW, lat} pair
     * @throws DegenerateInputException if the two points are identical or antipodal
     **/
    public static double[] limbIntersection(double lonC, double latC,
                                            double lon1, double lat1, double lon2, double lat2) {

        Vector3D center = Vectors.xyz(lonC, latC);
        Vector3D p1 = Vectors.xyz(lon1, lat1);

        Vector3D v = Vectors.hat(Vector3D.crossProduct(center, normal(lon1, lat1, lon2, lat2)));
        if (v.dotProduct(p1) < 0) {
            v = v.negate();
        }

        return Vectors.lonlat(v);

    }

}
