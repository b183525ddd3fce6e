package footprint.tools.geometry;

import net.sf.geographiclib.Geodesic;
import net.sf.geographiclib.GeodesicData;
import net.sf.geographiclib.GeodesicMask;
import net.sf.geographiclib.PolygonArea;
import net.sf.geographiclib.PolygonResult;

/**
 * Contains spherical distance and area operations. Bodies are handled as spheres, longitudes are
 * west-positive and converted to the east-positive convention of the geodesic library.
 */
public class GeographicTools {

    private static final Geodesic UNIT_SPHERE = new Geodesic(1, 0);

    private GeographicTools() {
    }

    /**
     * Computes the angular distance between two pairs of coordinates over a sphere
     *
     * @param lonW1 the first west longitude
     * @param lat1  the first latitude
     * @param lonW2 the second west longitude
     * @param lat2  the second latitude
     * @return a double value for the computed angular distance, in degrees
     **/
    public static double angularDistance(double lonW1, double lat1, double lonW2, double lat2) {
        GeodesicData g = UNIT_SPHERE.Inverse(lat1, -lonW1, lat2, -lonW2, GeodesicMask.DISTANCE);
        return g.a12;
    }

    /**
     * This method computes the area of each polygon of a path over a sphere, using the
     * net.sf.geographiclib library. Section 6, C. F. F. Karney, Algorithms for geodesics,
     * J. Geodesy 87, 43–55 (2013).
     *
     * @param path         the path, every polygon is closed implicitly
     * @param radiusMeters the sphere radius in meters
     * @return the summed area in meters squared
     **/
    public static double sphericalArea(GeoPath path, double radiusMeters) {

        Geodesic sphere = new Geodesic(radiusMeters, 0);
        double area = 0;

        for (int[] run : PathCode.runs(path.getCodes())) {

            PolygonArea polygonArea = new PolygonArea(sphere, false);
            int end = run[1];
            // The library closes the polygon itself
            if (end - run[0] > 1 && path.getLat(end - 1) == path.getLat(run[0])
                    && path.getLonW(end - 1) == path.getLonW(run[0])) {
                end--;
            }

            for (int i = run[0]; i < end; i++) {
                polygonArea.AddPoint(path.getLat(i), -path.getLonW(i));
            }

            PolygonResult result = polygonArea.Compute();
            area += Math.abs(result.area);

        }

        return area;

    }

}
