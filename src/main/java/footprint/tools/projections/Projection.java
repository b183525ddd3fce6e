package footprint.tools.projections;

import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.GridLine;
import footprint.tools.geometry.PlanarPath;

import java.util.List;

/**
 * A map projection from west longitude / latitude (degrees) to planar coordinates. Points the
 * projection cannot represent are returned as NaN pairs, never as exceptions.
 **/
public interface Projection {

    ProjectionKind kind();

    /**
     * @param lonW west longitude in degrees
     * @param lat  latitude in degrees
     * @return the {x, y} pair, NaN when the point is not visible
     **/
    double[] transformPoint(double lonW, double lat);

    /**
     * @return the {lonW, lat} pair, NaN when the point is outside the planar domain
     **/
    double[] inversePoint(double x, double y);

    /**
     * Bulk version of {@link #transformPoint(double, double)}
     *
     * @return {xs, ys}
     **/
    double[][] transform(double[] lonW, double[] lat);

    /**
     * Bulk version of {@link #inversePoint(double, double)}
     *
     * @return {lonWs, lats}
     **/
    double[][] inverse(double[] x, double[] y);

    /**
     * Projects a path, closing each of its polygons and repairing those that cross a pole, the
     * antimeridian or the limb of the body.
     *
     * @param path the geographic path
     * @return the closed planar path, holding one or two polygons per input polygon
     * @throws footprint.tools.geometry.TopologyException if a polygon crosses the map boundary more than twice
     **/
    PlanarPath transformPath(GeoPath path);

    /**
     * @return the largest x jump of a continuous projected edge, infinite without periodic boundary
     **/
    double crossingThreshold();

    /**
     * @return the planar image {x, y} of the pole line, NaN when the pole has no single image
     **/
    double[] polePlanePoint(boolean north);

    List<GridLine> meridians(double[] lons, int npt);

    List<GridLine> parallels(double[] lats, int npt);

}
