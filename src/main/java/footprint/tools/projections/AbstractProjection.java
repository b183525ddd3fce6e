package footprint.tools.projections;

import footprint.tools.geometry.Discontinuities;
import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.GridLine;
import footprint.tools.geometry.PlanarPath;
import footprint.tools.geometry.TopologyException;
import footprint.tools.math.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared behaviour of the projections: bulk transforms built on the point kernels, and the path
 * pipeline that closes each polygon, projects it and repairs the pole and antimeridian crossings.
 **/
public abstract class AbstractProjection implements Projection {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractProjection.class);

    public static final double EPSILON = Vectors.EPSILON;

    protected static double[] undefined() {
        return new double[]{Double.NaN, Double.NaN};
    }

    /**
     * Point kernel of the forward transform
     *
     * @return the {x, y} pair, a NaN pair when the point is not visible
     **/
    protected abstract double[] forward(double lonW, double lat);

    /**
     * Point kernel of the inverse transform
     *
     * @return the {lonW, lat} pair, a NaN pair outside the planar domain
     **/
    protected abstract double[] backward(double x, double y);

    @Override
    public double[] transformPoint(double lonW, double lat) {
        double[][] xy = transform(new double[]{lonW}, new double[]{lat});
        return new double[]{xy[0][0], xy[1][0]};
    }

    @Override
    public double[] inversePoint(double x, double y) {
        double[][] lonLat = inverse(new double[]{x}, new double[]{y});
        return new double[]{lonLat[0][0], lonLat[1][0]};
    }

    @Override
    public double[][] transform(double[] lonW, double[] lat) {

        checkSizes(lonW, lat);

        double[] x = new double[lonW.length];
        double[] y = new double[lonW.length];
        for (int i = 0; i < lonW.length; i++) {
            double[] xy = forward(lonW[i], lat[i]);
            x[i] = xy[0];
            y[i] = xy[1];
        }
        return new double[][]{x, y};

    }

    @Override
    public double[][] inverse(double[] x, double[] y) {

        checkSizes(x, y);

        double[] lonW = new double[x.length];
        double[] lat = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double[] lonLat = backward(x[i], y[i]);
            lonW[i] = lonLat[0];
            lat[i] = lonLat[1];
        }
        return new double[][]{lonW, lat};

    }

    protected static void checkSizes(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Coordinate arrays must have the same size: " + a.length + " != " + b.length);
        }
    }

    @Override
    public PlanarPath transformPath(GeoPath path) {

        List<PlanarPath> polygons = new ArrayList<>();
        for (GeoPath polygon : path.closed().runs()) {
            polygons.add(transformPolygon(polygon));
        }
        return PlanarPath.concat(polygons);

    }

    /**
     * Projects a single closed polygon
     **/
    protected PlanarPath transformPolygon(GeoPath polygon) {

        GeoPath vertices = densify(polygon);
        double[][] xy = transform(vertices.getLonW(), vertices.getLat());
        return resolveCrossings(xy[0], xy[1], vertices);

    }

    /**
     * Hook replacing the polygon edges before projection, identity by default
     **/
    protected GeoPath densify(GeoPath polygon) {
        return polygon;
    }

    /**
     * Classifies the projected polygon by the number of boundary crossings and repairs it
     *
     * @throws TopologyException with more than 2 crossings
     **/
    protected PlanarPath resolveCrossings(double[] x, double[] y, GeoPath vertices) {

        double threshold = crossingThreshold();
        if (Double.isInfinite(threshold)) {
            return new PlanarPath(x, y, vertices.getCodes());
        }

        int crossings = Discontinuities.countCrossings(x, threshold);
        LOG.debug("{} polygon of {} vertices crosses the boundary {} times", kind(), x.length, crossings);

        switch (crossings) {
            case 0:
                return new PlanarPath(x, y, vertices.getCodes());
            case 1:
                return Discontinuities.wrapPole(x, y, threshold, polePlanePoint(true)[1], polePlanePoint(false)[1]);
            case 2:
                return Discontinuities.splitAntimeridian(x, y, threshold);
            default:
                throw new TopologyException(crossings);
        }

    }

    @Override
    public List<GridLine> meridians(double[] lons, int npt) {

        double[] lats = linspace(-90, 90, npt);
        List<GridLine> lines = new ArrayList<>();
        for (double lon : lons) {
            double[] lonW = new double[npt];
            Arrays.fill(lonW, lon);
            double[][] xy = transform(lonW, lats);
            lines.add(new GridLine(true, lon, xy[0], xy[1]));
        }
        return lines;

    }

    @Override
    public List<GridLine> parallels(double[] lats, int npt) {

        double[] lonW = linspace(0, 360, npt);
        List<GridLine> lines = new ArrayList<>();
        for (double lat : lats) {
            double[] lat0 = new double[npt];
            Arrays.fill(lat0, lat);
            double[][] xy = transform(lonW, lat0);
            lines.add(new GridLine(false, lat, xy[0], xy[1]));
        }
        return lines;

    }

    protected static double[] linspace(double start, double end, int n) {

        if (n < 2) {
            throw new IllegalArgumentException("At least 2 samples are required, got " + n);
        }

        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = start + (end - start) * i / (n - 1);
        }
        return values;

    }

}
