package footprint.tools.geometry;

import footprint.tools.math.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Repairs closed projected polygons that jump across the periodic boundary of a cylindrical map,
 * located at x = -xc and x = +xc.
 **/
public class Discontinuities {

    private static final Logger LOG = LoggerFactory.getLogger(Discontinuities.class);

    private Discontinuities() {
    }

    /**
     * Counts the edges of a polygon whose x jump is larger than the threshold
     *
     * @param x         the projected x coordinates
     * @param threshold the maximum x jump of a continuous edge
     * @return the number of crossings
     **/
    public static int countCrossings(double[] x, double threshold) {

        int crossings = 0;
        for (int i = 0; i < x.length - 1; i++) {
            if (Math.abs(x[i + 1] - x[i]) > threshold) {
                crossings++;
            }
        }
        return crossings;

    }

    /**
     * Closes a polygon that surrounds a pole and crosses the boundary once. At the crossing edge, the
     * polygon follows the boundary up to the pole line, runs along it and comes back on the other side.
     *
     * @param x     the projected x coordinates of the closed polygon
     * @param y     the projected y coordinates of the closed polygon
     * @param xc    the boundary half width
     * @param north y of the North Pole line
     * @param south y of the South Pole line
     * @return the wrapped polygon
     **/
    public static PlanarPath wrapPole(double[] x, double[] y, double xc, double north, double south) {

        // The pole enclosed by the polygon is on the side of its furthest vertex
        int furthest = 0;
        for (int i = 1; i < y.length; i++) {
            if (Math.abs(y[i]) > Math.abs(y[furthest])) {
                furthest = i;
            }
        }
        double pole = y[furthest] >= 0 ? north : south;

        List<double[]> vertices = new ArrayList<>();
        vertices.add(new double[]{x[0], y[0]});

        for (int i = 0; i < x.length - 1; i++) {

            if (Math.abs(x[i + 1] - x[i]) > xc) {

                double a = x[i];
                double b = x[i + 1];
                double x1;
                double x2;
                double f;

                if (a > 0) {
                    x1 = xc;
                    x2 = -xc;
                    f = (xc - a) / (b + 2 * xc - a);
                } else {
                    x1 = -xc;
                    x2 = xc;
                    f = (xc + a) / (a - b + 2 * xc);
                }

                double yb = y[i] + f * (y[i + 1] - y[i]);

                vertices.add(new double[]{x1, yb});
                vertices.add(new double[]{x1, pole});
                vertices.add(new double[]{x2, pole});
                vertices.add(new double[]{x2, yb});

            }

            vertices.add(new double[]{x[i + 1], y[i + 1]});

        }

        LOG.debug("Polygon wrapped around the {} pole, {} vertices", pole >= 0 ? "north" : "south", vertices.size());

        return PlanarPath.polygon(vertices);

    }

    /**
     * Splits a closed polygon crossing the boundary twice in a left part (around -xc) and a right part
     * (around +xc), both closed and interpolated on the boundary.
     *
     * @param x  the projected x coordinates of the closed polygon
     * @param y  the projected y coordinates of the closed polygon
     * @param xc the boundary half width
     * @return a path holding the left polygon followed by the right one
     * @throws DegenerateSplitException if one of the parts has less than 3 distinct vertices, as for a
     *                                  polygon that only touches the boundary
     **/
    public static PlanarPath splitAntimeridian(double[] x, double[] y, double xc) {

        int n = x.length - 1;

        double[] xr = new double[x.length];
        double[] xl = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            xr[i] = Vectors.mod(x[i], 2 * xc);
            xl[i] = xr[i] - 2 * xc;
        }

        List<double[]> right = new ArrayList<>();
        List<double[]> left = new ArrayList<>();

        for (int i = 0; i < n; i++) {

            if (xr[i] <= xc) {
                right.add(new double[]{xr[i], y[i]});
            }
            if ((xr[i] <= xc && xr[i + 1] > xc) || (xr[i] > xc && xr[i + 1] <= xc)) {
                double f = (xc - xr[i]) / (xr[i + 1] - xr[i]);
                right.add(new double[]{xc, y[i] + f * (y[i + 1] - y[i])});
            }

            if (xl[i] >= -xc) {
                left.add(new double[]{xl[i], y[i]});
            }
            if ((xl[i] >= -xc && xl[i + 1] < -xc) || (xl[i] < -xc && xl[i + 1] >= -xc)) {
                double f = (-xc - xl[i]) / (xl[i + 1] - xl[i]);
                left.add(new double[]{-xc, y[i] + f * (y[i + 1] - y[i])});
            }

        }

        left = withoutRepeats(left);
        right = withoutRepeats(right);

        if (left.size() <= 2) {
            throw new DegenerateSplitException("left", left.size());
        }
        if (right.size() <= 2) {
            throw new DegenerateSplitException("right", right.size());
        }

        left.add(left.get(0));
        right.add(right.get(0));

        LOG.debug("Polygon split on the antimeridian, {} left and {} right vertices", left.size(), right.size());

        return PlanarPath.concat(List.of(PlanarPath.polygon(left), PlanarPath.polygon(right)));

    }

    /**
     * Drops consecutive identical vertices of an open ring, the last one compared with the first
     **/
    private static List<double[]> withoutRepeats(List<double[]> ring) {

        List<double[]> kept = new ArrayList<>();
        for (double[] vertex : ring) {
            if (kept.isEmpty() || !Arrays.equals(vertex, kept.get(kept.size() - 1))) {
                kept.add(vertex);
            }
        }
        while (kept.size() > 1 && Arrays.equals(kept.get(0), kept.get(kept.size() - 1))) {
            kept.remove(kept.size() - 1);
        }
        return kept;

    }

}
