package footprint.tools.projections;

import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.PlanarPath;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class SkyTest {

    private static final double DELTA = 1e-12;
    private static final double TAN_10 = Math.tan(Math.toRadians(10));

    private static void assertMatrix(double[][] expected, Sky sky) {
        double[][] m = sky.getMatrix();
        for (int i = 0; i < 3; i++) {
            assertArrayEquals("row " + i, expected[i], m[i], DELTA);
        }
    }

    @Test
    public void identityPointing() {

        Sky sky = new Sky();

        assertMatrix(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}}, sky);
        assertArrayEquals(new double[]{0, 0}, sky.transformPoint(0, 0), DELTA);
        assertArrayEquals(new double[]{TAN_10, 0}, sky.transformPoint(10, 0), DELTA);
        assertArrayEquals(new double[]{0, TAN_10}, sky.transformPoint(0, 10), DELTA);

    }

    @Test
    public void rotationMatrices() {

        assertMatrix(new double[][]{{0, 1, 0}, {-1, 0, 0}, {0, 0, 1}}, new Sky(90, 0, 0));
        assertMatrix(new double[][]{{0, 0, 1}, {0, 1, 0}, {-1, 0, 0}}, new Sky(0, 90, 0));
        assertMatrix(new double[][]{{1, 0, 0}, {0, 0, 1}, {0, -1, 0}}, new Sky(0, 0, 90));
        assertMatrix(new double[][]{{0, 0, 1}, {0, -1, 0}, {1, 0, 0}}, new Sky(90, 90, 90));

    }

    @Test
    public void pointing() {

        assertArrayEquals(new double[]{-TAN_10, 0}, new Sky(10, 0, 0).transformPoint(0, 0), DELTA);
        assertArrayEquals(new double[]{0, 0}, new Sky(10, 0, 0).transformPoint(10, 0), DELTA);
        assertArrayEquals(new double[]{0, -TAN_10}, new Sky(0, 0, 90).transformPoint(10, 0), DELTA);

    }

    @Test
    public void inverse() {

        assertArrayEquals(new double[]{350, 0}, new Sky().inversePoint(-TAN_10, 0), 1e-9);
        assertArrayEquals(new double[]{10, 0}, new Sky(10, 0, 0).inversePoint(0, 0), 1e-9);

    }

    @Test
    public void roundTrip() {

        Sky sky = new Sky(123, -40, 37);
        double[][] points = {{123, -40}, {130, -35}, {110, -50}, {125, -41}};

        for (double[] point : points) {
            double[] xy = sky.transformPoint(point[0], point[1]);
            assertArrayEquals(point, sky.inversePoint(xy[0], xy[1]), 1e-9);
        }

    }

    @Test
    public void bulkMatchesPointTransform() {

        Sky sky = new Sky(123, -40, 37);
        double[] ra = {123, 130, 110, 125, 100};
        double[] dec = {-40, -35, -50, -41, -30};

        double[][] xy = sky.transform(ra, dec);
        for (int i = 0; i < ra.length; i++) {
            double[] point = sky.transformPoint(ra[i], dec[i]);
            assertEquals(point[0], xy[0][i], 0);
            assertEquals(point[1], xy[1][i], 0);
        }

    }

    @Test
    public void rightAscensionIsWrapped() {
        assertEquals(10, new Sky(370, 0, 0).getRa(), 0);
        assertEquals(350, new Sky(-10, 0, 0).getRa(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void declinationMustBeALatitude() {
        new Sky(0, 91, 0);
    }

    @Test
    public void pathsAreClosedWithoutBoundaryHandling() {

        PlanarPath path = new Sky(0, 0, 0).transformPath(new GeoPath(List.of(
                new double[]{355, -5}, new double[]{5, -5}, new double[]{5, 5}, new double[]{355, 5})));

        assertEquals(5, path.size());
        assertArrayEquals(path.getVertices().get(0), path.getVertices().get(4), 0);
        assertEquals(-Math.tan(Math.toRadians(5)), path.getX(0), 1e-3);

    }

}
