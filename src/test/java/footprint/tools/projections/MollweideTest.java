package footprint.tools.projections;

import footprint.tools.geometry.GeoPath;
import footprint.tools.utilities.Bodies;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MollweideTest {

    private static final double DELTA = 1e-9;

    private static final Mollweide PROJ = new Mollweide();

    @Test
    public void defaultRadii() {

        assertEquals(1, PROJ.getRy(), 1e-12);
        assertEquals(2 / Math.PI, PROJ.getRx(), 1e-12);
        assertArrayEquals(new double[]{-2, 2, -1, 1}, PROJ.getExtent(), 1e-12);

    }

    @Test
    public void points() {

        assertArrayEquals(new double[]{0, 0}, PROJ.transformPoint(0, 0), DELTA);
        assertArrayEquals(new double[]{0, 1}, PROJ.transformPoint(0, 90), DELTA);
        assertArrayEquals(new double[]{0, -1}, PROJ.transformPoint(0, -90), DELTA);
        assertArrayEquals(new double[]{-1, 0}, PROJ.transformPoint(90, 0), DELTA);
        assertArrayEquals(new double[]{1, 0}, PROJ.transformPoint(270, 0), DELTA);
        assertArrayEquals(new double[]{-2, 0}, PROJ.transformPoint(180, 0), DELTA);
        assertArrayEquals(new double[]{2, 0}, PROJ.transformPoint(-180, 0), DELTA);

    }

    @Test
    public void latitudesCloseToThePolesConverge() {

        assertArrayEquals(new double[]{0, 1}, PROJ.transformPoint(0, 90 - 1e-12), 1e-6);
        assertArrayEquals(new double[]{0, -1}, PROJ.transformPoint(0, -90 + 1e-9), 1e-5);

    }

    @Test
    public void auxiliaryAngleSolvesTheMollweideEquation() {

        double[] lat = {-60, -15, 0, 33, 89.5};
        double[] theta = Mollweide.auxiliaryAngles(lat);

        for (int i = 0; i < lat.length; i++) {
            assertEquals(Math.PI * Math.sin(Math.toRadians(lat[i])), 2 * theta[i] + Math.sin(2 * theta[i]), 1e-9);
        }

    }

    @Test
    public void stationaryPointSnapsToThePole() {

        assertEquals(Math.PI, Mollweide.newtonStep(Math.PI, Math.PI), 0);
        assertEquals(-Math.PI, Mollweide.newtonStep(Math.PI, -Math.PI), 0);
        assertEquals(-Math.PI, Mollweide.newtonStep(-Math.PI, -Math.PI), 0);

    }

    @Test
    public void bulkMatchesPointTransform() {

        double[] lon = {0, 30, 120, 200, 359};
        double[] lat = {90, -45, 10, 75, -89.9};

        double[][] xy = PROJ.transform(lon, lat);
        for (int i = 0; i < lon.length; i++) {
            assertArrayEquals(PROJ.transformPoint(lon[i], lat[i]), new double[]{xy[0][i], xy[1][i]}, 0);
        }

    }

    @Test
    public void inverse() {

        assertArrayEquals(new double[]{180, 0}, PROJ.inversePoint(2, 0), DELTA);
        assertArrayEquals(new double[]{270, 0}, PROJ.inversePoint(1, 0), DELTA);
        assertArrayEquals(new double[]{0, 90}, PROJ.inversePoint(0, 1), DELTA);

        assertTrue(Double.isNaN(PROJ.inversePoint(3, 0)[0]));
        assertTrue(Double.isNaN(PROJ.inversePoint(2, 1)[0]));
        assertTrue(Double.isNaN(PROJ.inversePoint(0, 2)[1]));

    }

    @Test
    public void roundTrip() {

        Mollweide proj = new Mollweide(60, Bodies.get("Titan"));
        double[][] points = {{60, 0}, {10, 45}, {300, -70}, {200, 20}};

        for (double[] point : points) {
            double[] xy = proj.transformPoint(point[0], point[1]);
            assertArrayEquals(point, proj.inversePoint(xy[0], xy[1]), 1e-7);
        }

    }

    @Test(expected = UnsupportedOperationException.class)
    public void pathsAreNotSupported() {
        PROJ.transformPath(new GeoPath(List.of(new double[]{0, 0}, new double[]{10, 0}, new double[]{10, 10})));
    }

    @Test(expected = IllegalArgumentException.class)
    public void centerStaysOnTheEquator() {
        PROJ.withCenter(10, 20);
    }

    @Test
    public void proj4AndWkt() {

        Mollweide titan = new Mollweide(0, Bodies.get("Titan"));

        assertEquals("+proj=moll +lon_0=0 +x_0=0 +y_0=0 +R=2574730.0 +units=m +no_defs", titan.proj4());
        assertTrue(titan.wkt().contains("PROJECTION[\"Mollweide\"],PARAMETER[\"false_easting\", 0],"
                + "PARAMETER[\"false_northing\", 0],PARAMETER[\"central_meridian\", 0],UNIT[\"Meter\", 1]]"));

    }

}
