package footprint.tools.geometry;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class GeographicToolsTest {

    @Test
    public void angularDistance() {

        assertEquals(90, GeographicTools.angularDistance(0, 0, 90, 0), 1e-9);
        assertEquals(90, GeographicTools.angularDistance(123, 0, 0, 90), 1e-9);
        assertEquals(180, GeographicTools.angularDistance(20, 30, 200, -30), 1e-9);
        assertEquals(0, GeographicTools.angularDistance(20, 30, 380, 30), 1e-9);

    }

    @Test
    public void areaOfAPolarCap() {

        // Cap above 60°N approximated by a dense polygon
        int n = 3600;
        double[] lon = new double[n];
        double[] lat = new double[n];
        for (int i = 0; i < n; i++) {
            lon[i] = 360.0 * i / n;
            lat[i] = 60;
        }

        double r = 2574730;
        double expected = 2 * Math.PI * r * r * (1 - Math.sin(Math.toRadians(60)));
        double area = GeographicTools.sphericalArea(new GeoPath(lon, lat, null, null), r);

        assertEquals(expected, area, expected * 1e-4);

    }

}
