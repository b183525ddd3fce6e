package footprint.tools.projections;

import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.PathCode;
import footprint.tools.geometry.PlanarPath;
import org.junit.Test;

import java.util.List;

import static footprint.tools.projections.EquirectangularTest.assertVertices;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class EquirectangularGCTest {

    private static final GeoPath TRIANGLE = new GeoPath(List.of(
            new double[]{20, 30}, new double[]{-10, 0}, new double[]{20, -30}));

    @Test
    public void defaults() {

        EquirectangularGC proj = new EquirectangularGC();

        assertEquals(8, proj.getNptGc());
        assertEquals(ProjectionKind.EQUIRECTANGULAR_GC, proj.kind());
        assertEquals(180, proj.getLonW0(), 0);

    }

    @Test
    public void edgesAreDensifiedAlongGreatCircles() {

        GeoPath densified = new EquirectangularGC(3).densify(TRIANGLE.closed());

        assertEquals(7, densified.size());
        assertEquals(PathCode.MOVE, densified.getCode(0));
        assertEquals(PathCode.LINE, densified.getCode(1));
        assertEquals(PathCode.CLOSE, densified.getCode(6));
        assertArrayEquals(new double[]{20, 0}, new double[]{densified.getLonW(5), densified.getLat(5)}, 1e-9);
        assertArrayEquals(new double[]{20, 30}, new double[]{densified.getLonW(6), densified.getLat(6)}, 0);

    }

    @Test
    public void pathAcrossTheAntimeridian() {

        PlanarPath path = new EquirectangularGC(3).transformPath(TRIANGLE);
        List<PlanarPath> polygons = path.polygons();

        assertEquals(12, path.size());
        assertVertices(new double[][]{{-180, 11.1}, {-170, 0}, {-180, -11.1}, {-180, 11.1}}, polygons.get(0), 0.1);
        assertVertices(new double[][]{{160, 30}, {176.1, 15.5}, {180, 11.1}, {180, -11.1},
                {176.1, -15.5}, {160, -30}, {160, 0}, {160, 30}}, polygons.get(1), 0.1);

    }

    @Test
    public void repeatedVerticesAreKeptStraight() {

        GeoPath path = new GeoPath(List.of(new double[]{170, 0}, new double[]{170, 0},
                new double[]{180, 10}, new double[]{190, 0}));

        PlanarPath planar = new EquirectangularGC(4).transformPath(path);

        assertEquals(1 + 3 + 3 + 3 + 1, planar.size());
        assertTrue(planar.isDefined());

    }

    @Test
    public void proj4AndWktWithoutTarget() {

        EquirectangularGC proj = new EquirectangularGC(180, 0, 0, null, 1, 8);

        assertEquals("+proj=eqc +lat_0=0 +lon_0=180 +lat_ts=0 +x_0=0 +y_0=0"
                + " +a=1000.0 +b=1000.0 +units=m +no_defs", proj.proj4());
        assertTrue(proj.wkt().startsWith("PROJCS[\"PROJCS_Undefined_Equirectangular\",GEOGCS[\"GCS_Undefined\","
                + "DATUM[\"D_Undefined\",SPHEROID[\"Undefined_Mean_Sphere\", 1000, 0]]"));

    }

    @Test
    public void withCenterKeepsTheSampling() {

        EquirectangularGC proj = new EquirectangularGC(5).withCenter(0, 0);

        assertEquals(5, proj.getNptGc());
        assertEquals(0, proj.getLonW0(), 0);

    }

    @Test(expected = IllegalArgumentException.class)
    public void samplingNeedsTwoPoints() {
        new EquirectangularGC(1);
    }

}
