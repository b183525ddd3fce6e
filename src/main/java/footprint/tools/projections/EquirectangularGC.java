package footprint.tools.projections;

import footprint.tools.geometry.DegenerateInputException;
import footprint.tools.geometry.GeoPath;
import footprint.tools.geometry.GreatCircle;
import footprint.tools.geometry.PathCode;
import footprint.tools.utilities.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Equirectangular projection where the polygon edges follow great circles instead of straight lines
 * in the map plane. Each edge is sampled on {@code nptGc} points before projection.
 **/
public class EquirectangularGC extends Equirectangular {

    private static final Logger LOG = LoggerFactory.getLogger(EquirectangularGC.class);

    public static final int DEFAULT_NPT_GC = 8;

    private final int nptGc;

    public EquirectangularGC() {
        this(DEFAULT_NPT_GC);
    }

    public EquirectangularGC(int nptGc) {
        this(DEFAULT_LON_W_0, 0, 0, null, DEFAULT_RADIUS_KM, nptGc);
    }

    public EquirectangularGC(double lonW0, double lat0, double latTs, Body body, int nptGc) {
        this(lonW0, lat0, latTs, body.name(), body.radius(), nptGc);
    }

    public EquirectangularGC(double lonW0, double lat0, double latTs, String target, double radiusKm, int nptGc) {
        super(lonW0, lat0, latTs, target, radiusKm);
        if (nptGc < 2) {
            throw new IllegalArgumentException("Great circle edges need at least 2 points, got " + nptGc);
        }
        this.nptGc = nptGc;
    }

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.EQUIRECTANGULAR_GC;
    }

    @Override
    public EquirectangularGC withCenter(double lonW0, double lat0) {
        return new EquirectangularGC(lonW0, lat0, getLatTs(), targetName(), getRadius(), nptGc);
    }

    public int getNptGc() {
        return nptGc;
    }

    /**
     * Replaces every edge of the closed polygon by its great circle arc
     **/
    @Override
    protected GeoPath densify(GeoPath polygon) {

        List<double[]> vertices = new ArrayList<>();
        List<PathCode> codes = new ArrayList<>();

        for (int i = 0; i < polygon.size() - 1; i++) {

            double lon1 = polygon.getLonW(i);
            double lat1 = polygon.getLat(i);
            double lon2 = polygon.getLonW(i + 1);
            double lat2 = polygon.getLat(i + 1);

            List<double[]> arc;
            try {
                arc = GreatCircle.arc(lon1, lat1, lon2, lat2, nptGc);
            } catch (DegenerateInputException e) {
                LOG.warn("Edge {} kept straight: {}", i, e.getMessage());
                vertices.add(new double[]{lon1, lat1});
                codes.add(polygon.getCode(i));
                continue;
            }

            // The arc end is the start of the next edge
            for (int k = 0; k < arc.size() - 1; k++) {
                vertices.add(arc.get(k));
                codes.add(k == 0 ? polygon.getCode(i) : PathCode.LINE);
            }

        }

        int last = polygon.size() - 1;
        vertices.add(new double[]{polygon.getLonW(last), polygon.getLat(last)});
        codes.add(PathCode.CLOSE);

        return new GeoPath(vertices, codes);

    }

}
