package footprint.tools.utilities;

import footprint.tools.projections.Equirectangular;
import footprint.tools.projections.EquirectangularGC;
import footprint.tools.projections.Mollweide;
import footprint.tools.projections.Orthographic;
import footprint.tools.projections.Projection;
import footprint.tools.projections.Sky;
import footprint.tools.projections.Stereographic;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static footprint.tools.utilities.ProjectionConfig.orDefault;

/**
 * Builds projections from their configuration
 **/
public class Projections {

    private static final Logger LOG = LoggerFactory.getLogger(Projections.class);

    private Projections() {
    }

    public static Projection fromFile(String configFilePath) throws ConfigurationException {
        return fromConfig(new ProjectionConfig(configFilePath));
    }

    /**
     * The radius is taken from the configuration when set, then from the target body, then from the
     * projection default
     *
     * @param config the projection settings
     * @return the projection
     * @throws IllegalArgumentException if the target body is unknown
     **/
    public static Projection fromConfig(ProjectionConfig config) {

        Projection projection = build(config);
        LOG.debug("Projection built from configuration: {}", projection);
        return projection;

    }

    private static Projection build(ProjectionConfig config) {

        switch (config.projection()) {
            case EQUIRECTANGULAR:
                return new Equirectangular(
                        orDefault(config.lonW0(), Equirectangular.DEFAULT_LON_W_0),
                        orDefault(config.lat0(), 0),
                        orDefault(config.latTs(), 0),
                        config.target(),
                        radius(config, Equirectangular.DEFAULT_RADIUS_KM));
            case EQUIRECTANGULAR_GC:
                return new EquirectangularGC(
                        orDefault(config.lonW0(), Equirectangular.DEFAULT_LON_W_0),
                        orDefault(config.lat0(), 0),
                        orDefault(config.latTs(), 0),
                        config.target(),
                        radius(config, Equirectangular.DEFAULT_RADIUS_KM),
                        config.nptGc() > 0 ? config.nptGc() : EquirectangularGC.DEFAULT_NPT_GC);
            case ORTHOGRAPHIC:
                return new Orthographic(
                        orDefault(config.lonW0(), 0),
                        orDefault(config.lat0(), 0),
                        config.target(),
                        radius(config, Orthographic.DEFAULT_RADIUS_KM),
                        orDefault(config.dtheta(), Orthographic.DEFAULT_DTHETA));
            case STEREOGRAPHIC:
                return new Stereographic(
                        orDefault(config.lonW0(), 0),
                        orDefault(config.lat0(), 90),
                        config.target(),
                        radius(config, Stereographic.DEFAULT_RADIUS_KM));
            case MOLLWEIDE:
                return new Mollweide(
                        orDefault(config.lonW0(), 0),
                        config.target(),
                        radius(config, Mollweide.DEFAULT_RADIUS_KM));
            case SKY:
                return new Sky(config.ra(), config.dec(), config.twist());
            default:
                throw new IllegalArgumentException("Unsupported projection: " + config.projection());
        }

    }

    private static double radius(ProjectionConfig config, double fallback) {

        if (!Double.isNaN(config.radiusKm())) {
            return config.radiusKm();
        }
        if (config.target() != null) {
            return Bodies.get(config.target()).radius();
        }
        return fallback;

    }

}
