package footprint.tools.utilities;

import footprint.tools.projections.ProjectionKind;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.JSONConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;

import java.io.File;
import java.util.Locale;

/**
 * Projection settings read from a .properties or .json file. Unset numeric values are NaN (or 0 for
 * the great circle sampling) and fall back to the defaults of the selected projection.
 **/
public record ProjectionConfig(
        ProjectionKind projection,
        String target,
        double radiusKm,
        double lonW0,
        double lat0,
        double latTs,
        int nptGc,
        double dtheta,
        double ra,
        double dec,
        double twist
) {

    public ProjectionConfig(String configFilePath) throws ConfigurationException {
        this(loadConfiguration(configFilePath));
    }

    private ProjectionConfig(Configuration config) {
        this(
                ProjectionKind.fromName(config.getString("projection", ProjectionKind.EQUIRECTANGULAR.name())),
                emptyToNull(config.getString("target", null)),
                config.getDouble("radius_km", Double.NaN),
                config.getDouble("lon_w_0", Double.NaN),
                config.getDouble("lat_0", Double.NaN),
                config.getDouble("lat_ts", Double.NaN),
                config.getInt("npt_gc", 0),
                config.getDouble("dtheta", Double.NaN),
                config.getDouble("ra", 0),
                config.getDouble("dec", 0),
                config.getDouble("twist", 0)
        );
    }

    private static Configuration loadConfiguration(String configFilePath) throws ConfigurationException {
        Configurations configs = new Configurations();
        if (configFilePath.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return configs.fileBased(JSONConfiguration.class, new File(configFilePath));
        }
        return configs.properties(configFilePath);
    }

    private static String emptyToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    /**
     * @return the configured value, or the fallback when unset
     **/
    static double orDefault(double value, double fallback) {
        return Double.isNaN(value) ? fallback : value;
    }

}
