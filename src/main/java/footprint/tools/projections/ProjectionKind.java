package footprint.tools.projections;

import java.util.Locale;

/**
 * The closed set of supported projections
 **/
public enum ProjectionKind {

    EQUIRECTANGULAR("eqc", "Equirectangular"),
    EQUIRECTANGULAR_GC("eqc", "Equirectangular"),
    ORTHOGRAPHIC("ortho", "Orthographic"),
    STEREOGRAPHIC("stere", "Stereographic"),
    MOLLWEIDE("moll", "Mollweide"),
    SKY(null, "Sky");

    private final String proj4Key;
    private final String wktName;

    ProjectionKind(String proj4Key, String wktName) {
        this.proj4Key = proj4Key;
        this.wktName = wktName;
    }

    /**
     * @return the PROJ4 +proj key, null for the sky projection
     **/
    public String getProj4Key() {
        return proj4Key;
    }

    public String getWktName() {
        return wktName;
    }

    /**
     * Case insensitive lookup accepting the enum name, the PROJ4 key or the WKT name
     **/
    public static ProjectionKind fromName(String name) {

        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ProjectionKind kind : values()) {
            if (kind.name().equals(key) || kind.wktName.toUpperCase(Locale.ROOT).equals(key)
                    || (kind.proj4Key != null && kind.proj4Key.toUpperCase(Locale.ROOT).equals(key))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown projection: " + name);

    }

}
