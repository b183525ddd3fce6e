package footprint.tools.utilities;

/**
 * A target body approximated by a sphere
 *
 * @param name        the body name
 * @param radius      the mean radius in km
 * @param uncertainty the mean radius uncertainty in km
 * @param radii       the triaxial radii (a, b, c) in km
 **/
public record Body(String name, double radius, double uncertainty, double[] radii) {

    public Body {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A body needs a name");
        }
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Radius of " + name + " must be positive: " + radius);
        }
    }

    /**
     * @return the mean radius in meters
     **/
    public double radiusMeters() {
        return radius * 1e3;
    }

    @Override
    public String toString() {
        return name + " (" + radius + " ± " + uncertainty + " km)";
    }

}
