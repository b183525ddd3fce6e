package footprint.tools.projections;

import footprint.tools.math.Vectors;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Gnomonic projection of the celestial sphere on the plane tangent to an instrument boresight. The
 * pointing is given by its right ascension, declination and twist angle, in degrees. Coordinates
 * handled by this projection are (ra, dec) instead of (west longitude, latitude).
 **/
public class Sky extends AbstractProjection {

    private final double ra;
    private final double dec;
    private final double twist;
    private final RealMatrix m;

    public Sky() {
        this(0, 0, 0);
    }

    /**
     * @param ra    the boresight right ascension, wrapped to [0, 360)
     * @param dec   the boresight declination, in [-90, 90]
     * @param twist the rotation around the boresight
     **/
    public Sky(double ra, double dec, double twist) {

        if (dec < -90 || dec > 90) {
            throw new IllegalArgumentException("Declination must be in [-90, 90]: " + dec);
        }

        this.ra = Vectors.deg360(ra);
        this.dec = dec;
        this.twist = twist;
        this.m = rotation(this.ra, dec, twist);

    }

    /**
     * Rotation from the celestial frame to the instrument frame, boresight along the first axis
     **/
    private static RealMatrix rotation(double ra, double dec, double twist) {

        double[] csRa = Vectors.cs(ra);
        double[] csDec = Vectors.cs(dec);
        double[] csTwist = Vectors.cs(twist / 2);

        RealMatrix m1 = MatrixUtils.createRealMatrix(new double[][]{
                {csDec[0], 0, csDec[1]},
                {0, 1, 0},
                {-csDec[1], 0, csDec[0]}
        });

        RealMatrix m2 = MatrixUtils.createRealMatrix(new double[][]{
                {csRa[0], csRa[1], 0},
                {-csRa[1], csRa[0], 0},
                {0, 0, 1}
        });

        // Quaternion of the twist around the boresight
        double q0 = csTwist[0];
        double q1 = csTwist[1] * csDec[0] * csRa[0];
        double q2 = csTwist[1] * csDec[0] * csRa[1];
        double q3 = csTwist[1] * csDec[1];

        RealMatrix m3 = MatrixUtils.createRealMatrix(new double[][]{
                {1 - 2 * (q2 * q2 + q3 * q3), 2 * (q1 * q2 + q0 * q3), 2 * (q1 * q3 - q0 * q2)},
                {2 * (q1 * q2 - q0 * q3), 1 - 2 * (q1 * q1 + q3 * q3), 2 * (q2 * q3 + q0 * q1)},
                {2 * (q1 * q3 + q0 * q2), 2 * (q2 * q3 - q0 * q1), 1 - 2 * (q1 * q1 + q2 * q2)}
        });

        return m1.multiply(m2).multiply(m3);

    }

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.SKY;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    public double getTwist() {
        return twist;
    }

    /**
     * @return a copy of the rotation matrix
     **/
    public double[][] getMatrix() {
        return m.getData();
    }

    /**
     * @param ra  the right ascension in degrees
     * @param dec the declination in degrees
     **/
    @Override
    protected double[] forward(double ra, double dec) {

        double[] csRa = Vectors.cs(ra);
        double[] csDec = Vectors.cs(dec);

        double[] v = m.operate(new double[]{csRa[0] * csDec[0], csRa[1] * csDec[0], csDec[1]});

        return new double[]{v[1] / v[0], v[2] / v[0]};

    }

    @Override
    protected double[] backward(double x, double y) {

        double norm = Math.sqrt(1 + x * x + y * y);
        double[] v = m.transpose().operate(new double[]{1 / norm, x / norm, y / norm});

        double raOut = Vectors.deg360(Math.toDegrees(Math.atan2(v[1], v[0])));
        double decOut = Math.toDegrees(Math.asin(Math.max(-1, Math.min(1, v[2]))));

        return new double[]{raOut, decOut};

    }

    @Override
    public double crossingThreshold() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public double[] polePlanePoint(boolean north) {
        return forward(0, north ? 90 : -90);
    }

    @Override
    public String toString() {
        return "<Sky> RA: " + ra + "° | DEC: " + dec + "° | TWIST: " + twist + "°";
    }

}
