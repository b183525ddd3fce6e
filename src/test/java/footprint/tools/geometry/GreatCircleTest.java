package footprint.tools.geometry;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class GreatCircleTest {

    @Test
    public void arcKeepsItsEndpoints() {

        List<double[]> arc = GreatCircle.arc(20, 30, 120, 45, 10);

        assertEquals(10, arc.size());
        assertArrayEquals(new double[]{20, 30}, arc.get(0), 0);
        assertArrayEquals(new double[]{120, 45}, arc.get(9), 0);
        assertArrayEquals(new double[]{69.6, 50.8}, arc.get(5), 0.1);

    }

    @Test
    public void arcPointsAreEvenlySpaced() {

        List<double[]> arc = GreatCircle.arc(0, 0, 90, 0, 4);

        assertArrayEquals(new double[]{30, 0}, arc.get(1), 1e-9);
        assertArrayEquals(new double[]{60, 0}, arc.get(2), 1e-9);

    }

    @Test(expected = DegenerateInputException.class)
    public void arcBetweenIdenticalPointsIsDegenerate() {
        GreatCircle.arc(20, 30, 20, 30, 5);
    }

    @Test(expected = DegenerateInputException.class)
    public void arcBetweenAntipodesIsDegenerate() {
        GreatCircle.arc(20, 30, 200, -30, 5);
    }

    @Test
    public void latitudeOnCircleGoesThroughTheAnchors() {

        assertEquals(30, GreatCircle.latitudeOnCircle(20, 20, 30, 120, 45), 1e-9);
        assertEquals(45, GreatCircle.latitudeOnCircle(120, 20, 30, 120, 45), 1e-9);
        assertEquals(-30, GreatCircle.latitudeOnCircle(200, 20, 30, 120, 45), 1e-9);

        double[] lats = GreatCircle.latitudeOnCircle(new double[]{20, 120, 300}, 20, 30, 120, 45);
        assertEquals(-45, lats[2], 1e-9);

    }

    @Test(expected = DegenerateInputException.class)
    public void latitudeOnAMeridianIsDegenerate() {
        GreatCircle.latitudeOnCircle(10, 20, 30, 20, -10);
    }

    @Test
    public void poleAxis() {

        assertArrayEquals(new double[]{20, -60, 110, 0}, GreatCircle.poleAxis(20, 30), 0);
        assertArrayEquals(new double[]{300, 50, 30, 0}, GreatCircle.poleAxis(300, -40), 0);

    }

    @Test
    public void poleLatitude() {

        assertEquals(-60, GreatCircle.poleLatitude(20, 20, 30), 1e-9);
        assertEquals(60, GreatCircle.poleLatitude(200, 20, 30), 1e-9);
        assertEquals(0, GreatCircle.poleLatitude(110, 20, 30), 1e-9);
        assertEquals(-58.4, GreatCircle.poleLatitude(0, 20, 30), 0.1);

    }

    @Test
    public void circleSamplesTheAntipode() {

        List<double[]> circle = GreatCircle.circle(20, 30, 120, 45, 10);

        assertEquals(10, circle.size());
        assertEquals(0, circle.get(0)[0], 0);
        assertEquals(360, circle.get(9)[0], 0);
        assertArrayEquals(new double[]{200, -30}, circle.get(5), 1e-9);
        assertEquals(circle.get(0)[1], circle.get(9)[1], 1e-9);

    }

    @Test
    public void limbIntersectionLiesOnTheEquatorForAPolarCenter() {

        double[] intersection = GreatCircle.limbIntersection(0, 90, 60, 40, 30, -20);

        assertEquals(0, intersection[1], 1e-9);
        assertEquals(38.97, intersection[0], 0.01);

    }

    @Test
    public void limbIntersectionIsOnTheSideOfTheFirstPoint() {

        double[] intersection = GreatCircle.limbIntersection(0, 0, 10, 0, 120, 0);
        assertArrayEquals(new double[]{90, 0}, intersection, 1e-9);

        intersection = GreatCircle.limbIntersection(0, 0, 350, 0, 240, 0);
        assertArrayEquals(new double[]{270, 0}, intersection, 1e-9);

    }

    @Test(expected = DegenerateInputException.class)
    public void limbIntersectionOfAntipodalPoints() {
        GreatCircle.limbIntersection(0, 90, 0, 10, 180, -10);
    }

}
