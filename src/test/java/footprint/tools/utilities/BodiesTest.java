package footprint.tools.utilities;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BodiesTest {

    @Test
    public void titan() {

        Body titan = Bodies.get("Titan");

        assertEquals("Titan", titan.name());
        assertEquals(2574.73, titan.radius(), 0);
        assertEquals(2574730, titan.radiusMeters(), 1e-6);
        assertArrayEquals(new double[]{2574.32, 2574.36, 2574.91}, titan.radii(), 0);

    }

    @Test
    public void enceladus() {

        Body enceladus = Bodies.get("enceladus");

        assertEquals(252.1, enceladus.radius(), 0);
        assertArrayEquals(new double[]{256.6, 251.4, 248.3}, enceladus.radii(), 0);

    }

    @Test
    public void lookupIsCaseInsensitive() {

        assertSame(Bodies.get("TITAN"), Bodies.get(" titan "));
        assertTrue(Bodies.contains("Rhea"));
        assertFalse(Bodies.contains("Pandora-X"));
        assertTrue(Bodies.all().size() >= 2);

    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownBody() {
        Bodies.get("Vulcan");
    }

    @Test(expected = IllegalStateException.class)
    public void missingRegistry() {
        Bodies.load("/footprint/tools/missing.json");
    }

    @Test(expected = IllegalArgumentException.class)
    public void bodyNeedsAPositiveRadius() {
        new Body("Dust", 0, 0, new double[0]);
    }

}
