package au.org.ala.scalers.kernel;

import au.org.ala.scalers.TestBase;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OutOfBoundsModeTest extends TestBase {

    private static final int SIZE = 5;

    private void assertResolves(OutOfBoundsMode mode, int[] coords, int[] expected) {
        for (int i = 0; i < coords.length; i++) {
            Assert.assertEquals(mode + " at " + coords[i], expected[i], mode.resolve(coords[i], SIZE));
        }
    }

    @Test
    public void testInsideIsUnchanged() {
        for (OutOfBoundsMode mode : OutOfBoundsMode.values()) {
            for (int c = 0; c < SIZE; c++) {
                Assert.assertEquals(c, mode.resolve(c, SIZE));
            }
        }
    }

    @Test
    public void testClamp() {
        assertResolves(OutOfBoundsMode.CLAMP, new int[]{-1, -3, 5, 7}, new int[]{0, 0, 4, 4});
    }

    @Test
    public void testHalf() {
        assertResolves(OutOfBoundsMode.HALF, new int[]{-1, -2, -3, 5, 6, 7}, new int[]{0, 1, 2, 4, 3, 2});
    }

    @Test
    public void testWhole() {
        assertResolves(OutOfBoundsMode.WHOLE, new int[]{-1, -2, -3, 5, 6, 7}, new int[]{1, 2, 3, 3, 2, 1});
    }

    @Test
    public void testWrap() {
        assertResolves(OutOfBoundsMode.WRAP, new int[]{-1, -2, 5, 7, -20}, new int[]{4, 3, 0, 2, 0});
    }

    @Test
    public void testFarOutsideStaysInRange() {
        for (OutOfBoundsMode mode : OutOfBoundsMode.values()) {
            for (int c = -50; c < 50; c++) {
                int resolved = mode.resolve(c, SIZE);
                Assert.assertTrue(mode + " at " + c + " gave " + resolved, resolved >= 0 && resolved < SIZE);
                Assert.assertEquals(0, mode.resolve(c, 1));
            }
        }
    }
}
