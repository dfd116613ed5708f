package au.org.ala.scalers;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScaleFactorTest extends TestBase {

    @Test
    public void testApplyIntegral() {
        Assert.assertEquals(new Dimension(20, 30), ScaleFactor.uniform(2).apply(10, 15));
        Assert.assertEquals(new Dimension(30, 20), ScaleFactor.of(3, 2).apply(10, 10));
        Assert.assertEquals(new Dimension(0, 0), ScaleFactor.uniform(3).apply(0, 0));
    }

    @Test
    public void testApplyUniformAndPerAxis() {
        Assert.assertEquals(new Dimension(32, 32), ScaleFactor.uniform(2).apply(16, 16));
        Assert.assertEquals(new Dimension(30, 40), ScaleFactor.of(3, 2).apply(10, 20));
    }

    @Test
    public void testApplyFractionalRoundsDown() {
        Assert.assertEquals(new Dimension(2, 2), ScaleFactor.uniform(0.5).apply(5, 5));
        Assert.assertEquals(new Dimension(15, 7), ScaleFactor.of(1.5, 1.5).apply(10, 5));
        // 11 * (15 / 11.0) is 14.999999999999998 in binary floating point
        Assert.assertEquals(new Dimension(15, 15), ScaleFactor.uniform(15 / 11.0).apply(11, 11));
    }

    @Test(expected = ArithmeticException.class)
    public void testApplyOverflow() {
        ScaleFactor.uniform(2).apply(Integer.MAX_VALUE, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testApplyNegativeSource() {
        ScaleFactor.uniform(2).apply(-1, 1);
    }

    @Test
    public void testInvalidComponents() {
        double[] invalid = {0, -1, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
        for (double value : invalid) {
            try {
                ScaleFactor.of(value, 1);
                Assert.fail("expected rejection of x = " + value);
            } catch (IllegalArgumentException e) {
                println("rejected %s: %s", value, e.getMessage());
            }
            try {
                ScaleFactor.of(1, value);
                Assert.fail("expected rejection of y = " + value);
            } catch (IllegalArgumentException e) {
                println("rejected %s: %s", value, e.getMessage());
            }
        }
    }

    @Test
    public void testToString() {
        Assert.assertEquals("2x", ScaleFactor.uniform(2).toString());
        Assert.assertEquals("2x3", ScaleFactor.of(2, 3).toString());
        Assert.assertEquals("1.5x", ScaleFactor.uniform(1.5).toString());
        Assert.assertEquals("0.5x0.25", ScaleFactor.of(0.5, 0.25).toString());
    }

    @Test
    public void testParse() {
        Assert.assertEquals(ScaleFactor.uniform(2), ScaleFactor.parse("2x"));
        Assert.assertEquals(ScaleFactor.of(2, 3), ScaleFactor.parse("2X3"));
        Assert.assertEquals(ScaleFactor.uniform(1.5), ScaleFactor.parse(" 1.5x "));
        ScaleFactor odd = ScaleFactor.of(0.75, 4);
        Assert.assertEquals(odd, ScaleFactor.parse(odd.toString()));
    }

    @Test
    public void testParseInvalid() {
        for (String text : new String[]{"", "2", "x2", "2x3x4", "twox", "0x", "-1x"}) {
            try {
                ScaleFactor.parse(text);
                Assert.fail("expected '" + text + "' to be rejected");
            } catch (IllegalArgumentException e) {
                println("'%s': %s", text, e.getMessage());
            }
        }
    }

    @Test
    public void testEqualityAndPredicates() {
        Assert.assertEquals(ScaleFactor.uniform(2), ScaleFactor.of(2, 2));
        Assert.assertEquals(ScaleFactor.uniform(2).hashCode(), ScaleFactor.of(2, 2).hashCode());
        Assert.assertNotEquals(ScaleFactor.of(2, 3), ScaleFactor.of(3, 2));
        Assert.assertTrue(ScaleFactor.of(2, 3).isIntegral());
        Assert.assertFalse(ScaleFactor.of(2, 3).isUniform());
        Assert.assertFalse(ScaleFactor.uniform(0.5).isIntegral());
    }
}
