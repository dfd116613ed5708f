package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerQuality;
import au.org.ala.scalers.TestBase;
import au.org.ala.scalers.UnsupportedScaleException;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;
import java.util.Arrays;

@RunWith(JUnit4.class)
public class BoxDownscaleTest extends TestBase {

    private static final int BLACK = 0xff000000;
    private static final int WHITE = 0xffffffff;

    private final Scalers scalers = new Scalers();

    @Test
    public void testAveragesBlocks() {
        BufferedImage source = image(4, 2,
                BLACK, WHITE, WHITE, WHITE,
                WHITE, WHITE, WHITE, WHITE);
        BufferedImage result = scalers.downscale(source, new BoxDownscale(2), ScalerQuality.FAST);
        Assert.assertEquals(2, result.getWidth());
        Assert.assertEquals(1, result.getHeight());
        // (0 + 255 * 3) / 4 = 191.25
        Assert.assertEquals(0xffbfbfbf, result.getRGB(0, 0));
        Assert.assertEquals(WHITE, result.getRGB(1, 0));
    }

    @Test
    public void testHighQualityAveragesInLinearLight() {
        BufferedImage source = image(2, 2, BLACK, WHITE, WHITE, WHITE);
        int fast = scalers.downscale(source, new BoxDownscale(2), ScalerQuality.FAST).getRGB(0, 0) & 0xff;
        int high = scalers.downscale(source, new BoxDownscale(2), ScalerQuality.HIGH_QUALITY).getRGB(0, 0) & 0xff;
        println("fast %d, high quality %d", fast, high);
        Assert.assertEquals(191, fast);
        Assert.assertEquals(225, high, 1);
    }

    @Test
    public void testPartialBlocksAreTruncated() {
        BufferedImage result = scalers.downscale(patternImage(11, 7), new BoxDownscale(3, 2), ScalerQuality.FAST);
        Assert.assertEquals(3, result.getWidth());
        Assert.assertEquals(3, result.getHeight());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSourceSmallerThanBlock() {
        scalers.downscale(solidImage(4, 2, WHITE), new BoxDownscale(3), ScalerQuality.FAST);
    }

    @Test
    public void testUnsupportedRatios() {
        for (int[] ratios : new int[][]{{1, 1}, {6, 6}, {2, 6}, {0, 2}}) {
            try {
                new BoxDownscale(ratios[0], ratios[1]);
                Assert.fail("expected " + Arrays.toString(ratios) + " to be rejected");
            } catch (UnsupportedScaleException e) {
                println(e.getMessage());
            }
        }
    }

    @Test
    public void testStaticSide() {
        Assert.assertEquals(Arrays.asList(2, 3, 4, 5), BoxDownscale.SUPPORTED_RATIOS);
        Assert.assertEquals(Arrays.asList(new Dimension(5, 1), new Dimension(3, 1)), BoxDownscale.possibleTargets(10, 3));
        Assert.assertTrue(BoxDownscale.possibleTargets(1, 1).isEmpty());
        Assert.assertEquals(ScaleFactor.of(0.5, 0.25), new BoxDownscale(2, 4).getScale());
    }

    @Test
    public void testMixedRatiosAreNotFitTargets() {
        BufferedImage mixed = new Scalers().downscale(patternImage(6, 6), new BoxDownscale(2, 3), ScalerQuality.FAST);
        Assert.assertEquals(3, mixed.getWidth());
        Assert.assertEquals(2, mixed.getHeight());
        Assert.assertEquals(Arrays.asList(new Dimension(3, 3), new Dimension(2, 2), new Dimension(1, 1), new Dimension(1, 1)),
                BoxDownscale.possibleTargets(6, 6));
        Assert.assertFalse(BoxDownscale.possibleTargets(6, 6).contains(new Dimension(3, 2)));
    }
}
