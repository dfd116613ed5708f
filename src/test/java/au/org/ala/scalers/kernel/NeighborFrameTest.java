package au.org.ala.scalers.kernel;

import au.org.ala.scalers.TestBase;
import au.org.ala.scalers.color.Argb8888;
import au.org.ala.scalers.color.ColorCodecs.Identity;
import au.org.ala.scalers.color.ColorPipelines;
import au.org.ala.scalers.color.OklabF;
import au.org.ala.scalers.color.RgbaF;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;

@RunWith(JUnit4.class)
public class NeighborFrameTest extends TestBase {

    @Test
    public void testRasterOverSubimage() {
        BufferedImage image = patternImage(8, 6);
        BufferedImage sub = image.getSubimage(2, 1, 3, 4);
        Argb8888Raster raster = Argb8888Raster.wrap(sub);
        Assert.assertEquals(3, raster.getWidth());
        Assert.assertEquals(4, raster.getHeight());
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 3; x++) {
                Assert.assertEquals(image.getRGB(x + 2, y + 1), raster.get(x, y).getArgb());
            }
        }
        raster.set(1, 1, Argb8888.of(0xff123456));
        Assert.assertEquals(0xff123456, image.getRGB(3, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRasterRejectsOtherImageTypes() {
        Argb8888Raster.wrap(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB));
    }

    @Test
    public void testEdgesFollowModes() {
        Argb8888Raster raster = Argb8888Raster.wrap(image(3, 1, 0xff000001, 0xff000002, 0xff000003));
        Identity<Argb8888> identity = new Identity<>(Argb8888.class);

        NeighborFrame<Argb8888, Argb8888> clamp = NeighborFrame.decode(raster, identity, identity,
                OutOfBoundsMode.CLAMP, OutOfBoundsMode.CLAMP);
        Assert.assertEquals(0xff000001, clamp.work(-2, 0).getArgb());
        Assert.assertEquals(0xff000003, clamp.work(5, -4).getArgb());

        NeighborFrame<Argb8888, Argb8888> wrap = NeighborFrame.decode(raster, identity, identity,
                OutOfBoundsMode.WRAP, OutOfBoundsMode.CLAMP);
        Assert.assertEquals(0xff000003, wrap.work(-1, 0).getArgb());
        Assert.assertEquals(0xff000001, wrap.key(3, 2).getArgb());
    }

    @Test
    public void testDecodesAndProjects() {
        Argb8888Raster raster = Argb8888Raster.wrap(solidImage(2, 2, 0xffffffff));
        NeighborFrame<RgbaF, RgbaF> gamma = new ScalerPipeline().decode(raster, ColorPipelines.gammaFloat());
        Assert.assertEquals(new RgbaF(1f, 1f, 1f, 1f), gamma.work(1, 1));

        NeighborFrame<?, OklabF> oklab = new ScalerPipeline().decode(raster, ColorPipelines.linearOklab());
        Assert.assertEquals(1f, oklab.key(0, 0).getLightness(), 1e-3f);
    }

    @Test
    public void testWindowDecodesOnlyRowsSlidInto() {
        RecordingRaster raster = new RecordingRaster(patternImage(4, 20));
        Identity<Argb8888> identity = new Identity<>(Argb8888.class);
        NeighborFrame<Argb8888, Argb8888> frame = NeighborFrame.window(raster, identity, identity,
                OutOfBoundsMode.CLAMP, OutOfBoundsMode.CLAMP, 3);

        frame.slide(4, 6);
        frame.slide(5, 7);
        for (int y = 0; y < 20; y++) {
            int expected = y >= 4 && y <= 7 ? 4 : 0;
            Assert.assertEquals("row " + y, expected, raster.getReads(y));
        }
        Assert.assertEquals(patternImage(4, 20).getRGB(2, 7), frame.work(2, 7).getArgb());
        try {
            frame.work(0, 4);
            Assert.fail("row 4 left the window");
        } catch (IllegalStateException e) {
            println("expected: %s", e.getMessage());
        }
    }

    @Test
    public void testMirroredRowsDecodedOnce() {
        RecordingRaster raster = new RecordingRaster(patternImage(3, 10));
        Identity<Argb8888> identity = new Identity<>(Argb8888.class);
        NeighborFrame<Argb8888, Argb8888> frame = NeighborFrame.window(raster, identity, identity,
                OutOfBoundsMode.CLAMP, OutOfBoundsMode.HALF, 5);

        frame.slide(-2, 2);
        Assert.assertEquals(3, raster.getReads(0));
        Assert.assertEquals(3, raster.getReads(1));
        Assert.assertEquals(3, raster.getReads(2));
        Assert.assertEquals(0, raster.getReads(3));
        Assert.assertEquals(frame.work(1, 1), frame.work(1, -2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWindowRejectsLongerRange() {
        Identity<Argb8888> identity = new Identity<>(Argb8888.class);
        NeighborFrame<Argb8888, Argb8888> frame = NeighborFrame.window(Argb8888Raster.wrap(patternImage(4, 20)),
                identity, identity, OutOfBoundsMode.CLAMP, OutOfBoundsMode.CLAMP, 3);
        frame.slide(0, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySourceRejected() {
        Identity<Argb8888> identity = new Identity<>(Argb8888.class);
        PixelRaster<Argb8888> empty = new PixelRaster<Argb8888>() {
            @Override
            public int getWidth() {
                return 0;
            }

            @Override
            public int getHeight() {
                return 3;
            }

            @Override
            public Argb8888 get(int x, int y) {
                throw new AssertionError("no pixels to read");
            }

            @Override
            public void set(int x, int y, Argb8888 pixel) {
                throw new AssertionError("no pixels to write");
            }

            @Override
            public Class<Argb8888> getPixelType() {
                return Argb8888.class;
            }
        };
        NeighborFrame.decode(empty, identity, identity, OutOfBoundsMode.CLAMP, OutOfBoundsMode.CLAMP);
    }
}
