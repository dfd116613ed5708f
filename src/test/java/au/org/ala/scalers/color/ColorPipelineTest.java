package au.org.ala.scalers.color;

import au.org.ala.scalers.IncompatibleRoleTypesException;
import au.org.ala.scalers.TestBase;
import au.org.ala.scalers.color.ColorCodecs.Argb8888ToRgbaF;
import au.org.ala.scalers.color.ColorCodecs.Identity;
import au.org.ala.scalers.color.ColorCodecs.LinearRgbaFToOklabF;
import au.org.ala.scalers.color.ColorCodecs.LinearRgbaFToSrgb32;
import au.org.ala.scalers.color.ColorCodecs.RgbaFToArgb8888;
import au.org.ala.scalers.color.ColorCodecs.Srgb32ToLinearRgbaF;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ColorPipelineTest extends TestBase {

    @Test
    public void testShippedPipelines() {
        Assert.assertEquals(Argb8888.class, ColorPipelines.identity().getPixelType());
        Assert.assertEquals(RgbaF.class, ColorPipelines.gammaFloat().getWorkType());
        Assert.assertEquals(LinearRgbaF.class, ColorPipelines.linearOklab().getWorkType());
        Assert.assertEquals(OklabF.class, ColorPipelines.linearOklab().getKeyType());
        println("%s", ColorPipelines.linearOklab());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Test(expected = IncompatibleRoleTypesException.class)
    public void testBindRejectsMismatchedWorkTypes() {
        Decode decoder = new Argb8888ToRgbaF();
        Project projector = new LinearRgbaFToOklabF();
        Encode encoder = new RgbaFToArgb8888();
        ColorPipeline.bind(decoder, projector, encoder);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Test(expected = IncompatibleRoleTypesException.class)
    public void testBindRejectsMismatchedPixelTypes() {
        Decode decoder = new Identity<>(RgbaF.class);
        Project projector = new Identity<>(RgbaF.class);
        Encode encoder = new RgbaFToArgb8888();
        ColorPipeline.bind(decoder, projector, encoder);
    }

    @Test(expected = NullPointerException.class)
    public void testBindRejectsNull() {
        ColorPipeline.bind(new Srgb32ToLinearRgbaF(), new LinearRgbaFToOklabF(), (LinearRgbaFToSrgb32) null);
    }

    @Test
    public void testRequirePixelType() {
        ColorPipelines.gammaFloat().requirePixelType(Argb8888.class);
        try {
            ColorPipelines.gammaFloat().requirePixelType(RgbaF.class);
            Assert.fail("expected a pixel type mismatch");
        } catch (IncompatibleRoleTypesException e) {
            println(e.getMessage());
        }
    }

    @Test
    public void testSrgbRoundTrip() {
        Srgb32ToLinearRgbaF decoder = new Srgb32ToLinearRgbaF();
        LinearRgbaFToSrgb32 encoder = new LinearRgbaFToSrgb32();
        for (int v = 0; v < 256; v++) {
            Argb8888 pixel = Argb8888.of(v, v, 255 - v, v / 2);
            Assert.assertEquals(pixel, encoder.encode(decoder.decode(pixel)));
        }
    }

    @Test
    public void testOklabOfWhiteAndBlack() {
        LinearRgbaFToOklabF projector = new LinearRgbaFToOklabF();
        OklabF white = projector.project(new LinearRgbaF(1f, 1f, 1f, 1f));
        OklabF black = projector.project(new LinearRgbaF(0f, 0f, 0f, 1f));
        Assert.assertEquals(1f, white.getLightness(), 1e-3f);
        Assert.assertEquals(0f, white.getA(), 1e-3f);
        Assert.assertEquals(0f, white.getB(), 1e-3f);
        Assert.assertEquals(0f, black.getLightness(), 1e-3f);
        Assert.assertEquals(1f, white.distanceTo(black), 1e-3f);
    }

    @Test
    public void testEqualityAndLerp() {
        Assert.assertTrue(ColorEquality.<Argb8888>exact().test(Argb8888.of(0xff102030), Argb8888.of(0xff102030)));
        Assert.assertFalse(ColorEquality.<Argb8888>exact().test(Argb8888.of(0xff102030), Argb8888.of(0xff102031)));

        ColorEquality<OklabF> near = ColorEquality.oklab(0.02f);
        Assert.assertTrue(near.test(new OklabF(0.5f, 0f, 0f, 1f), new OklabF(0.51f, 0f, 0f, 1f)));
        Assert.assertFalse(near.test(new OklabF(0.5f, 0f, 0f, 1f), new OklabF(0.55f, 0f, 0f, 1f)));
        Assert.assertEquals(0f, new OklabF(0.5f, 0.1f, -0.1f, 1f).distanceTo(new OklabF(0.5f, 0.1f, -0.1f, 0f)), 0f);
        Assert.assertTrue(near.test(new OklabF(0.5f, 0f, 0f, 1f), new OklabF(0.5f, 0f, 0f, 0.2f)));

        Assert.assertEquals(Argb8888.of(0xff808080), ColorLerp.argb8888().lerp(Argb8888.of(0xff000000), Argb8888.of(0xffffffff)));
        RgbaF mid = ColorLerp.<RgbaF>componentwise().lerp(new RgbaF(0f, 1f, 0.5f, 1f), new RgbaF(1f, 0f, 0.5f, 1f));
        Assert.assertEquals(new RgbaF(0.5f, 0.5f, 0.5f, 1f), mid);
    }
}
