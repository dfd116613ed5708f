package au.org.ala.scalers.color;

import au.org.ala.scalers.color.ColorCodecs.Argb8888ToRgbaF;
import au.org.ala.scalers.color.ColorCodecs.Identity;
import au.org.ala.scalers.color.ColorCodecs.LinearRgbaFToOklabF;
import au.org.ala.scalers.color.ColorCodecs.LinearRgbaFToSrgb32;
import au.org.ala.scalers.color.ColorCodecs.RgbaFToArgb8888;
import au.org.ala.scalers.color.ColorCodecs.Srgb32ToLinearRgbaF;

/**
 * Ready made pipelines over {@link Argb8888} storage.
 */
public final class ColorPipelines {

    private static final ColorPipeline<Argb8888, Argb8888, Argb8888, Identity<Argb8888>, Identity<Argb8888>, Identity<Argb8888>> IDENTITY;
    private static final ColorPipeline<RgbaF, RgbaF, Argb8888, Argb8888ToRgbaF, Identity<RgbaF>, RgbaFToArgb8888> GAMMA_FLOAT;
    private static final ColorPipeline<LinearRgbaF, OklabF, Argb8888, Srgb32ToLinearRgbaF, LinearRgbaFToOklabF, LinearRgbaFToSrgb32> LINEAR_OKLAB;

    static {
        Identity<Argb8888> identity = new Identity<>(Argb8888.class);
        IDENTITY = ColorPipeline.bind(identity, identity, identity);
        GAMMA_FLOAT = ColorPipeline.bind(new Argb8888ToRgbaF(), new Identity<>(RgbaF.class), new RgbaFToArgb8888());
        LINEAR_OKLAB = ColorPipeline.bind(new Srgb32ToLinearRgbaF(), new LinearRgbaFToOklabF(), new LinearRgbaFToSrgb32());
    }

    private ColorPipelines() {
    }

    /**
     * Works directly on stored pixels; keys are the pixels themselves.
     */
    public static ColorPipeline<Argb8888, Argb8888, Argb8888, Identity<Argb8888>, Identity<Argb8888>, Identity<Argb8888>> identity() {
        return IDENTITY;
    }

    /**
     * Float accumulation of the gamma encoded values.
     */
    public static ColorPipeline<RgbaF, RgbaF, Argb8888, Argb8888ToRgbaF, Identity<RgbaF>, RgbaFToArgb8888> gammaFloat() {
        return GAMMA_FLOAT;
    }

    /**
     * Linear light working color with Oklab keys.
     */
    public static ColorPipeline<LinearRgbaF, OklabF, Argb8888, Srgb32ToLinearRgbaF, LinearRgbaFToOklabF, LinearRgbaFToSrgb32> linearOklab() {
        return LINEAR_OKLAB;
    }
}
