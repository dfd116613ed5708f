package au.org.ala.scalers.resize;

import au.org.ala.scalers.Resampler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.UnsupportedScaleException;
import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;
import au.org.ala.scalers.kernel.Accum4F;
import au.org.ala.scalers.kernel.NeighborFrame;
import au.org.ala.scalers.kernel.ResampleKernel;
import au.org.ala.scalers.kernel.ResampleKernelCallback;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.MoreObjects;

/**
 * The Mitchell-Netravali family of piecewise cubic filters, parameterised by {@code B} (blur) and {@code C}
 * (ringing). Reads a 4x4 neighbourhood around each mapped source position.
 */
public final class MitchellNetravali implements Resampler {

    public static final double MIN_SCALE = 1.0 / 32;
    public static final double MAX_SCALE = 32;
    public static final ScaleFactor DEFAULT_SCALE = ScaleFactor.uniform(2);

    public static final double MITCHELL_B = 1.0 / 3;
    public static final double MITCHELL_C = 1.0 / 3;
    public static final double ROBIDOUX_B = 0.3782157550102413;
    public static final double ROBIDOUX_C = 0.3108921224948793;
    public static final double ROBIDOUX_SHARP_B = 0.2620145123990142;
    public static final double ROBIDOUX_SHARP_C = 0.3689927438004929;
    public static final double ROBIDOUX_SOFT_B = 0.67962275088539597;
    public static final double ROBIDOUX_SOFT_C = 0.16018862455730199;

    public static final ResamplerDescriptor<MitchellNetravali> DESCRIPTOR = new ResamplerDescriptor<>(MitchellNetravali.class,
            "Mitchell-Netravali", "Don P. Mitchell, Arun N. Netravali", 1988, null,
            "Cubic filter balancing blur and ringing (B = C = 1/3)",
            MIN_SCALE, MAX_SCALE, DEFAULT_SCALE, MitchellNetravali::new, MitchellNetravali::dispatch);

    public static final ResamplerDescriptor<MitchellNetravali> CATMULL_ROM_DESCRIPTOR = new ResamplerDescriptor<>(MitchellNetravali.class,
            "Catmull-Rom", "Edwin Catmull, Raphael Rom", 1974, null,
            "Interpolating cubic spline (B = 0, C = 0.5)",
            MIN_SCALE, MAX_SCALE, DEFAULT_SCALE, MitchellNetravali::catmullRom, MitchellNetravali::dispatch);

    public static final ResamplerDescriptor<MitchellNetravali> B_SPLINE_DESCRIPTOR = new ResamplerDescriptor<>(MitchellNetravali.class,
            "B-Spline", null, 0, null,
            "Smooth approximating cubic B-spline (B = 1, C = 0)",
            MIN_SCALE, MAX_SCALE, DEFAULT_SCALE, MitchellNetravali::bSpline, MitchellNetravali::dispatch);

    public static final ResamplerDescriptor<MitchellNetravali> ROBIDOUX_DESCRIPTOR = new ResamplerDescriptor<>(MitchellNetravali.class,
            "Robidoux", "Nicolas Robidoux", 2011, null,
            "Cubic tuned for cylindrical resampling",
            MIN_SCALE, MAX_SCALE, DEFAULT_SCALE, MitchellNetravali::robidoux, MitchellNetravali::dispatch);

    public static final ResamplerDescriptor<MitchellNetravali> ROBIDOUX_SHARP_DESCRIPTOR = new ResamplerDescriptor<>(MitchellNetravali.class,
            "RobidouxSharp", "Nicolas Robidoux", 2011, null,
            "Sharper Robidoux variant (B = 0.2620, C = 0.3690)",
            MIN_SCALE, MAX_SCALE, DEFAULT_SCALE, MitchellNetravali::robidouxSharp, MitchellNetravali::dispatch);

    public static final ResamplerDescriptor<MitchellNetravali> ROBIDOUX_SOFT_DESCRIPTOR = new ResamplerDescriptor<>(MitchellNetravali.class,
            "RobidouxSoft", "Nicolas Robidoux", 2011, null,
            "Smoother Robidoux variant (B = 0.6796, C = 0.1602)",
            MIN_SCALE, MAX_SCALE, DEFAULT_SCALE, MitchellNetravali::robidouxSoft, MitchellNetravali::dispatch);

    private final double b;
    private final double c;
    private final ScaleFactor scale;

    public MitchellNetravali() {
        this(DEFAULT_SCALE);
    }

    public MitchellNetravali(ScaleFactor scale) {
        this(MITCHELL_B, MITCHELL_C, scale);
    }

    /**
     * @throws UnsupportedScaleException if either axis of {@code scale} is outside {@code [MIN_SCALE, MAX_SCALE]}
     */
    public MitchellNetravali(double b, double c, ScaleFactor scale) {
        if (!supportsScale(scale)) {
            throw UnsupportedScaleException.forRange("Mitchell-Netravali", scale, MIN_SCALE, MAX_SCALE);
        }
        this.b = b;
        this.c = c;
        this.scale = scale;
    }

    public static MitchellNetravali catmullRom(ScaleFactor scale) {
        return new MitchellNetravali(0, 0.5, scale);
    }

    public static MitchellNetravali bSpline(ScaleFactor scale) {
        return new MitchellNetravali(1, 0, scale);
    }

    public static MitchellNetravali robidoux(ScaleFactor scale) {
        return new MitchellNetravali(ROBIDOUX_B, ROBIDOUX_C, scale);
    }

    public static MitchellNetravali robidouxSharp(ScaleFactor scale) {
        return new MitchellNetravali(ROBIDOUX_SHARP_B, ROBIDOUX_SHARP_C, scale);
    }

    public static MitchellNetravali robidouxSoft(ScaleFactor scale) {
        return new MitchellNetravali(ROBIDOUX_SOFT_B, ROBIDOUX_SOFT_C, scale);
    }

    public static boolean supportsScale(ScaleFactor scale) {
        return scale.getX() >= MIN_SCALE && scale.getX() <= MAX_SCALE
                && scale.getY() >= MIN_SCALE && scale.getY() <= MAX_SCALE;
    }

    public double getB() {
        return b;
    }

    public double getC() {
        return c;
    }

    @Override
    public double getScaleX() {
        return scale.getX();
    }

    @Override
    public double getScaleY() {
        return scale.getY();
    }

    @Override
    public ScaleFactor getScale() {
        return scale;
    }

    @Override
    public int getRadius() {
        return 2;
    }

    @Override
    public <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, R>
    R invokeKernel(ResampleKernelCallback<W, K, P, D, J, E, R> callback) {
        return callback.invoke(new MitchellNetravaliKernel<W, K, P, D, J, E>((float) b, (float) c));
    }

    ScalerDispatch dispatch(ScalerPipeline pipeline) {
        return ScalerDispatches.resampling(this, pipeline);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("b", b).add("c", c).add("scale", scale).toString();
    }

    static float weight(float x, float b, float c) {
        x = Math.abs(x);
        if (x < 1f) {
            return ((12f - 9f * b - 6f * c) * x * x * x
                    + (-18f + 12f * b + 6f * c) * x * x
                    + (6f - 2f * b)) / 6f;
        }
        if (x < 2f) {
            return ((-b - 6f * c) * x * x * x
                    + (6f * b + 30f * c) * x * x
                    + (-12f * b - 48f * c) * x
                    + (8f * b + 24f * c)) / 6f;
        }
        return 0f;
    }

    static final class MitchellNetravaliKernel<W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
            implements ResampleKernel<W, K, P, D, J, E> {

        private final float b;
        private final float c;

        MitchellNetravaliKernel(float b, float c) {
            this.b = b;
            this.c = c;
        }

        @Override
        public int getRadius() {
            return 2;
        }

        @Override
        public P resample(NeighborFrame<W, K> frame, int destX, int destY, int destWidth, int destHeight, E encoder) {
            float srcX = ResampleKernel.sourceCoordinate(destX, frame.getWidth(), destWidth);
            float srcY = ResampleKernel.sourceCoordinate(destY, frame.getHeight(), destHeight);
            int x0 = (int) Math.floor(srcX);
            int y0 = (int) Math.floor(srcY);
            float fx = srcX - x0;
            float fy = srcY - y0;

            float[] wx = new float[4];
            float[] wy = new float[4];
            for (int i = 0; i < 4; i++) {
                wx[i] = weight(fx - (i - 1), b, c);
                wy[i] = weight(fy - (i - 1), b, c);
            }

            Accum4F<W> acc = new Accum4F<>();
            for (int ky = 0; ky < 4; ky++) {
                for (int kx = 0; kx < 4; kx++) {
                    float w = wx[kx] * wy[ky];
                    if (w != 0f) {
                        acc.addMul(frame.work(x0 + kx - 1, y0 + ky - 1), w);
                    }
                }
            }
            return encoder.encode(acc.result());
        }
    }
}
