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
 * Linear interpolation between the four nearest source pixels.
 */
public final class Bilinear implements Resampler {

    public static final double MIN_SCALE = 1.0 / 32;
    public static final double MAX_SCALE = 32;

    public static final ResamplerDescriptor<Bilinear> DESCRIPTOR = new ResamplerDescriptor<>(Bilinear.class,
            "Bilinear", null, 0, null, "Linear interpolation of the 2x2 nearest pixels",
            MIN_SCALE, MAX_SCALE, ScaleFactor.uniform(2), Bilinear::new, Bilinear::dispatch);

    private final ScaleFactor scale;

    public Bilinear() {
        this(ScaleFactor.uniform(2));
    }

    public Bilinear(ScaleFactor scale) {
        if (!supportsScale(scale)) {
            throw UnsupportedScaleException.forRange("Bilinear", scale, MIN_SCALE, MAX_SCALE);
        }
        this.scale = scale;
    }

    public static boolean supportsScale(ScaleFactor scale) {
        return scale.getX() >= MIN_SCALE && scale.getX() <= MAX_SCALE
                && scale.getY() >= MIN_SCALE && scale.getY() <= MAX_SCALE;
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
        return 1;
    }

    @Override
    public <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, R>
    R invokeKernel(ResampleKernelCallback<W, K, P, D, J, E, R> callback) {
        return callback.invoke(new BilinearKernel<W, K, P, D, J, E>());
    }

    ScalerDispatch dispatch(ScalerPipeline pipeline) {
        return ScalerDispatches.resampling(this, pipeline);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("scale", scale).toString();
    }

    static final class BilinearKernel<W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
            implements ResampleKernel<W, K, P, D, J, E> {

        @Override
        public int getRadius() {
            return 1;
        }

        @Override
        public P resample(NeighborFrame<W, K> frame, int destX, int destY, int destWidth, int destHeight, E encoder) {
            float srcX = ResampleKernel.sourceCoordinate(destX, frame.getWidth(), destWidth);
            float srcY = ResampleKernel.sourceCoordinate(destY, frame.getHeight(), destHeight);
            int x0 = (int) Math.floor(srcX);
            int y0 = (int) Math.floor(srcY);
            float fx = srcX - x0;
            float fy = srcY - y0;

            Accum4F<W> acc = new Accum4F<>();
            acc.addMul(frame.work(x0, y0), (1 - fx) * (1 - fy));
            acc.addMul(frame.work(x0 + 1, y0), fx * (1 - fy));
            acc.addMul(frame.work(x0, y0 + 1), (1 - fx) * fy);
            acc.addMul(frame.work(x0 + 1, y0 + 1), fx * fy);
            return encoder.encode(acc.result());
        }
    }
}
