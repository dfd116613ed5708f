package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.PixelScaler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerQuality;
import au.org.ala.scalers.UnsupportedScaleException;
import au.org.ala.scalers.color.Argb8888;
import au.org.ala.scalers.color.ColorEquality;
import au.org.ala.scalers.color.ColorLerp;
import au.org.ala.scalers.color.ColorPipeline;
import au.org.ala.scalers.color.ColorPipelines;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;
import au.org.ala.scalers.kernel.Argb8888Raster;
import au.org.ala.scalers.kernel.NeighborFrame;
import au.org.ala.scalers.kernel.PixelRaster;
import au.org.ala.scalers.kernel.PixelScaleKernel;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Andrea Mazzoleni's Scale2x and Scale3x pixel art magnifiers.
 * <p>
 * Each source pixel {@code P} becomes a 2x2 or 3x3 block. When the pixels above and below it differ and the pixels
 * left and right of it differ, block corners next to two matching neighbours take the blend of those neighbours;
 * everything else keeps the color of {@code P}.
 */
public final class Scale implements PixelScaler {

    public static final List<ScaleFactor> SUPPORTED_SCALES = ImmutableList.of(ScaleFactor.uniform(2), ScaleFactor.uniform(3));

    public static final PixelScalerDescriptor<Scale> DESCRIPTOR = new PixelScalerDescriptor<>(Scale.class,
            "Scale", "Andrea Mazzoleni", 2001, "https://www.scale2x.it/algorithm",
            "Edge-aware 2x/3x scaling from the AdvanceMAME project",
            SUPPORTED_SCALES, Scale::supportsScale, Scale::possibleTargets, Scale::new, Scale::dispatch);

    static final float OKLAB_EQUALITY_THRESHOLD = 0.02f;

    private final ScaleFactor scale;

    public Scale() {
        this(ScaleFactor.uniform(2));
    }

    /**
     * @throws UnsupportedScaleException unless {@code scale} is 2x or 3x
     */
    public Scale(ScaleFactor scale) {
        if (!supportsScale(scale)) {
            throw UnsupportedScaleException.forScale("Scale", scale);
        }
        this.scale = scale;
    }

    public static Scale x2() {
        return new Scale(ScaleFactor.uniform(2));
    }

    public static Scale x3() {
        return new Scale(ScaleFactor.uniform(3));
    }

    public static boolean supportsScale(ScaleFactor scale) {
        return SUPPORTED_SCALES.contains(scale);
    }

    public static List<Dimension> possibleTargets(int sourceWidth, int sourceHeight) {
        return ImmutableList.of(
                ScaleFactor.uniform(2).apply(sourceWidth, sourceHeight),
                ScaleFactor.uniform(3).apply(sourceWidth, sourceHeight));
    }

    @Override
    public ScaleFactor getScale() {
        return scale;
    }

    ScalerDispatch dispatch(ScalerPipeline pipeline) {
        return (source, quality) -> {
            if (quality == ScalerQuality.HIGH_QUALITY) {
                return upscale(pipeline, source, ColorPipelines.linearOklab(),
                        ColorEquality.oklab(OKLAB_EQUALITY_THRESHOLD), ColorLerp.componentwise());
            }
            return upscale(pipeline, source, ColorPipelines.identity(), ColorEquality.exact(), ColorLerp.argb8888());
        };
    }

    private <W, K, D extends Decode<Argb8888, W>, J extends Project<W, K>, E extends Encode<W, Argb8888>>
    BufferedImage upscale(ScalerPipeline pipeline, BufferedImage image, ColorPipeline<W, K, Argb8888, D, J, E> colors,
                          ColorEquality<K> equality, ColorLerp<W> lerp) {
        Argb8888Raster source = Argb8888Raster.wrap(image);
        Dimension size = scale.apply(source.getWidth(), source.getHeight());
        Argb8888Raster target = Argb8888Raster.create(size.width, size.height);
        if (scale.getX() == 2) {
            pipeline.upscale(source, target, colors, new Scale2xKernel<W, K, Argb8888, E>(equality, lerp));
        } else {
            pipeline.upscale(source, target, colors, new Scale3xKernel<W, K, Argb8888, E>(equality, lerp));
        }
        return target.getImage();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("scale", scale).toString();
    }

    static final class Scale2xKernel<W, K, P, E extends Encode<W, P>> implements PixelScaleKernel<W, K, P, E> {

        private final ColorEquality<K> equality;
        private final ColorLerp<W> lerp;

        Scale2xKernel(ColorEquality<K> equality, ColorLerp<W> lerp) {
            this.equality = equality;
            this.lerp = lerp;
        }

        @Override
        public int getScaleX() {
            return 2;
        }

        @Override
        public int getScaleY() {
            return 2;
        }

        @Override
        public void scale(NeighborFrame<W, K> frame, int sourceX, int sourceY, PixelRaster<P> target, E encoder) {
            //   B
            // D P F
            //   H
            K b = frame.key(sourceX, sourceY - 1);
            K d = frame.key(sourceX - 1, sourceY);
            K f = frame.key(sourceX + 1, sourceY);
            K h = frame.key(sourceX, sourceY + 1);
            W p = frame.work(sourceX, sourceY);

            W e0 = p;
            W e1 = p;
            W e2 = p;
            W e3 = p;
            if (!equality.test(b, h) && !equality.test(d, f)) {
                W bw = frame.work(sourceX, sourceY - 1);
                W dw = frame.work(sourceX - 1, sourceY);
                W fw = frame.work(sourceX + 1, sourceY);
                W hw = frame.work(sourceX, sourceY + 1);
                if (equality.test(d, b)) {
                    e0 = lerp.lerp(dw, bw);
                }
                if (equality.test(b, f)) {
                    e1 = lerp.lerp(bw, fw);
                }
                if (equality.test(d, h)) {
                    e2 = lerp.lerp(dw, hw);
                }
                if (equality.test(h, f)) {
                    e3 = lerp.lerp(hw, fw);
                }
            }

            int x = sourceX * 2;
            int y = sourceY * 2;
            target.set(x, y, encoder.encode(e0));
            target.set(x + 1, y, encoder.encode(e1));
            target.set(x, y + 1, encoder.encode(e2));
            target.set(x + 1, y + 1, encoder.encode(e3));
        }
    }

    static final class Scale3xKernel<W, K, P, E extends Encode<W, P>> implements PixelScaleKernel<W, K, P, E> {

        private final ColorEquality<K> equality;
        private final ColorLerp<W> lerp;

        Scale3xKernel(ColorEquality<K> equality, ColorLerp<W> lerp) {
            this.equality = equality;
            this.lerp = lerp;
        }

        @Override
        public int getScaleX() {
            return 3;
        }

        @Override
        public int getScaleY() {
            return 3;
        }

        @Override
        public void scale(NeighborFrame<W, K> frame, int sourceX, int sourceY, PixelRaster<P> target, E encoder) {
            // A B C
            // D P F
            // G H I
            K a = frame.key(sourceX - 1, sourceY - 1);
            K b = frame.key(sourceX, sourceY - 1);
            K c = frame.key(sourceX + 1, sourceY - 1);
            K d = frame.key(sourceX - 1, sourceY);
            K p = frame.key(sourceX, sourceY);
            K f = frame.key(sourceX + 1, sourceY);
            K g = frame.key(sourceX - 1, sourceY + 1);
            K h = frame.key(sourceX, sourceY + 1);
            K i = frame.key(sourceX + 1, sourceY + 1);
            W pw = frame.work(sourceX, sourceY);

            W e0 = pw, e1 = pw, e2 = pw;
            W e3 = pw, e4 = pw, e5 = pw;
            W e6 = pw, e7 = pw, e8 = pw;

            if (!equality.test(b, h) && !equality.test(d, f)) {
                W bw = frame.work(sourceX, sourceY - 1);
                W dw = frame.work(sourceX - 1, sourceY);
                W fw = frame.work(sourceX + 1, sourceY);
                W hw = frame.work(sourceX, sourceY + 1);

                boolean db = equality.test(d, b);
                boolean bf = equality.test(b, f);
                boolean dh = equality.test(d, h);
                boolean hf = equality.test(h, f);
                boolean pa = equality.test(p, a);
                boolean pc = equality.test(p, c);
                boolean pg = equality.test(p, g);
                boolean pi = equality.test(p, i);

                if (db) {
                    e0 = lerp.lerp(dw, bw);
                }
                if (bf) {
                    e2 = lerp.lerp(bw, fw);
                }
                if (dh) {
                    e6 = lerp.lerp(dw, hw);
                }
                if (hf) {
                    e8 = lerp.lerp(hw, fw);
                }

                if (db && bf && !pc && !pa) {
                    e1 = lerp.lerp(lerp.lerp(bw, dw), fw);
                } else if (db && !pc) {
                    e1 = lerp.lerp(dw, bw);
                } else if (bf && !pa) {
                    e1 = lerp.lerp(bw, fw);
                }

                if (db && dh && !pg && !pa) {
                    e3 = lerp.lerp(lerp.lerp(dw, bw), hw);
                } else if (db && !pg) {
                    e3 = lerp.lerp(dw, bw);
                } else if (dh && !pa) {
                    e3 = lerp.lerp(dw, hw);
                }

                if (bf && hf && !pi && !pc) {
                    e5 = lerp.lerp(lerp.lerp(fw, bw), hw);
                } else if (bf && !pi) {
                    e5 = lerp.lerp(bw, fw);
                } else if (hf && !pc) {
                    e5 = lerp.lerp(hw, fw);
                }

                if (dh && hf && !pi && !pg) {
                    e7 = lerp.lerp(lerp.lerp(hw, dw), fw);
                } else if (dh && !pi) {
                    e7 = lerp.lerp(dw, hw);
                } else if (hf && !pg) {
                    e7 = lerp.lerp(hw, fw);
                }
            }

            int x = sourceX * 3;
            int y = sourceY * 3;
            target.set(x, y, encoder.encode(e0));
            target.set(x + 1, y, encoder.encode(e1));
            target.set(x + 2, y, encoder.encode(e2));
            target.set(x, y + 1, encoder.encode(e3));
            target.set(x + 1, y + 1, encoder.encode(e4));
            target.set(x + 2, y + 1, encoder.encode(e5));
            target.set(x, y + 2, encoder.encode(e6));
            target.set(x + 1, y + 2, encoder.encode(e7));
            target.set(x + 2, y + 2, encoder.encode(e8));
        }
    }
}
