package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.Argb8888;
import com.google.common.base.Preconditions;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.awt.image.SinglePixelPackedSampleModel;
import java.awt.image.WritableRaster;

/**
 * {@link PixelRaster} over the pixel array of a {@link BufferedImage#TYPE_INT_ARGB} image.
 */
public final class Argb8888Raster implements PixelRaster<Argb8888> {

    private final BufferedImage image;
    private final int[] data;
    private final int offset;
    private final int stride;
    private final int width;
    private final int height;

    private Argb8888Raster(BufferedImage image) {
        WritableRaster raster = image.getRaster();
        SinglePixelPackedSampleModel sampleModel = (SinglePixelPackedSampleModel) raster.getSampleModel();
        this.image = image;
        this.data = ((DataBufferInt) raster.getDataBuffer()).getData();
        this.stride = sampleModel.getScanlineStride();
        this.offset = -raster.getSampleModelTranslateY() * stride - raster.getSampleModelTranslateX();
        this.width = image.getWidth();
        this.height = image.getHeight();
    }

    public static Argb8888Raster wrap(BufferedImage image) {
        Preconditions.checkArgument(image.getType() == BufferedImage.TYPE_INT_ARGB,
                "expected a TYPE_INT_ARGB image but got type %s", image.getType());
        return new Argb8888Raster(image);
    }

    public static Argb8888Raster create(int width, int height) {
        return new Argb8888Raster(new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB));
    }

    public BufferedImage getImage() {
        return image;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public Argb8888 get(int x, int y) {
        return Argb8888.of(data[offset + y * stride + x]);
    }

    @Override
    public void set(int x, int y, Argb8888 pixel) {
        data[offset + y * stride + x] = pixel.getArgb();
    }

    @Override
    public Class<Argb8888> getPixelType() {
        return Argb8888.class;
    }
}
