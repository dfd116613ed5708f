package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.Argb8888;

import java.awt.image.BufferedImage;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Counts the pixel reads made from each row of a wrapped image.
 */
final class RecordingRaster implements PixelRaster<Argb8888> {

    private final Argb8888Raster raster;
    private final AtomicIntegerArray reads;

    RecordingRaster(BufferedImage image) {
        this.raster = Argb8888Raster.wrap(image);
        this.reads = new AtomicIntegerArray(raster.getHeight());
    }

    int getReads(int row) {
        return reads.get(row);
    }

    @Override
    public int getWidth() {
        return raster.getWidth();
    }

    @Override
    public int getHeight() {
        return raster.getHeight();
    }

    @Override
    public Argb8888 get(int x, int y) {
        reads.incrementAndGet(y);
        return raster.get(x, y);
    }

    @Override
    public void set(int x, int y, Argb8888 pixel) {
        raster.set(x, y, pixel);
    }

    @Override
    public Class<Argb8888> getPixelType() {
        return Argb8888.class;
    }
}
