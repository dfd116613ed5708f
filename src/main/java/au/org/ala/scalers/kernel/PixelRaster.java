package au.org.ala.scalers.kernel;

/**
 * The contract an image container meets to be scaled: random pixel access in its own storage type.
 *
 * @param <P> stored pixel
 */
public interface PixelRaster<P> {

    int getWidth();

    int getHeight();

    P get(int x, int y);

    void set(int x, int y, P pixel);

    Class<P> getPixelType();

}
