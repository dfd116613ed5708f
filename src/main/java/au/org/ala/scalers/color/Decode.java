package au.org.ala.scalers.color;

/**
 * Converts a stored pixel into the working color a kernel blends in.
 *
 * @param <P> stored pixel
 * @param <W> working color
 */
public interface Decode<P, W> {

    W decode(P pixel);

    Class<P> getPixelType();

    Class<W> getWorkType();

}
