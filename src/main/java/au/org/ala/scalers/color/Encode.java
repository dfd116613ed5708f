package au.org.ala.scalers.color;

/**
 * Converts a working color back into the stored pixel layout.
 *
 * @param <W> working color
 * @param <P> stored pixel
 */
public interface Encode<W, P> {

    P encode(W work);

    Class<W> getWorkType();

    Class<P> getPixelType();

}
