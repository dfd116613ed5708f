package au.org.ala.scalers.color;

/**
 * Reduces a working color to the key color kernels compare. Implementations must be pure: the same input always
 * yields an equal key, whatever order pixels are projected in.
 *
 * @param <W> working color
 * @param <K> key color
 */
public interface Project<W, K> {

    K project(W work);

    Class<W> getWorkType();

    Class<K> getKeyType();

}
