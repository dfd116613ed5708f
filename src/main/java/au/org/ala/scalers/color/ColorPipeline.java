package au.org.ala.scalers.color;

import au.org.ala.scalers.IncompatibleRoleTypesException;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A decoder, projector and encoder checked to agree on their pixel, working and key types.
 * <p>
 * The generic bounds already reject mismatched roles at compile time. {@link #bind} also compares the runtime
 * classes each role declares, so a pipeline assembled through raw or unchecked types fails here, once, instead of
 * with a {@link ClassCastException} somewhere inside a kernel loop.
 *
 * @param <W> working color
 * @param <K> key color
 * @param <P> stored pixel
 * @param <D> decoder type
 * @param <J> projector type
 * @param <E> encoder type
 */
public final class ColorPipeline<W, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>> {

    private final D decoder;
    private final J projector;
    private final E encoder;

    private ColorPipeline(D decoder, J projector, E encoder) {
        this.decoder = decoder;
        this.projector = projector;
        this.encoder = encoder;
    }

    /**
     * @throws IncompatibleRoleTypesException if the roles' declared types do not line up
     */
    public static <W, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
    ColorPipeline<W, K, P, D, J, E> bind(D decoder, J projector, E encoder) {
        Preconditions.checkNotNull(decoder, "decoder");
        Preconditions.checkNotNull(projector, "projector");
        Preconditions.checkNotNull(encoder, "encoder");

        requireSame("pixel", decoder.getPixelType(), encoder.getPixelType(), decoder, encoder);
        requireSame("working", decoder.getWorkType(), projector.getWorkType(), decoder, projector);
        requireSame("working", decoder.getWorkType(), encoder.getWorkType(), decoder, encoder);

        return new ColorPipeline<>(decoder, projector, encoder);
    }

    private static void requireSame(String role, Class<?> expected, Class<?> actual, Object first, Object second) {
        if (!expected.equals(actual)) {
            throw new IncompatibleRoleTypesException(String.format("%s type mismatch: %s uses %s but %s uses %s",
                    role, first.getClass().getSimpleName(), expected.getName(),
                    second.getClass().getSimpleName(), actual.getName()));
        }
    }

    /**
     * @throws IncompatibleRoleTypesException if this pipeline does not store pixels as {@code pixelType}
     */
    public void requirePixelType(Class<?> pixelType) {
        if (!getPixelType().equals(pixelType)) {
            throw new IncompatibleRoleTypesException(String.format("pipeline stores %s pixels, not %s",
                    getPixelType().getName(), pixelType.getName()));
        }
    }

    public D getDecoder() {
        return decoder;
    }

    public J getProjector() {
        return projector;
    }

    public E getEncoder() {
        return encoder;
    }

    public Class<P> getPixelType() {
        return decoder.getPixelType();
    }

    public Class<W> getWorkType() {
        return decoder.getWorkType();
    }

    public Class<K> getKeyType() {
        return projector.getKeyType();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("pixel", getPixelType().getSimpleName())
                .add("work", getWorkType().getSimpleName())
                .add("key", getKeyType().getSimpleName())
                .toString();
    }
}
