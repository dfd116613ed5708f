package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;

/**
 * The per-pixel inner loop of a resampler, bound to one set of color roles.
 * <p>
 * {@code D} and {@code J} take no part in a single pixel's computation; they record which decoder and projector
 * produced the {@link NeighborFrame} the kernel reads, so a kernel can only be run against the roles it was bound for.
 */
public interface ResampleKernel<W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>> {

    /**
     * @return how many rows above and below the mapped source row the kernel reads
     */
    int getRadius();

    /**
     * Computes the output pixel at {@code (destX, destY)} of a {@code destWidth x destHeight} target. Only rows
     * within {@link #getRadius()} of {@code floor(sourceCoordinate(destY, frame.getHeight(), destHeight))} are
     * readable.
     */
    P resample(NeighborFrame<W, K> frame, int destX, int destY, int destWidth, int destHeight, E encoder);

    /**
     * Maps the centre of output pixel {@code dest} to a source coordinate.
     */
    static float sourceCoordinate(int dest, int sourceSize, int destSize) {
        return (dest + 0.5f) * sourceSize / destSize - 0.5f;
    }
}
